package com.theset.setlist.infrastructure.adapter.catalog;

import com.theset.setlist.infrastructure.adapter.catalog.json.CatalogTracksJson;
import retrofit2.Call;
import retrofit2.http.GET;
import retrofit2.http.Path;

/**
 * Retrofit contract of the external music catalog.
 */
public interface CatalogApi {

    /**
     * Fetches every track of an artist in one response.
     *
     * @param catalogId the artist's id in the catalog
     * @return A `Call` wrapping the JSON track list.
     */
    @GET("v1/artists/{catalogId}/tracks")
    Call<CatalogTracksJson> fetchArtistTracks(@Path("catalogId") String catalogId);
}
