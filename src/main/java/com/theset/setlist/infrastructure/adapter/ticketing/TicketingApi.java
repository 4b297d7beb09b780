package com.theset.setlist.infrastructure.adapter.ticketing;

import com.theset.setlist.infrastructure.adapter.ticketing.json.TicketingEventJson;
import retrofit2.Call;
import retrofit2.http.GET;
import retrofit2.http.Path;
import retrofit2.http.Query;

/**
 * Retrofit contract of the external ticketing/event source.
 */
public interface TicketingApi {

    /**
     * Fetches a single event with its embedded venue and attraction.
     *
     * @return A `Call` wrapping the raw JSON event; a 404 means the event is unknown.
     */
    @GET("discovery/v2/events/{eventId}.json")
    Call<TicketingEventJson> fetchEvent(@Path("eventId") String eventId, @Query("apikey") String apiKey);
}
