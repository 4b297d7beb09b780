package com.theset.setlist.infrastructure.persistence;

import com.theset.setlist.domain.model.Artist;
import com.theset.setlist.domain.model.Track;
import com.theset.setlist.domain.model.WriteOutcome;
import com.theset.setlist.domain.port.out.ArtistStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public class JdbcArtistStore implements ArtistStore {

    private static final Logger logger = LoggerFactory.getLogger(JdbcArtistStore.class);

    private static final String COLUMNS = """
            id, name, image_url, genres, popularity, upcoming_shows,
            catalog_id, stored_tracks, tracks_last_updated, updated_at
            """;

    private static final String INSERT = """
            INSERT INTO artists (
                id, name, image_url, genres, popularity, upcoming_shows,
                catalog_id, stored_tracks, tracks_last_updated, updated_at
            ) VALUES (?, ?, ?, ?::jsonb, ?, ?, ?, ?::jsonb, ?, ?)
            """;

    private static final String UPSERT = INSERT + """
            ON CONFLICT (id) DO UPDATE SET
                name = EXCLUDED.name,
                image_url = EXCLUDED.image_url,
                genres = EXCLUDED.genres,
                popularity = EXCLUDED.popularity,
                upcoming_shows = EXCLUDED.upcoming_shows,
                catalog_id = COALESCE(EXCLUDED.catalog_id, artists.catalog_id),
                stored_tracks = COALESCE(EXCLUDED.stored_tracks, artists.stored_tracks),
                tracks_last_updated = COALESCE(EXCLUDED.tracks_last_updated, artists.tracks_last_updated),
                updated_at = EXCLUDED.updated_at
            """;

    private static final String RETURNING = "RETURNING " + COLUMNS;

    private final JdbcTemplate jdbcTemplate;
    private final JsonColumns json;
    private final RowMapper<Artist> rowMapper;

    public JdbcArtistStore(JdbcTemplate jdbcTemplate, JsonColumns json) {
        this.jdbcTemplate = jdbcTemplate;
        this.json = json;
        this.rowMapper = (rs, rowNum) -> new Artist(
                rs.getString("id"),
                rs.getString("name"),
                rs.getString("image_url"),
                json.readStrings(rs.getString("genres")),
                rs.getInt("popularity"),
                rs.getInt("upcoming_shows"),
                rs.getString("catalog_id"),
                json.readTracks(rs.getString("stored_tracks")),
                toInstant(rs.getTimestamp("tracks_last_updated")),
                toInstant(rs.getTimestamp("updated_at")));
    }

    @Override
    public Optional<Artist> findById(String id) {
        try {
            return jdbcTemplate.query("SELECT " + COLUMNS + " FROM artists WHERE id = ?", rowMapper, id)
                    .stream()
                    .findFirst();
        } catch (DataAccessException e) {
            logger.error("Database error while finding artist {}", id, e);
            return Optional.empty();
        }
    }

    @Override
    public WriteOutcome<Artist> upsert(Artist artist) {
        return JdbcWrites.write("artist upsert " + artist.id(),
                () -> jdbcTemplate.queryForObject(UPSERT + RETURNING, rowMapper, parameters(artist)));
    }

    @Override
    public WriteOutcome<Artist> insert(Artist artist) {
        return JdbcWrites.write("artist insert " + artist.id(),
                () -> jdbcTemplate.queryForObject(INSERT + RETURNING, rowMapper, parameters(artist)));
    }

    @Override
    public List<Track> findStoredTracks(String artistId) {
        try {
            List<String> rows = jdbcTemplate.queryForList(
                    "SELECT stored_tracks FROM artists WHERE id = ?", String.class, artistId);
            if (rows.isEmpty() || rows.get(0) == null) {
                return List.of();
            }
            return json.readTracks(rows.get(0));
        } catch (DataAccessException e) {
            logger.error("Database error while reading stored tracks of artist {}", artistId, e);
            return List.of();
        }
    }

    @Override
    public boolean replaceStoredTracks(String artistId, List<Track> tracks, Instant updatedAt) {
        Timestamp timestamp = Timestamp.from(updatedAt);
        int updated = jdbcTemplate.update("""
                UPDATE artists
                SET stored_tracks = ?::jsonb, tracks_last_updated = ?, updated_at = ?
                WHERE id = ?
                """, json.write(tracks), timestamp, timestamp, artistId);
        return updated > 0;
    }

    private Object[] parameters(Artist artist) {
        return new Object[]{
                artist.id(),
                artist.name(),
                artist.imageUrl(),
                json.write(artist.genres()),
                artist.popularity(),
                artist.upcomingShows(),
                artist.catalogId(),
                json.write(artist.storedTracks()),
                toTimestamp(artist.tracksLastUpdated()),
                toTimestamp(artist.updatedAt())
        };
    }

    static Timestamp toTimestamp(Instant instant) {
        return instant == null ? null : Timestamp.from(instant);
    }

    static Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
