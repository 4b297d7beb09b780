package com.theset.setlist.infrastructure.persistence;

import com.theset.setlist.domain.model.Show;
import com.theset.setlist.domain.model.ShowListing;
import com.theset.setlist.domain.model.WriteOutcome;
import com.theset.setlist.domain.port.out.ArtistStore;
import com.theset.setlist.domain.port.out.ShowStore;
import com.theset.setlist.domain.port.out.VenueStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.Optional;

import static com.theset.setlist.infrastructure.persistence.JdbcArtistStore.toInstant;
import static com.theset.setlist.infrastructure.persistence.JdbcArtistStore.toTimestamp;

@Repository
public class JdbcShowStore implements ShowStore {

    private static final Logger logger = LoggerFactory.getLogger(JdbcShowStore.class);

    private static final String COLUMNS = "id, name, artist_id, venue_id, date, image_url, ticket_url, genre_ids, updated_at";

    private static final String INSERT = """
            INSERT INTO shows (id, name, artist_id, venue_id, date, image_url, ticket_url, genre_ids, updated_at)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?::jsonb, ?)
            """;

    private static final String UPSERT = INSERT + """
            ON CONFLICT (id) DO UPDATE SET
                name = EXCLUDED.name,
                artist_id = EXCLUDED.artist_id,
                venue_id = EXCLUDED.venue_id,
                date = EXCLUDED.date,
                image_url = EXCLUDED.image_url,
                ticket_url = EXCLUDED.ticket_url,
                genre_ids = EXCLUDED.genre_ids,
                updated_at = EXCLUDED.updated_at
            """;

    private final JdbcTemplate jdbcTemplate;
    private final JsonColumns json;
    private final ArtistStore artistStore;
    private final VenueStore venueStore;
    private final RowMapper<Show> rowMapper;

    public JdbcShowStore(JdbcTemplate jdbcTemplate, JsonColumns json, ArtistStore artistStore, VenueStore venueStore) {
        this.jdbcTemplate = jdbcTemplate;
        this.json = json;
        this.artistStore = artistStore;
        this.venueStore = venueStore;
        this.rowMapper = (rs, rowNum) -> new Show(
                rs.getString("id"),
                rs.getString("name"),
                rs.getString("artist_id"),
                rs.getString("venue_id"),
                toInstant(rs.getTimestamp("date")),
                rs.getString("image_url"),
                rs.getString("ticket_url"),
                json.readStrings(rs.getString("genre_ids")),
                toInstant(rs.getTimestamp("updated_at")));
    }

    @Override
    public Optional<Show> findById(String id) {
        try {
            return jdbcTemplate.query("SELECT " + COLUMNS + " FROM shows WHERE id = ?", rowMapper, id)
                    .stream()
                    .findFirst();
        } catch (DataAccessException e) {
            logger.error("Database error while finding show {}", id, e);
            return Optional.empty();
        }
    }

    @Override
    public Optional<ShowListing> findListing(String showId) {
        return findById(showId).map(show -> new ShowListing(
                show,
                show.artistId() == null ? null : artistStore.findById(show.artistId()).orElse(null),
                show.venueId() == null ? null : venueStore.findById(show.venueId()).orElse(null)));
    }

    @Override
    public WriteOutcome<Show> upsert(Show show) {
        return JdbcWrites.write("show upsert " + show.id(),
                () -> jdbcTemplate.queryForObject(UPSERT + "RETURNING " + COLUMNS, rowMapper, parameters(show)));
    }

    @Override
    public WriteOutcome<Show> insert(Show show) {
        return JdbcWrites.write("show insert " + show.id(),
                () -> jdbcTemplate.queryForObject(INSERT + "RETURNING " + COLUMNS, rowMapper, parameters(show)));
    }

    private Object[] parameters(Show show) {
        return new Object[]{
                show.id(),
                show.name(),
                show.artistId(),
                show.venueId(),
                toTimestamp(show.date()),
                show.imageUrl(),
                show.ticketUrl(),
                json.write(show.genreIds()),
                toTimestamp(show.updatedAt())
        };
    }
}
