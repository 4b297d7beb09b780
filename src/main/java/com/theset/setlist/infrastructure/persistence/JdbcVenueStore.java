package com.theset.setlist.infrastructure.persistence;

import com.theset.setlist.domain.model.Venue;
import com.theset.setlist.domain.model.WriteOutcome;
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
public class JdbcVenueStore implements VenueStore {

    private static final Logger logger = LoggerFactory.getLogger(JdbcVenueStore.class);

    private static final String INSERT = """
            INSERT INTO venues (id, name, city, state, country, timezone, updated_at)
            VALUES (?, ?, ?, ?, ?, ?, ?)
            """;

    private static final String UPSERT = INSERT + """
            ON CONFLICT (id) DO UPDATE SET
                name = EXCLUDED.name,
                city = EXCLUDED.city,
                state = EXCLUDED.state,
                country = EXCLUDED.country,
                timezone = COALESCE(EXCLUDED.timezone, venues.timezone),
                updated_at = EXCLUDED.updated_at
            """;

    private static final String RETURNING = "RETURNING id, name, city, state, country, timezone, updated_at";

    private static final RowMapper<Venue> ROW_MAPPER = (rs, rowNum) -> new Venue(
            rs.getString("id"),
            rs.getString("name"),
            rs.getString("city"),
            rs.getString("state"),
            rs.getString("country"),
            rs.getString("timezone"),
            toInstant(rs.getTimestamp("updated_at")));

    private final JdbcTemplate jdbcTemplate;

    public JdbcVenueStore(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public Optional<Venue> findById(String id) {
        try {
            return jdbcTemplate.query(
                            "SELECT id, name, city, state, country, timezone, updated_at FROM venues WHERE id = ?",
                            ROW_MAPPER, id)
                    .stream()
                    .findFirst();
        } catch (DataAccessException e) {
            logger.error("Database error while finding venue {}", id, e);
            return Optional.empty();
        }
    }

    @Override
    public WriteOutcome<Venue> upsert(Venue venue) {
        return JdbcWrites.write("venue upsert " + venue.id(),
                () -> jdbcTemplate.queryForObject(UPSERT + RETURNING, ROW_MAPPER, parameters(venue)));
    }

    @Override
    public WriteOutcome<Venue> insert(Venue venue) {
        return JdbcWrites.write("venue insert " + venue.id(),
                () -> jdbcTemplate.queryForObject(INSERT + RETURNING, ROW_MAPPER, parameters(venue)));
    }

    private static Object[] parameters(Venue venue) {
        return new Object[]{
                venue.id(), venue.name(), venue.city(), venue.state(), venue.country(), venue.timezone(),
                toTimestamp(venue.updatedAt())
        };
    }
}
