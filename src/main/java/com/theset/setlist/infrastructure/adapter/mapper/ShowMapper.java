package com.theset.setlist.infrastructure.adapter.mapper;

import com.theset.setlist.domain.model.Artist;
import com.theset.setlist.domain.model.Show;
import com.theset.setlist.domain.model.ShowImport;
import com.theset.setlist.domain.model.Venue;
import com.theset.setlist.infrastructure.adapter.ticketing.json.AttractionJson;
import com.theset.setlist.infrastructure.adapter.ticketing.json.ImageJson;
import com.theset.setlist.infrastructure.adapter.ticketing.json.TicketingEventJson;
import com.theset.setlist.infrastructure.adapter.ticketing.json.VenueJson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Normalizes raw ticketing events into the persisted Show, Artist and Venue model.
 * Optional or inconsistent provider fields stop here.
 */
@Component
public class ShowMapper {

    private static final Logger logger = LoggerFactory.getLogger(ShowMapper.class);

    private static final String CATALOG_LINK_KEY = "spotify";
    private static final String CATALOG_ARTIST_PATH = "/artist/";

    public Optional<ShowImport> mapToShowImport(TicketingEventJson event) {
        if (event == null || isBlank(event.id())) {
            logger.warn("Ticketing event without id ignored");
            return Optional.empty();
        }

        Artist artist = firstAttraction(event).map(this::mapToArtist).orElse(null);
        Venue venue = firstVenue(event).map(this::mapToVenue).orElse(null);

        Show show = new Show(
                event.id(),
                event.name() != null ? event.name() : "Untitled show",
                artist != null ? artist.id() : null,
                venue != null ? venue.id() : null,
                parseDate(event),
                largestImage(event.images()),
                event.url(),
                genreIds(event),
                null
        );

        return Optional.of(new ShowImport(show, artist, venue));
    }

    private Artist mapToArtist(AttractionJson attraction) {
        List<String> genres = attraction.classifications() == null ? List.of() :
                attraction.classifications().stream()
                        .filter(Objects::nonNull)
                        .map(AttractionJson.ClassificationRefJson::genre)
                        .filter(Objects::nonNull)
                        .map(TicketingEventJson.NamedRefJson::name)
                        .filter(name -> !isBlank(name) && !"Undefined".equals(name))
                        .distinct()
                        .toList();

        return new Artist(
                attraction.id(),
                attraction.name() != null ? attraction.name() : "Unknown artist",
                largestImage(attraction.images()),
                genres,
                0,
                attraction.upcomingEventCount(),
                extractCatalogId(attraction.externalLinks()),
                null,
                null,
                null
        );
    }

    private Venue mapToVenue(VenueJson venue) {
        return new Venue(
                venue.id(),
                venue.name() != null ? venue.name() : "Unknown venue",
                venue.city() != null ? venue.city().name() : null,
                venue.state() != null ? firstNonBlank(venue.state().stateCode(), venue.state().name()) : null,
                venue.country() != null ? firstNonBlank(venue.country().countryCode(), venue.country().name()) : null,
                validZone(venue.timezone()).map(ZoneId::getId).orElse(null),
                null
        );
    }

    /**
     * Prefers the exact start instant, falls back to midnight of the local date in the
     * event's zone, or UTC when no zone is reported.
     * Announced-later and unparsable dates map to null.
     */
    Instant parseDate(TicketingEventJson event) {
        if (event.dates() == null || event.dates().start() == null) {
            return null;
        }
        TicketingEventJson.StartJson start = event.dates().start();
        if (Boolean.TRUE.equals(start.dateTBD())) {
            return null;
        }
        try {
            if (!isBlank(start.dateTime())) {
                return Instant.parse(start.dateTime());
            }
            if (!isBlank(start.localDate())) {
                return LocalDate.parse(start.localDate()).atStartOfDay(eventZone(event)).toInstant();
            }
        } catch (DateTimeParseException e) {
            logger.warn("Unparsable date for event {}: {}", event.id(), e.getMessage());
        }
        return null;
    }

    private ZoneId eventZone(TicketingEventJson event) {
        return validZone(event.dates().timezone())
                .or(() -> firstVenue(event).flatMap(venue -> validZone(venue.timezone())))
                .orElse(ZoneOffset.UTC);
    }

    private Optional<ZoneId> validZone(String zoneId) {
        if (isBlank(zoneId)) {
            return Optional.empty();
        }
        try {
            return Optional.of(ZoneId.of(zoneId));
        } catch (DateTimeException e) {
            logger.warn("Ignoring unknown time zone {}", zoneId);
            return Optional.empty();
        }
    }

    String extractCatalogId(Map<String, List<AttractionJson.LinkJson>> externalLinks) {
        if (externalLinks == null) {
            return null;
        }
        List<AttractionJson.LinkJson> links = externalLinks.get(CATALOG_LINK_KEY);
        if (links == null) {
            return null;
        }
        return links.stream()
                .filter(Objects::nonNull)
                .map(AttractionJson.LinkJson::url)
                .filter(url -> url != null && url.contains(CATALOG_ARTIST_PATH))
                .map(url -> url.substring(url.indexOf(CATALOG_ARTIST_PATH) + CATALOG_ARTIST_PATH.length()))
                .map(id -> id.contains("?") ? id.substring(0, id.indexOf('?')) : id)
                .map(id -> id.endsWith("/") ? id.substring(0, id.length() - 1) : id)
                .filter(id -> !id.isBlank())
                .findFirst()
                .orElse(null);
    }

    private List<String> genreIds(TicketingEventJson event) {
        if (event.classifications() == null) {
            return List.of();
        }
        return event.classifications().stream()
                .filter(Objects::nonNull)
                .map(TicketingEventJson.ClassificationJson::genre)
                .filter(Objects::nonNull)
                .map(TicketingEventJson.NamedRefJson::id)
                .filter(id -> !isBlank(id))
                .distinct()
                .toList();
    }

    private Optional<AttractionJson> firstAttraction(TicketingEventJson event) {
        if (event.embedded() == null || event.embedded().attractions() == null) {
            return Optional.empty();
        }
        return event.embedded().attractions().stream()
                .filter(attraction -> attraction != null && !isBlank(attraction.id()))
                .findFirst();
    }

    private Optional<VenueJson> firstVenue(TicketingEventJson event) {
        if (event.embedded() == null || event.embedded().venues() == null) {
            return Optional.empty();
        }
        return event.embedded().venues().stream()
                .filter(venue -> venue != null && !isBlank(venue.id()))
                .findFirst();
    }

    private String largestImage(List<ImageJson> images) {
        if (images == null) {
            return null;
        }
        return images.stream()
                .filter(image -> image != null && !isBlank(image.url()))
                .max(Comparator.comparingInt(image -> image.width() != null ? image.width() : 0))
                .map(ImageJson::url)
                .orElse(null);
    }

    private static String firstNonBlank(String first, String second) {
        return !isBlank(first) ? first : second;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
