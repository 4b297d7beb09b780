package com.theset.setlist.application.show;

import com.theset.setlist.domain.model.ShowDetail;
import com.theset.setlist.domain.model.ShowListing;
import com.theset.setlist.domain.model.Venue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Human-readable show date and page metadata.
 */
@Component
public class DisplayFormatter {

    private static final Logger logger = LoggerFactory.getLogger(DisplayFormatter.class);

    static final String UNKNOWN_DATE = "TBD";
    static final ShowDetail.DocumentMetadata FALLBACK_METADATA = new ShowDetail.DocumentMetadata(
            "Show Details | TheSet",
            "Vote on setlists for upcoming concerts and shows on TheSet.");

    private static final DateTimeFormatter DISPLAY_DATE =
            DateTimeFormatter.ofPattern("EEE, MMM d, yyyy", Locale.US);

    /**
     * Calendar date of the show at its venue; UTC when the venue zone is unknown or invalid.
     */
    public String displayDate(Instant date, String timezone) {
        if (date == null) {
            return UNKNOWN_DATE;
        }
        try {
            return DISPLAY_DATE.format(date.atZone(zoneOf(timezone)));
        } catch (DateTimeException e) {
            logger.warn("Could not format show date {}: {}", date, e.getMessage());
            return UNKNOWN_DATE;
        }
    }

    public String displayDateAtVenue(ShowListing listing) {
        if (listing == null || listing.show() == null) {
            return UNKNOWN_DATE;
        }
        return displayDate(listing.show().date(), listing.venue() == null ? null : listing.venue().timezone());
    }

    public ShowDetail.DocumentMetadata documentMetadata(ShowListing listing) {
        if (listing == null || listing.show() == null) {
            return FALLBACK_METADATA;
        }
        try {
            String artistName = orDefault(listing.artist() == null ? null : listing.artist().name(), "Artist");
            String venueName = orDefault(listing.venue() == null ? null : listing.venue().name(), "Venue");
            String location = location(listing.venue());
            String date = displayDateAtVenue(listing);

            String title = String.format("TheSet | %s at %s in %s | %s", artistName, venueName, location, date);
            String description = String.format(
                    "Vote on %s's setlist for their show at %s in %s on %s. Influence what songs they'll play live!",
                    artistName, venueName, location, date);
            return new ShowDetail.DocumentMetadata(title, description);
        } catch (RuntimeException e) {
            logger.error("Error building metadata for show {}", listing.show().id(), e);
            return FALLBACK_METADATA;
        }
    }

    private static ZoneId zoneOf(String timezone) {
        if (timezone == null || timezone.isBlank()) {
            return ZoneOffset.UTC;
        }
        try {
            return ZoneId.of(timezone);
        } catch (DateTimeException e) {
            logger.debug("Unknown venue time zone {}, using UTC", timezone);
            return ZoneOffset.UTC;
        }
    }

    private static String location(Venue venue) {
        String city = venue == null ? "" : orDefault(venue.city(), "");
        String state = venue == null ? "" : orDefault(venue.state(), "");
        if (!city.isEmpty() && !state.isEmpty()) {
            return city + ", " + state;
        }
        if (!city.isEmpty()) {
            return city;
        }
        return state.isEmpty() ? "Location" : state;
    }

    private static String orDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }
}
