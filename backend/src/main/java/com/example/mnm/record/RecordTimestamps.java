package com.example.mnm.record;

import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.Map;

/**
 * Creation and modification stamps carried by every record, as ISO-8601 UTC strings
 * with millisecond precision.
 */
@Component
public class RecordTimestamps {

    public static final String CREATED_AT = "createdAt";
    public static final String UPDATED_AT = "updatedAt";

    private static final DateTimeFormatter FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS'Z'").withZone(ZoneOffset.UTC);

    private final Clock clock;

    public RecordTimestamps(Clock clock) {
        this.clock = clock;
    }

    public Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MILLIS);
    }

    public String format(Instant instant) {
        return FORMAT.format(instant.truncatedTo(ChronoUnit.MILLIS));
    }

    /**
     * Sets both stamps to now, overwriting whatever the payload carried.
     */
    public void stampCreated(Map<String, Object> payload) {
        String now = format(now());
        payload.put(CREATED_AT, now);
        payload.put(UPDATED_AT, now);
    }

    /**
     * Sets {@code updatedAt} to now and drops any {@code createdAt} the payload carried.
     */
    public void stampUpdated(Map<String, Object> payload) {
        payload.remove(CREATED_AT);
        payload.put(UPDATED_AT, format(now()));
    }

    /**
     * The {@code updatedAt} to store when a record stamped {@code previous} is modified:
     * {@code candidate} (or now, if it is absent or unreadable), pushed past {@code previous}
     * by a millisecond when it would not be strictly later.
     */
    public String nextUpdatedAt(Object previous, Object candidate) {
        Instant next = parse(candidate);
        if (next == null) {
            next = now();
        }
        Instant last = parse(previous);
        if (last != null && !next.isAfter(last)) {
            next = last.plusMillis(1);
        }
        return format(next);
    }

    static Instant parse(Object value) {
        if (value == null) {
            return null;
        }
        try {
            return Instant.parse(value.toString());
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
