package com.qa.coverage.utils;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.Locale;

import org.apache.commons.lang3.StringUtils;

import com.qa.coverage.engine.InvalidCutoffException;

/**
 * Turns the {@code cutoff} request parameter into an instant. Accepted forms: ISO instant, offset
 * date-time, local date-time (read in the reference zone) and plain date (end of that day).
 */
public final class CutoffParser {

    private CutoffParser() {
    }

    /** Returns null for a blank value, meaning "now". */
    public static Instant parse(String raw, ZoneId referenceZone) {
        if (StringUtils.isBlank(raw)) {
            return null;
        }
        String value = raw.trim();
        Instant parsed;
        try {
            if (value.endsWith("Z") || value.endsWith("z")) {
                parsed = Instant.parse(value.toUpperCase(Locale.ROOT));
            } else if (value.length() == 10) {
                parsed = LocalDate.parse(value).plusDays(1).atStartOfDay(referenceZone).toInstant().minusMillis(1);
            } else if (hasOffset(value)) {
                parsed = OffsetDateTime.parse(value).toInstant();
            } else {
                parsed = LocalDateTime.parse(value).atZone(referenceZone).toInstant();
            }
        } catch (DateTimeParseException e) {
            throw new InvalidCutoffException("Malformed cutoff '" + value + "'", e);
        } catch (DateTimeException e) {
            throw new InvalidCutoffException("Unusable cutoff '" + value + "': " + e.getMessage(), e);
        }
        return InvalidCutoffException.requireValid(parsed);
    }

    // offset follows the time part, e.g. 2024-05-01T10:00:00+02:00
    private static boolean hasOffset(String value) {
        int t = value.indexOf('T');
        return t > 0 && (value.indexOf('+', t) > 0 || value.indexOf('-', t) > 0);
    }
}
