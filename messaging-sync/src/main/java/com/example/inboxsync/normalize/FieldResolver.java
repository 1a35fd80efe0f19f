package com.example.inboxsync.normalize;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.StringUtils;

/**
 * Resolves values the platform delivers under inconsistent field names. Candidates are
 * passed in priority order; the first present, non-blank one wins.
 */
@Slf4j
public final class FieldResolver {

    private FieldResolver() {
    }

    public static String firstText(String... candidates) {
        for (String candidate : candidates) {
            if (StringUtils.hasText(candidate)) {
                return candidate;
            }
        }
        return null;
    }

    @SafeVarargs
    public static <T> T firstPresent(T... candidates) {
        for (T candidate : candidates) {
            if (candidate != null) {
                return candidate;
            }
        }
        return null;
    }

    public static boolean isTrue(Boolean value) {
        return Boolean.TRUE.equals(value);
    }

    /**
     * Accepts ISO-8601 instants, offset date-times and epoch milliseconds.
     */
    public static Instant parseInstant(String value) {
        if (!StringUtils.hasText(value)) {
            return null;
        }
        String trimmed = value.trim();
        if (trimmed.chars().allMatch(Character::isDigit)) {
            try {
                return Instant.ofEpochMilli(Long.parseLong(trimmed));
            } catch (NumberFormatException ex) {
                log.debug("Ignoring out-of-range epoch timestamp '{}'", trimmed);
                return null;
            }
        }
        try {
            return Instant.parse(trimmed);
        } catch (DateTimeParseException ex) {
            try {
                return OffsetDateTime.parse(trimmed).toInstant();
            } catch (DateTimeParseException nested) {
                log.debug("Ignoring unparseable timestamp '{}'", trimmed);
                return null;
            }
        }
    }
}
