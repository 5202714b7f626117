package com.dailystatus.utils;

import com.dailystatus.core.ContractViolationException;

import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;

public final class Timestamps {
    private static final DateTimeFormatter DISPLAY_TS = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ssxxx");

    private Timestamps() {
    }

    /**
     * Parses an ISO-8601 timestamp. Values without an offset are taken as UTC.
     */
    public static OffsetDateTime parseUtc(String raw, String field) {
        if (raw == null || raw.trim().isEmpty()) {
            throw new ContractViolationException("missing timestamp: " + field);
        }
        try {
            TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME.parseBest(
                    raw.trim(),
                    OffsetDateTime::from,
                    LocalDateTime::from
            );
            if (parsed instanceof OffsetDateTime odt) {
                return odt;
            }
            return ((LocalDateTime) parsed).atOffset(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            throw new ContractViolationException("malformed timestamp in " + field + ": " + raw, e);
        }
    }

    /**
     * Report display form, keeping the source offset: {@code 2026-10-16 03:15:00+00:00}.
     */
    public static String display(OffsetDateTime value) {
        return value == null ? "" : DISPLAY_TS.format(value);
    }
}
