package com.dailystatus.utils;

import com.dailystatus.core.ContractViolationException;
import org.junit.jupiter.api.Test;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class TimestampsTest {

    @Test
    void timestampWithoutOffsetShouldBeUtc() {
        OffsetDateTime parsed = Timestamps.parseUtc("2026-10-17T06:00:00", "created_at");
        assertEquals(ZoneOffset.UTC, parsed.getOffset());
        assertEquals(OffsetDateTime.parse("2026-10-17T06:00:00Z").toInstant(), parsed.toInstant());
    }

    @Test
    void explicitOffsetShouldBeKept() {
        OffsetDateTime parsed = Timestamps.parseUtc("2026-10-17T08:00:00.1234567+02:00", "finished");
        assertEquals(ZoneOffset.ofHours(2), parsed.getOffset());
        assertEquals("2026-10-17 08:00:00+02:00", Timestamps.display(parsed));
    }

    @Test
    void zuluSuffixShouldDisplayAsUtcOffset() {
        assertEquals("2026-10-17 06:00:00+00:00", Timestamps.display(Timestamps.parseUtc("2026-10-17T06:00:00Z", "x")));
    }

    @Test
    void malformedOrMissingTimestampShouldViolateContract() {
        assertThrows(ContractViolationException.class, () -> Timestamps.parseUtc("yesterday", "created_at"));
        assertThrows(ContractViolationException.class, () -> Timestamps.parseUtc(null, "created_at"));
    }
}
