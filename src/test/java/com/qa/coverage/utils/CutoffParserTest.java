package com.qa.coverage.utils;

import com.qa.coverage.engine.InvalidCutoffException;
import org.junit.Test;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.fail;

public class CutoffParserTest {

    private static final ZoneId UTC = ZoneOffset.UTC;

    @Test
    public void blankMeansNow() {
        assertNull(CutoffParser.parse(null, UTC));
        assertNull(CutoffParser.parse("  ", UTC));
    }

    @Test
    public void acceptsIsoInstant() {
        assertEquals(Instant.parse("2024-05-01T10:00:00Z"), CutoffParser.parse("2024-05-01T10:00:00Z", UTC));
    }

    @Test
    public void plainDateMeansEndOfThatDay() {
        assertEquals(Instant.parse("2024-05-01T23:59:59.999Z"), CutoffParser.parse("2024-05-01", UTC));
        assertEquals(Instant.parse("2024-05-01T21:59:59.999Z"),
                CutoffParser.parse("2024-05-01", ZoneId.of("Europe/Berlin")));
    }

    @Test
    public void acceptsOffsetAndLocalDateTimes() {
        assertEquals(Instant.parse("2024-05-01T08:00:00Z"), CutoffParser.parse("2024-05-01T10:00:00+02:00", UTC));
        assertEquals(Instant.parse("2024-05-01T14:00:00Z"),
                CutoffParser.parse("2024-05-01T10:00:00", ZoneId.of("America/New_York")));
    }

    @Test
    public void rejectsGarbageAndPreEpochValues() {
        for (String raw : new String[] {"yesterday", "2024-13-01", "1969-12-31T23:59:59Z"}) {
            try {
                CutoffParser.parse(raw, UTC);
                fail(raw + " accepted");
            } catch (InvalidCutoffException e) {
                assertEquals("InvalidCutoff", e.getErrorType());
            }
        }
    }
}
