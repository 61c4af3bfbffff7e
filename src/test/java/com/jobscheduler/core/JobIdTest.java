package com.jobscheduler.core;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class JobIdTest {

    @Test
    public void testTextFormIs26CrockfordCharacters() {
        String text = JobId.generate().toString();

        assertEquals(26, text.length());
        assertTrue(text.matches("[0-7][0-9A-HJKMNP-TV-Z]{25}"), text);
        assertEquals(text, JobId.parse(text).toString());
    }

    @Test
    public void testGeneratedIdsAreStrictlyIncreasing() {
        List<JobId> ids = new ArrayList<>();
        for (int i = 0; i < 10_000; i++) {
            ids.add(JobId.generate());
        }

        Set<JobId> unique = new HashSet<>(ids);
        assertEquals(ids.size(), unique.size(), "Duplicate id generated");
        for (int i = 1; i < ids.size(); i++) {
            assertTrue(ids.get(i - 1).compareTo(ids.get(i)) < 0, "Ids out of order at index " + i);
            // Text form sorts the same way as the id itself
            assertTrue(ids.get(i - 1).toString().compareTo(ids.get(i).toString()) < 0);
        }
    }

    @Test
    public void testTimestampReflectsCreationTime() {
        Instant before = Instant.now().minusMillis(1);
        JobId id = JobId.generate();

        Instant timestamp = id.getTimestamp();
        assertFalse(timestamp.isBefore(before.minus(Duration.ofSeconds(1))));
        assertFalse(timestamp.isAfter(Instant.now().plus(Duration.ofSeconds(1))));
    }

    @Test
    public void testParseKnownValue() {
        JobId id = JobId.parse("01ARZ3NDEKTSV4RRFFQ69G5FAV");

        assertEquals("01ARZ3NDEKTSV4RRFFQ69G5FAV", id.toString());
        assertEquals(1469922850259L, id.getTimestamp().toEpochMilli());
    }

    @Test
    public void testParseIsCaseInsensitiveAndAcceptsAliases() {
        JobId canonical = JobId.parse("01ARZ3NDEKTSV4RRFFQ69G5FAV");

        assertEquals(canonical, JobId.parse("01arz3ndektsv4rrffq69g5fav"));
        assertEquals(canonical, JobId.parse("O1ARZ3NDEKTSV4RRFFQ69G5FAV"));
    }

    @Test
    public void testParseRejectsMalformedText() {
        assertThrows(IllegalArgumentException.class, () -> JobId.parse(null));
        assertThrows(IllegalArgumentException.class, () -> JobId.parse(""));
        assertThrows(IllegalArgumentException.class, () -> JobId.parse("01ARZ3NDEKTSV4RRFFQ69G5FA"));
        assertThrows(IllegalArgumentException.class, () -> JobId.parse("01ARZ3NDEKTSV4RRFFQ69G5FAU"));
        // First character carries only 3 bits
        assertThrows(IllegalArgumentException.class, () -> JobId.parse("81ARZ3NDEKTSV4RRFFQ69G5FAV"));
    }
}
