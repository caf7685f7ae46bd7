package com.example.cablebox.application.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.example.cablebox.domain.model.CandidateFilter;
import com.example.cablebox.domain.model.StationRules;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.Collections;
import org.junit.jupiter.api.Test;

class CandidateFilterBuilderTest {

    private static final Instant NOW = Instant.parse("2026-02-22T12:34:56Z");

    private final CandidateFilterBuilder builder = new CandidateFilterBuilder();

    @Test
    void shouldProduceNoClausesForDefaultRules() {
        CandidateFilter filter = builder.build(new StationRules(), NOW);

        assertFalse(filter.hasClauses());
        assertNull(filter.getAddedAfter());
    }

    @Test
    void shouldLowerCaseAndDeduplicateMatchKeys() {
        StationRules rules = new StationRules();
        rules.setIncludeGenres(Arrays.asList(" Rock ", "rock", "Indie  Pop"));
        rules.setExcludeArtists(Collections.singletonList("The Band"));

        CandidateFilter filter = builder.build(rules, NOW);

        assertEquals(Arrays.asList("rock", "indie pop"), filter.getIncludeGenres());
        assertEquals(Collections.singletonList("the band"), filter.getExcludeArtists());
        assertTrue(filter.hasClauses());
    }

    @Test
    void shouldComputeRecentlyAddedCutoffFromHourBucket() {
        StationRules rules = new StationRules();
        rules.setRecentlyAddedDays(30);

        CandidateFilter filter = builder.build(rules, NOW);

        assertEquals(LocalDateTime.of(2026, 1, 23, 12, 0), filter.getAddedAfter());
    }

    @Test
    void shouldCopyRanges() {
        StationRules rules = new StationRules();
        StationRules.YearRange years = new StationRules.YearRange();
        years.setMin(1990);
        years.setMax(1999);
        rules.setYearRange(years);
        StationRules.DurationRange duration = new StationRules.DurationRange();
        duration.setMaxSec(300);
        rules.setDurationRange(duration);

        CandidateFilter filter = builder.build(rules, NOW);

        assertEquals(Integer.valueOf(1990), filter.getYearMin());
        assertEquals(Integer.valueOf(1999), filter.getYearMax());
        assertNull(filter.getDurationMinSec());
        assertEquals(Integer.valueOf(300), filter.getDurationMaxSec());
    }

    @Test
    void shouldShareSignatureForEquivalentRulesInSameHour() {
        StationRules first = new StationRules();
        first.setIncludeArtists(Arrays.asList("Artist B", "artist a"));
        StationRules second = new StationRules();
        second.setIncludeArtists(Arrays.asList(" ARTIST A", "Artist B", "artist b"));

        String signature = builder.signature(first, NOW);

        assertEquals(signature, builder.signature(second, Instant.parse("2026-02-22T12:59:59Z")));
        assertNotEquals(signature, builder.signature(second, Instant.parse("2026-02-22T13:00:00Z")));
        assertNotEquals(signature, builder.signature(new StationRules(), NOW));
    }

    @Test
    void shouldNotConfuseIncludeAndExcludeInSignature() {
        StationRules include = new StationRules();
        include.setIncludeGenres(Collections.singletonList("Jazz"));
        StationRules exclude = new StationRules();
        exclude.setExcludeGenres(Collections.singletonList("Jazz"));

        assertNotEquals(builder.signature(include, NOW), builder.signature(exclude, NOW));
    }
}
