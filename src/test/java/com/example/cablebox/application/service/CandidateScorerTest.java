package com.example.cablebox.application.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.example.cablebox.common.config.AppStationProperties;
import com.example.cablebox.domain.model.ListeningHistorySnapshot;
import com.example.cablebox.domain.model.TrackFeedback;
import com.example.cablebox.infrastructure.persistence.entity.TrackEntity;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class CandidateScorerTest {

    private static final Instant NOW = Instant.parse("2026-02-22T12:00:00Z");

    private final CandidateScorer scorer = new CandidateScorer(new AppStationProperties(), () -> 0.5D);

    @Test
    void shouldIncreaseRecencyBoostAsLastPlayMovesIntoThePast() {
        double oneHourAgo = CandidateScorer.computeRecencyBoost(NOW.minus(Duration.ofHours(1)), NOW, 36D);
        double sevenDaysAgo = CandidateScorer.computeRecencyBoost(NOW.minus(Duration.ofDays(7)), NOW, 36D);

        assertTrue(sevenDaysAgo > oneHourAgo);
        assertEquals(1D, CandidateScorer.computeRecencyBoost(null, NOW, 36D));
        assertTrue(sevenDaysAgo < 1D);
    }

    @Test
    void shouldRankLikedTrackAboveDislikedRepeatedArtist() {
        TrackEntity track = CandidateExclusionEngineTest.track("seeded-a", "Artist A");

        double liked = scorer.score(track, history("seeded-a", new TrackFeedback(true, false)),
                Collections.emptyList(), NOW, "fixed");
        double dislikedAndRepeated = scorer.score(track, history("seeded-a", new TrackFeedback(false, true)),
                Collections.singletonList("artist a"), NOW, "fixed");

        assertTrue(liked > dislikedAndRepeated);
        assertEquals(0.5D + 1.0D + 0.65D, liked - dislikedAndRepeated, 1e-9);
    }

    @Test
    void shouldUseSameBaseForSameSeed() {
        TrackEntity track = CandidateExclusionEngineTest.track("t1", "Artist A");
        ListeningHistorySnapshot history = ListeningHistorySnapshot.empty();

        double first = scorer.score(track, history, Collections.emptyList(), NOW, "seed-1");
        double second = scorer.score(track, history, Collections.emptyList(), NOW, "seed-1");

        assertEquals(first, second);
    }

    @Test
    void shouldDrawBaseFromRandomSourceWithoutSeed() {
        TrackEntity track = CandidateExclusionEngineTest.track("t1", "Artist A");

        double score = scorer.score(track, ListeningHistorySnapshot.empty(), Collections.emptyList(), NOW, null);

        assertEquals(1.5D, score, 1e-9);
    }

    private static ListeningHistorySnapshot history(String trackId, TrackFeedback feedback) {
        Map<String, TrackFeedback> byTrack = new HashMap<>();
        byTrack.put(trackId, feedback);
        return new ListeningHistorySnapshot(Collections.emptySet(), Collections.emptyMap(), byTrack);
    }
}
