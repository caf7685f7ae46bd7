package com.example.cablebox.domain.model;

import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.Set;

/**
 * Per-user history facts about one candidate pool.
 */
public final class ListeningHistorySnapshot {

    private final Set<String> recentlyPlayedIds;
    private final Map<String, Instant> lastPlayedAt;
    private final Map<String, TrackFeedback> feedback;

    public ListeningHistorySnapshot(Set<String> recentlyPlayedIds,
                                    Map<String, Instant> lastPlayedAt,
                                    Map<String, TrackFeedback> feedback) {
        this.recentlyPlayedIds = Collections.unmodifiableSet(recentlyPlayedIds);
        this.lastPlayedAt = Collections.unmodifiableMap(lastPlayedAt);
        this.feedback = Collections.unmodifiableMap(feedback);
    }

    public static ListeningHistorySnapshot empty() {
        return new ListeningHistorySnapshot(Collections.emptySet(), Collections.emptyMap(), Collections.emptyMap());
    }

    /** Ids played inside the station's repeat-avoidance window. */
    public Set<String> getRecentlyPlayedIds() {
        return recentlyPlayedIds;
    }

    /** Latest play per id across all history; absent means never played. */
    public Instant lastPlayedAt(String trackId) {
        return lastPlayedAt.get(trackId);
    }

    public TrackFeedback feedbackFor(String trackId) {
        return feedback.getOrDefault(trackId, TrackFeedback.NONE);
    }
}
