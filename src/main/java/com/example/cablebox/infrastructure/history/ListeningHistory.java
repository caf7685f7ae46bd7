package com.example.cablebox.infrastructure.history;

import com.example.cablebox.domain.model.TrackFeedback;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Per-user play history and feedback, always restricted to the given ids.
 */
public interface ListeningHistory {

    Set<String> recentlyPlayedIds(Long userId, List<String> trackIds, Instant since);

    Map<String, Instant> lastPlayedPerTrack(Long userId, List<String> trackIds);

    Map<String, TrackFeedback> feedbackPerTrack(Long userId, List<String> trackIds);
}
