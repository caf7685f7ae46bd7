package com.example.cablebox.application.service;

import com.example.cablebox.common.config.AppStationProperties;
import com.example.cablebox.domain.model.ListeningHistorySnapshot;
import com.example.cablebox.domain.model.TrackFeedback;
import com.example.cablebox.infrastructure.history.ListeningHistory;
import com.example.cablebox.infrastructure.persistence.entity.TrackEntity;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.springframework.stereotype.Service;

/**
 * Loads repeat-avoidance, recency and feedback facts for a candidate pool.
 * Lookups never leave the pool's ids and run in bounded chunks.
 */
@Service
public class StationHistoryLoader {

    private final ListeningHistory listeningHistory;
    private final AppStationProperties stationProperties;

    public StationHistoryLoader(ListeningHistory listeningHistory, AppStationProperties stationProperties) {
        this.listeningHistory = listeningHistory;
        this.stationProperties = stationProperties;
    }

    public ListeningHistorySnapshot load(Long userId, List<TrackEntity> candidates, Instant now, int avoidRepeatHours) {
        if (candidates.isEmpty()) {
            return ListeningHistorySnapshot.empty();
        }
        Set<String> distinctIds = new LinkedHashSet<>();
        for (TrackEntity candidate : candidates) {
            distinctIds.add(candidate.getId());
        }
        Instant repeatCutoff = now.minus(Duration.ofHours(Math.max(0, avoidRepeatHours)));

        Set<String> recentlyPlayed = new HashSet<>();
        Map<String, Instant> lastPlayed = new HashMap<>();
        Map<String, TrackFeedback> feedback = new HashMap<>();
        for (List<String> chunk : chunk(new ArrayList<>(distinctIds), stationProperties.getHistoryBatchSize())) {
            recentlyPlayed.addAll(listeningHistory.recentlyPlayedIds(userId, chunk, repeatCutoff));
            lastPlayed.putAll(listeningHistory.lastPlayedPerTrack(userId, chunk));
            feedback.putAll(listeningHistory.feedbackPerTrack(userId, chunk));
        }
        return new ListeningHistorySnapshot(recentlyPlayed, lastPlayed, feedback);
    }

    private static List<List<String>> chunk(List<String> ids, int batchSize) {
        int size = Math.max(1, batchSize);
        List<List<String>> chunks = new ArrayList<>((ids.size() + size - 1) / size);
        for (int from = 0; from < ids.size(); from += size) {
            chunks.add(ids.subList(from, Math.min(ids.size(), from + size)));
        }
        return chunks;
    }
}
