package com.example.cablebox.infrastructure.history;

import com.example.cablebox.domain.model.TrackFeedback;
import com.example.cablebox.infrastructure.persistence.entity.TrackFeedbackEntity;
import com.example.cablebox.infrastructure.persistence.mapper.PlayEventMapper;
import com.example.cablebox.infrastructure.persistence.mapper.TrackFeedbackMapper;
import com.example.cablebox.infrastructure.persistence.model.LastPlayedRow;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.springframework.stereotype.Component;

@Component
public class MybatisListeningHistory implements ListeningHistory {

    private final PlayEventMapper playEventMapper;
    private final TrackFeedbackMapper trackFeedbackMapper;

    public MybatisListeningHistory(PlayEventMapper playEventMapper, TrackFeedbackMapper trackFeedbackMapper) {
        this.playEventMapper = playEventMapper;
        this.trackFeedbackMapper = trackFeedbackMapper;
    }

    @Override
    public Set<String> recentlyPlayedIds(Long userId, List<String> trackIds, Instant since) {
        if (trackIds.isEmpty()) {
            return new HashSet<>();
        }
        LocalDateTime sinceUtc = LocalDateTime.ofInstant(since, ZoneOffset.UTC);
        return new HashSet<>(playEventMapper.selectRecentlyPlayedIds(userId, trackIds, sinceUtc));
    }

    @Override
    public Map<String, Instant> lastPlayedPerTrack(Long userId, List<String> trackIds) {
        Map<String, Instant> result = new HashMap<>();
        if (trackIds.isEmpty()) {
            return result;
        }
        for (LastPlayedRow row : playEventMapper.selectLastPlayedPerTrack(userId, trackIds)) {
            if (row.getTrackId() != null && row.getLastPlayedAt() != null) {
                result.put(row.getTrackId(), row.getLastPlayedAt().toInstant(ZoneOffset.UTC));
            }
        }
        return result;
    }

    @Override
    public Map<String, TrackFeedback> feedbackPerTrack(Long userId, List<String> trackIds) {
        Map<String, TrackFeedback> result = new HashMap<>();
        if (trackIds.isEmpty()) {
            return result;
        }
        for (TrackFeedbackEntity row : trackFeedbackMapper.selectByUserAndTrackIds(userId, trackIds)) {
            result.put(row.getTrackId(), new TrackFeedback(isSet(row.getLiked()), isSet(row.getDisliked())));
        }
        return result;
    }

    private static boolean isSet(Integer flag) {
        return flag != null && flag == 1;
    }
}
