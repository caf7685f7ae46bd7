package com.example.cablebox.application.service;

import com.example.cablebox.domain.PlaybackReason;
import com.example.cablebox.domain.model.GenerationState;
import com.example.cablebox.infrastructure.state.StationStateStore;
import java.time.Instant;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Writes the outcome of one advance: the new station state and its play
 * event, both or neither.
 */
@Service
public class StationProgressRecorder {

    private final StationStateStore stationStateStore;
    private final PlayEventService playEventService;

    public StationProgressRecorder(StationStateStore stationStateStore, PlayEventService playEventService) {
        this.stationStateStore = stationStateStore;
        this.playEventService = playEventService;
    }

    @Transactional(rollbackFor = Exception.class)
    public void commitAdvance(Long stationId,
                              Long userId,
                              GenerationState nextState,
                              String trackId,
                              Instant playedAt,
                              int startOffsetSec,
                              PlaybackReason reason) {
        stationStateStore.upsertState(stationId, userId, nextState);
        playEventService.recordStationPlay(userId, stationId, trackId, playedAt, startOffsetSec, reason);
    }
}
