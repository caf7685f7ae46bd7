package com.example.cablebox.infrastructure.state;

import com.example.cablebox.domain.model.GenerationState;

public interface StationStateStore {

    /** Persisted state, or an empty state for a station that never played. */
    GenerationState getState(Long stationId);

    void upsertState(Long stationId, Long userId, GenerationState state);
}
