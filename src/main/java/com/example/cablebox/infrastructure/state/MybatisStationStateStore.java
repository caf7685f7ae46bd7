package com.example.cablebox.infrastructure.state;

import com.example.cablebox.domain.model.GenerationState;
import com.example.cablebox.infrastructure.persistence.entity.StationStateEntity;
import com.example.cablebox.infrastructure.persistence.mapper.StationStateMapper;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

@Component
public class MybatisStationStateStore implements StationStateStore {

    private static final Logger log = LoggerFactory.getLogger(MybatisStationStateStore.class);

    private static final TypeReference<List<Object>> JSON_LIST = new TypeReference<List<Object>>() {
    };

    private final StationStateMapper stationStateMapper;
    private final ObjectMapper objectMapper;

    public MybatisStationStateStore(StationStateMapper stationStateMapper, ObjectMapper objectMapper) {
        this.stationStateMapper = stationStateMapper;
        this.objectMapper = objectMapper;
    }

    @Override
    public GenerationState getState(Long stationId) {
        StationStateEntity entity = stationStateMapper.selectByStationId(stationId);
        if (entity == null) {
            return GenerationState.empty();
        }
        Instant lastPlayedAt = entity.getLastPlayedAt() == null
                ? null
                : entity.getLastPlayedAt().toInstant(ZoneOffset.UTC);
        return new GenerationState(
                readStringList(stationId, entity.getRecentTrackIdsJson()),
                readStringList(stationId, entity.getRecentArtistNamesJson()),
                entity.getLastTrackId(),
                lastPlayedAt
        );
    }

    @Override
    public void upsertState(Long stationId, Long userId, GenerationState state) {
        StationStateEntity entity = new StationStateEntity();
        entity.setStationId(stationId);
        entity.setUserId(userId);
        entity.setRecentTrackIdsJson(writeStringList(state.getRecentTrackIds()));
        entity.setRecentArtistNamesJson(writeStringList(state.getRecentArtistNames()));
        entity.setLastTrackId(state.getLastTrackId());
        entity.setLastPlayedAt(state.getLastPlayedAt() == null
                ? null
                : LocalDateTime.ofInstant(state.getLastPlayedAt(), ZoneOffset.UTC));
        stationStateMapper.upsert(entity);
    }

    /**
     * Non-string entries are skipped; a malformed column reads as empty so a
     * damaged row cannot block the station.
     */
    private List<String> readStringList(Long stationId, String json) {
        if (!StringUtils.hasText(json)) {
            return Collections.emptyList();
        }
        try {
            List<Object> raw = objectMapper.readValue(json, JSON_LIST);
            List<String> values = new ArrayList<>(raw.size());
            for (Object entry : raw) {
                if (entry instanceof String) {
                    values.add((String) entry);
                }
            }
            return values;
        } catch (JsonProcessingException e) {
            log.warn("STATION_EVENT event=state_json_unreadable stationId={} reason={}", stationId, e.getOriginalMessage());
            return Collections.emptyList();
        }
    }

    private String writeStringList(List<String> values) {
        try {
            return objectMapper.writeValueAsString(values);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize station state", e);
        }
    }
}
