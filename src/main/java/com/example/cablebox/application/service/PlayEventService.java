package com.example.cablebox.application.service;

import com.example.cablebox.domain.PlaybackReason;
import com.example.cablebox.infrastructure.persistence.entity.PlayEventEntity;
import com.example.cablebox.infrastructure.persistence.mapper.PlayEventMapper;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

@Service
public class PlayEventService {

    private static final Logger log = LoggerFactory.getLogger(PlayEventService.class);

    private final PlayEventMapper playEventMapper;

    public PlayEventService(PlayEventMapper playEventMapper) {
        this.playEventMapper = playEventMapper;
    }

    /**
     * Append the play produced by a station advance.
     *
     * @param startOffsetSec where playback starts inside the track
     * @param reason         why the track started playing
     */
    public void recordStationPlay(Long userId,
                                  Long stationId,
                                  String trackId,
                                  Instant playedAt,
                                  int startOffsetSec,
                                  PlaybackReason reason) {
        PlayEventEntity entity = new PlayEventEntity();
        entity.setUserId(userId);
        entity.setStationId(stationId);
        entity.setTrackId(trackId);
        entity.setPlayedAt(LocalDateTime.ofInstant(playedAt, ZoneOffset.UTC));
        entity.setSkipped(0);
        entity.setListenSeconds(0);
        entity.setStartOffsetSec(Math.max(0, startOffsetSec));
        entity.setReason(reason == null ? null : reason.name());

        playEventMapper.insert(entity);

        log.debug("Recorded station play: userId={}, stationId={}, trackId={}, offsetSec={}, reason={}",
                userId, stationId, trackId, startOffsetSec, reason);
    }

    /**
     * Record how the listener left the previous track. Updates the latest
     * play of that track on the station, or appends one when the play was
     * never recorded here.
     *
     * @param listenSeconds actual seconds played before the report
     */
    public void recordListen(Long userId,
                             Long stationId,
                             String trackId,
                             boolean skipped,
                             int listenSeconds,
                             Integer startOffsetSec,
                             PlaybackReason reason,
                             Instant reportedAt) {
        if (!StringUtils.hasText(trackId)) {
            log.warn("Ignored listen report with invalid trackId={}", trackId);
            return;
        }
        int safeListenSeconds = Math.max(0, listenSeconds);
        int updated = playEventMapper.updateLatestListen(
                userId, stationId, trackId.trim(), skipped ? 1 : 0, safeListenSeconds);
        if (updated > 0) {
            log.debug("Recorded listen report: userId={}, stationId={}, trackId={}, skipped={}, listenSeconds={}",
                    userId, stationId, trackId, skipped, safeListenSeconds);
            return;
        }

        PlayEventEntity entity = new PlayEventEntity();
        entity.setUserId(userId);
        entity.setStationId(stationId);
        entity.setTrackId(trackId.trim());
        entity.setPlayedAt(LocalDateTime.ofInstant(reportedAt, ZoneOffset.UTC));
        entity.setSkipped(skipped ? 1 : 0);
        entity.setListenSeconds(safeListenSeconds);
        entity.setStartOffsetSec(startOffsetSec == null ? 0 : Math.max(0, startOffsetSec));
        entity.setReason(reason == null ? null : reason.name());
        playEventMapper.insert(entity);

        log.debug("Appended listen report: userId={}, stationId={}, trackId={}, skipped={}, listenSeconds={}",
                userId, stationId, trackId, skipped, safeListenSeconds);
    }
}
