package com.example.cablebox.application.service;

import com.example.cablebox.common.config.AppStationProperties;
import com.example.cablebox.common.exception.BusinessException;
import com.example.cablebox.common.exception.StationErrorCodes;
import com.example.cablebox.common.util.RandomSource;
import com.example.cablebox.domain.PlaybackReason;
import com.example.cablebox.domain.model.CandidateFilter;
import com.example.cablebox.domain.model.GenerationContext;
import com.example.cablebox.domain.model.GenerationOptions;
import com.example.cablebox.domain.model.GenerationPick;
import com.example.cablebox.domain.model.GenerationState;
import com.example.cablebox.domain.model.ListeningHistorySnapshot;
import com.example.cablebox.domain.model.PlaybackInfo;
import com.example.cablebox.domain.model.StationAdvanceResult;
import com.example.cablebox.domain.model.StationRules;
import com.example.cablebox.domain.model.StationTrack;
import com.example.cablebox.domain.model.TuneInSettings;
import com.example.cablebox.infrastructure.catalog.TrackCatalog;
import com.example.cablebox.infrastructure.persistence.entity.StationEntity;
import com.example.cablebox.infrastructure.persistence.entity.TrackEntity;
import com.example.cablebox.infrastructure.persistence.mapper.StationMapper;
import com.example.cablebox.infrastructure.state.StationStateStore;
import com.example.cablebox.infrastructure.stream.StreamClientProvider;
import com.example.cablebox.infrastructure.stream.StreamUrlResolver;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Entry point of station generation.
 * <p>
 * {@link #advanceNextTrack} consumes one track and persists the station's new
 * state together with a play event. {@link #peekNextTracks} runs the same
 * pick against a local copy of the state and writes nothing. Advances of one
 * station are serialized by an in-process lock; all reads and the pick happen
 * before the single transactional write, so a failed advance records nothing.
 */
@Service
public class StationGeneratorService {

    private static final Logger log = LoggerFactory.getLogger(StationGeneratorService.class);

    private final StationMapper stationMapper;
    private final StationRulesParser rulesParser;
    private final CandidateFilterBuilder filterBuilder;
    private final CandidatePoolCache poolCache;
    private final TrackCatalog trackCatalog;
    private final StationHistoryLoader historyLoader;
    private final StationStateStore stationStateStore;
    private final StationTrackPicker trackPicker;
    private final TuneInOffsetCalculator tuneInOffsetCalculator;
    private final StationProgressRecorder progressRecorder;
    private final StreamClientProvider streamClientProvider;
    private final AppStationProperties stationProperties;
    private final MeterRegistry meterRegistry;
    private final Clock clock;
    private final RandomSource randomSource;
    private final ReentrantLock[] advanceLocks;

    @Autowired
    public StationGeneratorService(StationMapper stationMapper,
                                   StationRulesParser rulesParser,
                                   CandidateFilterBuilder filterBuilder,
                                   CandidatePoolCache poolCache,
                                   TrackCatalog trackCatalog,
                                   StationHistoryLoader historyLoader,
                                   StationStateStore stationStateStore,
                                   StationTrackPicker trackPicker,
                                   TuneInOffsetCalculator tuneInOffsetCalculator,
                                   StationProgressRecorder progressRecorder,
                                   StreamClientProvider streamClientProvider,
                                   AppStationProperties stationProperties,
                                   ObjectProvider<MeterRegistry> meterRegistryProvider) {
        this(stationMapper, rulesParser, filterBuilder, poolCache, trackCatalog, historyLoader, stationStateStore,
                trackPicker, tuneInOffsetCalculator, progressRecorder, streamClientProvider, stationProperties,
                meterRegistryProvider, Clock.systemUTC(), RandomSource.system());
    }

    StationGeneratorService(StationMapper stationMapper,
                            StationRulesParser rulesParser,
                            CandidateFilterBuilder filterBuilder,
                            CandidatePoolCache poolCache,
                            TrackCatalog trackCatalog,
                            StationHistoryLoader historyLoader,
                            StationStateStore stationStateStore,
                            StationTrackPicker trackPicker,
                            TuneInOffsetCalculator tuneInOffsetCalculator,
                            StationProgressRecorder progressRecorder,
                            StreamClientProvider streamClientProvider,
                            AppStationProperties stationProperties,
                            ObjectProvider<MeterRegistry> meterRegistryProvider,
                            Clock clock,
                            RandomSource randomSource) {
        this.stationMapper = stationMapper;
        this.rulesParser = rulesParser;
        this.filterBuilder = filterBuilder;
        this.poolCache = poolCache;
        this.trackCatalog = trackCatalog;
        this.historyLoader = historyLoader;
        this.stationStateStore = stationStateStore;
        this.trackPicker = trackPicker;
        this.tuneInOffsetCalculator = tuneInOffsetCalculator;
        this.progressRecorder = progressRecorder;
        this.streamClientProvider = streamClientProvider;
        this.stationProperties = stationProperties;
        this.meterRegistry = meterRegistryProvider.getIfAvailable();
        this.clock = clock;
        this.randomSource = randomSource;
        this.advanceLocks = new ReentrantLock[Math.max(1, stationProperties.getAdvanceLockStripes())];
        for (int i = 0; i < advanceLocks.length; i++) {
            advanceLocks[i] = new ReentrantLock();
        }
    }

    public StationAdvanceResult advanceNextTrack(Long stationId, Long userId) {
        return advanceNextTrack(stationId, userId, GenerationOptions.defaults());
    }

    /**
     * Pick the next track, persist the advanced state and append a play event.
     *
     * @throws BusinessException {@code STATION_UNAVAILABLE} for a missing or
     *                           disabled station, {@code STATION_NO_CANDIDATES}
     *                           when the rules match nothing
     */
    public StationAdvanceResult advanceNextTrack(Long stationId, Long userId, GenerationOptions options) {
        long startedAtNanos = System.nanoTime();
        GenerationOptions safeOptions = options == null ? GenerationOptions.defaults() : options;
        ReentrantLock lock = advanceLockFor(stationId);
        lock.lock();
        try {
            GenerationContext context = buildContext(stationId, userId, safeOptions);
            GenerationPick pick = trackPicker.pick(context, context.getState(), Collections.emptySet(), 0);
            TrackEntity track = pick.getTrack();
            PlaybackInfo playback = resolvePlayback(track, context.getRules(), safeOptions.getReason(),
                    context.getSeed());

            progressRecorder.commitAdvance(stationId, userId, pick.getNextState(), track.getId(), context.getNow(),
                    playback.getStartOffsetSec(), playback.getReason());

            log.info("STATION_EVENT event=advance stationId={} userId={} trackId={} offsetSec={} reason={} "
                            + "relaxedTrack={} relaxedArtist={} poolSize={} traceId={}",
                    stationId, userId, track.getId(), playback.getStartOffsetSec(), playback.getReason(),
                    pick.isRelaxedTrackExclusion(), pick.isRelaxedArtistExclusion(),
                    context.getCandidates().size(), currentTraceId());
            recordRelaxation(pick);
            recordCounter("station.advance.success", "reason", playback.getReason().name());
            return new StationAdvanceResult(toStationTrack(track, context.getStreamUrlResolver()), playback);
        } catch (BusinessException e) {
            log.warn("STATION_EVENT event=advance_failure stationId={} userId={} code={} traceId={}",
                    stationId, userId, safeCode(e.getCode()), currentTraceId());
            recordCounter("station.advance.failure", "code", safeCode(e.getCode()));
            throw e;
        } finally {
            lock.unlock();
            recordDuration("station.advance.latency", System.nanoTime() - startedAtNanos);
        }
    }

    public List<StationTrack> peekNextTracks(Long stationId, Long userId, int count) {
        return peekNextTracks(stationId, userId, count, GenerationOptions.defaults());
    }

    /**
     * Preview up to {@code count} upcoming tracks without touching persisted
     * state. Stops early when a step cannot pick a track.
     */
    public List<StationTrack> peekNextTracks(Long stationId, Long userId, int count, GenerationOptions options) {
        if (count <= 0) {
            return Collections.emptyList();
        }
        int safeCount = Math.min(count, Math.max(1, stationProperties.getPeekMaxCount()));
        GenerationOptions safeOptions = options == null ? GenerationOptions.defaults() : options;
        GenerationContext context = buildContext(stationId, userId, safeOptions);

        GenerationState simulated = context.getState();
        Set<String> pickedIds = new LinkedHashSet<>();
        List<StationTrack> preview = new ArrayList<>(safeCount);
        for (int step = 0; step < safeCount; step++) {
            GenerationPick pick;
            try {
                pick = trackPicker.pick(context, simulated, pickedIds, step);
            } catch (RuntimeException e) {
                log.info("STATION_EVENT event=peek_stopped stationId={} userId={} step={} requested={} reason={} traceId={}",
                        stationId, userId, step, safeCount, describe(e), currentTraceId());
                break;
            }
            simulated = pick.getNextState();
            pickedIds.add(pick.getTrack().getId());
            preview.add(toStationTrack(pick.getTrack(), context.getStreamUrlResolver()));
        }

        log.debug("STATION_EVENT event=peek stationId={} userId={} requested={} returned={} traceId={}",
                stationId, userId, safeCount, preview.size(), currentTraceId());
        recordCounter("station.peek.requests");
        return preview;
    }

    /**
     * Number of catalog tracks the rules match, without picking.
     */
    public int getStationPreviewCount(StationRules rules, Instant now) {
        StationRules safeRules = rulesParser.validate(rules == null ? new StationRules() : rules);
        CandidateFilter filter = filterBuilder.build(safeRules, now == null ? clock.instant() : now);
        long total = trackCatalog.count(filter);
        return (int) Math.min(Integer.MAX_VALUE, Math.max(0L, total));
    }

    public int getStationPreviewCount(Long stationId, Long userId) {
        StationRules rules = rulesParser.parse(loadAvailableStation(stationId, userId).getRulesJson());
        return getStationPreviewCount(rules, clock.instant());
    }

    /**
     * Start offset for a track when tuning into the station. With a seed the
     * result is reproducible per track.
     */
    public int computeTuneInOffset(String trackId, Integer durationSec, StationRules rules, String seed) {
        TuneInSettings settings = TuneInSettings.from(rules);
        String gateKey = seed == null ? null : seed + ":tune-in-gate:" + trackId;
        String offsetKey = seed == null ? null : seed + ":tune-in-offset:" + trackId;
        return tuneInOffsetCalculator.compute(durationSec, settings,
                randomSource.drawFor(gateKey), randomSource.drawFor(offsetKey));
    }

    private GenerationContext buildContext(Long stationId, Long userId, GenerationOptions options) {
        StationEntity station = loadAvailableStation(stationId, userId);
        StationRules rules = rulesParser.parse(station.getRulesJson());
        Instant now = options.getNow() == null ? clock.instant() : options.getNow();
        String seed = StringUtils.hasText(options.getSeed()) ? options.getSeed().trim() : null;

        StreamUrlResolver streamUrlResolver = streamClientProvider.forUser(userId);
        CandidateFilter filter = filterBuilder.build(rules, now);
        String signature = filterBuilder.signature(rules, now);
        List<TrackEntity> candidates = poolCache.getPool(userId, stationId, filter, signature, seed);
        ListeningHistorySnapshot history = historyLoader.load(userId, candidates, now, rules.getAvoidRepeatHours());
        GenerationState state = stationStateStore.getState(stationId);
        return new GenerationContext(stationId, userId, rules, now, seed, candidates, history, state,
                streamUrlResolver);
    }

    private StationEntity loadAvailableStation(Long stationId, Long userId) {
        StationEntity station = stationId == null || userId == null
                ? null
                : stationMapper.selectByIdAndUserId(stationId, userId);
        if (station == null || station.getIsEnabled() == null || station.getIsEnabled() != 1) {
            throw new BusinessException(StationErrorCodes.STATION_UNAVAILABLE,
                    "Station is unavailable", "Pick another station");
        }
        return station;
    }

    private PlaybackInfo resolvePlayback(TrackEntity track, StationRules rules, PlaybackReason requested, String seed) {
        PlaybackReason reason = requested == null ? PlaybackReason.MANUAL : requested;
        if (reason == PlaybackReason.RESUME || reason == PlaybackReason.NEXT) {
            return new PlaybackInfo(0, reason);
        }
        int offset = computeTuneInOffset(track.getId(), track.getDurationSec(), rules, seed);
        return new PlaybackInfo(offset, offset > 0 ? PlaybackReason.TUNE_IN : PlaybackReason.MANUAL);
    }

    private StationTrack toStationTrack(TrackEntity track, StreamUrlResolver streamUrlResolver) {
        StationTrack result = new StationTrack();
        result.setTrackId(track.getId());
        result.setTitle(track.getTitle());
        result.setArtist(track.getArtist());
        result.setAlbum(track.getAlbum());
        result.setDurationSec(track.getDurationSec());
        result.setGenre(track.getGenre());
        result.setYear(track.getYear());
        result.setStreamUrl(streamUrlResolver.buildStreamUrl(track.getId()));
        if (StringUtils.hasText(track.getCoverArtId())) {
            result.setArtworkUrl(streamUrlResolver.buildCoverArtUrl(track.getCoverArtId()));
        }
        return result;
    }

    private ReentrantLock advanceLockFor(Long stationId) {
        int hash = stationId == null ? 0 : stationId.hashCode();
        return advanceLocks[Math.floorMod(hash, advanceLocks.length)];
    }

    private void recordRelaxation(GenerationPick pick) {
        if (pick.isRelaxedTrackExclusion()) {
            recordCounter("station.exclusion.relaxed", "kind", "track");
        }
        if (pick.isRelaxedArtistExclusion()) {
            recordCounter("station.exclusion.relaxed", "kind", "artist");
        }
    }

    private String describe(RuntimeException e) {
        if (e instanceof BusinessException) {
            return safeCode(((BusinessException) e).getCode());
        }
        return e.getClass().getSimpleName();
    }

    private String currentTraceId() {
        String traceId = MDC.get("requestId");
        return StringUtils.hasText(traceId) ? traceId : "unknown";
    }

    private String safeCode(String code) {
        return StringUtils.hasText(code) ? code : "UNKNOWN";
    }

    private void recordCounter(String name, String... tags) {
        if (meterRegistry == null) {
            return;
        }
        try {
            meterRegistry.counter(name, tags).increment();
        } catch (Exception ex) {
            log.debug("Station metric counter failed, name={}", name, ex);
        }
    }

    private void recordDuration(String name, long nanos) {
        if (meterRegistry == null || nanos <= 0) {
            return;
        }
        try {
            meterRegistry.timer(name).record(nanos, TimeUnit.NANOSECONDS);
        } catch (Exception ex) {
            log.debug("Station metric timer failed, name={}", name, ex);
        }
    }
}
