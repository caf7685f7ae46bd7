package com.example.cablebox.application.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.example.cablebox.common.config.AppStationProperties;
import com.example.cablebox.common.exception.BusinessException;
import com.example.cablebox.common.exception.StationErrorCodes;
import com.example.cablebox.domain.PlaybackReason;
import com.example.cablebox.domain.model.GenerationOptions;
import com.example.cablebox.domain.model.GenerationState;
import com.example.cablebox.domain.model.StationAdvanceResult;
import com.example.cablebox.domain.model.StationRules;
import com.example.cablebox.domain.model.StationTrack;
import com.example.cablebox.infrastructure.history.ListeningHistory;
import com.example.cablebox.infrastructure.persistence.entity.StationEntity;
import com.example.cablebox.infrastructure.persistence.mapper.StationMapper;
import com.example.cablebox.infrastructure.state.StationStateStore;
import com.example.cablebox.infrastructure.stream.StreamClientProvider;
import com.example.cablebox.infrastructure.stream.SubsonicStreamUrlResolver;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.stream.Collectors;
import javax.validation.Validation;
import javax.validation.ValidatorFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.support.StaticListableBeanFactory;

class StationGeneratorServiceTest {

    private static final Instant NOW = Instant.parse("2026-02-22T12:00:00Z");
    private static final Long USER_ID = 1L;
    private static final Long STATION_ID = 7L;

    private ValidatorFactory validatorFactory;
    private StationMapper stationMapper;
    private StationStateStore stationStateStore;
    private StationProgressRecorder progressRecorder;
    private StreamClientProvider streamClientProvider;
    private SimpleMeterRegistry meterRegistry;
    private AppStationProperties properties;
    private InMemoryTrackCatalog catalog;
    private StationGeneratorService service;

    @BeforeEach
    void setUp() {
        validatorFactory = Validation.buildDefaultValidatorFactory();
        stationMapper = mock(StationMapper.class);
        stationStateStore = mock(StationStateStore.class);
        progressRecorder = mock(StationProgressRecorder.class);
        streamClientProvider = mock(StreamClientProvider.class);
        meterRegistry = new SimpleMeterRegistry();
        properties = new AppStationProperties();

        when(stationMapper.selectByIdAndUserId(STATION_ID, USER_ID)).thenReturn(station("{}", 1));
        when(stationStateStore.getState(STATION_ID)).thenReturn(GenerationState.empty());
        when(streamClientProvider.forUser(USER_ID)).thenReturn(new SubsonicStreamUrlResolver(
                "http://music.local/", "demo", "tok", "salt", "music-cable-box", "1.16.1", "json"));

        useCatalog(InMemoryTrackCatalog.ofSize(60, 12));
    }

    @AfterEach
    void tearDown() {
        validatorFactory.close();
    }

    @Test
    void peekShouldReturnDistinctTracksWithoutPersisting() {
        List<StationTrack> preview = service.peekNextTracks(STATION_ID, USER_ID, 50,
                GenerationOptions.seeded("peek-seed", NOW));

        assertEquals(50, preview.size());
        assertEquals(50, new HashSet<>(trackIds(preview)).size());
        verifyNoInteractions(progressRecorder);
        verify(stationStateStore, never()).upsertState(anyLong(), anyLong(), any(GenerationState.class));
    }

    @Test
    void peekShouldBeReproducibleWithSeed() {
        List<StationTrack> first = service.peekNextTracks(STATION_ID, USER_ID, 10,
                GenerationOptions.seeded("repeatable", NOW));
        List<StationTrack> second = service.peekNextTracks(STATION_ID, USER_ID, 10,
                GenerationOptions.seeded("repeatable", NOW.plusSeconds(60)));

        assertEquals(trackIds(first), trackIds(second));
    }

    @Test
    void peekShouldStopEarlyWhenCandidatesRunOut() {
        useCatalog(InMemoryTrackCatalog.ofSize(3, 3));

        List<StationTrack> preview = service.peekNextTracks(STATION_ID, USER_ID, 10,
                GenerationOptions.seeded("short", NOW));

        assertEquals(3, preview.size());
        assertEquals(3, new HashSet<>(trackIds(preview)).size());
    }

    @Test
    void peekShouldReturnNothingForNonPositiveCount() {
        assertTrue(service.peekNextTracks(STATION_ID, USER_ID, 0).isEmpty());
        verifyNoInteractions(stationMapper);
    }

    @Test
    void peekShouldCapRequestedCount() {
        properties.setPeekMaxCount(5);

        assertEquals(5, service.peekNextTracks(STATION_ID, USER_ID, 40,
                GenerationOptions.seeded("cap", NOW)).size());
    }

    @Test
    void advanceShouldPersistStateAndRecordPlay() {
        StationAdvanceResult result = service.advanceNextTrack(STATION_ID, USER_ID,
                GenerationOptions.seeded("advance", NOW));

        String trackId = result.getTrack().getTrackId();
        ArgumentCaptor<GenerationState> stateCaptor = ArgumentCaptor.forClass(GenerationState.class);
        verify(progressRecorder).commitAdvance(eq(STATION_ID), eq(USER_ID), stateCaptor.capture(), eq(trackId),
                eq(NOW), anyInt(), any(PlaybackReason.class));
        assertEquals(Arrays.asList(trackId), stateCaptor.getValue().getRecentTrackIds());
        assertEquals(trackId, stateCaptor.getValue().getLastTrackId());
        assertEquals(NOW, stateCaptor.getValue().getLastPlayedAt());
        assertTrue(result.getTrack().getStreamUrl().startsWith("http://music.local/rest/stream.view?"));
        assertEquals(1D, meterRegistry.counter("station.advance.success",
                "reason", result.getPlayback().getReason().name()).count());
    }

    @Test
    void advanceShouldAvoidRecentTracksAndArtists() {
        useCatalog(InMemoryTrackCatalog.ofSize(3, 3));
        when(stationStateStore.getState(STATION_ID)).thenReturn(new GenerationState(
                Arrays.asList("t000", "t001"), Arrays.asList("Artist 0", "Artist 1"), "t001", NOW.minusSeconds(200)));

        StationAdvanceResult result = service.advanceNextTrack(STATION_ID, USER_ID,
                GenerationOptions.seeded("avoid", NOW));

        assertEquals("t002", result.getTrack().getTrackId());
    }

    @Test
    void advanceShouldStartResumedTrackFromTheTop() {
        when(stationMapper.selectByIdAndUserId(STATION_ID, USER_ID))
                .thenReturn(station("{\"tuneInProbability\":1}", 1));
        GenerationOptions options = GenerationOptions.seeded("resume", NOW);
        options.setReason(PlaybackReason.RESUME);

        StationAdvanceResult result = service.advanceNextTrack(STATION_ID, USER_ID, options);

        assertEquals(0, result.getPlayback().getStartOffsetSec());
        assertEquals(PlaybackReason.RESUME, result.getPlayback().getReason());
    }

    @Test
    void advanceShouldTuneIntoTrackWhenEnabled() {
        when(stationMapper.selectByIdAndUserId(STATION_ID, USER_ID))
                .thenReturn(station("{\"tuneInProbability\":1}", 1));

        StationAdvanceResult result = service.advanceNextTrack(STATION_ID, USER_ID,
                GenerationOptions.seeded("tune-in", NOW));

        assertEquals(PlaybackReason.TUNE_IN, result.getPlayback().getReason());
        assertTrue(result.getPlayback().getStartOffsetSec() >= 8);
        assertTrue(result.getPlayback().getStartOffsetSec() <= 108);
        verify(progressRecorder).commitAdvance(eq(STATION_ID), eq(USER_ID), any(GenerationState.class),
                anyString(), eq(NOW), eq(result.getPlayback().getStartOffsetSec()), eq(PlaybackReason.TUNE_IN));
    }

    @Test
    void advanceShouldRejectMissingOrDisabledStation() {
        when(stationMapper.selectByIdAndUserId(STATION_ID, USER_ID)).thenReturn(null);
        BusinessException missing = assertThrows(BusinessException.class,
                () -> service.advanceNextTrack(STATION_ID, USER_ID));

        when(stationMapper.selectByIdAndUserId(STATION_ID, USER_ID)).thenReturn(station("{}", 0));
        BusinessException disabled = assertThrows(BusinessException.class,
                () -> service.peekNextTracks(STATION_ID, USER_ID, 5));

        assertEquals(StationErrorCodes.STATION_UNAVAILABLE, missing.getCode());
        assertEquals(StationErrorCodes.STATION_UNAVAILABLE, disabled.getCode());
        verifyNoInteractions(progressRecorder);
        assertEquals(1D, meterRegistry.counter("station.advance.failure",
                "code", StationErrorCodes.STATION_UNAVAILABLE).count());
    }

    @Test
    void advanceShouldFailWithoutCandidates() {
        useCatalog(InMemoryTrackCatalog.ofSize(0, 1));

        BusinessException error = assertThrows(BusinessException.class,
                () -> service.advanceNextTrack(STATION_ID, USER_ID, GenerationOptions.seeded("empty", NOW)));

        assertEquals(StationErrorCodes.STATION_NO_CANDIDATES, error.getCode());
        verifyNoInteractions(progressRecorder);
        assertTrue(service.peekNextTracks(STATION_ID, USER_ID, 5, GenerationOptions.seeded("empty", NOW)).isEmpty());
    }

    @Test
    void advanceShouldNotPersistWhenStreamAccountIsMissing() {
        when(streamClientProvider.forUser(USER_ID)).thenThrow(new BusinessException(
                StationErrorCodes.STREAM_ACCOUNT_MISSING, "missing"));

        assertThrows(BusinessException.class, () -> service.advanceNextTrack(STATION_ID, USER_ID));
        verifyNoInteractions(progressRecorder);
    }

    @Test
    void previewCountShouldReportMatchingRows() {
        assertEquals(60, service.getStationPreviewCount(new StationRules(), NOW));
        assertEquals(60, service.getStationPreviewCount(STATION_ID, USER_ID));
    }

    @Test
    void tuneInOffsetShouldBeReproducibleWithSeed() {
        StationRules rules = new StationRules();
        rules.setTuneInProbability(1D);

        int first = service.computeTuneInOffset("t001", 240, rules, "seed");
        int second = service.computeTuneInOffset("t001", 240, rules, "seed");

        assertEquals(first, second);
        assertEquals(0, service.computeTuneInOffset("t001", 30, rules, "seed"));
    }

    private void useCatalog(InMemoryTrackCatalog trackCatalog) {
        catalog = trackCatalog;
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        ListeningHistory listeningHistory = mock(ListeningHistory.class);
        CandidatePoolCache poolCache = new CandidatePoolCache(catalog, properties, clock, () -> 0.42D);
        StationTrackPicker picker = new StationTrackPicker(
                new CandidateExclusionEngine(),
                new CandidateScorer(properties, () -> 0.42D),
                new WeightedSampler(properties),
                properties,
                () -> 0.42D);
        service = new StationGeneratorService(
                stationMapper,
                new StationRulesParser(new ObjectMapper(), validatorFactory.getValidator()),
                new CandidateFilterBuilder(),
                poolCache,
                catalog,
                new StationHistoryLoader(listeningHistory, properties),
                stationStateStore,
                picker,
                new TuneInOffsetCalculator(),
                progressRecorder,
                streamClientProvider,
                properties,
                beanProvider(meterRegistry),
                clock,
                () -> 0.42D);
    }

    private static StationEntity station(String rulesJson, int enabled) {
        StationEntity entity = new StationEntity();
        entity.setId(STATION_ID);
        entity.setUserId(USER_ID);
        entity.setName("Evening Rock");
        entity.setRulesJson(rulesJson);
        entity.setIsEnabled(enabled);
        return entity;
    }

    private static List<String> trackIds(List<StationTrack> tracks) {
        return tracks.stream().map(StationTrack::getTrackId).collect(Collectors.toList());
    }

    private static ObjectProvider<MeterRegistry> beanProvider(MeterRegistry meterRegistry) {
        StaticListableBeanFactory beanFactory = new StaticListableBeanFactory();
        beanFactory.addBean("meterRegistry", meterRegistry);
        return beanFactory.getBeanProvider(MeterRegistry.class);
    }
}
