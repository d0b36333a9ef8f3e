package me.golemcore.presence.domain.service;

import me.golemcore.presence.domain.model.DayBoundaryDecision;
import me.golemcore.presence.domain.model.SleepSegment;
import me.golemcore.presence.domain.model.SleepSource;
import me.golemcore.presence.port.outbound.DayStartPort;
import me.golemcore.presence.port.outbound.TelemetryStoreException;
import me.golemcore.presence.port.outbound.TelemetryStorePort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class DayBoundaryResolverTest {

    private TelemetryStorePort telemetryStore;
    private SleepWakeRecorder recorder;
    private DayStartPort dayStartPort;
    private DayBoundaryResolver resolver;

    @BeforeEach
    void setUp() {
        telemetryStore = mock(TelemetryStorePort.class);
        recorder = mock(SleepWakeRecorder.class);
        dayStartPort = mock(DayStartPort.class);
        Clock clock = Clock.fixed(Instant.parse("2026-03-11T07:00:00Z"), ZoneOffset.UTC);
        resolver = new DayBoundaryResolver(telemetryStore, recorder, dayStartPort, SleepSettings.defaults(), clock);
    }

    private static Instant at(String time) {
        return Instant.parse(time);
    }

    // ===== Away returns =====

    @Test
    void shouldIgnoreBriefAway() {
        DayBoundaryDecision decision = resolver.onAwayReturn(at("2026-03-11T03:00:00Z"),
                at("2026-03-11T03:10:00Z"), at("2026-03-11T03:10:00Z"));

        assertEquals(DayBoundaryDecision.NOT_A_DAY_START, decision);
        verifyNoInteractions(dayStartPort);
    }

    @Test
    void shouldIgnoreDaytimeBreak() {
        DayBoundaryDecision decision = resolver.onAwayReturn(at("2026-03-11T12:00:00Z"),
                at("2026-03-11T14:00:00Z"), at("2026-03-11T14:00:00Z"));

        assertEquals(DayBoundaryDecision.NOT_A_DAY_START, decision);
        assertTrue(resolver.getPendingWake().isEmpty());
    }

    @Test
    void shouldConfirmImmediatelyWhenReturningAfterWindowClosed() {
        Instant back = at("2026-03-11T09:30:00Z");

        DayBoundaryDecision decision = resolver.onAwayReturn(at("2026-03-10T23:00:00Z"), back, back);

        assertEquals(DayBoundaryDecision.CONFIRMED_DAY_START, decision);
        verify(dayStartPort).onDayStart(back);
        assertEquals(Optional.of(back), resolver.getCurrentDayStart());
    }

    @Test
    void shouldAwaitConfirmationForReturnInsideWindow() {
        Instant back = at("2026-03-11T07:00:00Z");

        DayBoundaryDecision decision = resolver.onAwayReturn(at("2026-03-10T23:00:00Z"), back, back);

        assertEquals(DayBoundaryDecision.AWAITING_CONFIRMATION, decision);
        assertEquals(Optional.of(back), resolver.getPendingWake());
        verifyNoInteractions(dayStartPort);

        assertTrue(resolver.onActivePoll(at("2026-03-11T07:10:00Z")).isEmpty());
        assertEquals(Optional.of(back), resolver.onActivePoll(at("2026-03-11T07:15:00Z")));

        verify(dayStartPort).onDayStart(back);
        assertEquals(Optional.of(back), resolver.getCurrentDayStart());
        assertTrue(resolver.getPendingWake().isEmpty());
    }

    @Test
    void shouldNotLetEveningBreakUseUpTheNight() {
        Instant evening = at("2026-03-10T22:40:00Z");

        DayBoundaryDecision decision = resolver.onAwayReturn(at("2026-03-10T22:00:00Z"), evening, evening);

        assertEquals(DayBoundaryDecision.NOT_A_DAY_START, decision);
        assertTrue(resolver.getPendingWake().isEmpty());
        assertTrue(resolver.onActivePoll(at("2026-03-10T22:56:00Z")).isEmpty());

        Instant morning = at("2026-03-11T09:30:00Z");
        DayBoundaryDecision morningDecision = resolver.onAwayReturn(at("2026-03-11T00:30:00Z"), morning, morning);

        assertEquals(DayBoundaryDecision.CONFIRMED_DAY_START, morningDecision);
        verify(dayStartPort).onDayStart(morning);
        verify(dayStartPort, never()).onDayStart(evening);
        assertEquals(Optional.of(morning), resolver.getCurrentDayStart());
    }

    @Test
    void shouldTreatShortNightBreakBeforeWakeDividerAsInterruption() {
        Instant back = at("2026-03-11T02:40:00Z");

        DayBoundaryDecision decision = resolver.onAwayReturn(at("2026-03-11T02:00:00Z"), back, back);

        assertEquals(DayBoundaryDecision.NOT_A_DAY_START, decision);
        assertTrue(resolver.getPendingWake().isEmpty());
    }

    @Test
    void shouldHoldShortBreakAfterWakeDividerAsPendingWake() {
        Instant back = at("2026-03-11T05:45:00Z");

        DayBoundaryDecision decision = resolver.onAwayReturn(at("2026-03-11T05:00:00Z"), back, back);

        assertEquals(DayBoundaryDecision.AWAITING_CONFIRMATION, decision);
        assertEquals(Optional.of(back), resolver.getPendingWake());
    }

    @Test
    void shouldConfirmPendingWakeWhenWindowCloses() {
        Instant back = at("2026-03-11T08:55:00Z");
        resolver.onAwayReturn(at("2026-03-11T01:00:00Z"), back, back);

        assertEquals(Optional.of(back), resolver.onActivePoll(at("2026-03-11T09:00:00Z")));
        verify(dayStartPort).onDayStart(back);
    }

    @Test
    void shouldRecordBriefActivityWhenUserLeavesAgain() {
        Instant back = at("2026-03-11T04:00:00Z");
        resolver.onAwayReturn(at("2026-03-10T23:30:00Z"), back, back);

        resolver.onAwayStarted(at("2026-03-11T04:05:00Z"), at("2026-03-11T04:08:00Z"));

        verify(recorder).recordBriefActivity(back, at("2026-03-11T04:05:00Z"));
        verifyNoInteractions(dayStartPort);
        assertTrue(resolver.getPendingWake().isEmpty());
        assertTrue(resolver.getCurrentDayStart().isEmpty());
    }

    @Test
    void shouldConfirmPendingWakeWhenActivityLastedGraceBeforeLeaving() {
        Instant back = at("2026-03-11T06:30:00Z");
        resolver.onAwayReturn(at("2026-03-10T23:30:00Z"), back, back);

        resolver.onAwayStarted(at("2026-03-11T06:50:00Z"), at("2026-03-11T06:53:00Z"));

        verify(dayStartPort).onDayStart(back);
        verify(recorder, never()).recordBriefActivity(any(), any());
    }

    @Test
    void shouldStartOnlyOneDayPerNight() {
        Instant back = at("2026-03-11T09:30:00Z");
        resolver.onAwayReturn(at("2026-03-10T23:00:00Z"), back, back);

        DayBoundaryDecision second = resolver.onAwayReturn(at("2026-03-11T07:30:00Z"),
                at("2026-03-11T08:30:00Z"), at("2026-03-11T08:30:00Z"));

        assertEquals(DayBoundaryDecision.NOT_A_DAY_START, second);
        verify(dayStartPort, times(1)).onDayStart(any());
    }

    @Test
    void shouldStartNextDayAfterFollowingNight() {
        resolver.onAwayReturn(at("2026-03-10T23:00:00Z"), at("2026-03-11T09:30:00Z"), at("2026-03-11T09:30:00Z"));
        Instant nextMorning = at("2026-03-12T09:15:00Z");

        DayBoundaryDecision decision = resolver.onAwayReturn(at("2026-03-11T23:30:00Z"), nextMorning,
                nextMorning);

        assertEquals(DayBoundaryDecision.CONFIRMED_DAY_START, decision);
        assertEquals(Optional.of(nextMorning), resolver.getCurrentDayStart());
    }

    @Test
    void shouldSurviveFailingDayStartCollaborator() {
        doThrow(new IllegalStateException("listener failed")).when(dayStartPort).onDayStart(any());
        Instant back = at("2026-03-11T09:30:00Z");

        DayBoundaryDecision decision = resolver.onAwayReturn(at("2026-03-10T23:00:00Z"), back, back);

        assertEquals(DayBoundaryDecision.CONFIRMED_DAY_START, decision);
        assertEquals(Optional.of(back), resolver.getCurrentDayStart());
    }

    // ===== Startup =====

    @Test
    void shouldRestoreDayStartFromLatestSegmentOnRestart() {
        Instant now = at("2026-03-11T15:00:00Z");
        when(telemetryStore.findSleepSegmentsTouching(now.minusSeconds(24 * 3600), now)).thenReturn(List.of(
                SleepSegment.builder().id("a").start(at("2026-03-10T23:00:00Z")).end(at("2026-03-11T06:45:00Z"))
                        .source(SleepSource.PRESENCE_INFERRED).build(),
                SleepSegment.builder().id("b").start(at("2026-03-11T06:50:00Z")).end(at("2026-03-11T07:10:00Z"))
                        .source(SleepSource.USER_STATED).build(),
                SleepSegment.builder().id("open").start(at("2026-03-11T14:00:00Z"))
                        .source(SleepSource.USER_STATED).build()));

        Instant dayStart = resolver.resolveStartup(now);

        assertEquals(at("2026-03-11T07:10:00Z"), dayStart);
        verifyNoInteractions(recorder);
        assertTrue(resolver.isStartupResolved());
    }

    @Test
    void shouldSynthesizeColdStartEndingAtTypicalWakeTime() {
        Instant now = at("2026-03-10T23:00:00Z");
        when(telemetryStore.findSleepSegmentsTouching(any(), any())).thenReturn(List.of());

        Instant dayStart = resolver.resolveStartup(now);

        assertEquals(at("2026-03-10T07:00:00Z"), dayStart);
        verify(recorder).recordAssumedColdStart(at("2026-03-09T22:30:00Z"), at("2026-03-10T07:00:00Z"));
    }

    @Test
    void shouldUseYesterdaysWakeTimeWhenStartingBeforeIt() {
        Instant now = at("2026-03-11T05:00:00Z");
        when(telemetryStore.findSleepSegmentsTouching(any(), any())).thenReturn(List.of());

        Instant dayStart = resolver.resolveStartup(now);

        assertEquals(at("2026-03-10T07:00:00Z"), dayStart);
        verify(recorder).recordAssumedColdStart(at("2026-03-09T22:30:00Z"), at("2026-03-10T07:00:00Z"));
    }

    @Test
    void shouldResolveStartupOnlyOnce() {
        when(telemetryStore.findSleepSegmentsTouching(any(), any())).thenReturn(List.of());

        Instant first = resolver.resolveStartup(at("2026-03-11T10:00:00Z"));
        Instant second = resolver.resolveStartup(at("2026-03-11T12:00:00Z"));

        assertEquals(first, second);
        verify(telemetryStore, times(1)).findSleepSegmentsTouching(any(), any());
        verify(recorder, times(1)).recordAssumedColdStart(any(), any());
    }

    @Test
    void shouldKeepColdStartDayStartWhenWriteFails() {
        when(telemetryStore.findSleepSegmentsTouching(any(), any())).thenReturn(List.of());
        when(recorder.recordAssumedColdStart(any(), any())).thenThrow(new TelemetryStoreException("disk", null));

        assertThrows(TelemetryStoreException.class, () -> resolver.resolveStartup(at("2026-03-11T10:00:00Z")));

        assertEquals(Optional.of(at("2026-03-11T07:00:00Z")), resolver.getCurrentDayStart());
    }
}
