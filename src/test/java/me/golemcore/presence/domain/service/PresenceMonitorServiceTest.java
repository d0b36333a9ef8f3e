package me.golemcore.presence.domain.service;

import me.golemcore.presence.domain.model.PresenceEvent;
import me.golemcore.presence.domain.model.PresenceEventKind;
import me.golemcore.presence.domain.model.PresenceSnapshot;
import me.golemcore.presence.domain.model.PresenceState;
import me.golemcore.presence.domain.model.PresenceStateKind;
import me.golemcore.presence.domain.model.SleepSegment;
import me.golemcore.presence.domain.model.SleepSource;
import me.golemcore.presence.infrastructure.config.PresenceProperties;
import me.golemcore.presence.port.inbound.IdleSignalUnavailableException;
import me.golemcore.presence.port.inbound.IdleTimePort;
import me.golemcore.presence.port.outbound.TelemetryStoreException;
import me.golemcore.presence.port.outbound.TelemetryStorePort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class PresenceMonitorServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-10T10:00:00Z");

    private IdleTimePort idleTimePort;
    private TelemetryStorePort telemetryStore;
    private SleepWakeRecorder recorder;
    private DayBoundaryResolver dayBoundaryResolver;
    private PresenceProperties properties;
    private PresenceMonitorService service;

    @BeforeEach
    void setUp() {
        idleTimePort = mock(IdleTimePort.class);
        telemetryStore = mock(TelemetryStorePort.class);
        recorder = mock(SleepWakeRecorder.class);
        dayBoundaryResolver = mock(DayBoundaryResolver.class);
        properties = new PresenceProperties();
        service = newService(recorder, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private PresenceMonitorService newService(SleepWakeRecorder sleepWakeRecorder, Clock clock) {
        return new PresenceMonitorService(idleTimePort, telemetryStore, sleepWakeRecorder, dayBoundaryResolver,
                PresenceThresholds.defaults(), properties, clock);
    }

    // ===== Transitions =====

    @Test
    void shouldAppendAwayEventsInOrderOnSinglePollJump() {
        PresenceState state = service.poll(400, NOW);

        assertEquals(PresenceStateKind.CONFIRMED_AWAY, state.getKind());
        ArgumentCaptor<PresenceEvent> captor = ArgumentCaptor.forClass(PresenceEvent.class);
        verify(telemetryStore, times(2)).appendPresenceEvent(captor.capture());
        assertEquals(PresenceEventKind.POTENTIALLY_AWAY, captor.getAllValues().get(0).getKind());
        assertEquals(PresenceEventKind.CONFIRMED_AWAY, captor.getAllValues().get(1).getKind());
        verify(dayBoundaryResolver).onAwayStarted(NOW.minusSeconds(400), NOW);
    }

    @Test
    void shouldHandOffReturnedIntervalToRecorderThenResolver() {
        service.poll(400, NOW);
        Instant back = NOW.plusSeconds(3600);

        PresenceState state = service.poll(0, back);

        assertEquals(PresenceStateKind.ACTIVE, state.getKind());
        InOrder inOrder = inOrder(telemetryStore, recorder, dayBoundaryResolver);
        inOrder.verify(telemetryStore).appendPresenceEvent(argThat(e -> e.getKind() == PresenceEventKind.RETURNED));
        inOrder.verify(recorder).classifyAndRecord(NOW.minusSeconds(400), back);
        inOrder.verify(dayBoundaryResolver).onAwayReturn(NOW.minusSeconds(400), back, back);
        inOrder.verify(dayBoundaryResolver).onActivePoll(back);
    }

    @Test
    void shouldKeepAwayForRetryAndResolveDayBoundaryWhenSleepRecordFails() {
        service.poll(400, NOW);
        Instant back = NOW.plusSeconds(3600);
        when(recorder.classifyAndRecord(any(), any())).thenThrow(new TelemetryStoreException("disk full", null));

        assertThrows(TelemetryStoreException.class, () -> service.poll(0, back));

        verify(dayBoundaryResolver).onAwayReturn(NOW.minusSeconds(400), back, back);
        assertEquals(PresenceStateKind.ACTIVE, service.getState().getKind());
        assertEquals(1, service.getUnrecordedAwayCount());
    }

    @Test
    void shouldRetryFailedSleepRecordOnNextPolls() {
        service.poll(400, NOW);
        Instant back = NOW.plusSeconds(3600);
        Instant awayStart = NOW.minusSeconds(400);
        when(recorder.classifyAndRecord(awayStart, back))
                .thenThrow(new TelemetryStoreException("disk full", null))
                .thenThrow(new TelemetryStoreException("disk full", null))
                .thenReturn(Optional.empty());

        assertThrows(TelemetryStoreException.class, () -> service.poll(0, back));
        service.poll(0, back.plusSeconds(5));
        assertEquals(1, service.getUnrecordedAwayCount());

        service.poll(0, back.plusSeconds(10));
        service.poll(0, back.plusSeconds(15));

        verify(recorder, times(3)).classifyAndRecord(awayStart, back);
        assertEquals(0, service.getUnrecordedAwayCount());
    }

    @Test
    void shouldKeepStateWhenEventAppendFails() {
        doThrow(new TelemetryStoreException("disk full", null)).when(telemetryStore).appendPresenceEvent(any());

        assertThrows(TelemetryStoreException.class, () -> service.poll(90, NOW));

        assertEquals(PresenceStateKind.ACTIVE, service.getState().getKind());
    }

    @Test
    void shouldClampNegativeIdleToZero() {
        PresenceState state = service.poll(-5, NOW);

        assertEquals(PresenceStateKind.ACTIVE, state.getKind());
        assertEquals(0, service.getPresenceState().getIdleSeconds());
        verify(telemetryStore, never()).appendPresenceEvent(any());
    }

    // ===== Degraded signal =====

    @Test
    void shouldHoldStateWhileIdleSignalUnavailable() {
        service.poll(90, NOW.minusSeconds(5));
        when(idleTimePort.currentIdleSeconds()).thenThrow(new IdleSignalUnavailableException("no display"));

        PresenceState state = service.pollIdleTime();

        assertEquals(PresenceStateKind.POTENTIALLY_AWAY, state.getKind());
        PresenceSnapshot snapshot = service.getPresenceState();
        assertTrue(snapshot.isDegraded());
        assertEquals(NOW, snapshot.getLastCheckedAt());
        verify(telemetryStore, times(1)).appendPresenceEvent(any());
    }

    @Test
    void shouldTreatNaNAsUnavailable() {
        PresenceState state = service.poll(Double.NaN, NOW);

        assertEquals(PresenceStateKind.ACTIVE, state.getKind());
        assertTrue(service.isDegraded());
        verifyNoInteractions(telemetryStore);
    }

    @Test
    void shouldRecoverFromDegradedOnValidReading() {
        when(idleTimePort.currentIdleSeconds())
                .thenThrow(new IdleSignalUnavailableException("timeout"))
                .thenReturn(2.0);

        service.pollIdleTime();
        assertTrue(service.isDegraded());
        service.pollIdleTime();

        assertFalse(service.isDegraded());
        assertEquals(2.0, service.getPresenceState().getIdleSeconds());
    }

    // ===== Restart recovery =====

    @Test
    void shouldResumeRecentUnmatchedAway() {
        Instant awaySince = NOW.minusSeconds(3 * 3600);
        when(telemetryStore.findLatestPresenceEvent())
                .thenReturn(Optional.of(PresenceEvent.confirmedAway(awaySince, 200, awaySince.plusSeconds(200))));

        PresenceState state = service.recover(NOW);

        assertEquals(PresenceStateKind.CONFIRMED_AWAY, state.getKind());
        assertEquals(awaySince, state.getAwaySince());

        service.poll(0, NOW);
        verify(recorder).classifyAndRecord(awaySince, NOW);
    }

    @Test
    void shouldNotResumeStaleAway() {
        Instant awaySince = NOW.minusSeconds(20 * 3600);
        when(telemetryStore.findLatestPresenceEvent())
                .thenReturn(Optional.of(PresenceEvent.confirmedAway(awaySince, 200, awaySince)));

        PresenceState state = service.recover(NOW);

        assertEquals(PresenceStateKind.ACTIVE, state.getKind());
        assertEquals(awaySince, state.getLastEventTimestamp());
    }

    @Test
    void shouldStartActiveAfterMatchedReturn() {
        when(telemetryStore.findLatestPresenceEvent())
                .thenReturn(Optional.of(PresenceEvent.returned(NOW.minusSeconds(900), NOW.minusSeconds(60), 0)));

        assertEquals(PresenceStateKind.ACTIVE, service.recover(NOW).getKind());
    }

    // ===== End to end with the real recorder =====

    @Test
    void shouldNotRecordSleepForEveningIdleEndingBeforeWindow() {
        Clock clock = Clock.fixed(Instant.parse("2026-03-10T22:17:00Z"), ZoneOffset.UTC);
        SleepWakeRecorder realRecorder = new SleepWakeRecorder(telemetryStore, SleepSettings.defaults(), clock);
        PresenceMonitorService monitor = newService(realRecorder, clock);

        monitor.poll(61, Instant.parse("2026-03-10T19:33:01Z"));
        PresenceState away = monitor.poll(900, Instant.parse("2026-03-10T19:47:00Z"));
        assertEquals(Instant.parse("2026-03-10T19:32:00Z"), away.getAwaySince());

        monitor.poll(0, Instant.parse("2026-03-10T22:17:00Z"));

        verify(telemetryStore, never()).appendSleepSegment(any());
    }

    @Test
    void shouldStoreOvernightSleepAfterTransientWriteFailure() {
        Clock clock = Clock.fixed(Instant.parse("2026-03-11T07:00:00Z"), ZoneOffset.UTC);
        SleepWakeRecorder realRecorder = new SleepWakeRecorder(telemetryStore, SleepSettings.defaults(), clock);
        PresenceMonitorService monitor = newService(realRecorder, clock);
        doThrow(new TelemetryStoreException("disk full", null))
                .doNothing()
                .when(telemetryStore).appendSleepSegment(any());

        monitor.poll(200, Instant.parse("2026-03-10T23:03:20Z"));
        assertThrows(TelemetryStoreException.class,
                () -> monitor.poll(0, Instant.parse("2026-03-11T07:00:00Z")));
        monitor.poll(0, Instant.parse("2026-03-11T07:00:05Z"));

        ArgumentCaptor<SleepSegment> captor = ArgumentCaptor.forClass(SleepSegment.class);
        verify(telemetryStore, times(2)).appendSleepSegment(captor.capture());
        SleepSegment stored = captor.getAllValues().get(1);
        assertEquals(Instant.parse("2026-03-10T23:00:00Z"), stored.getStart());
        assertEquals(Instant.parse("2026-03-11T07:00:00Z"), stored.getEnd());
        assertEquals(0, monitor.getUnrecordedAwayCount());
    }

    @Test
    void shouldRecordOvernightAwayAsInferredSleep() {
        Clock clock = Clock.fixed(Instant.parse("2026-03-11T07:00:00Z"), ZoneOffset.UTC);
        SleepWakeRecorder realRecorder = new SleepWakeRecorder(telemetryStore, SleepSettings.defaults(), clock);
        PresenceMonitorService monitor = newService(realRecorder, clock);

        monitor.poll(200, Instant.parse("2026-03-10T23:03:20Z"));
        monitor.poll(0, Instant.parse("2026-03-11T07:00:00Z"));

        ArgumentCaptor<SleepSegment> captor = ArgumentCaptor.forClass(SleepSegment.class);
        verify(telemetryStore).appendSleepSegment(captor.capture());
        SleepSegment segment = captor.getValue();
        assertEquals(Instant.parse("2026-03-10T23:00:00Z"), segment.getStart());
        assertEquals(Instant.parse("2026-03-11T07:00:00Z"), segment.getEnd());
        assertEquals(SleepSource.PRESENCE_INFERRED, segment.getSource());
        assertEquals(480.0, segment.getDurationMinutes(), 1e-9);
    }
}
