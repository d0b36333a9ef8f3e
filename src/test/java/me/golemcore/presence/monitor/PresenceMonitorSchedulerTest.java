package me.golemcore.presence.monitor;

import me.golemcore.presence.domain.model.PresenceState;
import me.golemcore.presence.domain.service.DayBoundaryResolver;
import me.golemcore.presence.domain.service.PresenceMonitorService;
import me.golemcore.presence.infrastructure.config.PresenceProperties;
import me.golemcore.presence.port.outbound.TelemetryStoreException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class PresenceMonitorSchedulerTest {

    private static final Instant NOW = Instant.parse("2026-03-11T08:00:00Z");

    private PresenceMonitorService monitorService;
    private DayBoundaryResolver dayBoundaryResolver;
    private PresenceProperties properties;
    private PresenceMonitorScheduler scheduler;

    @BeforeEach
    void setUp() {
        monitorService = mock(PresenceMonitorService.class);
        dayBoundaryResolver = mock(DayBoundaryResolver.class);
        properties = new PresenceProperties();
        scheduler = new PresenceMonitorScheduler(monitorService, dayBoundaryResolver, properties,
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdown();
    }

    // ===== Startup =====

    @Test
    void startupResolvesDayBoundaryThenRecovers() {
        scheduler.startup(NOW);

        InOrder order = inOrder(dayBoundaryResolver, monitorService);
        order.verify(dayBoundaryResolver).resolveStartup(NOW);
        order.verify(monitorService).recover(NOW);
    }

    @Test
    void startupSurvivesResolverFailure() {
        when(dayBoundaryResolver.resolveStartup(NOW))
                .thenThrow(new TelemetryStoreException("write failed", new IOException("disk full")));

        assertDoesNotThrow(() -> scheduler.startup(NOW));
        verify(monitorService).recover(NOW);
    }

    @Test
    void startupSurvivesRecoveryFailure() {
        when(monitorService.recover(NOW)).thenThrow(new IllegalStateException("broken"));

        assertDoesNotThrow(() -> scheduler.startup(NOW));
    }

    @Test
    void initDoesNothingWhenDisabled() {
        properties.getMonitor().setEnabled(false);

        scheduler.init();

        verifyNoInteractions(dayBoundaryResolver, monitorService);
    }

    @Test
    void initRunsStartupWithClockTime() {
        properties.getMonitor().setPollIntervalSeconds(3600);

        scheduler.init();

        verify(dayBoundaryResolver).resolveStartup(NOW);
        verify(monitorService).recover(NOW);
    }

    // ===== Tick =====

    @Test
    void tickPollsIdleTime() {
        when(monitorService.pollIdleTime()).thenReturn(PresenceState.initial());

        scheduler.tick();

        verify(monitorService).pollIdleTime();
    }

    @Test
    void tickSwallowsPollFailuresAndKeepsRunning() {
        when(monitorService.pollIdleTime())
                .thenThrow(new TelemetryStoreException("append failed", new IOException("disk full")))
                .thenReturn(PresenceState.initial());

        assertDoesNotThrow(() -> scheduler.tick());
        assertDoesNotThrow(() -> scheduler.tick());

        verify(monitorService, times(2)).pollIdleTime();
    }
}
