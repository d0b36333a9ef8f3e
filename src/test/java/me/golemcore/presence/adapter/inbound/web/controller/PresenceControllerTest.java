package me.golemcore.presence.adapter.inbound.web.controller;

import me.golemcore.presence.domain.model.PresenceSnapshot;
import me.golemcore.presence.domain.model.PresenceStateKind;
import me.golemcore.presence.domain.model.PresenceStatistics;
import me.golemcore.presence.domain.service.DayBoundaryResolver;
import me.golemcore.presence.domain.service.PresenceMonitorService;
import me.golemcore.presence.domain.service.PresenceStatisticsService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class PresenceControllerTest {

    private static final Instant NOW = Instant.parse("2026-03-11T15:00:00Z");
    private static final Instant DAY_START = Instant.parse("2026-03-11T07:00:00Z");

    private PresenceMonitorService monitorService;
    private PresenceStatisticsService statisticsService;
    private DayBoundaryResolver dayBoundaryResolver;
    private PresenceController controller;

    @BeforeEach
    void setUp() {
        monitorService = mock(PresenceMonitorService.class);
        statisticsService = mock(PresenceStatisticsService.class);
        dayBoundaryResolver = mock(DayBoundaryResolver.class);
        controller = new PresenceController(monitorService, statisticsService, dayBoundaryResolver,
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void shouldReturnCurrentState() {
        PresenceSnapshot snapshot = PresenceSnapshot.builder()
                .state(PresenceStateKind.CONFIRMED_AWAY)
                .awaySince(Instant.parse("2026-03-11T14:30:00Z"))
                .idleSeconds(1800)
                .build();
        when(monitorService.getPresenceState()).thenReturn(snapshot);

        StepVerifier.create(controller.getState())
                .assertNext(response -> {
                    assertEquals(HttpStatus.OK, response.getStatusCode());
                    assertSame(snapshot, response.getBody());
                })
                .verifyComplete();
    }

    @Test
    void shouldDefaultStatisticsToCurrentDayStart() {
        PresenceStatistics stats = PresenceStatistics.builder().awayCount(2).since(DAY_START).build();
        when(dayBoundaryResolver.getCurrentDayStart()).thenReturn(Optional.of(DAY_START));
        when(statisticsService.getPresenceStatistics(DAY_START, NOW)).thenReturn(stats);

        StepVerifier.create(controller.getStatistics(null))
                .assertNext(response -> {
                    assertEquals(HttpStatus.OK, response.getStatusCode());
                    assertEquals(2, response.getBody().getAwayCount());
                })
                .verifyComplete();
    }

    @Test
    void shouldFallBackToMidnightWithoutDayStart() {
        Instant midnight = Instant.parse("2026-03-11T00:00:00Z");
        when(dayBoundaryResolver.getCurrentDayStart()).thenReturn(Optional.empty());
        when(statisticsService.getPresenceStatistics(midnight, NOW))
                .thenReturn(PresenceStatistics.empty(midnight, NOW));

        StepVerifier.create(controller.getStatistics(" "))
                .assertNext(response -> assertEquals(midnight, response.getBody().getSince()))
                .verifyComplete();
    }

    @Test
    void shouldUseExplicitSince() {
        Instant since = Instant.parse("2026-03-10T12:00:00Z");
        when(statisticsService.getPresenceStatistics(since, NOW)).thenReturn(PresenceStatistics.empty(since, NOW));

        StepVerifier.create(controller.getStatistics("2026-03-10T12:00:00Z"))
                .assertNext(response -> assertEquals(since, response.getBody().getSince()))
                .verifyComplete();
        verifyNoInteractions(dayBoundaryResolver);
    }

    @Test
    void shouldRejectInvalidSince() {
        assertThrows(IllegalArgumentException.class, () -> controller.getStatistics("yesterday"));
        verifyNoInteractions(statisticsService);
    }
}
