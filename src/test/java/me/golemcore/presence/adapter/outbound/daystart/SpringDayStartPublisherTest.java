package me.golemcore.presence.adapter.outbound.daystart;

import me.golemcore.presence.domain.model.DayStartedEvent;
import me.golemcore.presence.infrastructure.event.SpringEventBus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class SpringDayStartPublisherTest {

    private static final Instant NOW = Instant.parse("2026-03-11T09:05:00Z");

    private ApplicationEventPublisher applicationEventPublisher;
    private SpringDayStartPublisher publisher;

    @BeforeEach
    void setUp() {
        applicationEventPublisher = mock(ApplicationEventPublisher.class);
        publisher = new SpringDayStartPublisher(new SpringEventBus(applicationEventPublisher),
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void shouldPublishDayStartedEventWithOriginalWakeInstant() {
        Instant wake = Instant.parse("2026-03-11T07:40:00Z");

        publisher.onDayStart(wake);

        ArgumentCaptor<Object> captor = ArgumentCaptor.forClass(Object.class);
        verify(applicationEventPublisher).publishEvent(captor.capture());
        DayStartedEvent event = assertInstanceOf(DayStartedEvent.class, captor.getValue());
        assertEquals(wake, event.wakeInstant());
        assertEquals(NOW, event.confirmedAt());
    }
}
