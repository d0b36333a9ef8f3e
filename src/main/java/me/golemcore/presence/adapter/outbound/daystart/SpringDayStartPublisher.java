package me.golemcore.presence.adapter.outbound.daystart;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.extern.slf4j.Slf4j;
import me.golemcore.presence.domain.model.DayStartedEvent;
import me.golemcore.presence.infrastructure.event.SpringEventBus;
import me.golemcore.presence.port.outbound.DayStartPort;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;

/**
 * Hands confirmed day starts to the rest of the application as a
 * {@link DayStartedEvent}. Consumers subscribe with {@code @EventListener}.
 */
@Component
@Slf4j
public class SpringDayStartPublisher implements DayStartPort {

    private final SpringEventBus eventBus;
    private final Clock clock;

    public SpringDayStartPublisher(SpringEventBus eventBus, Clock clock) {
        this.eventBus = eventBus;
        this.clock = clock;
    }

    @Override
    public void onDayStart(Instant wakeInstant) {
        DayStartedEvent event = new DayStartedEvent(wakeInstant, clock.instant());
        log.info("[DayBoundary] Publishing day start at {}", wakeInstant);
        eventBus.publish(event);
    }
}
