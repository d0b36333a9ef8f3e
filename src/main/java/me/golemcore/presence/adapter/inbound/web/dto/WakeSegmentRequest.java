package me.golemcore.presence.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A stated wake interval. Either {@code end} or a positive
 * {@code durationMinutes} must be given; with only a duration the interval is
 * stored as an estimate.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WakeSegmentRequest {
    private Instant start;
    private Instant end;
    private Double durationMinutes;
    private String notes;
}
