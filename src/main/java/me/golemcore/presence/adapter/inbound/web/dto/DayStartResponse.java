package me.golemcore.presence.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DayStartResponse {
    private Instant dayStart;
    private Instant pendingWake;
    private boolean startupResolved;
}
