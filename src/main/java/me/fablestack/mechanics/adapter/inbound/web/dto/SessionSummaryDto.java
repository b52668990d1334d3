package me.fablestack.mechanics.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SessionSummaryDto {
    private String id;
    private String scenarioName;
    private int eventCount;
    private long lastSequence;
    private boolean inCombat;
    private long currency;
    private String createdAt;
    private String updatedAt;
}
