package me.fablestack.mechanics.adapter.inbound.web.dto;

import me.fablestack.mechanics.domain.model.TurnAction;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * WebSocket turn request: { "sessionId": "...", "text": "...", "actions": [...] }
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TurnSocketRequest {
    private String sessionId;
    private String text;
    private List<TurnAction> actions;
}
