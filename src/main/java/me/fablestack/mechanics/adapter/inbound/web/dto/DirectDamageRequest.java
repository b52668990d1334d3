package me.fablestack.mechanics.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DirectDamageRequest {
    private String targetId;
    private Integer amount;
    private String source;
}
