package me.fablestack.mechanics.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InventoryDeltaRequest {
    private String itemId;
    private Integer quantityDelta;
    private Long currencyDelta;
}
