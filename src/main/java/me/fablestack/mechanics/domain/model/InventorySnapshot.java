package me.fablestack.mechanics.domain.model;

import java.util.Map;

public record InventorySnapshot(Map<String, Integer> items, long currency) {

    public InventorySnapshot {
        items = items != null ? Map.copyOf(items) : Map.of();
    }
}
