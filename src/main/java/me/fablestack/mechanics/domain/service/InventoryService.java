package me.fablestack.mechanics.domain.service;

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

import me.fablestack.mechanics.domain.exception.MechanicsValidationException;
import me.fablestack.mechanics.domain.exception.NotFoundException;
import me.fablestack.mechanics.domain.model.GameSession;
import me.fablestack.mechanics.domain.model.InventorySnapshot;
import me.fablestack.mechanics.domain.model.PayloadKeys;
import me.fablestack.mechanics.domain.model.PendingEvent;
import me.fablestack.mechanics.domain.model.TimelineEventKind;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Item and currency mutations. Quantities and currency never go negative.
 */
@Service
public class InventoryService {

    private static final String ICON_GAIN = "➕";
    private static final String ICON_LOSS = "➖";

    /**
     * Validates a delta against the current inventory and describes it as a
     * single event. The kind follows the item delta: added, removed, or a pure
     * currency change when no item moves.
     */
    public PendingEvent prepareDelta(GameSession session, String itemId, int quantityDelta, long currencyDelta) {
        if (quantityDelta == 0 && currencyDelta == 0) {
            throw new MechanicsValidationException("Inventory delta must change an item or currency");
        }
        boolean itemChange = quantityDelta != 0;
        if (itemChange && (itemId == null || itemId.isBlank())) {
            throw new MechanicsValidationException("Item id is required for a quantity change");
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        if (itemChange) {
            int current = session.getItems().getOrDefault(itemId, 0);
            if (quantityDelta < 0 && !session.getItems().containsKey(itemId)) {
                throw new NotFoundException("Item not in inventory: " + itemId);
            }
            long after = (long) current + quantityDelta;
            if (after < 0) {
                throw new MechanicsValidationException(
                        "Cannot remove " + -quantityDelta + " " + itemId + ", only " + current + " held");
            }
            if (after > Integer.MAX_VALUE) {
                throw new MechanicsValidationException("Item quantity overflow for " + itemId);
            }
            payload.put(PayloadKeys.ITEM_ID, itemId);
            payload.put(PayloadKeys.QUANTITY_DELTA, quantityDelta);
            payload.put(PayloadKeys.QUANTITY_AFTER, (int) after);
        }

        long currencyAfter;
        try {
            currencyAfter = Math.addExact(session.getCurrency(), currencyDelta);
        } catch (ArithmeticException e) {
            throw new MechanicsValidationException("Currency overflow: " + session.getCurrency() + " + "
                    + currencyDelta, e);
        }
        if (currencyAfter < 0) {
            throw new MechanicsValidationException(
                    "Not enough currency: have " + session.getCurrency() + ", need " + -currencyDelta);
        }
        payload.put(PayloadKeys.CURRENCY_DELTA, currencyDelta);
        payload.put(PayloadKeys.CURRENCY_AFTER, currencyAfter);

        TimelineEventKind kind;
        if (quantityDelta > 0) {
            kind = TimelineEventKind.ITEM_ADDED;
        } else if (quantityDelta < 0) {
            kind = TimelineEventKind.ITEM_REMOVED;
        } else {
            kind = TimelineEventKind.CURRENCY_CHANGE;
        }
        String icon = kind == TimelineEventKind.CURRENCY_CHANGE
                ? (currencyDelta > 0 ? ICON_GAIN : ICON_LOSS)
                : null;
        return new PendingEvent(kind, payload, icon);
    }

    public InventorySnapshot snapshot(GameSession session) {
        return new InventorySnapshot(session.getItems(), session.getCurrency());
    }
}
