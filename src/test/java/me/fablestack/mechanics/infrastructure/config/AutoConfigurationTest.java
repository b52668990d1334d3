package me.fablestack.mechanics.infrastructure.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.fablestack.mechanics.domain.model.TimelineEvent;
import me.fablestack.mechanics.domain.model.TimelineEventKind;
import me.fablestack.mechanics.domain.service.DiceRoller;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AutoConfigurationTest {

    @Test
    void shouldSeedDiceWhenConfigured() {
        MechanicsProperties properties = new MechanicsProperties();
        properties.getDice().setSeed(42L);

        DiceRoller first = AutoConfiguration.diceRoller(properties);
        DiceRoller second = AutoConfiguration.diceRoller(properties);

        for (int i = 0; i < 20; i++) {
            assertEquals(first.percentile(), second.percentile());
        }
    }

    @Test
    void shouldWriteIsoTimestampsAndWireNames() throws Exception {
        ObjectMapper mapper = AutoConfiguration.objectMapper();
        TimelineEvent event = TimelineEvent.builder()
                .sequenceNumber(3)
                .timestamp(Instant.parse("2026-01-15T10:00:00Z"))
                .kind(TimelineEventKind.COMBAT_INFO)
                .payload(Map.of("action", "started"))
                .build();

        String json = mapper.writeValueAsString(event);

        assertTrue(json.contains("\"2026-01-15T10:00:00Z\""));
        assertTrue(json.contains("\"combat-info\""));
        assertEquals(event, mapper.readValue(json, TimelineEvent.class));
    }

    @Test
    void shouldIgnoreUnknownProperties() throws Exception {
        ObjectMapper mapper = AutoConfiguration.objectMapper();

        MechanicsProperties.DiceProperties dice = mapper.readValue("{\"seed\":7,\"extra\":true}",
                MechanicsProperties.DiceProperties.class);

        assertEquals(7L, dice.getSeed());
    }
}
