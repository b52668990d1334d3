package me.fablestack.mechanics.infrastructure.config;

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

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.fablestack.mechanics.domain.service.DiceRoller;
import me.fablestack.mechanics.domain.service.RandomDiceRoller;
import me.fablestack.mechanics.port.outbound.NarratorPort;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.info.BuildProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Spring configuration providing the shared infrastructure beans and logging
 * startup information.
 *
 * <p>
 * This configuration:
 * <ul>
 * <li>Provides the {@link Clock} every timestamp is taken from</li>
 * <li>Provides the Jackson {@link ObjectMapper} used for session
 * documents</li>
 * <li>Provides the {@link DiceRoller}, seeded when {@code fable.dice.seed} is
 * set</li>
 * </ul>
 *
 * @since 1.0
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class AutoConfiguration {

    private final MechanicsProperties properties;
    private final NarratorPort narratorPort;
    private final ObjectProvider<BuildProperties> buildPropertiesProvider;

    @Bean
    public static Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @Bean
    public static DiceRoller diceRoller(MechanicsProperties properties) {
        Long seed = properties.getDice().getSeed();
        return seed != null ? new RandomDiceRoller(seed) : new RandomDiceRoller();
    }

    @PostConstruct
    public void init() {
        BuildProperties buildProps = buildPropertiesProvider.getIfAvailable();
        String version = buildProps != null ? buildProps.getVersion() : "dev";
        log.info("FableStack Mechanics v{} starting...", version);
        log.info("Narrator: {}", narratorPort.getNarratorId());
        log.info("Storage Path: {}", properties.getStorage().getLocal().getBasePath());
        log.info("Dice: {}", properties.getDice().getSeed() != null
                ? "seeded (" + properties.getDice().getSeed() + ")"
                : "system entropy");
        log.info("Narration timeout: {}, buffer: {} tokens", properties.getNarration().getTimeout(),
                properties.getNarration().getBufferSize());
    }
}
