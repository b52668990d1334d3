package me.fablestack.mechanics;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for the FableStack mechanics core.
 *
 * <p>
 * The mechanics core turns a player's declared intent into verifiable numeric
 * outcomes and records them in an ordered, replayable session timeline before
 * any narration is produced.
 *
 * <h2>Key Features</h2>
 * <ul>
 * <li><b>Skill checks</b> - percentile resolution against a clamped
 * target</li>
 * <li><b>Combat</b> - deterministic initiative, attack and damage resolution,
 * turn sequencing and encounter life-cycle</li>
 * <li><b>Timeline</b> - append-only event log with restore points and
 * rollback</li>
 * <li><b>Turn streaming</b> - mechanics first, then tag-filtered narration
 * tokens over SSE or WebSocket</li>
 * </ul>
 *
 * <h2>Architecture</h2>
 * <p>
 * Hexagonal architecture (Ports &amp; Adapters):
 *
 * <pre>
 * Input Layer        → REST controllers, SSE turn stream, WebSocket handler
 * Domain Layer       → SkillCheckResolver, CombatEngine, TimelineService, StreamCoordinator
 * Infrastructure     → Local JSON storage, narrator and intent resolver adapters
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.properties} under the
 * {@code fable.*} prefix.
 *
 * @since 1.0
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class MechanicsApplication {

    public static void main(String[] args) {
        SpringApplication.run(MechanicsApplication.class, args);
    }

}
