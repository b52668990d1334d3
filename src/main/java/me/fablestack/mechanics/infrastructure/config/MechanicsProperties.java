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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Centralized configuration properties for the mechanics core, bound from
 * application.properties.
 *
 * <p>
 * All configuration is organized under the {@code fable.*} prefix:
 * <ul>
 * <li>{@link StorageProperties} - persistence configuration</li>
 * <li>{@link DiceProperties} - random source seeding</li>
 * <li>{@link NarrationProperties} - narrator timeout and token buffering</li>
 * <li>{@link StreamProperties} - narration control tag delimiters</li>
 * <li>{@link TimelineProperties} - restore point rendering</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "fable")
@Data
public class MechanicsProperties {

    private StorageProperties storage = new StorageProperties();
    private DiceProperties dice = new DiceProperties();
    private NarrationProperties narration = new NarrationProperties();
    private StreamProperties stream = new StreamProperties();
    private TimelineProperties timeline = new TimelineProperties();

    @Data
    public static class StorageProperties {
        private LocalStorageProperties local = new LocalStorageProperties();
    }

    @Data
    public static class LocalStorageProperties {
        private String basePath = "${user.home}/.fablestack/workspace";
    }

    @Data
    public static class DiceProperties {
        /** Fixed seed for reproducible rolls; unset means system entropy. */
        private Long seed;
    }

    @Data
    public static class NarrationProperties {
        private Duration timeout = Duration.ofSeconds(60);
        private int bufferSize = 256;
    }

    @Data
    public static class StreamProperties {
        private String tagOpen = "<<";
        private String tagClose = ">>";
        private int maxTagLength = 64;
    }

    @Data
    public static class TimelineProperties {
        private int restorePreviewLength = 80;
    }
}
