package me.fablestack.mechanics.port.outbound;

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

import me.fablestack.mechanics.domain.model.NarrationRequest;
import reactor.core.publisher.Flux;

/**
 * Port for the prose narrator. The narrator only ever sees committed events
 * and produces text tokens that may contain inline control tags.
 */
public interface NarratorPort {

    /**
     * Returns the narrator identifier used in logs.
     */
    String getNarratorId();

    /**
     * Streams narration tokens for one turn. Errors and timeouts are handled by
     * the caller.
     */
    Flux<String> narrate(NarrationRequest request);
}
