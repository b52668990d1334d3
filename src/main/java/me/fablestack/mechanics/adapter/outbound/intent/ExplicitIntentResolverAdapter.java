package me.fablestack.mechanics.adapter.outbound.intent;

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

import me.fablestack.mechanics.domain.model.GameSession;
import me.fablestack.mechanics.domain.model.PlayerInput;
import me.fablestack.mechanics.domain.model.TurnAction;
import me.fablestack.mechanics.port.outbound.IntentResolverPort;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Objects;

/**
 * Intent resolver that trusts the actions the caller submitted with the
 * input. Free text is recorded but not interpreted.
 */
@Component
public class ExplicitIntentResolverAdapter implements IntentResolverPort {

    @Override
    public List<TurnAction> resolve(GameSession session, PlayerInput input) {
        if (input.getActions() == null) {
            return List.of();
        }
        return input.getActions().stream().filter(Objects::nonNull).toList();
    }
}
