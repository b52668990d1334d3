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

/**
 * Source of uniform dice rolls. Every mechanical randomness goes through this
 * interface so tests can script rolls.
 */
public interface DiceRoller {

    /**
     * Rolls one die.
     *
     * @param sides
     *            number of faces, at least 1
     * @return a value uniformly drawn from {@code [1, sides]}
     */
    int roll(int sides);

    default int d20() {
        return roll(20);
    }

    default int percentile() {
        return roll(100);
    }
}
