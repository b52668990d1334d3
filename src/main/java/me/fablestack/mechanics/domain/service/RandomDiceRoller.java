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

import java.util.Random;

/**
 * {@link DiceRoller} backed by {@link Random}. A fixed seed gives a
 * reproducible roll sequence.
 */
public class RandomDiceRoller implements DiceRoller {

    private final Random random;

    public RandomDiceRoller() {
        this.random = new Random();
    }

    public RandomDiceRoller(long seed) {
        this.random = new Random(seed);
    }

    @Override
    public int roll(int sides) {
        if (sides < 1) {
            throw new MechanicsValidationException("Die must have at least one side, got " + sides);
        }
        synchronized (random) {
            return random.nextInt(sides) + 1;
        }
    }
}
