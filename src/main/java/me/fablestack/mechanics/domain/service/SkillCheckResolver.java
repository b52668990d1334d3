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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.fablestack.mechanics.domain.exception.MechanicsValidationException;
import me.fablestack.mechanics.domain.model.Difficulty;
import me.fablestack.mechanics.domain.model.PayloadKeys;
import me.fablestack.mechanics.domain.model.PendingEvent;
import me.fablestack.mechanics.domain.model.SkillCheckRequest;
import me.fablestack.mechanics.domain.model.SkillCheckResult;
import me.fablestack.mechanics.domain.model.TimelineEventKind;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Percentile skill check resolution.
 *
 * <p>
 * The target is {@code stat * 3 + rank * 10 - offset}, clamped to
 * {@code [1, 99]} so a check can always succeed or fail. A d100 roll at or
 * below the target succeeds.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SkillCheckResolver {

    static final int MIN_TARGET = 1;
    static final int MAX_TARGET = 99;
    static final int STAT_MULTIPLIER = 3;
    static final int RANK_MULTIPLIER = 10;

    private static final String SUCCESS_ICON = "✅";
    private static final String FAILURE_ICON = "❌";

    private final DiceRoller diceRoller;

    public SkillCheckResult resolve(int statValue, int skillRank, Difficulty difficulty) {
        validate(statValue, skillRank, difficulty);
        int target = computeTarget(statValue, skillRank, difficulty);
        int roll = diceRoller.percentile();
        boolean success = roll <= target;
        return new SkillCheckResult(target, roll, success, target - roll);
    }

    /**
     * Resolves the check and builds the single event that records it.
     */
    public Resolution resolveWithEvent(SkillCheckRequest request) {
        if (request == null) {
            throw new MechanicsValidationException("Skill check request is required");
        }
        SkillCheckResult result = resolve(request.statValue(), request.skillRank(), request.difficulty());
        log.debug("[SkillCheck] {}/{}: target={}, roll={}, success={}", request.statName(), request.skillName(),
                result.target(), result.roll(), result.success());
        return new Resolution(result, toEvent(request, result));
    }

    public int computeTarget(int statValue, int skillRank, Difficulty difficulty) {
        // long arithmetic: large stats must saturate at the clamp, not wrap
        long raw = (long) statValue * STAT_MULTIPLIER + (long) skillRank * RANK_MULTIPLIER - difficulty.getOffset();
        return (int) Math.max(MIN_TARGET, Math.min(MAX_TARGET, raw));
    }

    private void validate(int statValue, int skillRank, Difficulty difficulty) {
        if (statValue < 0) {
            throw new MechanicsValidationException("Stat value must not be negative: " + statValue);
        }
        if (skillRank < 0) {
            throw new MechanicsValidationException("Skill rank must not be negative: " + skillRank);
        }
        if (difficulty == null) {
            throw new MechanicsValidationException("Difficulty is required");
        }
    }

    private PendingEvent toEvent(SkillCheckRequest request, SkillCheckResult result) {
        Map<String, Object> payload = new LinkedHashMap<>();
        if (request.statName() != null) {
            payload.put(PayloadKeys.STAT_NAME, request.statName());
        }
        if (request.skillName() != null) {
            payload.put(PayloadKeys.SKILL_NAME, request.skillName());
        }
        payload.put(PayloadKeys.STAT_VALUE, request.statValue());
        payload.put(PayloadKeys.SKILL_RANK, request.skillRank());
        payload.put(PayloadKeys.DIFFICULTY, request.difficulty().getValue());
        payload.put(PayloadKeys.ROLL, result.roll());
        payload.put(PayloadKeys.TARGET, result.target());
        payload.put(PayloadKeys.SUCCESS, result.success());
        payload.put(PayloadKeys.MARGIN, result.margin());
        return new PendingEvent(TimelineEventKind.SKILL_CHECK, payload,
                result.success() ? SUCCESS_ICON : FAILURE_ICON);
    }

    /**
     * Verdict plus the not-yet-committed event.
     */
    public record Resolution(SkillCheckResult result, PendingEvent event) {
    }
}
