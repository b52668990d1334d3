package me.fablestack.mechanics.domain.exception;

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
 * The request is well formed but conflicts with the current session state:
 * acting out of turn, acting on a concluded encounter, or touching a session
 * that already has a turn in flight. No partial mutation happens.
 */
public class StateConflictException extends IllegalStateException implements MechanicsFailure {

    private static final long serialVersionUID = 1L;

    public StateConflictException(String message) {
        super(message);
    }

    @Override
    public ErrorCode getErrorCode() {
        return ErrorCode.STATE_CONFLICT;
    }
}
