package me.golemcore.presence.domain.model;

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
 * Outcome of evaluating a return from an away interval against the day
 * boundary.
 */
public enum DayBoundaryDecision {

    /** Brief interruption or daytime break. */
    NOT_A_DAY_START,

    /**
     * Return inside the sleep window. Becomes a day start once the user stays
     * active long enough or the window closes.
     */
    AWAITING_CONFIRMATION,

    /** Day start handed off to the day-start collaborator. */
    CONFIRMED_DAY_START
}
