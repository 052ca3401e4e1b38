package me.golemcore.relay.domain.model;

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

import lombok.Builder;
import lombok.Value;

/**
 * Snapshot of the shared outbound rate-limit window.
 *
 * <p>
 * Contains:
 * <ul>
 * <li>{@code requestCount} - requests issued in the current window</li>
 * <li>{@code windowStartMs} - epoch millis when the current window opened</li>
 * <li>{@code serverRemaining} - last {@code X-Ratelimit-Remaining} seen, or
 * null</li>
 * <li>{@code serverResetAtMs} - epoch millis derived from the last
 * {@code X-Ratelimit-Reset} seen, or null</li>
 * </ul>
 *
 * @since 1.0
 */
@Value
@Builder
public class RateLimitWindow {

    int requestCount;
    long windowStartMs;
    Integer serverRemaining;
    Long serverResetAtMs;
}
