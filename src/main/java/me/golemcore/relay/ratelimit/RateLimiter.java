package me.golemcore.relay.ratelimit;

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

import me.golemcore.relay.domain.model.RateLimitWindow;

/**
 * Gate in front of every outbound REST call.
 *
 * <p>
 * The Mattermost server enforces one limit per credential, so a single
 * instance is shared by all callers in the process. Implementations block the
 * calling worker thread rather than rejecting the request.
 *
 * @since 1.0
 * @see FixedWindowRateLimiter
 */
public interface RateLimiter {

    /**
     * Block until one more request fits in the current window, then reserve a
     * slot for it.
     */
    void acquire();

    /**
     * Record the server's view of the limit from response headers. Either value
     * may be null when the header was absent.
     *
     * @param remaining
     *            raw {@code X-Ratelimit-Remaining} header value
     * @param resetSeconds
     *            raw {@code X-Ratelimit-Reset} header value, seconds until the
     *            server window resets
     */
    void updateFromHeaders(String remaining, String resetSeconds);

    /**
     * Current window state, for diagnostics.
     */
    RateLimitWindow getWindow();
}
