package me.golemcore.relay.adapter.inbound.mattermost;

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

import java.util.Map;

/**
 * First frame sent on a fresh socket:
 * {@code {"seq":1,"action":"authentication_challenge","data":{"token":"..."}}}.
 *
 * <p>
 * {@link #toString()} masks the token so the frame is safe to log.
 */
record AuthenticationChallengeFrame(long seq, String action, Map<String, String> data) {

    static final String ACTION = "authentication_challenge";

    static AuthenticationChallengeFrame of(long seq, String token) {
        return new AuthenticationChallengeFrame(seq, ACTION, Map.of("token", token));
    }

    @Override
    public String toString() {
        return "AuthenticationChallengeFrame[seq=" + seq + ", action=" + action + ", data={token=***}]";
    }
}
