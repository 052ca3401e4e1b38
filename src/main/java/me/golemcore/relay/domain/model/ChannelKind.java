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

/**
 * Mattermost channel type. Wire codes are single letters.
 */
public enum ChannelKind {
    OPEN("O"),
    PRIVATE("P"),
    DIRECT("D"),
    GROUP("G");

    private final String code;

    ChannelKind(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    /**
     * Direct and group channels have fixed membership and cannot be joined or
     * left.
     */
    public boolean isJoinable() {
        return this == OPEN || this == PRIVATE;
    }

    /**
     * Parse a wire code. Unknown or missing codes map to {@link #OPEN}, the
     * most restrictive kind for routing (mention required).
     */
    public static ChannelKind fromCode(String code) {
        if (code != null) {
            for (ChannelKind kind : values()) {
                if (kind.code.equalsIgnoreCase(code.trim())) {
                    return kind;
                }
            }
        }
        return OPEN;
    }
}
