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
 * Paging and time filters for channel history. {@code since}, {@code before}
 * and {@code after} are passed through to the server unchanged when set.
 */
@Value
@Builder
public class PostQuery {

    @Builder.Default
    int page = 0;

    @Builder.Default
    int perPage = 60;

    /** Epoch millis; only posts modified after this instant. */
    Long since;

    /** Post ID; only posts before it. */
    String before;

    /** Post ID; only posts after it. */
    String after;

    public static PostQuery firstPage(int perPage) {
        return PostQuery.builder().perPage(perPage).build();
    }
}
