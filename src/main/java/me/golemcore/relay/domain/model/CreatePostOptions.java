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
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Optional fields of a new post.
 */
@Value
@Builder
public class CreatePostOptions {

    /** Thread anchor; null for a top-level post. */
    String rootId;

    @Singular
    List<String> fileIds;

    @Singular
    Map<String, Object> props;

    public static CreatePostOptions none() {
        return CreatePostOptions.builder().build();
    }

    public static CreatePostOptions replyTo(String rootId) {
        return CreatePostOptions.builder().rootId(rootId).build();
    }
}
