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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Mattermost's paged post list: an {@code order} of IDs plus a {@code posts}
 * map keyed by ID.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public class PostList {

    @Builder.Default
    private List<String> order = new ArrayList<>();

    @Builder.Default
    private Map<String, ChatPost> posts = new LinkedHashMap<>();

    @JsonProperty("next_post_id")
    private String nextPostId;

    @JsonProperty("prev_post_id")
    private String prevPostId;

    /**
     * Posts in server order, skipping IDs missing from the map. Posts absent
     * from {@code order} are appended at the end.
     */
    public List<ChatPost> orderedPosts() {
        List<ChatPost> result = new ArrayList<>();
        if (posts == null || posts.isEmpty()) {
            return result;
        }
        List<String> ids = order != null ? order : List.of();
        for (String id : ids) {
            ChatPost post = posts.get(id);
            if (post != null) {
                result.add(post);
            }
        }
        for (Map.Entry<String, ChatPost> entry : posts.entrySet()) {
            if (!ids.contains(entry.getKey())) {
                result.add(entry.getValue());
            }
        }
        return result;
    }
}
