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

import java.util.Objects;
import java.util.Optional;

/**
 * Normalized output of the reasoning backend: either usable {@link Text} or
 * {@link Empty}.
 *
 * <p>
 * The class hierarchy is closed: the private constructor admits only the two
 * nested variants. Blank text is never represented as {@link Text}.
 *
 * @since 1.0
 */
public abstract class GeneratedReply {

    private static final Empty EMPTY = new Empty();

    private GeneratedReply() {
    }

    /**
     * Wrap text, collapsing null or blank input to {@link #empty()}.
     */
    public static GeneratedReply text(String value) {
        if (value == null || value.isBlank()) {
            return EMPTY;
        }
        return new Text(value.trim());
    }

    public static GeneratedReply empty() {
        return EMPTY;
    }

    public abstract boolean isEmpty();

    public abstract Optional<String> text();

    public static final class Text extends GeneratedReply {

        private final String value;

        private Text(String value) {
            this.value = value;
        }

        public String getValue() {
            return value;
        }

        @Override
        public boolean isEmpty() {
            return false;
        }

        @Override
        public Optional<String> text() {
            return Optional.of(value);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Text other && value.equals(other.value);
        }

        @Override
        public int hashCode() {
            return Objects.hash(value);
        }

        @Override
        public String toString() {
            return "Text[" + value.length() + " chars]";
        }
    }

    public static final class Empty extends GeneratedReply {

        private Empty() {
        }

        @Override
        public boolean isEmpty() {
            return true;
        }

        @Override
        public Optional<String> text() {
            return Optional.empty();
        }

        @Override
        public String toString() {
            return "Empty";
        }
    }
}
