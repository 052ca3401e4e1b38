package me.golemcore.relay.domain.service;

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

import me.golemcore.relay.domain.model.ErrorType;

import java.util.List;

/**
 * Pre-written replies posted when no generated text is available.
 */
public final class ReplyTemplates {

    public static final String DIRECT_FALLBACK = "I received your message, but I'm having trouble generating "
            + "a response right now. Please try again!";
    public static final String THREAD_FALLBACK = "I saw your reply in this thread, but I couldn't put together "
            + "an answer just now. Please try again in a moment!";
    public static final String CHANNEL_FALLBACK = "Thanks for the mention! I couldn't come up with a response "
            + "right now. Please try again shortly!";
    public static final String TEMPORARILY_UNAVAILABLE = "I'm temporarily unavailable. Please try again later!";

    private static final List<String> FALLBACKS = List.of(DIRECT_FALLBACK, THREAD_FALLBACK, CHANNEL_FALLBACK);

    private ReplyTemplates() {
    }

    /**
     * Fallback for an empty generation. Direct messages take precedence over
     * thread phrasing.
     */
    public static String fallback(boolean directMessage, boolean threadReply) {
        if (directMessage) {
            return DIRECT_FALLBACK;
        }
        if (threadReply) {
            return THREAD_FALLBACK;
        }
        return CHANNEL_FALLBACK;
    }

    public static List<String> allFallbacks() {
        return FALLBACKS;
    }

    /**
     * User-facing apology for a failure of the given category.
     */
    public static String apology(ErrorType errorType, boolean directMessage) {
        String prefix = directMessage ? "Sorry," : "Apologies,";
        ErrorType type = errorType != null ? errorType : ErrorType.UNKNOWN_ERROR;
        String body = switch (type) {
            case NETWORK_ERROR -> "I'm having trouble connecting to my AI services right now. "
                    + "Please try again in a moment!";
            case API_RATE_LIMIT -> "I'm getting a lot of requests right now. Please wait a moment and try again!";
            case AI_MODEL_ERROR -> "my AI brain is having a temporary hiccup. Give me a moment to recover!";
            case AUTHENTICATION_ERROR -> "I'm having authentication issues. My admin needs to check my credentials!";
            case TIMEOUT_ERROR -> "that took too long to process. Please try asking in a simpler way!";
            case VALIDATION_ERROR -> "I didn't understand your message format. Could you rephrase that?";
            default -> "I encountered an unexpected issue. Please try again or contact support if this persists!";
        };
        return prefix + " " + body;
    }
}
