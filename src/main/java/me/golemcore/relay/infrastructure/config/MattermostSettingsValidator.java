package me.golemcore.relay.infrastructure.config;

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

import okhttp3.HttpUrl;

/**
 * Fail-fast validation of the Mattermost connection settings. Runs before the
 * REST gateway is constructed, so nothing touches the network with a broken
 * configuration.
 */
public final class MattermostSettingsValidator {

    static final String URL_SETTING = "relay.mattermost.url";
    static final String TOKEN_SETTING = "relay.mattermost.token";
    static final String TEAM_SETTING = "relay.mattermost.team";
    static final String PING_SETTING = "relay.mattermost.ws-ping-interval-ms";

    private MattermostSettingsValidator() {
    }

    /**
     * Validate settings and return the parsed base URL.
     *
     * @throws RelayConfigurationException
     *             naming the first missing or malformed setting
     */
    public static HttpUrl validate(RelayProperties.MattermostProperties settings) {
        if (settings == null) {
            throw new RelayConfigurationException(URL_SETTING, "Mattermost settings are missing");
        }
        String url = settings.getUrl();
        if (url == null || url.isBlank()) {
            throw new RelayConfigurationException(URL_SETTING, "Mattermost URL is required");
        }
        HttpUrl baseUrl = HttpUrl.parse(url.trim());
        if (baseUrl == null) {
            throw new RelayConfigurationException(URL_SETTING,
                    "Mattermost URL must be an absolute http(s) URL, got '" + url + "'");
        }
        if (settings.getToken() == null || settings.getToken().isBlank()) {
            throw new RelayConfigurationException(TOKEN_SETTING, "Mattermost access token is required");
        }
        if (settings.getTeam() == null || settings.getTeam().isBlank()) {
            throw new RelayConfigurationException(TEAM_SETTING, "Mattermost team name is required");
        }
        if (settings.getWsPingIntervalMs() <= 0) {
            throw new RelayConfigurationException(PING_SETTING, "WebSocket ping interval must be positive");
        }
        return baseUrl;
    }
}
