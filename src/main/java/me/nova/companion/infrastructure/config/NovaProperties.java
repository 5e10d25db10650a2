package me.nova.companion.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Centralized configuration properties for Nova, bound from
 * application.properties.
 *
 * <p>
 * All configuration is organized under the {@code nova.*} prefix:
 * <ul>
 * <li>{@link LlmProperties} - model endpoint settings</li>
 * <li>{@link StorageProperties} - local workspace location</li>
 * <li>{@link HttpProperties} - outbound HTTP client timeouts</li>
 * <li>{@link VoiceProperties} - gate pipeline cooldowns and limits</li>
 * <li>{@link TelemetryProperties} - decision log sizing and location</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "nova")
@Data
public class NovaProperties {

    private LlmProperties llm = new LlmProperties();
    private StorageProperties storage = new StorageProperties();
    private HttpProperties http = new HttpProperties();
    private VoiceProperties voice = new VoiceProperties();
    private TelemetryProperties telemetry = new TelemetryProperties();

    @Data
    public static class LlmProperties {
        /** Provider id: "openai" for an OpenAI-compatible endpoint, "mock" otherwise. */
        private String provider = "openai";
        private String apiUrl = "https://api.openai.com/v1";
        private String apiKey;
        private String model = "gpt-4o-mini";
        private double temperature = 0.7;
    }

    @Data
    public static class StorageProperties {
        private String basePath = "${user.home}/.nova/workspace";
    }

    @Data
    public static class HttpProperties {
        private long connectTimeout = 10000;
        private long readTimeout = 60000;
        private long writeTimeout = 60000;
        private int maxIdleConnections = 5;
        private long keepAliveDuration = 300000;
    }

    @Data
    public static class VoiceProperties {
        private Duration reflectionCooldown = Duration.ofSeconds(45);
        private Duration continuityCooldown = Duration.ofMinutes(10);
        private Duration modelTimeout = Duration.ofSeconds(60);
        private String defaultSystemPrompt = "You are Nova, a personal companion. You are calm, present and honest. "
                + "You remember what matters to the person you are talking with and you never perform empathy.";
    }

    @Data
    public static class TelemetryProperties {
        private int maxRecordsPerUser = 200;
        private String directory = "telemetry";
        private String decisionLogFile = "gate-decisions.jsonl";
    }
}
