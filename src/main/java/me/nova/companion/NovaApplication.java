package me.nova.companion;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for the Nova companion backend.
 *
 * <p>
 * Nova is a personal chat companion. Every inbound turn goes through the voice
 * engine, an ordered gate pipeline that answers locally whenever it can and
 * otherwise makes exactly one call to the configured language model.
 *
 * <h2>Key Features</h2>
 * <ul>
 * <li><b>Gate Pipeline</b> - ordered short-circuit stages (ellipsis, ultra
 * short, casual probe, greeting, explicit invite, reflection)</li>
 * <li><b>Single causal chain</b> - at most one model call per turn, no hidden
 * rewrites</li>
 * <li><b>Memory continuity</b> - opt-in, cooldown-gated references to stored
 * memories</li>
 * <li><b>Decision telemetry</b> - per-user ring buffer mirrored to a JSONL
 * log</li>
 * </ul>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.properties} under {@code nova.*}
 * prefix.
 *
 * @since 1.0
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class NovaApplication {

    public static void main(String[] args) {
        SpringApplication.run(NovaApplication.class, args);
    }

}
