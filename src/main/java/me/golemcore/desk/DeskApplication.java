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

package me.golemcore.desk;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for GolemCore Desk.
 *
 * <p>
 * GolemCore Desk is a support inbox auto-responder: it discovers support mail,
 * classifies it, drafts replies through a prioritized dispatch pipeline and
 * streams state changes to connected dashboards.
 *
 * <h2>Key Features</h2>
 * <ul>
 * <li><b>Mail Discovery</b> - IMAP and Gmail polling with de-duplication</li>
 * <li><b>Prioritized Dispatch</b> - urgent messages answered first, bounded
 * retries with a templated fallback</li>
 * <li><b>Multi-LLM Generation</b> - OpenAI and Anthropic via langchain4j with
 * rate-limit cooldown and quota backoff</li>
 * <li><b>Knowledge Grounding</b> - LightRAG snippets in the prompt</li>
 * <li><b>Live Events</b> - server-sent events for created and updated
 * messages</li>
 * </ul>
 *
 * <h2>Architecture</h2>
 * <p>
 * Hexagonal architecture (Ports & Adapters):
 *
 * <pre>
 * Input Layer        → REST controllers, DiscoveryPoller
 * Domain Layer       → DispatchWorker, ResponseGenerator, Services
 * Infrastructure     → LLM/Storage/Mail/Knowledge Adapters
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.properties} under {@code desk.*}
 * prefix.
 *
 * @since 1.0
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class DeskApplication {

    public static void main(String[] args) {
        SpringApplication.run(DeskApplication.class, args);
    }

}
