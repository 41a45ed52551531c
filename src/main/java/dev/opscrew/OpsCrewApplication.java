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

package dev.opscrew;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for OpsCrew.
 *
 * <p>
 * OpsCrew is a DevOps assistant built as a crew of agents: a coordinator that
 * talks to the user and delegates sub-tasks to specialists (infrastructure as
 * code, Kubernetes, monitoring, security), each driving its own bounded
 * reason-act-observe loop over a language model and sandboxed tools.
 *
 * <h2>Architecture</h2>
 * <p>
 * Hexagonal architecture (Ports & Adapters):
 *
 * <pre>
 * Input Layer        → ConsoleRunner (AgentInvocationPort)
 * Domain Layer       → AgentOrchestrator, ToolLoopSystem, CapabilityRegistry
 * Infrastructure     → Langchain4jAdapter (LlmPort), ShellTool, FileSystemTool
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.properties} under the
 * {@code crew.*} prefix.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class OpsCrewApplication {

    public static void main(String[] args) {
        SpringApplication.run(OpsCrewApplication.class, args);
    }

}
