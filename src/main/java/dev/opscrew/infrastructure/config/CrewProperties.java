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

package dev.opscrew.infrastructure.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Centralized configuration properties for the crew, bound from
 * application.properties.
 *
 * <p>
 * All configuration is organized under the {@code crew.*} prefix:
 * <ul>
 * <li>{@link LlmProperties} - model providers and sampling settings</li>
 * <li>{@link LoopProperties} - agent loop budget and tool timeout</li>
 * <li>{@link StreamProperties} - event channel sizing</li>
 * <li>{@link ToolsProperties} - built-in tool enablement and sandbox</li>
 * <li>{@link AgentsProperties} - coordinator and specialist roster</li>
 * <li>{@link ConsoleProperties} - optional stdin/stdout transport</li>
 * </ul>
 */
@Component
@ConfigurationProperties(prefix = "crew")
@Data
public class CrewProperties {

    private LlmProperties llm = new LlmProperties();
    private LoopProperties loop = new LoopProperties();
    private StreamProperties stream = new StreamProperties();
    private ToolsProperties tools = new ToolsProperties();
    private AgentsProperties agents = new AgentsProperties();
    private ConsoleProperties console = new ConsoleProperties();

    @Data
    public static class LlmProperties {
        private ProviderProperties anthropic = new ProviderProperties("claude-3-5-sonnet-latest");
        private ProviderProperties openai = new ProviderProperties("gpt-4o");
        private double temperature = 0.2;
        private int maxTokens = 4096;
        private long timeoutMs = 120_000L;
    }

    @Data
    public static class ProviderProperties {
        private String apiKey;
        private String model;
        private String baseUrl;

        public ProviderProperties() {
        }

        public ProviderProperties(String model) {
            this.model = model;
        }

        public boolean hasApiKey() {
            return apiKey != null && !apiKey.isBlank();
        }
    }

    @Data
    public static class LoopProperties {
        /**
         * Model calls per agent run. Applies to the coordinator and to every
         * delegated specialist separately.
         */
        private int maxIterations = 5;

        /**
         * Wall-clock limit for a single tool call, independent of any caller
         * deadline.
         */
        private long toolTimeoutMs = 30_000L;
    }

    @Data
    public static class StreamProperties {
        private int bufferCapacity = 256;
    }

    @Data
    public static class ToolsProperties {
        private String workspace = "sandbox";
        private ShellToolProperties shell = new ShellToolProperties();
        private FileSystemToolProperties filesystem = new FileSystemToolProperties();
    }

    @Data
    public static class ShellToolProperties {
        private boolean enabled = true;
        private int defaultTimeout = 10;
        private int maxTimeout = 300;
        private List<String> forbiddenPatterns = new ArrayList<>(List.of("rm -rf", ">", "<", "|", "&"));
        private List<String> allowedEnvVars = new ArrayList<>();
    }

    @Data
    public static class FileSystemToolProperties {
        private boolean enabled = true;
        private long maxFileSize = 1_048_576L;
    }

    @Data
    public static class AgentsProperties {
        private String coordinator = "Rapid";
        private List<String> specialists = new ArrayList<>(List.of("Terra", "Kube", "Metric", "Guard"));
    }

    @Data
    public static class ConsoleProperties {
        private boolean enabled = false;
    }
}
