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

package dev.opscrew.port.outbound;

import dev.opscrew.domain.model.LlmChunk;
import dev.opscrew.domain.model.LlmRequest;
import reactor.core.publisher.Flux;

/**
 * Port for the model session behind every agent (OpenAI, Anthropic, etc.).
 * Given the ordered messages and the capability schemas of a request, produces
 * an incremental stream of content deltas and tool-call deltas.
 */
public interface LlmPort {

    /**
     * Returns the provider identifier (e.g., "openai", "anthropic").
     */
    String getProviderId();

    /**
     * Executes a streaming chat request. The returned flux emits deltas in the
     * order the provider produced them and completes after the last one.
     */
    Flux<LlmChunk> chatStream(LlmRequest request);

    /**
     * Returns the model identifier used for requests without an override.
     */
    String getCurrentModel();

    /**
     * Checks if the provider has credentials and can serve requests.
     */
    boolean isAvailable();
}
