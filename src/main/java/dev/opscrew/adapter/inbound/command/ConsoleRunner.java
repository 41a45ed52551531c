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

package dev.opscrew.adapter.inbound.command;

import dev.opscrew.domain.model.Message;
import dev.opscrew.domain.model.OrchestratorRequest;
import dev.opscrew.domain.model.StreamEvent;
import dev.opscrew.domain.model.StreamEventType;
import dev.opscrew.domain.stream.StreamEventJson;
import dev.opscrew.port.inbound.AgentInvocationPort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Line-oriented console transport: each stdin line is a user message, each
 * event of the resulting invocation is printed as one JSON line.
 *
 * <p>
 * The conversation carries over between lines; the coordinator's streamed text
 * is kept as the assistant reply. {@code /exit} or end of input stops the
 * runner. Enabled with {@code crew.console.enabled=true}.
 */
@Component
@ConditionalOnProperty(prefix = "crew.console", name = "enabled", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class ConsoleRunner implements CommandLineRunner {

    private static final String EXIT_COMMAND = "/exit";

    private final AgentInvocationPort invocationPort;
    private final StreamEventJson eventJson;

    @Override
    public void run(String... args) throws IOException {
        BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        PrintWriter out = new PrintWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8), true);
        log.info("[Console] Ready, agents: {}", invocationPort.getAvailableAgents().size());
        serve(in, out);
    }

    void serve(BufferedReader in, PrintWriter out) throws IOException {
        List<Message> history = new ArrayList<>();
        String line = in.readLine();
        while (line != null) {
            String input = line.strip();
            if (EXIT_COMMAND.equalsIgnoreCase(input)) {
                break;
            }
            if (!input.isEmpty()) {
                history.add(Message.user(input));
                String reply = invoke(history, out);
                history.add(Message.assistant(reply));
            }
            line = in.readLine();
        }
        out.flush();
    }

    private String invoke(List<Message> history, PrintWriter out) {
        OrchestratorRequest request = OrchestratorRequest.builder()
                .messages(new ArrayList<>(history))
                .build();
        StringBuilder reply = new StringBuilder();
        invocationPort.invoke(request)
                .doOnNext(event -> {
                    if (event.is(StreamEventType.CHUNK)) {
                        reply.append((String) event.get(StreamEvent.KEY_TEXT));
                    }
                    out.println(eventJson.render(event));
                })
                .blockLast();
        return reply.toString();
    }
}
