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

package dev.opscrew.domain.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Ordered, append-only message history of a single loop run.
 *
 * <p>
 * A conversation is owned by exactly one loop and is not thread-safe. Messages
 * coming from outside are copied on the way in so no two conversations share a
 * {@link Message} instance.
 */
public final class Conversation {

    private final List<Message> messages = new ArrayList<>();

    private Conversation() {
    }

    public static Conversation empty() {
        return new Conversation();
    }

    public static Conversation of(List<Message> initial) {
        Conversation conversation = new Conversation();
        if (initial != null) {
            for (Message message : initial) {
                conversation.append(Message.copyOf(message));
            }
        }
        return conversation;
    }

    public void append(Message message) {
        if (message == null) {
            throw new IllegalArgumentException("message must not be null");
        }
        messages.add(message);
    }

    /**
     * Read-only view of the history. The view reflects later appends.
     */
    public List<Message> messages() {
        return Collections.unmodifiableList(messages);
    }

    /**
     * Point-in-time copy, safe to hand to a model adapter.
     */
    public List<Message> snapshot() {
        return List.copyOf(messages);
    }

    public int size() {
        return messages.size();
    }

    public Message last() {
        return messages.isEmpty() ? null : messages.get(messages.size() - 1);
    }
}
