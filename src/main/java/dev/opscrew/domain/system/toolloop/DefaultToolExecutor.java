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

package dev.opscrew.domain.system.toolloop;

import dev.opscrew.domain.component.ToolComponent;
import dev.opscrew.domain.model.Message;
import dev.opscrew.domain.model.ToolFailureKind;
import dev.opscrew.domain.model.ToolResult;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Default ToolExecutorPort: runs the tool and waits for it with a hard
 * wall-clock limit.
 *
 * <p>
 * Thrown exceptions and errors, exceptionally completed futures, null results
 * and timeouts all become failed {@link ToolResult}s. Only virtual machine
 * errors propagate.
 */
@Slf4j
public class DefaultToolExecutor implements ToolExecutorPort {

    private final long timeoutMs;

    public DefaultToolExecutor(long timeoutMs) {
        this.timeoutMs = timeoutMs > 0 ? timeoutMs : 30_000L;
    }

    @Override
    public ToolExecutionOutcome execute(Message.ToolCall toolCall, ToolComponent tool) {
        long start = System.currentTimeMillis();
        CompletableFuture<ToolResult> future = null;
        try {
            future = tool.execute(toolCall.getArguments());
            if (future == null) {
                return ToolExecutionOutcome.synthetic(toolCall, ToolFailureKind.EXECUTION_FAILED,
                        "Tool returned no result");
            }
            ToolResult result = future.get(timeoutMs, TimeUnit.MILLISECONDS);
            if (result == null) {
                return ToolExecutionOutcome.synthetic(toolCall, ToolFailureKind.EXECUTION_FAILED,
                        "Tool returned no result");
            }
            log.debug("[Tools] '{}' finished in {}ms, success={}", toolCall.getName(),
                    System.currentTimeMillis() - start, result.isSuccess());
            return ToolExecutionOutcome.of(toolCall, result);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("[Tools] '{}' timed out after {}ms", toolCall.getName(), timeoutMs);
            return ToolExecutionOutcome.synthetic(toolCall, ToolFailureKind.TIMEOUT,
                    "Tool '" + toolCall.getName() + "' timed out after " + timeoutMs + " ms");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ToolExecutionOutcome.synthetic(toolCall, ToolFailureKind.EXECUTION_FAILED,
                    "Tool execution interrupted");
        } catch (ExecutionException e) {
            log.error("[Tools] '{}' failed", toolCall.getName(), e.getCause());
            return ToolExecutionOutcome.synthetic(toolCall, ToolFailureKind.EXECUTION_FAILED,
                    "Tool execution failed: " + safeCauseMessage(e));
        } catch (VirtualMachineError e) {
            throw e;
        } catch (RuntimeException | Error e) {
            log.error("[Tools] '{}' threw", toolCall.getName(), e);
            return ToolExecutionOutcome.synthetic(toolCall, ToolFailureKind.EXECUTION_FAILED,
                    "Tool execution failed: " + safeCauseMessage(e));
        }
    }

    static String safeCauseMessage(Throwable error) {
        if (error == null) {
            return "unknown";
        }

        Throwable cursor = error;
        Throwable cause = cursor.getCause();
        while (cause != null) {
            if (cause.equals(cursor)) {
                break;
            }
            cursor = cause;
            cause = cursor.getCause();
        }

        String message = cursor.getMessage();
        if (message == null || message.isBlank()) {
            message = cursor.getClass().getSimpleName();
        }
        return message;
    }
}
