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

package dev.opscrew.tools;

import dev.opscrew.domain.component.ToolComponent;
import dev.opscrew.domain.model.ToolDefinition;
import dev.opscrew.domain.model.ToolFailureKind;
import dev.opscrew.domain.model.ToolResult;
import dev.opscrew.infrastructure.config.CrewProperties;
import dev.opscrew.security.CommandGuard;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Tool for executing shell commands within a sandboxed environment.
 *
 * <p>
 * Commands execute via {@code /bin/sh -c} in the workspace directory with a
 * sanitized environment. Every command is checked by {@link CommandGuard}
 * first; a rejected command never starts and resolves with
 * {@code {stdout: "", stderr: "Error: Command contains forbidden pattern: ..."}}.
 *
 * <p>
 * The tool never fails its future. Results carry {@code {stdout, stderr,
 * exitCode}}; a timeout kills the process and reports what it printed so far.
 *
 * <p>
 * Configuration:
 * <ul>
 * <li>{@code crew.tools.workspace} - Working directory
 * <li>{@code crew.tools.shell.default-timeout} - Default timeout (seconds)
 * <li>{@code crew.tools.shell.max-timeout} - Max timeout (seconds)
 * <li>{@code crew.tools.shell.forbidden-patterns} - Deny-listed substrings
 * </ul>
 *
 * @see CommandGuard
 */
@Component
@Slf4j
public class ShellTool implements ToolComponent {

    public static final String NAME = "shell";
    public static final String KEY_STDOUT = "stdout";
    public static final String KEY_STDERR = "stderr";
    public static final String KEY_EXIT_CODE = "exitCode";

    private static final String PARAM_TYPE = "type";
    private static final String PARAM_COMMAND = "command";
    private static final String PARAM_TIMEOUT = "timeout";
    private static final String PARAM_WORKDIR = "workdir";
    private static final String TYPE_STRING = "string";

    private static final int MAX_OUTPUT_LENGTH = 100_000;

    private static final Set<String> DEFAULT_ALLOWED_ENV_VARS = Set.of(
            "PATH", "LANG", "LC_ALL", "LC_CTYPE", "TERM", "TMPDIR",
            "TZ", "SHELL", "USER", "LOGNAME");

    private final Path workspaceRoot;
    private final CommandGuard commandGuard;
    private final boolean enabled;
    private final int defaultTimeout;
    private final int maxTimeout;
    private final Set<String> allowedEnvVars;
    private final ExecutorService executor;

    public ShellTool(CrewProperties properties, CommandGuard commandGuard) {
        CrewProperties.ShellToolProperties config = properties.getTools().getShell();
        this.enabled = config.isEnabled();
        int ceiling = executorCeilingSeconds(properties.getLoop().getToolTimeoutMs());
        this.maxTimeout = Math.max(Math.min(config.getMaxTimeout(), ceiling), 1);
        this.defaultTimeout = Math.min(Math.max(config.getDefaultTimeout(), 1), this.maxTimeout);
        if (config.getMaxTimeout() > this.maxTimeout) {
            log.info("[Shell] Max timeout lowered from {}s to {}s to stay under the tool timeout",
                    config.getMaxTimeout(), this.maxTimeout);
        }
        this.workspaceRoot = Paths.get(properties.getTools().getWorkspace()).toAbsolutePath().normalize();
        this.commandGuard = commandGuard;
        this.allowedEnvVars = buildAllowedEnvVars(config.getAllowedEnvVars());
        this.executor = Executors.newCachedThreadPool();

        try {
            Files.createDirectories(workspaceRoot);
            log.info("[Shell] Workspace: {}", workspaceRoot);
        } catch (IOException e) {
            log.error("[Shell] Failed to create workspace directory: {}", workspaceRoot, e);
        }
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("[Shell] Executor did not terminate within timeout");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(NAME)
                .description("""
                        Execute a shell command in the sandbox workspace and return its stdout and stderr.
                        Commands run with timeout protection (default %ds, max %ds).
                        Redirection, pipes, background jobs and destructive commands are rejected.
                        """.formatted(defaultTimeout, maxTimeout))
                .inputSchema(Map.of(
                        PARAM_TYPE, "object",
                        "properties", Map.of(
                                PARAM_COMMAND, Map.of(
                                        PARAM_TYPE, TYPE_STRING,
                                        "description", "Shell command to execute"),
                                PARAM_TIMEOUT, Map.of(
                                        PARAM_TYPE, "integer",
                                        "description", "Timeout in seconds (optional)"),
                                PARAM_WORKDIR, Map.of(
                                        PARAM_TYPE, TYPE_STRING,
                                        "description", "Working directory relative to workspace (optional)")),
                        "required", List.of(PARAM_COMMAND)))
                .build();
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
        CompletableFuture<ToolResult> result = new CompletableFuture<>();
        Future<?> task = executor.submit(() -> {
            try {
                result.complete(run(parameters));
            } catch (Error e) {
                result.completeExceptionally(e);
                throw e;
            }
        });
        // Interrupting the worker kills the running process
        result.whenComplete((ignored, error) -> {
            if (result.isCancelled()) {
                task.cancel(true);
            }
        });
        return result;
    }

    private ToolResult run(Map<String, Object> parameters) {
        try {
            Object commandValue = parameters.get(PARAM_COMMAND);
            String command = commandValue instanceof String s ? s : null;
            if (command == null || command.isBlank()) {
                return ToolResult.failure(ToolFailureKind.INVALID_INPUT, "Missing required parameter: command");
            }
            log.info("[Shell] Command: '{}'", truncate(command, 200));

            Optional<String> forbidden = commandGuard.findForbidden(command);
            if (forbidden.isPresent()) {
                String message = "Command contains forbidden pattern: " + forbidden.get();
                return ToolResult.failure(ToolFailureKind.POLICY_DENIED, message, output("", "Error: " + message,
                        null));
            }

            int timeout = resolveTimeout(parameters.get(PARAM_TIMEOUT));

            Path workDir = workspaceRoot;
            Object workdirValue = parameters.get(PARAM_WORKDIR);
            if (workdirValue instanceof String workdirStr && !workdirStr.isBlank()) {
                workDir = workspaceRoot.resolve(workdirStr).normalize();
                if (!workDir.startsWith(workspaceRoot) || commandGuard.detectPathTraversal(workdirStr)) {
                    log.warn("[Shell] Working directory outside workspace: {}", workdirStr);
                    return ToolResult.failure(ToolFailureKind.POLICY_DENIED,
                            "Working directory must be within workspace");
                }
                if (!Files.isDirectory(workDir)) {
                    return ToolResult.failure(ToolFailureKind.INVALID_INPUT,
                            "Working directory does not exist: " + workdirStr);
                }
            }

            ToolResult result = executeCommand(command, workDir, timeout);
            log.info("[Shell] Command result: success={}", result.isSuccess());
            return result;
        } catch (RuntimeException e) {
            log.error("[Shell] ERROR: {}", e.getMessage(), e);
            return ToolResult.failure("Error: " + e.getMessage());
        }
    }

    private int resolveTimeout(Object timeoutObj) {
        if (timeoutObj instanceof Number number) {
            return Math.max(1, Math.min(number.intValue(), maxTimeout));
        }
        return defaultTimeout;
    }

    private String truncate(String text, int maxLen) {
        if (text.length() <= maxLen) {
            return text;
        }
        return text.substring(0, maxLen) + "...";
    }

    private static Set<String> buildAllowedEnvVars(List<String> configured) {
        if (configured == null || configured.isEmpty()) {
            return DEFAULT_ALLOWED_ENV_VARS;
        }
        Set<String> merged = new HashSet<>(DEFAULT_ALLOWED_ENV_VARS);
        configured.stream()
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .forEach(merged::add);
        return Collections.unmodifiableSet(merged);
    }

    /**
     * Whole seconds left for the command once the executor's wall-clock limit
     * and the output drain are accounted for.
     */
    static int executorCeilingSeconds(long toolTimeoutMs) {
        if (toolTimeoutMs <= 0) {
            return Integer.MAX_VALUE;
        }
        return (int) Math.max(1, toolTimeoutMs / 1000 - 2);
    }

    private static void kill(Process process) {
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
    }

    private ToolResult executeCommand(String command, Path workDir, int timeoutSeconds) {
        ProcessBuilder pb = new ProcessBuilder("/bin/sh", "-c", command);
        pb.directory(workDir.toFile());

        // Only keep safe vars, drops LD_PRELOAD and credentials
        Map<String, String> env = pb.environment();
        env.keySet().retainAll(allowedEnvVars);
        env.put("HOME", workspaceRoot.toString());
        env.put("PWD", workDir.toString());

        Process process = null;
        try {
            process = pb.start();
            Process started = process;
            Future<String> stdoutFuture = executor.submit(() -> readStream(started.getInputStream()));
            Future<String> stderrFuture = executor.submit(() -> readStream(started.getErrorStream()));

            boolean completed = process.waitFor(timeoutSeconds, TimeUnit.SECONDS);
            if (!completed) {
                kill(process);
                String message = "Command timed out after " + timeoutSeconds + " seconds";
                log.warn("[Shell] {}", message);
                return ToolResult.failure(ToolFailureKind.TIMEOUT, message,
                        output(drain(stdoutFuture), "Error: " + message, null));
            }

            String stdout = drain(stdoutFuture);
            String stderr = drain(stderrFuture);
            int exitCode = process.exitValue();
            Map<String, Object> data = output(stdout, stderr, exitCode);

            if (exitCode == 0) {
                return ToolResult.success(stdout.isEmpty() ? "(no output)" : stdout, data);
            }
            return ToolResult.failure(ToolFailureKind.EXECUTION_FAILED,
                    "Command failed with exit code " + exitCode, data);
        } catch (IOException e) {
            return ToolResult.failure(ToolFailureKind.EXECUTION_FAILED,
                    "Failed to execute command: " + e.getMessage(),
                    output("", "Error: " + e.getMessage(), null));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            if (process != null) {
                kill(process);
            }
            log.warn("[Shell] Command interrupted, process killed");
            return ToolResult.failure(ToolFailureKind.TIMEOUT, "Command execution interrupted");
        }
    }

    private String readStream(InputStream stream) throws IOException {
        StringBuilder output = new StringBuilder();
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
            String line = reader.readLine();
            while (line != null) {
                if (output.length() < MAX_OUTPUT_LENGTH) {
                    output.append(line).append('\n');
                }
                line = reader.readLine();
            }
        }
        if (output.length() > MAX_OUTPUT_LENGTH) {
            output.setLength(MAX_OUTPUT_LENGTH);
            output.append("\n[Output truncated...]");
        }
        return output.toString();
    }

    private String drain(Future<String> future) throws InterruptedException {
        try {
            return future.get(1, TimeUnit.SECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            return "[Output read timeout]";
        } catch (ExecutionException e) {
            return "[Output read failed: " + e.getCause().getMessage() + "]";
        }
    }

    private static Map<String, Object> output(String stdout, String stderr, Integer exitCode) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put(KEY_STDOUT, stdout);
        data.put(KEY_STDERR, stderr);
        if (exitCode != null) {
            data.put(KEY_EXIT_CODE, exitCode);
        }
        return data;
    }
}
