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
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Stream;

/**
 * Tool for file system operations within a sandboxed workspace.
 *
 * <p>
 * Operations:
 * <ul>
 * <li>read_file - Read text file content
 * <li>write_file - Write text content to file, creating parent directories
 * <li>list_directory - List entry names of a directory
 * </ul>
 *
 * <p>
 * All paths are resolved relative to the workspace root ({@code crew.tools.workspace}).
 * Traversal sequences and symlinks leading outside it are rejected.
 */
@Component
@Slf4j
public class FileSystemTool implements ToolComponent {

    public static final String NAME = "filesystem";
    public static final String OP_READ_FILE = "read_file";
    public static final String OP_WRITE_FILE = "write_file";
    public static final String OP_LIST_DIRECTORY = "list_directory";

    private static final String PARAM_OPERATION = "operation";
    private static final String PARAM_PATH = "path";
    private static final String PARAM_CONTENT = "content";
    private static final int MAX_FILES_LIST = 100;

    private final Path workspaceRoot;
    private final CommandGuard commandGuard;
    private final boolean enabled;
    private final long maxFileSize;

    public FileSystemTool(CrewProperties properties, CommandGuard commandGuard) {
        CrewProperties.FileSystemToolProperties config = properties.getTools().getFilesystem();
        this.enabled = config.isEnabled();
        this.maxFileSize = config.getMaxFileSize();
        this.workspaceRoot = Paths.get(properties.getTools().getWorkspace()).toAbsolutePath().normalize();
        this.commandGuard = commandGuard;

        try {
            Files.createDirectories(workspaceRoot);
            log.info("[FileSystem] Workspace: {}, enabled: {}", workspaceRoot, enabled);
        } catch (IOException e) {
            log.error("[FileSystem] Failed to create workspace directory: {}", workspaceRoot, e);
        }
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(NAME)
                .description("""
                        Reads, writes and lists files in the sandbox workspace.
                        Operations: read_file, write_file (requires content), list_directory.
                        All paths are relative to the workspace root.
                        """)
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                PARAM_OPERATION, Map.of(
                                        "type", "string",
                                        "enum", List.of(OP_READ_FILE, OP_WRITE_FILE, OP_LIST_DIRECTORY),
                                        "description", "Operation to perform"),
                                PARAM_PATH, Map.of(
                                        "type", "string",
                                        "description", "File or directory path (relative to workspace)"),
                                PARAM_CONTENT, Map.of(
                                        "type", "string",
                                        "description", "Content to write (for write_file operation)")),
                        "required", List.of(PARAM_OPERATION, PARAM_PATH)))
                .build();
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
        return CompletableFuture.supplyAsync(() -> {
            String operation = (String) parameters.get(PARAM_OPERATION);
            String pathStr = (String) parameters.get(PARAM_PATH);
            log.info("[FileSystem] Operation: {}, Path: {}", operation, pathStr);

            if (operation == null || pathStr == null) {
                return ToolResult.failure(ToolFailureKind.INVALID_INPUT,
                        "Missing required parameters: operation and path");
            }

            if (commandGuard.detectPathTraversal(pathStr)) {
                return ToolResult.failure(ToolFailureKind.POLICY_DENIED,
                        "Invalid path: path traversal not allowed");
            }

            Path resolvedPath = resolveSafePath(pathStr);
            if (resolvedPath == null) {
                return ToolResult.failure(ToolFailureKind.POLICY_DENIED, "Invalid path: must be within workspace");
            }

            ToolResult result = switch (operation) {
            case OP_READ_FILE -> readFile(resolvedPath);
            case OP_WRITE_FILE -> writeFile(resolvedPath, parameters);
            case OP_LIST_DIRECTORY -> listDirectory(resolvedPath);
            default -> ToolResult.failure(ToolFailureKind.INVALID_INPUT, "Unknown operation: " + operation);
            };

            log.debug("[FileSystem] Operation '{}' result: success={}", operation, result.isSuccess());
            return result;
        });
    }

    private Path resolveSafePath(String pathStr) {
        try {
            Path resolved = workspaceRoot.resolve(pathStr).normalize();
            if (!resolved.startsWith(workspaceRoot)) {
                return null;
            }

            if (Files.exists(resolved)) {
                Path realPath = resolved.toRealPath();
                Path realWorkspace = workspaceRoot.toRealPath();
                if (!realPath.startsWith(realWorkspace)) {
                    log.warn("[FileSystem] Symlink escape blocked: {} -> {}", resolved, realPath);
                    return null;
                }
            }
            return resolved;
        } catch (InvalidPathException e) {
            return null;
        } catch (IOException e) {
            log.warn("[FileSystem] Failed to resolve real path: {}", pathStr);
            return null;
        }
    }

    private ToolResult readFile(Path path) {
        if (!Files.isRegularFile(path)) {
            return ToolResult.failure("File not found: " + relativePath(path));
        }

        try {
            long size = Files.size(path);
            if (size > maxFileSize) {
                return ToolResult.failure("File too large (max " + maxFileSize + " bytes)");
            }
            String content = Files.readString(path, StandardCharsets.UTF_8);
            return ToolResult.success(content, Map.of(PARAM_CONTENT, content));
        } catch (IOException e) {
            return ToolResult.failure("Failed to read file: " + e.getMessage());
        }
    }

    private ToolResult writeFile(Path path, Map<String, Object> params) {
        Object content = params.get(PARAM_CONTENT);
        if (!(content instanceof String text)) {
            return ToolResult.failure(ToolFailureKind.INVALID_INPUT, "Missing content for write_file operation");
        }

        try {
            Path parent = path.getParent();
            if (parent != null && !Files.exists(parent)) {
                Files.createDirectories(parent);
            }
            Files.writeString(path, text, StandardCharsets.UTF_8);

            Map<String, Object> data = new LinkedHashMap<>();
            data.put("success", true);
            data.put(PARAM_PATH, relativePath(path));
            return ToolResult.success("Successfully written to file: " + relativePath(path), data);
        } catch (IOException e) {
            return ToolResult.failure("Failed to write file: " + e.getMessage());
        }
    }

    private ToolResult listDirectory(Path path) {
        if (!Files.isDirectory(path)) {
            return ToolResult.failure("Directory not found: " + relativePath(path));
        }

        try (Stream<Path> stream = Files.list(path)) {
            List<String> files = stream
                    .map(p -> p.getFileName().toString())
                    .sorted()
                    .limit(MAX_FILES_LIST)
                    .toList();
            return ToolResult.success(String.join("\n", files), Map.of("files", files));
        } catch (IOException e) {
            return ToolResult.failure("Failed to list directory: " + e.getMessage());
        }
    }

    private String relativePath(Path path) {
        String relative = workspaceRoot.relativize(path).toString();
        return relative.isEmpty() ? "." : relative;
    }
}
