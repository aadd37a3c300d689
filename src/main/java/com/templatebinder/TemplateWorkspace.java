package com.templatebinder;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * The directory templates are read from and written to. Every path handed in from outside
 * is workspace-relative and may not escape the root.
 */
public class TemplateWorkspace {
    private final Path workspaceRoot;

    public TemplateWorkspace(Path workspaceRoot) {
        this.workspaceRoot = workspaceRoot.toAbsolutePath().normalize();
    }

    public Path getWorkspaceRoot() {
        return workspaceRoot;
    }

    public Path resolvePath(String relativePath) {
        if (relativePath == null || relativePath.isBlank() || ".".equals(relativePath)) {
            return workspaceRoot;
        }

        // Normalize separators
        String normalized = relativePath.replace('\\', '/');

        // "/foo.aepx" is workspace-relative "foo.aepx"
        if (normalized.startsWith("/")) {
            normalized = normalized.substring(1);
        }
        if (normalized.isEmpty()) {
            return workspaceRoot;
        }

        Path resolved = workspaceRoot.resolve(normalized).normalize();
        if (!resolved.startsWith(workspaceRoot)) {
            throw new SecurityException("Path escapes workspace root: " + relativePath);
        }
        return resolved;
    }

    /**
     * Resolves a path that must name an existing regular file.
     */
    public Path resolveExisting(String relativePath) throws IOException {
        if (relativePath == null || relativePath.isBlank()) {
            throw new IllegalArgumentException("Path is required");
        }
        Path resolved = resolvePath(relativePath);
        if (!Files.exists(resolved)) {
            throw new FileNotFoundException("File not found: " + relativePath);
        }
        if (!Files.isRegularFile(resolved)) {
            throw new IOException("Path is not a file: " + relativePath);
        }
        return resolved;
    }

    public String relativize(Path path) {
        return workspaceRoot.relativize(path.toAbsolutePath().normalize()).toString().replace('\\', '/');
    }
}
