package com.briefforge.orchestrator.model;

/**
 * A single synthesized artifact. Never mutated after creation; renaming on
 * path collision produces a new instance via {@link #withPath}.
 */
public record GeneratedFile(String path, String content, FileType type) {

    public GeneratedFile withPath(String newPath) {
        return new GeneratedFile(newPath, content, type);
    }
}
