package com.briefforge.orchestrator.assembly;

import com.briefforge.orchestrator.model.FileType;
import com.briefforge.orchestrator.model.GeneratedFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Merges the file lists of several tasks into one path-unique artifact set.
 *
 * Synthesizers run independently, so two tasks can emit the same path. A
 * copy whose content matches any version already kept for that path is
 * dropped; otherwise it is kept under a numbered name ({@code cache-2.ts},
 * {@code cache-3.ts}, ...).
 */
@Component
public class ArtifactAssembler {

    private static final Logger log = LoggerFactory.getLogger(ArtifactAssembler.class);

    private static final String SOURCE_ROOT = "src/";

    /**
     * Merge file lists in order. The result has unique paths; relative order
     * of first appearances is preserved.
     */
    public List<GeneratedFile> assemble(List<List<GeneratedFile>> fileLists) {
        Map<String, GeneratedFile> byPath   = new LinkedHashMap<>();
        // requested path -> every path already holding a version of it
        Map<String, List<String>>  versions = new HashMap<>();

        for (List<GeneratedFile> files : fileLists) {
            for (GeneratedFile file : files) {
                GeneratedFile normalized = normalize(file);
                String        requested  = normalized.path();
                List<String>  taken      = versions.computeIfAbsent(requested, p -> new ArrayList<>());

                String sameContent = taken.stream()
                        .filter(p -> byPath.get(p).content().equals(normalized.content()))
                        .findFirst()
                        .orElse(null);

                if (sameContent != null) {
                    log.debug("Dropping duplicate artifact {} (same as {})", requested, sameContent);
                } else if (!byPath.containsKey(requested)) {
                    byPath.put(requested, normalized);
                    taken.add(requested);
                } else {
                    String renamed = nextFreePath(requested, byPath);
                    log.warn("Artifact path collision on {}; keeping another version as {}", requested, renamed);
                    byPath.put(renamed, normalized.withPath(renamed));
                    taken.add(renamed);
                }
            }
        }
        return new ArrayList<>(byPath.values());
    }

    /**
     * Place a file under {@code src/} by its type. Paths already under
     * {@code src/} are returned unchanged. A null type is inferred from the path.
     */
    public GeneratedFile normalize(GeneratedFile file) {
        String path = file.path() == null ? "" : file.path().replace('\\', '/');
        FileType type = file.type() == null ? inferType(path) : file.type();

        if (path.startsWith(SOURCE_ROOT)) {
            return new GeneratedFile(path, file.content(), type);
        }

        String fileName = path.substring(path.lastIndexOf('/') + 1);
        String lower    = path.toLowerCase();
        String dir = switch (type) {
            case API -> lower.contains("controller") ? "src/controllers/"
                      : lower.contains("route")      ? "src/routes/"
                      : "src/api/";
            case SCHEMA    -> "src/models/";
            case CONFIG    -> "src/config/";
            case COMPONENT -> "src/components/";
            case OTHER     -> "src/utils/";
        };
        return new GeneratedFile(dir + fileName, file.content(), type);
    }

    /** Artifact type implied by a path alone. */
    public static FileType inferType(String path) {
        String lower = path == null ? "" : path.toLowerCase();
        if (lower.contains("controller") || lower.contains("route")) return FileType.API;
        if (lower.contains("model") || lower.contains("schema"))     return FileType.SCHEMA;
        if (lower.contains("config") || lower.endsWith(".json"))     return FileType.CONFIG;
        if (lower.endsWith(".tsx") || lower.endsWith(".jsx"))        return FileType.COMPONENT;
        return FileType.OTHER;
    }

    // ------------------------------------------------------------------

    private static String nextFreePath(String path, Map<String, GeneratedFile> taken) {
        int slash = path.lastIndexOf('/');
        int dot   = path.lastIndexOf('.');
        boolean hasExt = dot > slash + 1;
        String base = hasExt ? path.substring(0, dot) : path;
        String ext  = hasExt ? path.substring(dot) : "";

        for (int n = 2; ; n++) {
            String candidate = base + "-" + n + ext;
            if (!taken.containsKey(candidate)) {
                return candidate;
            }
        }
    }
}
