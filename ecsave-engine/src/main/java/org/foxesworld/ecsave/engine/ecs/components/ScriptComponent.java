package org.foxesworld.ecsave.engine.ecs.components;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Script binding per-entity.
 *
 * <p>assetPath example: {@code "Scripts/entities/player.js"}.
 * Only {@link #assetPath} is persisted; the derived fields are rebuilt by the constructor.
 */
public final class ScriptComponent {

    /** Original asset path as provided by content/tools. */
    public final String assetPath;

    /** Normalized module id. */
    public final transient String moduleId;

    /**
     * Stable hash for quick indexing/logging.
     * NOTE: Not a security hash; just a fast stable 64-bit hash.
     */
    public final transient long moduleHash;

    @JsonCreator
    public ScriptComponent(@JsonProperty("assetPath") String assetPath) {
        this.assetPath = assetPath;
        this.moduleId = normalize(assetPath);
        this.moduleHash = hash64(this.moduleId);
    }

    private static String normalize(String id) {
        if (id == null) return "";
        String s = id.trim().replace('\\', '/');
        while (s.startsWith("./")) s = s.substring(2);
        return s;
    }

    /** FNV-1a 64-bit, stable across runs/JVMs. */
    private static long hash64(String s) {
        if (s == null || s.isEmpty()) return 0L;
        long h = 0xcbf29ce484222325L; // offset basis
        for (int i = 0, n = s.length(); i < n; i++) {
            h ^= s.charAt(i);
            h *= 0x100000001b3L; // prime
        }
        return h;
    }
}
