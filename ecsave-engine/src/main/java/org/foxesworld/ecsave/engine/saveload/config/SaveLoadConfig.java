package org.foxesworld.ecsave.engine.saveload.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Settings under {@code ecsave}. Every key falls back to its default when absent, the
 * defaults themselves live in {@code reference.conf}.
 */
public final class SaveLoadConfig {

    public static final String ROOT = "ecsave";

    public static final String DEFAULT_DIRECTORY = "saves";
    public static final String DEFAULT_FILE = "savegame.json";

    private final Path directory;
    private final String fileName;
    private final boolean prettyJson;
    private final boolean clearWorldOnLoad;

    public SaveLoadConfig(Path directory, String fileName, boolean prettyJson, boolean clearWorldOnLoad) {
        this.directory = Objects.requireNonNull(directory, "directory");
        this.fileName = requireName(fileName);
        this.prettyJson = prettyJson;
        this.clearWorldOnLoad = clearWorldOnLoad;
    }

    /** {@code application.conf} / system properties over {@code reference.conf}. */
    public static SaveLoadConfig load() {
        return from(ConfigFactory.load());
    }

    public static SaveLoadConfig defaults() {
        return new SaveLoadConfig(Path.of(DEFAULT_DIRECTORY), DEFAULT_FILE, false, true);
    }

    public static SaveLoadConfig from(Config root) {
        Objects.requireNonNull(root, "root");
        Config cfg = root.hasPath(ROOT) ? root.getConfig(ROOT) : ConfigFactory.empty();
        return new SaveLoadConfig(
                Path.of(str(cfg, "save.directory", DEFAULT_DIRECTORY)),
                str(cfg, "save.file", DEFAULT_FILE),
                bool(cfg, "json.pretty", false),
                bool(cfg, "load.clear-world", true));
    }

    public Path directory() { return directory; }

    public String fileName() { return fileName; }

    public Path saveFile() { return directory.resolve(fileName); }

    public boolean prettyJson() { return prettyJson; }

    public boolean clearWorldOnLoad() { return clearWorldOnLoad; }

    @Override
    public String toString() {
        return "SaveLoadConfig{file=" + saveFile() + ", prettyJson=" + prettyJson
                + ", clearWorldOnLoad=" + clearWorldOnLoad + '}';
    }

    private static String str(Config cfg, String key, String def) {
        if (!cfg.hasPath(key)) return def;
        String v = cfg.getString(key).trim();
        return v.isEmpty() ? def : v;
    }

    private static boolean bool(Config cfg, String key, boolean def) {
        return cfg.hasPath(key) ? cfg.getBoolean(key) : def;
    }

    private static String requireName(String fileName) {
        if (fileName == null || fileName.isBlank()) throw new IllegalArgumentException("save file name is blank");
        String f = fileName.trim();
        if (f.contains("/") || f.contains("\\")) {
            throw new IllegalArgumentException("save file name must not contain a path: " + f);
        }
        return f;
    }
}
