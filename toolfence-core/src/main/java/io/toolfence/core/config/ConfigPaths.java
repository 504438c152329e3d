package io.toolfence.core.config;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Locations derived from one toolfence home directory: the config file lives directly in it and
 * relative workspace paths are resolved against it.
 */
public final class ConfigPaths {
    static final String HOME_PROPERTY = "toolfence.home";
    static final String HOME_ENV = "TOOLFENCE_HOME";
    private static final String CONFIG_FILE = "config.json";
    private static final String WORKSPACE_DIR = "workspace";

    private final Path home;

    public ConfigPaths(Path home) {
        this.home = Objects.requireNonNull(home, "home must not be null").toAbsolutePath().normalize();
    }

    /**
     * Uses the {@code toolfence.home} system property, then {@code TOOLFENCE_HOME}, then
     * {@code ~/.toolfence}.
     */
    public static ConfigPaths fromEnvironment() {
        String configured = System.getProperty(HOME_PROPERTY);
        if (configured == null || configured.isBlank()) {
            configured = System.getenv(HOME_ENV);
        }
        if (configured == null || configured.isBlank()) {
            return new ConfigPaths(userHome().resolve(".toolfence"));
        }
        return new ConfigPaths(expandUserHome(configured.trim()));
    }

    /**
     * Paths for the directory holding {@code configFile}.
     */
    public static ConfigPaths forConfigFile(Path configFile) {
        Path parent = configFile.toAbsolutePath().normalize().getParent();
        return new ConfigPaths(parent == null ? Path.of("").toAbsolutePath() : parent);
    }

    public Path home() {
        return home;
    }

    public Path configFile() {
        return home.resolve(CONFIG_FILE);
    }

    public Path defaultWorkspace() {
        return home.resolve(WORKSPACE_DIR);
    }

    /**
     * Blank means {@link #defaultWorkspace()}; {@code ~} expands to the user home; other relative
     * paths are taken against {@link #home()}.
     */
    public Path resolveWorkspace(String rawPath) {
        if (rawPath == null || rawPath.isBlank()) {
            return defaultWorkspace();
        }
        Path expanded = expandUserHome(rawPath.trim());
        return (expanded.isAbsolute() ? expanded : home.resolve(expanded)).normalize();
    }

    private static Path expandUserHome(String rawPath) {
        if ("~".equals(rawPath)) {
            return userHome();
        }
        if (rawPath.startsWith("~/")) {
            return userHome().resolve(rawPath.substring(2));
        }
        return Path.of(rawPath);
    }

    private static Path userHome() {
        return Path.of(System.getProperty("user.home"));
    }
}
