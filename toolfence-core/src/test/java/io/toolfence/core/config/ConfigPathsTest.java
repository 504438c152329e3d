package io.toolfence.core.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConfigPathsTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldDeriveFilesFromHome() {
        ConfigPaths paths = new ConfigPaths(tempDir);

        assertThat(paths.configFile()).isEqualTo(tempDir.toAbsolutePath().resolve("config.json"));
        assertThat(paths.defaultWorkspace()).isEqualTo(tempDir.toAbsolutePath().resolve("workspace"));
    }

    @Test
    void shouldResolveWorkspaceVariants() {
        ConfigPaths paths = new ConfigPaths(tempDir);
        Path userHome = Path.of(System.getProperty("user.home"));
        Path absolute = tempDir.resolve("elsewhere").toAbsolutePath();

        assertThat(paths.resolveWorkspace(null)).isEqualTo(paths.defaultWorkspace());
        assertThat(paths.resolveWorkspace("  ")).isEqualTo(paths.defaultWorkspace());
        assertThat(paths.resolveWorkspace("~")).isEqualTo(userHome);
        assertThat(paths.resolveWorkspace("~/work")).isEqualTo(userHome.resolve("work"));
        assertThat(paths.resolveWorkspace("projects/../ws")).isEqualTo(paths.home().resolve("ws"));
        assertThat(paths.resolveWorkspace(absolute.toString())).isEqualTo(absolute);
    }

    @Test
    void shouldUseDirectoryOfConfigFile() {
        ConfigPaths paths = ConfigPaths.forConfigFile(tempDir.resolve("nested/config.json"));

        assertThat(paths.home()).isEqualTo(tempDir.toAbsolutePath().resolve("nested"));
        assertThat(paths.resolveWorkspace("ws")).isEqualTo(paths.home().resolve("ws"));
    }

    @Test
    void shouldHonorHomeSystemProperty() {
        String previous = System.getProperty(ConfigPaths.HOME_PROPERTY);
        try {
            System.setProperty(ConfigPaths.HOME_PROPERTY, tempDir.toString());

            assertThat(ConfigPaths.fromEnvironment().configFile())
                .isEqualTo(tempDir.toAbsolutePath().resolve("config.json"));
        } finally {
            if (previous == null) {
                System.clearProperty(ConfigPaths.HOME_PROPERTY);
            } else {
                System.setProperty(ConfigPaths.HOME_PROPERTY, previous);
            }
        }
    }
}
