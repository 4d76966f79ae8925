package com.dockeriot.common.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DatabaseSettingsLoaderTest {

    @TempDir
    Path tempDir;

    private Map<String, String> baseEnv() {
        Map<String, String> env = new HashMap<>();
        env.put("POSTGRES_SERVER", "db");
        env.put("POSTGRES_USER", "iot");
        env.put("POSTGRES_DB", "sensors");
        return env;
    }

    @Test
    void shouldResolveDirectPasswordWithDefaultPort() {
        Map<String, String> env = baseEnv();
        env.put("POSTGRES_PASSWORD", "secret");

        DatabaseSettings settings = DatabaseSettingsLoader.load(env::get);

        assertThat(settings.getPort()).isEqualTo(5432);
        assertThat(settings.getPassword()).isEqualTo("secret");
        assertThat(settings.connectionUri()).isEqualTo("postgresql://iot:secret@db:5432/sensors");
        assertThat(settings.jdbcUrl()).isEqualTo("jdbc:postgresql://db:5432/sensors");
    }

    @Test
    void shouldFailWhenNoPasswordSourceIsSet() {
        assertThatThrownBy(() -> DatabaseSettingsLoader.load(baseEnv()::get))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("At least one of POSTGRES_PASSWORD_FILE and POSTGRES_PASSWORD must be set.");
    }

    @Test
    void shouldReportEveryMissingRequiredKey() {
        Map<String, String> env = new HashMap<>();
        env.put("POSTGRES_PASSWORD", "secret");

        assertThatThrownBy(() -> DatabaseSettingsLoader.load(env::get))
                .isInstanceOfSatisfying(ConfigurationException.class, ex -> assertThat(ex.getProblems())
                        .containsExactly(
                                "POSTGRES_SERVER is required",
                                "POSTGRES_USER is required",
                                "POSTGRES_DB is required"));
    }

    @Test
    void shouldReadTrimmedPasswordFromFile() throws IOException {
        Path secret = Files.writeString(tempDir.resolve("db-password"), "from-file\n");
        Map<String, String> env = baseEnv();
        env.put("POSTGRES_PASSWORD_FILE", secret.toString());

        DatabaseSettings settings = DatabaseSettingsLoader.load(env::get);

        assertThat(settings.getPassword()).isEqualTo("from-file");
    }

    @Test
    void shouldFailWhenPasswordFileDoesNotExist() {
        Path missing = tempDir.resolve("nope");
        Map<String, String> env = baseEnv();
        env.put("POSTGRES_PASSWORD_FILE", missing.toString());

        assertThatThrownBy(() -> DatabaseSettingsLoader.load(env::get))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("Password file " + missing + " does not exist.");
    }

    @Test
    void directPasswordShouldWinOverFile() throws IOException {
        Path secret = Files.writeString(tempDir.resolve("db-password"), "from-file");
        Map<String, String> env = baseEnv();
        env.put("POSTGRES_PASSWORD", "direct");
        env.put("POSTGRES_PASSWORD_FILE", secret.toString());

        assertThat(DatabaseSettingsLoader.load(env::get).getPassword()).isEqualTo("direct");
    }

    @Test
    void emptyDirectPasswordShouldFallBackToFile() throws IOException {
        Path secret = Files.writeString(tempDir.resolve("db-password"), "from-file");
        Map<String, String> env = baseEnv();
        env.put("POSTGRES_PASSWORD", "");
        env.put("POSTGRES_PASSWORD_FILE", secret.toString());

        assertThat(DatabaseSettingsLoader.load(env::get).getPassword()).isEqualTo("from-file");
    }

    @Test
    void shouldRejectNonNumericPort() {
        Map<String, String> env = baseEnv();
        env.put("POSTGRES_PASSWORD", "secret");
        env.put("POSTGRES_PORT", "five");

        assertThatThrownBy(() -> DatabaseSettingsLoader.load(env::get))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("POSTGRES_PORT must be an integer");
    }

    @Test
    void shouldPercentEncodeCredentials() {
        Map<String, String> env = baseEnv();
        env.put("POSTGRES_USER", "iot user");
        env.put("POSTGRES_PASSWORD", "p@ss:w/rd");
        env.put("POSTGRES_PORT", "6543");

        DatabaseSettings settings = DatabaseSettingsLoader.load(env::get);

        assertThat(settings.connectionUri())
                .isEqualTo("postgresql://iot%20user:p%40ss%3Aw%2Frd@db:6543/sensors");
    }

    @Test
    void toStringShouldNotExposePassword() {
        Map<String, String> env = baseEnv();
        env.put("POSTGRES_PASSWORD", "hunter2");

        assertThat(DatabaseSettingsLoader.load(env::get).toString()).doesNotContain("hunter2");
    }
}
