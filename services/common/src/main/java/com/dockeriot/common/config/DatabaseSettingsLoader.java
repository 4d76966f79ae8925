package com.dockeriot.common.config;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Resolves {@link DatabaseSettings} from raw named values.
 *
 * <p>Recognised keys:
 * <ul>
 *   <li>{@code POSTGRES_SERVER} (required)</li>
 *   <li>{@code POSTGRES_PORT} (optional, defaults to 5432)</li>
 *   <li>{@code POSTGRES_USER} (required)</li>
 *   <li>{@code POSTGRES_DB} (required)</li>
 *   <li>{@code POSTGRES_PASSWORD} and/or {@code POSTGRES_PASSWORD_FILE}, at least one of them.
 *       A direct password takes precedence over the file.</li>
 * </ul>
 *
 * <p>The loader has no framework dependency: callers hand it a lookup function, usually
 * {@code System::getenv} or a Spring {@code Environment::getProperty}.
 */
@Slf4j
public final class DatabaseSettingsLoader {

    public static final String SERVER = "POSTGRES_SERVER";
    public static final String PORT = "POSTGRES_PORT";
    public static final String USER = "POSTGRES_USER";
    public static final String PASSWORD = "POSTGRES_PASSWORD";
    public static final String PASSWORD_FILE = "POSTGRES_PASSWORD_FILE";
    public static final String DATABASE = "POSTGRES_DB";

    private DatabaseSettingsLoader() {}

    /**
     * Validates the raw values and builds the descriptor.
     *
     * @throws ConfigurationException listing every problem found
     */
    public static DatabaseSettings load(Function<String, String> lookup) {
        List<String> problems = new ArrayList<>();

        String server = required(lookup, SERVER, problems);
        String user = required(lookup, USER, problems);
        String database = required(lookup, DATABASE, problems);
        int port = port(lookup.apply(PORT), problems);

        String password = lookup.apply(PASSWORD);
        String passwordFile = lookup.apply(PASSWORD_FILE);

        if (password == null && passwordFile == null) {
            problems.add("At least one of " + PASSWORD_FILE + " and " + PASSWORD + " must be set.");
        }

        String filePassword = null;
        if (passwordFile != null) {
            filePassword = readPasswordFile(passwordFile, problems);
        }

        if (!problems.isEmpty()) {
            throw new ConfigurationException(problems);
        }

        // An empty direct password does not shadow the file.
        boolean direct = password != null && !password.isEmpty();
        String effectivePassword = direct ? password : filePassword;
        if (effectivePassword == null) {
            effectivePassword = "";
        }

        DatabaseSettings settings = DatabaseSettings.builder()
                .server(server)
                .port(port)
                .user(user)
                .password(effectivePassword)
                .database(database)
                .build();

        log.info("Resolved database settings: {}:{}/{} as {} (password from {})",
                server, port, database, user,
                direct ? PASSWORD : PASSWORD_FILE);
        return settings;
    }

    private static String required(Function<String, String> lookup, String key, List<String> problems) {
        String value = lookup.apply(key);
        if (value == null || value.isBlank()) {
            problems.add(key + " is required");
            return null;
        }
        return value.trim();
    }

    private static int port(String raw, List<String> problems) {
        if (raw == null || raw.isBlank()) {
            return DatabaseSettings.DEFAULT_PORT;
        }
        try {
            int port = Integer.parseInt(raw.trim());
            if (port < 1 || port > 65535) {
                problems.add(PORT + " must be between 1 and 65535, got " + port);
            }
            return port;
        } catch (NumberFormatException e) {
            problems.add(PORT + " must be an integer, got '" + raw + "'");
            return DatabaseSettings.DEFAULT_PORT;
        }
    }

    private static String readPasswordFile(String location, List<String> problems) {
        Path path = Path.of(location);
        if (!Files.exists(path)) {
            problems.add("Password file " + location + " does not exist.");
            return null;
        }
        try {
            return Files.readString(path, StandardCharsets.UTF_8).strip();
        } catch (IOException e) {
            problems.add("Password file " + location + " could not be read: " + e.getMessage());
            return null;
        }
    }
}
