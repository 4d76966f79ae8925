package com.dockeriot.common.config;

import lombok.Builder;
import lombok.Value;
import org.springframework.web.util.UriComponentsBuilder;
import org.springframework.web.util.UriUtils;

import java.nio.charset.StandardCharsets;

/**
 * Immutable connection descriptor for the PostgreSQL store.
 * Resolved once at startup by {@link DatabaseSettingsLoader}.
 */
@Value
@Builder
public class DatabaseSettings {

    public static final int DEFAULT_PORT = 5432;

    private static final String URI_SCHEME = "postgresql";

    String server;
    int port;
    String user;
    String password;
    String database;

    /**
     * Full connection URI with percent-encoded credentials,
     * e.g. {@code postgresql://app:p%40ss@db:5432/iot}.
     */
    public String connectionUri() {
        String userInfo = UriUtils.encode(user, StandardCharsets.UTF_8)
                + ":" + UriUtils.encode(password, StandardCharsets.UTF_8);
        return UriComponentsBuilder.newInstance()
                .scheme(URI_SCHEME)
                .userInfo(userInfo)
                .host(server)
                .port(port)
                .path("/" + UriUtils.encode(database, StandardCharsets.UTF_8))
                .build(true)
                .toUriString();
    }

    /**
     * JDBC form of the same location; credentials are passed to the pool separately.
     */
    public String jdbcUrl() {
        return "jdbc:" + UriComponentsBuilder.newInstance()
                .scheme(URI_SCHEME)
                .host(server)
                .port(port)
                .path("/" + UriUtils.encode(database, StandardCharsets.UTF_8))
                .build(true)
                .toUriString();
    }

    @Override
    public String toString() {
        return "DatabaseSettings(server=" + server + ", port=" + port + ", user=" + user
                + ", database=" + database + ")";
    }
}
