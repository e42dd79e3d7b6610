package com.sunorcnys;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;

/**
 * Settings from {@code ~/.syncronus/syncronus.properties} (or the file named by {@code SYNCRONUS_CONFIG}).
 * Environment variables with the same key win over the file.
 */
public final class Config {

    private static final Logger log = LoggerFactory.getLogger(Config.class);

    static final List<String> KEYS = List.of(
            "SPOTIFY_CLIENT_ID", "SPOTIFY_CLIENT_SECRET", "SPOTIFY_REDIRECT_URI",
            "TIDAL_CLIENT_ID", "TIDAL_CLIENT_SECRET", "TIDAL_REDIRECT_URI",
            "SYNCRONUS_CACHE_DIR", "SYNCRONUS_MASTER_KEY",
            "REDIS_HOST", "REDIS_PORT", "REDIS_PASSWORD",
            "SYNCRONUS_CALLBACK_PORT");

    private static final Path HOME_DIR = Path.of(System.getProperty("user.home"), ".syncronus");
    private static final int DEFAULT_CALLBACK_PORT = 8890;
    private static final int DEFAULT_REDIS_PORT = 6379;

    private final Properties props;

    private Config(Properties props) {
        this.props = props;
    }

    public static Config load() {
        Map<String, String> env = System.getenv();
        String override = env.get("SYNCRONUS_CONFIG");
        Path file = (override != null && !override.isBlank()) ? Path.of(override.trim()) : HOME_DIR.resolve("syncronus.properties");

        Properties fromFile = new Properties();
        if (Files.exists(file)) {
            try (InputStream in = Files.newInputStream(file)) {
                fromFile.load(in);
                log.debug("Loaded configuration from {}", file);
            } catch (IOException e) {
                log.warn("Could not read configuration {}: {}", file, e.getMessage());
            }
        }
        return from(fromFile, env);
    }

    /**
     * @param fromFile values read from the properties file
     * @param env      environment; set keys take precedence
     */
    public static Config from(Properties fromFile, Map<String, String> env) {
        Properties merged = new Properties();
        merged.putAll(fromFile);
        for (String key : KEYS) {
            String value = env.get(key);
            if (value != null && !value.isBlank()) {
                merged.setProperty(key, value);
            }
        }
        return new Config(merged);
    }

    public String get(String key) {
        String value = props.getProperty(key);
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    public String getClientId(String service) {
        return get(prefix(service) + "_CLIENT_ID");
    }

    public String getClientSecret(String service) {
        return get(prefix(service) + "_CLIENT_SECRET");
    }

    /**
     * Configured redirect URI, else the local callback server's address.
     */
    public String getRedirectUri(String service) {
        String configured = get(prefix(service) + "_REDIRECT_URI");
        return configured != null ? configured : "http://127.0.0.1:" + getCallbackPort() + "/callback";
    }

    public Path getCacheDir() {
        String dir = get("SYNCRONUS_CACHE_DIR");
        return dir != null ? Path.of(dir) : HOME_DIR.resolve("cache");
    }

    public String getMasterKey() {
        return get("SYNCRONUS_MASTER_KEY");
    }

    public String getRedisHost() {
        return get("REDIS_HOST");
    }

    public int getRedisPort() {
        return intValue("REDIS_PORT", DEFAULT_REDIS_PORT);
    }

    public String getRedisPassword() {
        return get("REDIS_PASSWORD");
    }

    public int getCallbackPort() {
        return intValue("SYNCRONUS_CALLBACK_PORT", DEFAULT_CALLBACK_PORT);
    }

    private int intValue(String key, int fallback) {
        String value = get(key);
        if (value == null) {
            return fallback;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            log.warn("Ignoring non-numeric {}='{}', using {}", key, value, fallback);
            return fallback;
        }
    }

    private static String prefix(String service) {
        return service.trim().toUpperCase(Locale.ROOT);
    }
}
