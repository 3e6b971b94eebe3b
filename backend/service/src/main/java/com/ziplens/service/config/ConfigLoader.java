package com.ziplens.service.config;

import com.ziplens.core.util.JsonUtils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

public final class ConfigLoader {
    public static final String FETCH_CONFIG_FILE = "fetch.json";
    public static final String API_KEY_ENV = "CENSUS_API_KEY";

    private ConfigLoader() {
    }

    /**
     * Reads {@code fetch.json} from the directory, or returns defaults when the file does not exist.
     */
    public static FetchServiceConfig loadFetch(Path configDir) {
        Path path = configDir.resolve(FETCH_CONFIG_FILE);
        if (!Files.exists(path)) {
            return FetchServiceConfig.defaults();
        }
        return read(path, FetchServiceConfig.class);
    }

    public static String apiKey(Map<String, String> env) {
        String key = env.get(API_KEY_ENV);
        return key == null || key.isBlank() ? null : key.trim();
    }

    private static <T> T read(Path path, Class<T> type) {
        try (InputStream in = Files.newInputStream(path)) {
            return JsonUtils.objectMapper().readValue(in, type);
        } catch (IOException | IllegalArgumentException e) {
            throw new IllegalStateException("Failed loading config from " + path, e);
        }
    }
}
