package com.mimecast.lodestar.config;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.Strictness;
import com.google.gson.reflect.TypeToken;

import java.io.IOException;
import java.io.Reader;
import java.lang.reflect.Type;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

/**
 * Configuration foundation.
 *
 * <p>Map backed container providing type safe accessors with defaults.
 * <p>Files are read as JSON5 via a lenient Gson parser so comments and unquoted keys are accepted.
 */
public class ConfigFoundation {

    private static final Gson GSON = new GsonBuilder().setStrictness(Strictness.LENIENT).create();
    private static final Type MAP_TYPE = new TypeToken<Map<String, Object>>() {}.getType();

    /**
     * Configuration map.
     */
    protected final Map<String, Object> map;

    /**
     * Constructs a new empty ConfigFoundation instance.
     */
    public ConfigFoundation() {
        this.map = new HashMap<>();
    }

    /**
     * Constructs a new ConfigFoundation instance with given map.
     *
     * @param map Configuration map.
     */
    public ConfigFoundation(Map<String, Object> map) {
        this.map = map != null ? new HashMap<>(map) : new HashMap<>();
    }

    /**
     * Constructs a new ConfigFoundation instance from a JSON5 file.
     *
     * @param path Path to configuration file.
     * @throws IOException Unable to read or parse file.
     */
    public ConfigFoundation(String path) throws IOException {
        this.map = read(Path.of(path));
    }

    /**
     * Reads a JSON5 file into a map.
     *
     * @param path File path.
     * @return Map instance, never null.
     * @throws IOException Unable to read or parse file.
     */
    private static Map<String, Object> read(Path path) throws IOException {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            Map<String, Object> parsed = GSON.fromJson(reader, MAP_TYPE);
            return parsed != null ? new HashMap<>(parsed) : new HashMap<>();
        } catch (JsonParseException e) {
            throw new IOException("Invalid configuration file: " + path + " - " + e.getMessage(), e);
        }
    }

    /**
     * Gets string property.
     *
     * @param name         Property name.
     * @param defaultValue Default value.
     * @return String.
     */
    public String getStringProperty(String name, String defaultValue) {
        Object value = map.get(name);
        return value != null ? String.valueOf(value) : defaultValue;
    }

    /**
     * Gets long property.
     * <p>Gson yields doubles for all numbers, strings are parsed as well.
     *
     * @param name         Property name.
     * @param defaultValue Default value.
     * @return Long.
     */
    public Long getLongProperty(String name, Long defaultValue) {
        Object value = map.get(name);
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        if (value instanceof String) {
            try {
                return Long.parseLong(((String) value).trim());
            } catch (NumberFormatException e) {
                return defaultValue;
            }
        }
        return defaultValue;
    }

    /**
     * Gets boolean property.
     *
     * @param name         Property name.
     * @param defaultValue Default value.
     * @return Boolean.
     */
    public boolean getBooleanProperty(String name, boolean defaultValue) {
        Object value = map.get(name);
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof String) {
            return Boolean.parseBoolean((String) value);
        }
        return defaultValue;
    }
}
