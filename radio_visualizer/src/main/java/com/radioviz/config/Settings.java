package com.radioviz.config;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.Logger;

/**
 * Read-only view over a JSON settings document.
 *
 * Values are addressed by dotted paths ({@code "visualizer.bar_count"}) and every
 * getter takes the default to use when the path is missing or has the wrong type.
 */
public class Settings {

    /** Classpath resource holding the bundled defaults. */
    public static final String DEFAULT_RESOURCE = "config.json";

    private final JsonObject root;

    private Settings(JsonObject root) {
        this.root = root;
    }

    /**
     * Settings with no keys; every getter returns its default.
     */
    public static Settings empty() {
        return new Settings(new JsonObject());
    }

    /**
     * Parse settings from a JSON string.
     */
    public static Settings fromJson(String json) {
        try {
            JsonElement parsed = JsonParser.parseString(json);
            if (!parsed.isJsonObject()) {
                throw new ConfigurationLoadException("Settings root must be a JSON object", null);
            }
            return new Settings(parsed.getAsJsonObject());
        } catch (JsonParseException e) {
            throw new ConfigurationLoadException("Malformed settings JSON", e);
        }
    }

    /**
     * Load the bundled {@value #DEFAULT_RESOURCE} from the classpath.
     * Falls back to empty settings when the resource is absent.
     */
    public static Settings loadDefaults(Logger logger) {
        InputStream in = Settings.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE);
        if (in == null) {
            logger.info("No bundled " + DEFAULT_RESOURCE + " found, using built-in defaults");
            return empty();
        }
        try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
            return parse(reader, DEFAULT_RESOURCE);
        } catch (IOException e) {
            throw new ConfigurationLoadException("Failed to read " + DEFAULT_RESOURCE, e);
        }
    }

    /**
     * Load settings from a file. A missing file yields empty settings.
     */
    public static Settings load(Path file, Logger logger) {
        if (!Files.exists(file)) {
            logger.info("Settings file " + file + " not found, using defaults");
            return empty();
        }
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            Settings settings = parse(reader, file.toString());
            logger.info("Loaded settings from " + file);
            return settings;
        } catch (IOException e) {
            throw new ConfigurationLoadException("Failed to read settings file " + file, e);
        }
    }

    private static Settings parse(Reader reader, String source) {
        try {
            JsonElement parsed = JsonParser.parseReader(reader);
            if (!parsed.isJsonObject()) {
                throw new ConfigurationLoadException("Settings root in " + source + " must be a JSON object", null);
            }
            return new Settings(parsed.getAsJsonObject());
        } catch (JsonParseException e) {
            throw new ConfigurationLoadException("Malformed settings JSON in " + source, e);
        }
    }

    public boolean contains(String path) {
        return resolve(path) != null;
    }

    public int getInt(String path, int def) {
        JsonPrimitive value = number(path);
        return value != null ? value.getAsInt() : def;
    }

    public long getLong(String path, long def) {
        JsonPrimitive value = number(path);
        return value != null ? value.getAsLong() : def;
    }

    public double getDouble(String path, double def) {
        JsonPrimitive value = number(path);
        if (value == null) return def;
        return ValueSanitizer.sanitizeDouble(value.getAsDouble(), -Double.MAX_VALUE, Double.MAX_VALUE, def);
    }

    public boolean getBoolean(String path, boolean def) {
        JsonElement element = resolve(path);
        if (element == null || !element.isJsonPrimitive() || !element.getAsJsonPrimitive().isBoolean()) {
            return def;
        }
        return element.getAsBoolean();
    }

    public String getString(String path, String def) {
        JsonElement element = resolve(path);
        if (element == null || !element.isJsonPrimitive()) {
            return def;
        }
        return element.getAsString();
    }

    /**
     * Settings scoped to a nested section; empty when the section is missing.
     */
    public Settings getSection(String path) {
        JsonElement element = resolve(path);
        if (element == null || !element.isJsonObject()) {
            return empty();
        }
        return new Settings(element.getAsJsonObject());
    }

    private JsonPrimitive number(String path) {
        JsonElement element = resolve(path);
        if (element == null || !element.isJsonPrimitive() || !element.getAsJsonPrimitive().isNumber()) {
            return null;
        }
        return element.getAsJsonPrimitive();
    }

    private JsonElement resolve(String path) {
        JsonElement current = root;
        for (String part : path.split("\\.")) {
            if (current == null || !current.isJsonObject()) {
                return null;
            }
            current = current.getAsJsonObject().get(part);
        }
        if (current == null || current.isJsonNull()) {
            return null;
        }
        return current;
    }
}
