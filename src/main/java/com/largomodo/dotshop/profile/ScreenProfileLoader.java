package com.largomodo.dotshop.profile;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;
import com.largomodo.dotshop.core.BitOrder;
import com.largomodo.dotshop.core.ColorMode;
import com.largomodo.dotshop.core.InvalidScreenProfileException;
import com.largomodo.dotshop.core.ScanDirection;
import com.largomodo.dotshop.core.ScreenProfile;
import com.largomodo.dotshop.core.ScreenType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Reads screen profiles from JSON.
 * <p>
 * A profile document looks like:
 * <pre>{@code
 * {
 *   "id": "ssd1306-128x64",
 *   "name": "SSD1306 128x64 OLED",
 *   "width": 128,
 *   "height": 64,
 *   "colorMode": "mono",
 *   "scanDirection": "page",
 *   "bitOrder": "lsb-first",
 *   "alignment": 8,
 *   "screenType": "oled",
 *   "description": "I2C/SPI monochrome OLED"
 * }
 * }</pre>
 * {@code id}, {@code width}, {@code height} and {@code colorMode} are required; the rest fall
 * back to the {@link ScreenProfile} defaults. A catalog is either a JSON array of profiles or an
 * object with a {@code profiles} array. Every problem surfaces as
 * {@link InvalidScreenProfileException} before any frame is processed.
 */
public class ScreenProfileLoader {

    public static final String BUILTIN_CATALOG = "/profiles/builtin-profiles.json";

    private static final Logger log = LoggerFactory.getLogger(ScreenProfileLoader.class);

    private final String catalogResource;
    private Map<String, ScreenProfile> builtins;

    public ScreenProfileLoader() {
        this(BUILTIN_CATALOG);
    }

    /**
     * @param catalogResource classpath location of the built-in catalog
     */
    public ScreenProfileLoader(String catalogResource) {
        this.catalogResource = catalogResource;
    }

    /**
     * Resolves a command-line profile argument: an existing JSON file, else a built-in id.
     */
    public ScreenProfile resolve(String fileOrId) throws IOException {
        Path path = Path.of(fileOrId);
        if (Files.isRegularFile(path)) {
            return load(path);
        }
        return builtin(fileOrId);
    }

    /**
     * Loads a single profile document from a file.
     */
    public ScreenProfile load(Path path) throws IOException {
        log.debug("Loading screen profile from {}", path);
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return parse(reader);
        }
    }

    public ScreenProfile parse(Reader reader) {
        JsonElement root = read(reader);
        if (!root.isJsonObject()) {
            throw new InvalidScreenProfileException("Profile document must be a JSON object", null);
        }
        return toProfile(root.getAsJsonObject());
    }

    public List<ScreenProfile> parseCatalog(Reader reader) {
        JsonElement root = read(reader);
        JsonArray entries;
        if (root.isJsonArray()) {
            entries = root.getAsJsonArray();
        } else if (root.isJsonObject() && root.getAsJsonObject().has("profiles")
                && root.getAsJsonObject().get("profiles").isJsonArray()) {
            entries = root.getAsJsonObject().getAsJsonArray("profiles");
        } else {
            throw new InvalidScreenProfileException(
                    "Profile catalog must be a JSON array or an object with a 'profiles' array", null);
        }

        List<ScreenProfile> profiles = new ArrayList<>(entries.size());
        for (JsonElement entry : entries) {
            if (!entry.isJsonObject()) {
                throw new InvalidScreenProfileException("Catalog entry must be a JSON object: " + entry, null);
            }
            profiles.add(toProfile(entry.getAsJsonObject()));
        }
        return profiles;
    }

    /**
     * @return built-in profiles in catalog order
     */
    public synchronized List<ScreenProfile> builtins() {
        return List.copyOf(builtinMap().values());
    }

    /**
     * @throws InvalidScreenProfileException if no built-in profile has this id
     */
    public synchronized ScreenProfile builtin(String id) {
        ScreenProfile profile = builtinMap().get(id);
        if (profile == null) {
            throw new InvalidScreenProfileException(
                    "Unknown profile: " + id + ". Built-in profiles: " + String.join(", ", builtinMap().keySet()), id);
        }
        return profile;
    }

    private Map<String, ScreenProfile> builtinMap() {
        if (builtins == null) {
            InputStream stream = ScreenProfileLoader.class.getResourceAsStream(catalogResource);
            if (stream == null) {
                throw new IllegalStateException("Built-in profile catalog not found on classpath: " + catalogResource);
            }
            Map<String, ScreenProfile> loaded = new LinkedHashMap<>();
            try (Reader reader = new InputStreamReader(stream, StandardCharsets.UTF_8)) {
                for (ScreenProfile profile : parseCatalog(reader)) {
                    if (loaded.putIfAbsent(profile.id(), profile) != null) {
                        throw new InvalidScreenProfileException("Duplicate profile id in catalog", profile.id());
                    }
                }
            } catch (IOException e) {
                throw new IllegalStateException("Cannot read built-in profile catalog " + catalogResource, e);
            }
            builtins = loaded;
            log.debug("Loaded {} built-in screen profiles", loaded.size());
        }
        return builtins;
    }

    private static JsonElement read(Reader reader) {
        try {
            return JsonParser.parseReader(reader);
        } catch (JsonParseException e) {
            throw new InvalidScreenProfileException("Malformed profile JSON: " + e.getMessage(), null, e);
        }
    }

    private static ScreenProfile toProfile(JsonObject json) {
        String id = requiredString(json, "id", null);
        int width = requiredInt(json, "width", id);
        int height = requiredInt(json, "height", id);
        ColorMode colorMode = enumValue(json, "colorMode", id, ColorMode::fromId);
        if (colorMode == null) {
            throw new InvalidScreenProfileException("Missing required field 'colorMode'", id);
        }
        ScanDirection scan = enumValue(json, "scanDirection", id, ScanDirection::fromId);
        BitOrder bitOrder = enumValue(json, "bitOrder", id, BitOrder::fromId);
        ScreenType screenType = enumValue(json, "screenType", id, ScreenType::fromId);
        int alignment = json.has("alignment") ? requiredInt(json, "alignment", id) : ScreenProfile.DEFAULT_ALIGNMENT;

        return new ScreenProfile(id, optionalString(json, "name", id), width, height, colorMode,
                scan, bitOrder, alignment, screenType, optionalString(json, "description", id));
    }

    private static String requiredString(JsonObject json, String field, String profileId) {
        String value = optionalString(json, field, profileId);
        if (value == null || value.isBlank()) {
            throw new InvalidScreenProfileException("Missing required field '" + field + "'", profileId);
        }
        return value;
    }

    private static String optionalString(JsonObject json, String field, String profileId) {
        JsonElement element = json.get(field);
        if (element == null || element.isJsonNull()) {
            return null;
        }
        if (!element.isJsonPrimitive() || !element.getAsJsonPrimitive().isString()) {
            throw new InvalidScreenProfileException("Field '" + field + "' must be a string", profileId);
        }
        return element.getAsString();
    }

    private static int requiredInt(JsonObject json, String field, String profileId) {
        JsonElement element = json.get(field);
        if (element == null || element.isJsonNull()) {
            throw new InvalidScreenProfileException("Missing required field '" + field + "'", profileId);
        }
        if (!element.isJsonPrimitive() || !element.getAsJsonPrimitive().isNumber()) {
            throw new InvalidScreenProfileException("Field '" + field + "' must be an integer", profileId);
        }
        JsonPrimitive primitive = element.getAsJsonPrimitive();
        double value = primitive.getAsDouble();
        if (value != Math.rint(value) || value < Integer.MIN_VALUE || value > Integer.MAX_VALUE) {
            throw new InvalidScreenProfileException("Field '" + field + "' must be an integer, got: " + primitive, profileId);
        }
        return (int) value;
    }

    private static <E extends Enum<E>> E enumValue(JsonObject json, String field, String profileId,
                                                  Function<String, E> parser) {
        String value = optionalString(json, field, profileId);
        if (value == null) {
            return null;
        }
        try {
            return parser.apply(value);
        } catch (IllegalArgumentException e) {
            throw new InvalidScreenProfileException("Field '" + field + "': " + e.getMessage(), profileId, e);
        }
    }
}
