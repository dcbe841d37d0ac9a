package com.atrium.config;

import com.atrium.ids.LocalIdAllocator;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Set;

/**
 * Loads {@link SceneConfig} from JSON.
 * 
 * A file only needs the keys it overrides; everything else comes from the
 * bundled {@value #DEFAULTS_RESOURCE} resource.
 */
public class SceneConfigLoader {
    
    private static final Logger LOGGER = LoggerFactory.getLogger(SceneConfigLoader.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();
    
    public static final String DEFAULTS_RESOURCE = "atrium-scene.json";
    
    private static final Set<String> KNOWN_KEYS = Set.of(
        "regionName", "localIdSeed", "simulatorVersion", "regionLocX", "regionLocY"
    );
    
    /**
     * Loads the bundled defaults.
     * 
     * @return the default configuration
     * @throws ConfigLoadException if the bundled resource cannot be read
     * @throws ConfigValidationException if the bundled resource is invalid
     */
    public SceneConfig loadDefaults() throws ConfigLoadException, ConfigValidationException {
        try (InputStream in = SceneConfigLoader.class.getClassLoader().getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in == null) {
                LOGGER.debug("No {} on the classpath, using built-in defaults", DEFAULTS_RESOURCE);
                return SceneConfig.defaults();
            }
            return apply(SceneConfig.defaults(), MAPPER.readTree(in), DEFAULTS_RESOURCE);
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to read bundled " + DEFAULTS_RESOURCE, e);
        }
    }
    
    /**
     * Loads a configuration file on top of the defaults.
     * 
     * @param configFile the JSON file; a missing file yields the defaults
     * @return the loaded configuration
     * @throws ConfigLoadException if the file cannot be read or parsed
     * @throws ConfigValidationException if a value is of the wrong type or out of range
     */
    public SceneConfig load(Path configFile) throws ConfigLoadException, ConfigValidationException {
        SceneConfig defaults = loadDefaults();
        
        if (!Files.exists(configFile)) {
            LOGGER.debug("No scene config found at {}, using defaults", configFile);
            return defaults;
        }
        
        JsonNode root;
        try {
            root = MAPPER.readTree(Files.readString(configFile));
        } catch (IOException e) {
            throw new ConfigLoadException(
                String.format("Failed to load scene config from '%s'", configFile), e
            );
        }
        
        SceneConfig config = apply(defaults, root, configFile.toString());
        LOGGER.info("Loaded scene config for region '{}' from {}", config.regionName(), configFile);
        return config;
    }
    
    private SceneConfig apply(SceneConfig base, JsonNode root, String source) throws ConfigValidationException {
        if (root == null || root.isMissingNode() || root.isNull()) {
            return base;
        }
        if (!root.isObject()) {
            throw new ConfigValidationException("Scene config in " + source + " must be a JSON object");
        }
        
        Iterator<String> names = root.fieldNames();
        while (names.hasNext()) {
            String name = names.next();
            if (!KNOWN_KEYS.contains(name)) {
                LOGGER.debug("Ignoring unknown scene config key '{}' in {}", name, source);
            }
        }
        
        String regionName = textField(root, "regionName", base.regionName());
        if (regionName.isBlank()) {
            throw new ConfigValidationException("regionName must not be blank");
        }
        
        long seed = longField(root, "localIdSeed", base.localIdSeed());
        if (seed < 0 || seed > LocalIdAllocator.MAX_LOCAL_ID) {
            throw new ConfigValidationException(
                String.format("localIdSeed must be between 0 and %d, got %d", LocalIdAllocator.MAX_LOCAL_ID, seed)
            );
        }
        
        return new SceneConfig(
            regionName,
            seed,
            textField(root, "simulatorVersion", base.simulatorVersion()),
            intField(root, "regionLocX", base.regionLocX()),
            intField(root, "regionLocY", base.regionLocY())
        );
    }
    
    private static String textField(JsonNode root, String name, String fallback) throws ConfigValidationException {
        JsonNode node = root.get(name);
        if (node == null || node.isNull()) {
            return fallback;
        }
        if (!node.isTextual()) {
            throw new ConfigValidationException(name + " must be a string");
        }
        return node.asText();
    }
    
    private static long longField(JsonNode root, String name, long fallback) throws ConfigValidationException {
        JsonNode node = root.get(name);
        if (node == null || node.isNull()) {
            return fallback;
        }
        if (!node.isIntegralNumber() || !node.canConvertToLong()) {
            throw new ConfigValidationException(name + " must be an integer");
        }
        return node.asLong();
    }
    
    private static int intField(JsonNode root, String name, int fallback) throws ConfigValidationException {
        JsonNode node = root.get(name);
        if (node == null || node.isNull()) {
            return fallback;
        }
        if (!node.isIntegralNumber() || !node.canConvertToInt()) {
            throw new ConfigValidationException(name + " must be a 32-bit integer");
        }
        return node.asInt();
    }
}
