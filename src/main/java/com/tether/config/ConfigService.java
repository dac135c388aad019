package com.tether.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Loads and validates Tether's configuration file.
 * 
 * A missing file yields the defaults; an unreadable or invalid one fails.
 */
public class ConfigService {
    
    private static final Logger LOGGER = LoggerFactory.getLogger(ConfigService.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();
    
    /**
     * Loads {@value TetherConfig#FILE_NAME} from the given directory.
     * 
     * @param configDir directory to look in
     * @return the validated configuration
     * @throws ConfigLoadException if the file exists but cannot be read or parsed
     * @throws ConfigValidationException if a field violates the schema
     */
    public TetherConfig load(Path configDir) throws ConfigLoadException, ConfigValidationException {
        Path configFile = configDir.resolve(TetherConfig.FILE_NAME);
        
        Map<String, Object> config = new HashMap<>();
        
        if (Files.exists(configFile)) {
            try {
                JsonNode jsonNode = MAPPER.readTree(Files.readString(configFile));
                
                if (jsonNode == null || !jsonNode.isObject()) {
                    throw new ConfigLoadException(
                        String.format("Configuration '%s' must contain a JSON object", configFile));
                }
                
                Iterator<Map.Entry<String, JsonNode>> fields = jsonNode.fields();
                while (fields.hasNext()) {
                    Map.Entry<String, JsonNode> field = fields.next();
                    config.put(field.getKey(), convertJsonNode(field.getValue()));
                }
                
                LOGGER.debug("Loaded configuration from {}", configFile);
                
            } catch (IOException e) {
                throw new ConfigLoadException(
                    String.format("Failed to load configuration from '%s'", configFile), e);
            }
        } else {
            LOGGER.debug("No configuration file at {}, using defaults", configFile);
        }
        
        TetherConfig loaded = TetherConfig.fromMap(config);
        LOGGER.info("Configuration ready: geometry library {} (version {}), {} preload libraries",
            loaded.geometryLibrary(), loaded.geometryVersion(), loaded.preloadLibraries().size());
        return loaded;
    }
    
    /**
     * Converts scalar and array nodes. Objects and nulls come back as nodes,
     * which no schema field type accepts.
     */
    private Object convertJsonNode(JsonNode node) {
        if (node.isTextual()) {
            return node.asText();
        } else if (node.isNumber()) {
            if (node.isInt()) {
                return node.asInt();
            } else if (node.isLong()) {
                return node.asLong();
            } else {
                return node.asDouble();
            }
        } else if (node.isBoolean()) {
            return node.asBoolean();
        } else if (node.isArray()) {
            List<Object> array = new ArrayList<>();
            for (JsonNode element : node) {
                array.add(convertJsonNode(element));
            }
            return array;
        }
        return node;
    }
}
