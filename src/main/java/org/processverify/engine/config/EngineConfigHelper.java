package org.processverify.engine.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.processverify.engine.config.models.EngineConfig;
import org.processverify.engine.errors.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Loads {@link EngineConfig} from JSON, checking it against the engine config schema first.
 */
public class EngineConfigHelper {
    private static final Logger log = LoggerFactory.getLogger(EngineConfigHelper.class);

    public static final String DEFAULT_CONFIG_RESOURCE = "engine-config.json";
    public static final String CONFIG_SCHEMA_RESOURCE = "schemas/engine_config_schema.json";

    private static final ObjectMapper mapper = new ObjectMapper();

    /**
     * Loads the configuration bundled on the classpath.
     */
    public static EngineConfig loadDefaultConfig() {
        return loadConfigFromClasspath(DEFAULT_CONFIG_RESOURCE);
    }

    public static EngineConfig loadConfigFromClasspath(String classpathResource) {
        try (InputStream is = EngineConfigHelper.class.getClassLoader().getResourceAsStream(classpathResource)) {
            if (is == null) {
                throw new ConfigurationException("Config resource not found on classpath", classpathResource);
            }
            return bind(mapper.readTree(is), classpathResource);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read config resource", classpathResource, e);
        }
    }

    /**
     * Loads a configuration file from disk.
     *
     * @param configFilePath path of the JSON file
     * @return the validated configuration
     * @throws ConfigurationException if the file is unreadable or violates the schema
     */
    public static EngineConfig loadConfigFile(String configFilePath) {
        File file = new File(configFilePath);
        if (!file.isFile()) {
            throw new ConfigurationException("Config file not found", configFilePath);
        }
        try {
            return bind(mapper.readTree(file), configFilePath);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read config file", configFilePath, e);
        }
    }

    /**
     * Resolves an artifact file name against the configured workspace directory.
     */
    public static Path resolveInWorkspace(EngineConfig config, String fileName) {
        return Paths.get(config.workspace).resolve(fileName);
    }

    private static EngineConfig bind(JsonNode document, String source) {
        ConfigSchemaValidator.validate(CONFIG_SCHEMA_RESOURCE, document, source);
        try {
            EngineConfig config = mapper.treeToValue(document, EngineConfig.class);
            log.debug("Loaded engine config from '{}' (workspace '{}', data source '{}')",
                    source, config.workspace, config.dataSource);
            return config;
        } catch (JsonProcessingException e) {
            throw new ConfigurationException("Config does not match the engine config model", source, e);
        }
    }
}
