package org.processverify.engine.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import org.processverify.engine.errors.ConfigurationException;

import java.io.IOException;
import java.io.InputStream;
import java.util.Set;

/**
 * Validates JSON documents against a JSON schema (draft 2020-12) kept on the classpath.
 */
public class ConfigSchemaValidator {

    private static final ObjectMapper mapper = new ObjectMapper();
    private static final JsonSchemaFactory factory = JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V202012);

    /**
     * @param schemaResourcePath classpath location of the schema
     * @param document           the parsed document to check
     * @param documentName       name used in the error message
     * @throws ConfigurationException if the schema is missing or the document violates it
     */
    public static void validate(String schemaResourcePath, JsonNode document, String documentName) {
        ClassLoader cl = ConfigSchemaValidator.class.getClassLoader();

        try (InputStream schemaStream = cl.getResourceAsStream(schemaResourcePath)) {
            if (schemaStream == null) {
                throw new ConfigurationException("Schema not found", schemaResourcePath);
            }

            JsonNode schemaNode = mapper.readTree(schemaStream);
            JsonSchema schema = factory.getSchema(schemaNode);

            Set<ValidationMessage> errors = schema.validate(document);
            if (!errors.isEmpty()) {
                throw new ConfigurationException("Configuration JSON is INVALID: " + errors, documentName);
            }
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read schema", schemaResourcePath, e);
        }
    }
}
