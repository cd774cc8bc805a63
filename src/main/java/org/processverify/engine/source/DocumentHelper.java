package org.processverify.engine.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.processverify.engine.errors.Stage;
import org.processverify.engine.errors.StructuralParseException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads and writes the JSON documents exchanged through the workspace.
 * Documents produced by the generation service wrap their payload in "extracted_output";
 * both wrapped and bare documents are accepted.
 */
public class DocumentHelper {
    public static final String EXTRACTED_OUTPUT = "extracted_output";

    private static final ObjectMapper mapper = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    public static ObjectMapper mapper() {
        return mapper;
    }

    /**
     * @throws StructuralParseException if the file is missing, is not JSON or does not bind to {@code type}
     */
    public static <T> T readDocument(Path path, Class<T> type) {
        if (!Files.isRegularFile(path)) {
            throw new StructuralParseException("Document not found", path.toString(), Stage.PARSE);
        }
        try {
            return bind(mapper.readTree(path.toFile()), type, path.toString());
        } catch (IOException e) {
            throw new StructuralParseException("Failed to read JSON document", path.toString(), Stage.PARSE, e);
        }
    }

    public static <T> T bind(JsonNode document, Class<T> type, String source) {
        JsonNode payload = unwrap(document);
        try {
            return mapper.treeToValue(payload, type);
        } catch (IOException e) {
            throw new StructuralParseException(
                    "Document does not match " + type.getSimpleName(), source, Stage.PARSE, e);
        }
    }

    public static JsonNode unwrap(JsonNode document) {
        if (document != null && document.has(EXTRACTED_OUTPUT) && document.get(EXTRACTED_OUTPUT).isObject()) {
            return document.get(EXTRACTED_OUTPUT);
        }
        return document;
    }

    public static void writeDocument(Path path, Object document) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        mapper.writeValue(path.toFile(), document);
    }
}
