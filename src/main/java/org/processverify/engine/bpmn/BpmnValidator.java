package org.processverify.engine.bpmn;

import org.camunda.bpm.model.bpmn.Bpmn;
import org.camunda.bpm.model.bpmn.BpmnModelInstance;
import org.processverify.engine.errors.Stage;
import org.processverify.engine.errors.StructuralParseException;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;

/**
 * Strict BPMN 2.0 schema validation. {@link BpmnHelper} is lenient and only reads the
 * elements the engine needs; run this first when the input must be a well-formed model.
 */
public class BpmnValidator {

    /**
     * Validates a BPMN file from disk.
     *
     * @throws StructuralParseException if the file cannot be read or violates the BPMN schema
     */
    public static void validate(File bpmnFile) {
        try {
            BpmnModelInstance modelInstance = Bpmn.readModelFromFile(bpmnFile);
            Bpmn.validateModel(modelInstance);
        } catch (RuntimeException e) {
            throw new StructuralParseException("BPMN model is invalid", bpmnFile.getPath(), Stage.PARSE, e);
        }
    }

    /**
     * Validates a BPMN file from the classpath.
     *
     * @throws IllegalArgumentException if the resource does not exist
     * @throws StructuralParseException if the resource violates the BPMN schema
     */
    public static void validateFromClasspath(String classpathResource) {
        InputStream is = BpmnValidator.class.getClassLoader()
                .getResourceAsStream(classpathResource);

        if (is == null) {
            throw new IllegalArgumentException(
                    "BPMN resource not found on classpath: " + classpathResource
            );
        }

        try (is) {
            BpmnModelInstance modelInstance = Bpmn.readModelFromStream(is);
            Bpmn.validateModel(modelInstance);
        } catch (RuntimeException e) {
            throw new StructuralParseException("BPMN model is invalid", classpathResource, Stage.PARSE, e);
        } catch (IOException e) {
            throw new StructuralParseException("Failed to close BPMN resource", classpathResource, Stage.PARSE, e);
        }
    }

    /**
     * Boolean-style validation.
     */
    public static boolean isValid(File bpmnFile) {
        try {
            validate(bpmnFile);
            return true;
        } catch (StructuralParseException e) {
            return false;
        }
    }
}
