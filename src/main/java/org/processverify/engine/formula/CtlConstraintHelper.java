package org.processverify.engine.formula;

import com.fasterxml.jackson.databind.JsonNode;
import org.processverify.engine.errors.Stage;
import org.processverify.engine.errors.StructuralParseException;
import org.processverify.engine.formula.models.ConstraintType;
import org.processverify.engine.formula.models.CtlConstraint;
import org.processverify.engine.formula.models.CtlDocument;
import org.processverify.engine.formula.models.CtlMetadata;
import org.processverify.engine.formula.models.TransformedCtlDocument;
import org.processverify.engine.source.DocumentHelper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Loads, normalizes and stores CTL constraint documents.
 */
public class CtlConstraintHelper {
    private static final Logger log = LoggerFactory.getLogger(CtlConstraintHelper.class);

    /**
     * Reads the constraints of a (possibly wrapped) ctl_output.json. Entries that are not
     * JSON objects are skipped.
     */
    public static List<CtlConstraint> loadConstraints(Path ctlFile) {
        if (!Files.isRegularFile(ctlFile)) {
            throw new StructuralParseException("CTL document not found", ctlFile.toString(), Stage.PARSE);
        }
        JsonNode document;
        try {
            document = DocumentHelper.unwrap(DocumentHelper.mapper().readTree(ctlFile.toFile()));
        } catch (IOException e) {
            throw new StructuralParseException("Failed to read CTL document", ctlFile.toString(), Stage.PARSE, e);
        }
        return bindConstraints(document.path("ctl_constraints"), ctlFile.toString());
    }

    public static List<CtlConstraint> bindConstraints(JsonNode constraintsNode, String source) {
        List<CtlConstraint> constraints = new ArrayList<>();
        if (constraintsNode.isObject()) {
            constraints.add(DocumentHelper.bind(constraintsNode, CtlConstraint.class, source));
            return constraints;
        }
        for (int i = 0; i < constraintsNode.size(); i++) {
            JsonNode entry = constraintsNode.get(i);
            if (!entry.isObject()) {
                log.warn("Constraint {} of '{}' is not an object, skipping it", i, source);
                continue;
            }
            constraints.add(DocumentHelper.bind(entry, CtlConstraint.class, source));
        }
        return constraints;
    }

    /**
     * Normalizes constraints: missing ids become C001, C002, ... by position, unknown types
     * become safety properties, text fields are trimmed and constraints without a formula are dropped.
     */
    public static List<CtlConstraint> validateAndFormat(List<CtlConstraint> constraints) {
        List<CtlConstraint> formatted = new ArrayList<>();

        for (int i = 0; i < constraints.size(); i++) {
            CtlConstraint constraint = constraints.get(i);
            if (constraint == null) {
                log.warn("Constraint {} is empty, skipping it", i);
                continue;
            }

            String constraintId = constraint.constraintId() != null
                    ? constraint.constraintId()
                    : String.format("C%03d", i + 1);

            String constraintType = constraint.constraintType() == null
                    ? ConstraintType.SAFETY_PROPERTIES.label()
                    : constraint.constraintType();
            if (ConstraintType.fromLabel(constraintType).isEmpty()) {
                log.warn("Invalid constraint type '{}' for {}, using '{}'",
                        constraintType, constraintId, ConstraintType.SAFETY_PROPERTIES.label());
                constraintType = ConstraintType.SAFETY_PROPERTIES.label();
            }

            String formula = trim(constraint.ctlFormula());
            if (formula.isEmpty()) {
                log.warn("Empty CTL formula in constraint {}, dropping it", constraintId);
                continue;
            }

            formatted.add(new CtlConstraint(constraintId, formula, trim(constraint.description()),
                    trim(constraint.requirementReference()), constraintType));
        }

        log.info("Validated and formatted {} of {} CTL constraints", formatted.size(), constraints.size());
        return formatted;
    }

    public static CtlDocument toStandardDocument(List<CtlConstraint> constraints) {
        CtlMetadata metadata = new CtlMetadata(CtlMetadata.FORMAT_VERSION, LocalDateTime.now().toString(),
                constraints.size(), CtlMetadata.STANDARD_FORMAT);
        return new CtlDocument(metadata, constraints);
    }

    public static void saveStandardConstraints(List<CtlConstraint> constraints, Path outputFile) throws IOException {
        DocumentHelper.writeDocument(outputFile, toStandardDocument(constraints));
        log.info("Standard CTL constraints saved to '{}'", outputFile);
    }

    public static void saveTransformedConstraints(TransformedCtlDocument document, Path outputFile) throws IOException {
        DocumentHelper.writeDocument(outputFile, document);
        log.info("Transformed CTL constraints saved to '{}'", outputFile);
    }

    private static String trim(String value) {
        return value == null ? "" : value.trim();
    }
}
