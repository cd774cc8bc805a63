package org.processverify.engine.formula;

import org.processverify.engine.errors.StructuralParseException;
import org.processverify.engine.formula.models.CtlConstraint;
import org.processverify.engine.formula.models.CtlDocument;
import org.processverify.engine.formula.models.CtlMetadata;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CtlConstraintHelperTest {
    private static final Path CTL_OUTPUT = Path.of("src/test/resources/models/workspace/ctl_output.json");

    @TempDir
    Path tempDir;

    @Test
    void shouldSkipEntriesThatAreNotObjects() {
        List<CtlConstraint> constraints = CtlConstraintHelper.loadConstraints(CTL_OUTPUT);

        assertEquals(3, constraints.size());
        assertEquals("C001", constraints.get(0).constraintId());
        assertNull(constraints.get(1).constraintId());
    }

    @Test
    void shouldNormalizeConstraints() {
        List<CtlConstraint> formatted = CtlConstraintHelper.validateAndFormat(
                CtlConstraintHelper.loadConstraints(CTL_OUTPUT));

        assertEquals(2, formatted.size());

        CtlConstraint first = formatted.get(0);
        assertEquals("C001", first.constraintId());
        assertEquals("response_properties", first.constraintType());
        assertEquals("R1", first.requirementReference());

        CtlConstraint second = formatted.get(1);
        assertEquals("C002", second.constraintId());
        assertEquals("AG(!(T4) | T2)", second.ctlFormula());
        assertEquals("Goods are packed before dispatch", second.description());
        assertEquals("", second.requirementReference());
        assertEquals("safety_properties", second.constraintType());
    }

    @Test
    void shouldSkipNullEntries() {
        List<CtlConstraint> constraints = new ArrayList<>(Arrays.asList(
                null, new CtlConstraint(null, "EF(T1)", null, null, "liveness_properties")));

        List<CtlConstraint> formatted = CtlConstraintHelper.validateAndFormat(constraints);

        assertEquals(1, formatted.size());
        assertEquals("C002", formatted.get(0).constraintId());
        assertEquals("liveness_properties", formatted.get(0).constraintType());
    }

    @Test
    void shouldAcceptSingleConstraintObject() throws IOException {
        Path file = tempDir.resolve("ctl_output.json");
        Files.writeString(file, "{ \"ctl_constraints\": { \"constraint_id\": \"C1\", \"ctl_formula\": \"EF(T1)\" } }");

        List<CtlConstraint> constraints = CtlConstraintHelper.loadConstraints(file);

        assertEquals(1, constraints.size());
        assertEquals("EF(T1)", constraints.get(0).ctlFormula());
    }

    @Test
    void shouldWriteStandardDocument() throws IOException {
        List<CtlConstraint> formatted = CtlConstraintHelper.validateAndFormat(
                CtlConstraintHelper.loadConstraints(CTL_OUTPUT));
        Path output = tempDir.resolve("standard_ctl_constraints.json");

        CtlConstraintHelper.saveStandardConstraints(formatted, output);

        String json = Files.readString(output);
        assertTrue(json.contains("\"format\" : \"standard_ctl\""));
        assertTrue(json.contains("\"constraint_count\" : 2"));

        CtlDocument document = CtlConstraintHelper.toStandardDocument(formatted);
        assertEquals(CtlMetadata.FORMAT_VERSION, document.metadata().formatVersion());
        assertNotNull(document.metadata().generationTimestamp());
    }

    @Test
    void shouldThrowWhenFileIsMissing() {
        assertThrows(StructuralParseException.class,
                () -> CtlConstraintHelper.loadConstraints(tempDir.resolve("missing.json")));
    }
}
