package org.processverify.engine;

import lombok.Builder;
import org.processverify.engine.closure.models.UpdatedFlowReport;
import org.processverify.engine.formula.models.TransformedCtlDocument;
import org.processverify.engine.petriNet.models.PetriNet;
import org.processverify.engine.similarity.models.JaccardReport;
import org.processverify.engine.similarity.models.SsdtReport;

import java.nio.file.Path;

/**
 * Outputs of one {@link VerificationPipeline} run. Similarity reports are null when no
 * benchmark was given; the SSDT report is also null when a diagram is a collaboration.
 */
@Builder
public record PipelineResult(
        UpdatedFlowReport updatedFlow,
        Path bpmnFile,
        PetriNet petriNet,
        Path pnmlFile,
        TransformedCtlDocument transformedConstraints,
        JaccardReport jaccardReport,
        SsdtReport ssdtReport
) {
}
