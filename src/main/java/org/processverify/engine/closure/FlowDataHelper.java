package org.processverify.engine.closure;

import org.processverify.engine.closure.models.ControlFlow;
import org.processverify.engine.closure.models.GatewayDocument;
import org.processverify.engine.closure.models.GatewaySpec;
import org.processverify.engine.closure.models.SequenceDocument;
import org.processverify.engine.closure.models.UpdatedFlowReport;
import org.processverify.engine.source.DocumentHelper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Loads control-flow and gateway documents and stores the closure result.
 */
public class FlowDataHelper {
    private static final Logger log = LoggerFactory.getLogger(FlowDataHelper.class);

    public static SequenceDocument loadSequenceDocument(Path seqFile) {
        SequenceDocument document = DocumentHelper.readDocument(seqFile, SequenceDocument.class);
        log.debug("Loaded {} control flows from '{}'", document.controlFlow().size(), seqFile);
        return document;
    }

    public static GatewayDocument loadGatewayDocument(Path gateFile) {
        GatewayDocument document = DocumentHelper.readDocument(gateFile, GatewayDocument.class);
        log.debug("Loaded {} gateways from '{}'", document.gateways().size(), gateFile);
        return document;
    }

    /**
     * Runs the closure reduction and pairs the result with its inputs.
     */
    public static UpdatedFlowReport updateFlow(List<ControlFlow> controlFlow, List<GatewaySpec> gateways,
                                               String routingActor) {
        List<ControlFlow> updated = ClosureReducer.reduce(controlFlow, gateways, routingActor);
        return new UpdatedFlowReport(List.copyOf(controlFlow), List.copyOf(gateways), updated);
    }

    public static void saveUpdatedFlow(Path outputFile, UpdatedFlowReport report) throws IOException {
        DocumentHelper.writeDocument(outputFile, report);
        log.info("Updated flow saved to '{}' ({} original, {} updated flows)",
                outputFile, report.originalControlFlow().size(), report.updatedControlFlow().size());
    }

    public static UpdatedFlowReport loadUpdatedFlow(Path updatedFlowFile) {
        return DocumentHelper.readDocument(updatedFlowFile, UpdatedFlowReport.class);
    }
}
