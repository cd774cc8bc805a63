package org.processverify.engine;

import org.processverify.engine.bpmn.BpmnGenerator;
import org.processverify.engine.bpmn.BpmnHelper;
import org.processverify.engine.bpmn.models.DiagramType;
import org.processverify.engine.closure.FlowDataHelper;
import org.processverify.engine.closure.models.SequenceDocument;
import org.processverify.engine.closure.models.UpdatedFlowReport;
import org.processverify.engine.config.EngineConfigHelper;
import org.processverify.engine.config.models.EngineConfig;
import org.processverify.engine.errors.StructuralParseException;
import org.processverify.engine.formula.CtlConstraintHelper;
import org.processverify.engine.formula.FormulaSubstitution;
import org.processverify.engine.formula.SymbolTableHelper;
import org.processverify.engine.formula.models.CtlConstraint;
import org.processverify.engine.formula.models.TransformedCtlDocument;
import org.processverify.engine.petriNet.PetriNetTranslator;
import org.processverify.engine.petriNet.PnmlReader;
import org.processverify.engine.petriNet.models.PetriNet;
import org.processverify.engine.similarity.JaccardSimilarity;
import org.processverify.engine.similarity.SimilarityReportHelper;
import org.processverify.engine.similarity.SsdtSimilarity;
import org.processverify.engine.similarity.models.JaccardReport;
import org.processverify.engine.similarity.models.SsdtReport;
import org.processverify.engine.source.FlowDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Runs the structural stages in order: closure reduction of the control flow, generation of
 * the BPMN model from the reduced flow (unless a model is given), translation of that model into a Petri net, rewriting of the CTL constraints over the net's places
 * and, when a benchmark model is given, the similarity metrics. Every artifact is written to
 * the configured workspace.
 */
public class VerificationPipeline {
    private static final Logger log = LoggerFactory.getLogger(VerificationPipeline.class);

    private final EngineConfig config;
    private final FlowDataSource dataSource;
    private final BpmnGenerator generator;
    private final PetriNetTranslator translator;
    private final FormulaSubstitution substitution;
    private final JaccardSimilarity jaccard;

    public VerificationPipeline(EngineConfig config, FlowDataSource dataSource) {
        this.config = config;
        this.dataSource = dataSource;
        this.generator = new BpmnGenerator(config);
        this.translator = new PetriNetTranslator(config);
        this.substitution = new FormulaSubstitution(config.namingConvention);
        this.jaccard = new JaccardSimilarity(config.similarity);
    }

    /**
     * Generates the BPMN model from the data source into the workspace and verifies it.
     *
     * @param benchmarkBpmnFilePath reference model for the similarity metrics, or null to skip them
     */
    public PipelineResult run(String benchmarkBpmnFilePath) throws IOException {
        UpdatedFlowReport updatedFlow = updateFlow();
        Path bpmnFile = generateBpmn(updatedFlow);
        return verify(bpmnFile, updatedFlow, benchmarkBpmnFilePath);
    }

    /**
     * Verifies an existing model instead of a generated one.
     *
     * @param bpmnFilePath          the model to verify
     * @param benchmarkBpmnFilePath reference model for the similarity metrics, or null to skip them
     */
    public PipelineResult run(String bpmnFilePath, String benchmarkBpmnFilePath) throws IOException {
        return verify(Path.of(bpmnFilePath), updateFlow(), benchmarkBpmnFilePath);
    }

    private PipelineResult verify(Path bpmnFile, UpdatedFlowReport updatedFlow,
                                  String benchmarkBpmnFilePath) throws IOException {
        String bpmnFilePath = bpmnFile.toString();
        log.info("Starting verification of '{}'", bpmnFilePath);

        Path pnmlFile = translator.convertBpmnFile(bpmnFilePath);
        PetriNet net = PnmlReader.readPnmlFile(pnmlFile);
        TransformedCtlDocument transformed = transformConstraints(net);

        PipelineResult.PipelineResultBuilder result = PipelineResult.builder()
                .updatedFlow(updatedFlow)
                .bpmnFile(bpmnFile)
                .petriNet(net)
                .pnmlFile(pnmlFile)
                .transformedConstraints(transformed);

        if (benchmarkBpmnFilePath != null) {
            result.jaccardReport(compareJaccard(benchmarkBpmnFilePath, bpmnFilePath));
            result.ssdtReport(compareSsdt(benchmarkBpmnFilePath, bpmnFilePath));
        }

        log.info("Verification of '{}' completed", bpmnFilePath);
        return result.build();
    }

    /**
     * Applies the closure reduction to the control flow and saves the updated flow document.
     */
    public UpdatedFlowReport updateFlow() throws IOException {
        SequenceDocument sequence = dataSource.loadSequence();
        UpdatedFlowReport report = FlowDataHelper.updateFlow(
                sequence.controlFlow(), dataSource.loadGateways().gateways(), config.closure.routingActor);
        FlowDataHelper.saveUpdatedFlow(workspaceFile(config.outputFiles.updatedFlowOutputFile), report);
        return report;
    }

    /**
     * Draws the reduced flow as BPMN in the workspace: one process per actor, message flows
     * from the sequence document.
     *
     * @return the written BPMN path
     */
    public Path generateBpmn(UpdatedFlowReport updatedFlow) throws IOException {
        Path output = workspaceFile(config.outputFiles.bpmnOutputFile);
        generator.write(dataSource.loadSymbols(), updatedFlow, dataSource.loadSequence().messageFlow(), output);
        return output;
    }

    /**
     * Normalizes the constraints, saves them in the standard format and rewrites them over the net.
     */
    public TransformedCtlDocument transformConstraints(PetriNet net) throws IOException {
        List<CtlConstraint> constraints = CtlConstraintHelper.validateAndFormat(dataSource.loadConstraints());
        CtlConstraintHelper.saveStandardConstraints(constraints,
                workspaceFile(config.outputFiles.standardCtlConstraintsFile));

        List<String> symbols = SymbolTableHelper.taskSymbols(dataSource.loadSymbols());
        TransformedCtlDocument transformed = substitution.transform(net, symbols, constraints);
        CtlConstraintHelper.saveTransformedConstraints(transformed,
                workspaceFile(config.outputFiles.transformedCtlOutputFile));
        return transformed;
    }

    public JaccardReport compareJaccard(String benchmarkBpmnFilePath, String targetBpmnFilePath) throws IOException {
        JaccardReport report = jaccard.compareFiles(benchmarkBpmnFilePath, targetBpmnFilePath);
        SimilarityReportHelper.saveJaccardReport(report, workspaceFile(config.outputFiles.jaccardOutputFile));
        return report;
    }

    /**
     * Runs the SSDT comparison when both models are process diagrams; otherwise logs why it is skipped.
     */
    public SsdtReport compareSsdt(String benchmarkBpmnFilePath, String targetBpmnFilePath) throws IOException {
        if (isCollaboration(benchmarkBpmnFilePath) || isCollaboration(targetBpmnFilePath)) {
            log.warn("Skipping SSDT similarity: it is only defined for process diagrams ('{}' vs '{}')",
                    benchmarkBpmnFilePath, targetBpmnFilePath);
            return null;
        }
        SsdtReport report = SsdtSimilarity.compareFiles(benchmarkBpmnFilePath, targetBpmnFilePath);
        SimilarityReportHelper.saveSsdtReport(report, workspaceFile(config.outputFiles.ssdtOutputFile));
        return report;
    }

    private static boolean isCollaboration(String bpmnFilePath) {
        try {
            return BpmnHelper.detectDiagramType(Files.readString(Path.of(bpmnFilePath))) == DiagramType.COLLABORATION;
        } catch (IOException | StructuralParseException e) {
            log.debug("Cannot detect diagram type of '{}', treating it as a process diagram", bpmnFilePath, e);
            return false;
        }
    }

    private Path workspaceFile(String fileName) {
        return EngineConfigHelper.resolveInWorkspace(config, fileName);
    }
}
