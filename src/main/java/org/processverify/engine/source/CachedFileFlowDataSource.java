package org.processverify.engine.source;

import org.processverify.engine.closure.FlowDataHelper;
import org.processverify.engine.closure.models.GatewayDocument;
import org.processverify.engine.closure.models.SequenceDocument;
import org.processverify.engine.config.models.OutputFiles;
import org.processverify.engine.formula.CtlConstraintHelper;
import org.processverify.engine.formula.SymbolTableHelper;
import org.processverify.engine.formula.models.CtlConstraint;
import org.processverify.engine.formula.models.SymbolTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.List;

/**
 * Reads the documents a previous run left in the workspace directory.
 */
public class CachedFileFlowDataSource implements FlowDataSource {
    private static final Logger log = LoggerFactory.getLogger(CachedFileFlowDataSource.class);

    private final Path workspace;
    private final OutputFiles files;

    public CachedFileFlowDataSource(Path workspace, OutputFiles files) {
        this.workspace = workspace;
        this.files = files;
    }

    @Override
    public SequenceDocument loadSequence() {
        log.debug("Reading control flow from workspace '{}'", workspace);
        return FlowDataHelper.loadSequenceDocument(workspace.resolve(files.seqOutputFile));
    }

    @Override
    public GatewayDocument loadGateways() {
        return FlowDataHelper.loadGatewayDocument(workspace.resolve(files.gateOutputFile));
    }

    @Override
    public SymbolTable loadSymbols() {
        return SymbolTableHelper.loadSymbolTable(workspace.resolve(files.symbolOutputFile));
    }

    @Override
    public List<CtlConstraint> loadConstraints() {
        return CtlConstraintHelper.loadConstraints(workspace.resolve(files.ctlOutputFile));
    }

    public Path getWorkspace() {
        return workspace;
    }
}
