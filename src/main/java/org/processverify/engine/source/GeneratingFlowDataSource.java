package org.processverify.engine.source;

import org.processverify.engine.closure.BranchPairExtractor;
import org.processverify.engine.closure.models.GatewayDocument;
import org.processverify.engine.closure.models.SequenceDocument;
import org.processverify.engine.config.models.OutputFiles;
import org.processverify.engine.formula.SymbolTableHelper;
import org.processverify.engine.formula.models.CtlConstraint;
import org.processverify.engine.formula.models.CtlDocument;
import org.processverify.engine.formula.models.SymbolTable;
import org.processverify.engine.errors.GraphEngineException;
import org.processverify.engine.errors.Stage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Asks a {@link FlowDataGenerator} for each document. Documents are generated once per
 * instance, in dependency order: symbols, then control flow, then gateways and constraints.
 * With a dump directory, every generated document is also written there under its
 * workspace file name, so a later run can read it back with {@link CachedFileFlowDataSource}.
 */
public class GeneratingFlowDataSource implements FlowDataSource {
    private static final Logger log = LoggerFactory.getLogger(GeneratingFlowDataSource.class);

    private final FlowDataGenerator generator;
    private final Path dumpDirectory;
    private final OutputFiles files;

    private SymbolTable symbols;
    private SequenceDocument sequence;
    private GatewayDocument gateways;
    private List<CtlConstraint> constraints;

    public GeneratingFlowDataSource(FlowDataGenerator generator) {
        this(generator, null, new OutputFiles());
    }

    /**
     * @param dumpDirectory where generated documents are written, or null to keep them in memory only
     */
    public GeneratingFlowDataSource(FlowDataGenerator generator, Path dumpDirectory, OutputFiles files) {
        this.generator = Objects.requireNonNull(generator, "generator must not be null");
        this.dumpDirectory = dumpDirectory;
        this.files = files;
    }

    @Override
    public SymbolTable loadSymbols() {
        if (symbols == null) {
            symbols = SymbolTableHelper.addStartEndTasks(generator.generateSymbols());
            log.info("Generated symbol table: {} actors, {} tasks", symbols.actors().size(), symbols.tasks().size());
            dump(files.symbolOutputFile, symbols);
        }
        return symbols;
    }

    @Override
    public SequenceDocument loadSequence() {
        if (sequence == null) {
            sequence = generator.generateSequence(loadSymbols());
            log.info("Generated {} control flows", sequence.controlFlow().size());
            dump(files.seqOutputFile, sequence);
        }
        return sequence;
    }

    @Override
    public GatewayDocument loadGateways() {
        if (gateways == null) {
            var branchPairs = BranchPairExtractor.extract(loadSequence().controlFlow());
            gateways = generator.generateGateways(loadSymbols(), branchPairs);
            log.info("Generated {} gateways for {} branch positions", gateways.gateways().size(), branchPairs.size());
            dump(files.gateOutputFile, gateways);
        }
        return gateways;
    }

    @Override
    public List<CtlConstraint> loadConstraints() {
        if (constraints == null) {
            constraints = List.copyOf(generator.generateConstraints(loadSymbols(), loadSequence().controlFlow()));
            log.info("Generated {} CTL constraints", constraints.size());
            dump(files.ctlOutputFile, new CtlDocument(null, constraints));
        }
        return constraints;
    }

    private void dump(String fileName, Object document) {
        if (dumpDirectory == null) {
            return;
        }
        Path output = dumpDirectory.resolve(fileName);
        try {
            DocumentHelper.writeDocument(output, document);
            log.debug("Dumped generated document to '{}'", output);
        } catch (IOException e) {
            throw new GraphEngineException("Failed to dump generated document", output.toString(), Stage.CONFIG, e);
        }
    }
}
