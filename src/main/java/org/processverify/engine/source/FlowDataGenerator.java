package org.processverify.engine.source;

import org.processverify.engine.closure.models.BranchPair;
import org.processverify.engine.closure.models.ControlFlow;
import org.processverify.engine.closure.models.GatewayDocument;
import org.processverify.engine.closure.models.SequenceDocument;
import org.processverify.engine.formula.models.CtlConstraint;
import org.processverify.engine.formula.models.SymbolTable;

import java.util.List;

/**
 * Produces flow documents from requirement text. Implemented by the host application,
 * typically on top of a text generation service.
 */
public interface FlowDataGenerator {

    SymbolTable generateSymbols();

    SequenceDocument generateSequence(SymbolTable symbols);

    /**
     * @param branchPairs places in the control flow where several flows join or split
     */
    GatewayDocument generateGateways(SymbolTable symbols, List<BranchPair> branchPairs);

    List<CtlConstraint> generateConstraints(SymbolTable symbols, List<ControlFlow> controlFlow);
}
