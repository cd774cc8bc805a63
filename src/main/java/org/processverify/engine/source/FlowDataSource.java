package org.processverify.engine.source;

import org.processverify.engine.closure.models.GatewayDocument;
import org.processverify.engine.closure.models.SequenceDocument;
import org.processverify.engine.formula.models.CtlConstraint;
import org.processverify.engine.formula.models.SymbolTable;

import java.util.List;

/**
 * Supplies the structured documents the engine works on. Implementations either read
 * precomputed workspace artifacts or produce them on demand.
 */
public interface FlowDataSource {

    SequenceDocument loadSequence();

    GatewayDocument loadGateways();

    SymbolTable loadSymbols();

    /**
     * Raw constraints, before {@code CtlConstraintHelper.validateAndFormat}.
     */
    List<CtlConstraint> loadConstraints();
}
