package org.processverify.engine.bpmn.models;

public enum FlowKind {
    SEQUENCE,
    MESSAGE
}
