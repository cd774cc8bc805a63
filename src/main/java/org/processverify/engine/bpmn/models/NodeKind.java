package org.processverify.engine.bpmn.models;

public enum NodeKind {
    TASK,
    START_EVENT,
    END_EVENT,
    GATEWAY
}
