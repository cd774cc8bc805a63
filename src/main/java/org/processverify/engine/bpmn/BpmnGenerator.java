package org.processverify.engine.bpmn;

import org.processverify.engine.bpmn.models.GatewayType;
import org.processverify.engine.closure.models.ControlFlow;
import org.processverify.engine.closure.models.GatewaySpec;
import org.processverify.engine.closure.models.UpdatedFlowReport;
import org.processverify.engine.config.models.EngineConfig;
import org.processverify.engine.errors.GraphEngineException;
import org.processverify.engine.errors.Stage;
import org.processverify.engine.formula.models.ActorSymbol;
import org.processverify.engine.formula.models.SymbolTable;
import org.processverify.engine.formula.models.TaskSymbol;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.transform.OutputKeys;
import javax.xml.transform.Transformer;
import javax.xml.transform.TransformerFactory;
import javax.xml.transform.dom.DOMSource;
import javax.xml.transform.stream.StreamResult;
import java.io.IOException;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Builds BPMN 2.0 XML from the structured flow documents.
 * <p>
 * One actor yields a process diagram; several actors yield a collaboration with one
 * participant and one process per actor. Symbols {@code S<n>} become start events,
 * {@code E<n>} end events and every other task symbol a plain task. Gateways and the flows
 * synthesized for them live in the first process. Flow endpoints missing from the symbol
 * table are declared in the process of the flow's actor so that every reference resolves.
 */
public class BpmnGenerator {
    private static final Logger log = LoggerFactory.getLogger(BpmnGenerator.class);

    private static final String BPMN_PREFIX = "bpmn:";
    private static final String DEFINITIONS_ID = "Definitions_1";
    private static final String COLLABORATION_ID = "Collaboration_1";
    private static final String TARGET_NAMESPACE = "http://example.com/bpmn";

    private static final Pattern START_SYMBOL = Pattern.compile("S\\d+");
    private static final Pattern END_SYMBOL = Pattern.compile("E\\d+");

    private final String routingActor;

    public BpmnGenerator() {
        this(new EngineConfig());
    }

    public BpmnGenerator(EngineConfig config) {
        this.routingActor = config.closure.routingActor;
    }

    /**
     * @param symbols      actors and their tasks
     * @param flow         closure result; its gateways and updated control flow are drawn
     * @param messageFlows cross-actor flows, only drawn in a collaboration
     * @throws GraphEngineException if the symbol table names no actor
     */
    public Document toDocument(SymbolTable symbols, UpdatedFlowReport flow, List<ControlFlow> messageFlows) {
        List<ActorSymbol> actors = symbols.actors();
        if (actors.isEmpty()) {
            throw new GraphEngineException("Symbol table has no actors to draw processes for",
                    DEFINITIONS_ID, Stage.GENERATION);
        }

        Document doc;
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setNamespaceAware(true);
            doc = factory.newDocumentBuilder().newDocument();
        } catch (Exception e) {
            throw new GraphEngineException("Failed to create BPMN document", DEFINITIONS_ID, Stage.GENERATION, e);
        }

        Element definitionsEl = bpmnElement(doc, "definitions");
        definitionsEl.setAttributeNS(XMLConstants.XMLNS_ATTRIBUTE_NS_URI, "xmlns:bpmn", BpmnHelper.BPMN_NS);
        definitionsEl.setAttribute("id", DEFINITIONS_ID);
        definitionsEl.setAttribute("targetNamespace", TARGET_NAMESPACE);
        doc.appendChild(definitionsEl);

        boolean collaboration = actors.size() > 1;
        Element collaborationEl = null;
        if (collaboration) {
            collaborationEl = bpmnElement(doc, "collaboration");
            collaborationEl.setAttribute("id", COLLABORATION_ID);
            definitionsEl.appendChild(collaborationEl);
        }

        // actor symbol -> process element
        Map<String, Element> processes = new LinkedHashMap<>();
        for (ActorSymbol actor : actors) {
            String processId = "Process_" + actor.symbol();
            if (collaborationEl != null) {
                Element participantEl = bpmnElement(doc, "participant");
                participantEl.setAttribute("id", "Participant_" + actor.symbol());
                participantEl.setAttribute("name", actor.actorName());
                participantEl.setAttribute("processRef", processId);
                collaborationEl.appendChild(participantEl);
            }
            Element processEl = bpmnElement(doc, "process");
            processEl.setAttribute("id", processId);
            processEl.setAttribute("name", actor.actorName() + " Process");
            processEl.setAttribute("isExecutable", "true");
            definitionsEl.appendChild(processEl);
            processes.put(actor.symbol(), processEl);
        }

        Set<String> declared = new HashSet<>();
        for (TaskSymbol task : symbols.tasks()) {
            Element processEl = processFor(processes, task.actorSymbol());
            if (processEl == null) {
                log.warn("Task '{}' belongs to unknown actor '{}', not drawn", task.taskSymbol(), task.actorSymbol());
                continue;
            }
            if (declared.add(task.taskSymbol())) {
                processEl.appendChild(flowNode(doc, task.taskSymbol(), task.taskDescription()));
            }
        }

        Element firstProcess = processes.values().iterator().next();
        for (GatewaySpec gateway : flow.gateways()) {
            if (!declared.add(gateway.gatewaySymbol())) {
                log.warn("Gateway '{}' is already declared, drawing it once", gateway.gatewaySymbol());
                continue;
            }
            GatewayType type = gateway.routingType().orElse(GatewayType.EXCLUSIVE);
            Element gatewayEl = bpmnElement(doc, type.elementName());
            gatewayEl.setAttribute("id", gateway.gatewaySymbol());
            if (gateway.gatewayType() != null) {
                gatewayEl.setAttribute("name", gateway.gatewayType());
            }
            firstProcess.appendChild(gatewayEl);
        }

        List<Element> flowEls = new ArrayList<>();
        Set<String> flowIds = new HashSet<>();
        for (ControlFlow controlFlow : flow.updatedControlFlow()) {
            Element processEl = processFor(processes, controlFlow.actor());
            if (processEl == null) {
                log.warn("Flow {} has unknown actor '{}', not drawn", controlFlow.key(), controlFlow.actor());
                continue;
            }
            String flowId = "Flow_" + controlFlow.from() + "_to_" + controlFlow.to();
            if (!flowIds.add(flowId)) {
                continue;
            }
            for (String endpoint : List.of(controlFlow.from(), controlFlow.to())) {
                if (declared.add(endpoint)) {
                    log.debug("Declaring '{}' from flow {} in '{}'", endpoint, controlFlow.key(), processEl.getAttribute("id"));
                    processEl.appendChild(flowNode(doc, endpoint, null));
                }
            }
            Element flowEl = bpmnElement(doc, "sequenceFlow");
            flowEl.setAttribute("id", flowId);
            flowEl.setAttribute("sourceRef", controlFlow.from());
            flowEl.setAttribute("targetRef", controlFlow.to());
            processEl.appendChild(flowEl);
            flowEls.add(flowEl);
        }

        if (collaborationEl != null) {
            for (ControlFlow messageFlow : messageFlows) {
                Element messageFlowEl = bpmnElement(doc, "messageFlow");
                messageFlowEl.setAttribute("id", "MessageFlow_" + messageFlow.from() + "_to_" + messageFlow.to());
                messageFlowEl.setAttribute("sourceRef", messageFlow.from());
                messageFlowEl.setAttribute("targetRef", messageFlow.to());
                collaborationEl.appendChild(messageFlowEl);
            }
        } else if (!messageFlows.isEmpty()) {
            log.warn("Dropping {} message flows: a single actor yields a process diagram", messageFlows.size());
        }

        log.info("Generated {} diagram with {} processes, {} flow nodes, {} sequence flows",
                collaboration ? "collaboration" : "process", processes.size(), declared.size(), flowEls.size());
        return doc;
    }

    public String toXml(SymbolTable symbols, UpdatedFlowReport flow, List<ControlFlow> messageFlows) {
        Document doc = toDocument(symbols, flow, messageFlows);
        try {
            Transformer transformer = TransformerFactory.newInstance().newTransformer();
            transformer.setOutputProperty(OutputKeys.INDENT, "yes");
            transformer.setOutputProperty("{http://xml.apache.org/xslt}indent-amount", "2");
            transformer.setOutputProperty(OutputKeys.ENCODING, "UTF-8");
            transformer.setOutputProperty(OutputKeys.METHOD, "xml");
            transformer.setOutputProperty(OutputKeys.OMIT_XML_DECLARATION, "no");

            StringWriter writer = new StringWriter();
            transformer.transform(new DOMSource(doc), new StreamResult(writer));
            return writer.toString();
        } catch (Exception e) {
            throw new GraphEngineException("Failed to serialize BPMN", DEFINITIONS_ID, Stage.GENERATION, e);
        }
    }

    /**
     * Writes the generated model to a BPMN file, creating parent directories as needed.
     */
    public void write(SymbolTable symbols, UpdatedFlowReport flow, List<ControlFlow> messageFlows,
                      Path outputFile) throws IOException {
        String xml = toXml(symbols, flow, messageFlows);
        Path parent = outputFile.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(outputFile, xml, StandardCharsets.UTF_8);
        log.info("BPMN model saved to '{}'", outputFile);
    }

    /**
     * The single process of a process diagram takes everything; in a collaboration the routing
     * actor maps to the first process and unknown actors to none.
     */
    private Element processFor(Map<String, Element> processes, String actorSymbol) {
        if (processes.size() == 1 || routingActor.equals(actorSymbol)) {
            return processes.values().iterator().next();
        }
        return processes.get(actorSymbol);
    }

    private static Element flowNode(Document doc, String symbol, String name) {
        String elementName;
        if (START_SYMBOL.matcher(symbol).matches()) {
            elementName = "startEvent";
        } else if (END_SYMBOL.matcher(symbol).matches()) {
            elementName = "endEvent";
        } else {
            elementName = "task";
        }
        Element nodeEl = bpmnElement(doc, elementName);
        nodeEl.setAttribute("id", symbol);
        if (name != null && !name.isBlank()) {
            nodeEl.setAttribute("name", name);
        }
        return nodeEl;
    }

    private static Element bpmnElement(Document doc, String localName) {
        return doc.createElementNS(BpmnHelper.BPMN_NS, BPMN_PREFIX + localName);
    }
}
