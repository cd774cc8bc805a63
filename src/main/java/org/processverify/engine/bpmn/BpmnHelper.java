package org.processverify.engine.bpmn;

import org.processverify.engine.bpmn.models.Actor;
import org.processverify.engine.bpmn.models.DiagramType;
import org.processverify.engine.bpmn.models.Edge;
import org.processverify.engine.bpmn.models.FlowKind;
import org.processverify.engine.bpmn.models.GatewayType;
import org.processverify.engine.bpmn.models.Lane;
import org.processverify.engine.bpmn.models.Node;
import org.processverify.engine.bpmn.models.NodeKind;
import org.processverify.engine.bpmn.models.ProcessGraph;
import org.processverify.engine.errors.Stage;
import org.processverify.engine.errors.StructuralParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NodeList;
import org.xml.sax.InputSource;

import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import java.io.File;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads BPMN 2.0 XML into a {@link ProcessGraph}.
 */
public class BpmnHelper {
    private static final Logger log = LoggerFactory.getLogger(BpmnHelper.class);

    public static final String BPMN_NS = "http://www.omg.org/spec/BPMN/20100524/MODEL";

    public static final List<String> TASK_TYPES = List.of(
            "task", "userTask", "serviceTask", "scriptTask", "businessRuleTask",
            "manualTask", "sendTask", "receiveTask", "subProcess");

    public static final List<String> GATEWAY_TYPES = List.of(
            "exclusiveGateway", "inclusiveGateway", "parallelGateway", "eventBasedGateway");

    /**
     * Parses a BPMN file into a process graph.
     *
     * @param bpmnFilePath the path to the BPMN file
     * @return the parsed graph
     * @throws StructuralParseException if the file is missing or is not a BPMN definitions document
     */
    public static ProcessGraph parseBpmnFile(String bpmnFilePath) {
        Document doc;
        try {
            doc = newDocumentBuilder().parse(new File(bpmnFilePath));
        } catch (Exception e) {
            throw new StructuralParseException("Failed to parse BPMN file", bpmnFilePath, Stage.PARSE, e);
        }
        return toProcessGraph(doc, bpmnFilePath);
    }

    /**
     * Parses BPMN XML content into a process graph.
     *
     * @param bpmnXml BPMN 2.0 XML string
     * @return the parsed graph
     * @throws StructuralParseException if the content is not a BPMN definitions document
     */
    public static ProcessGraph parseBpmnXml(String bpmnXml) {
        return toProcessGraph(parseDocument(bpmnXml), "<inline>");
    }

    /**
     * Detects whether the BPMN content is a collaboration or a process diagram.
     * Defaults to {@link DiagramType#PROCESS} when neither element is present.
     */
    public static DiagramType detectDiagramType(String bpmnXml) {
        return detectDiagramType(parseDocument(bpmnXml));
    }

    static DiagramType detectDiagramType(Document doc) {
        if (doc.getElementsByTagNameNS(BPMN_NS, "collaboration").getLength() > 0) {
            return DiagramType.COLLABORATION;
        }
        return DiagramType.PROCESS;
    }

    private static Document parseDocument(String bpmnXml) {
        if (bpmnXml == null || bpmnXml.isBlank()) {
            throw new StructuralParseException("BPMN content is empty", "<inline>", Stage.PARSE);
        }
        try {
            return newDocumentBuilder().parse(new InputSource(new StringReader(bpmnXml)));
        } catch (Exception e) {
            throw new StructuralParseException("Failed to parse BPMN content", "<inline>", Stage.PARSE, e);
        }
    }

    private static DocumentBuilder newDocumentBuilder() throws Exception {
        DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
        factory.setNamespaceAware(true);
        return factory.newDocumentBuilder();
    }

    private static ProcessGraph toProcessGraph(Document doc, String source) {
        Element definitionsEl = doc.getDocumentElement();
        if (definitionsEl == null || !"definitions".equals(definitionsEl.getLocalName())) {
            throw new StructuralParseException("Root element is not 'definitions'", source, Stage.PARSE);
        }

        DiagramType type = detectDiagramType(doc);
        List<Actor> actors = new ArrayList<>();

        // process id -> process element
        Map<String, Element> processesById = new LinkedHashMap<>();
        NodeList processNodes = doc.getElementsByTagNameNS(BPMN_NS, "process");
        for (int i = 0; i < processNodes.getLength(); i++) {
            Element processEl = (Element) processNodes.item(i);
            String processId = processEl.getAttribute("id");
            if (!processId.isEmpty()) {
                processesById.put(processId, processEl);
            }
        }

        List<Lane> lanes = new ArrayList<>();
        if (type == DiagramType.COLLABORATION) {
            NodeList participantNodes = doc.getElementsByTagNameNS(BPMN_NS, "participant");
            for (int i = 0; i < participantNodes.getLength(); i++) {
                Element participantEl = (Element) participantNodes.item(i);
                String participantId = participantEl.getAttribute("id");
                String participantName = participantEl.getAttribute("name");
                String processRef = participantEl.getAttribute("processRef");

                if (!participantId.isEmpty() && !participantName.isEmpty()) {
                    actors.add(new Actor(participantId, participantName, Actor.PARTICIPANT));
                }

                Element processEl = processesById.get(processRef);
                if (processEl == null) {
                    log.warn("Participant '{}' references no known process ('{}'), skipping it", participantId, processRef);
                    continue;
                }
                String laneName = participantName.isEmpty() ? participantId : participantName;
                lanes.add(parseLane(participantId, laneName, processEl));
            }
        } else {
            for (Map.Entry<String, Element> entry : processesById.entrySet()) {
                String processName = entry.getValue().getAttribute("name");
                String laneName = processName.isEmpty() ? entry.getKey() : processName;
                lanes.add(parseLane(entry.getKey(), laneName, entry.getValue()));
            }
        }

        NodeList laneNodes = doc.getElementsByTagNameNS(BPMN_NS, "lane");
        for (int i = 0; i < laneNodes.getLength(); i++) {
            Element laneEl = (Element) laneNodes.item(i);
            String laneId = laneEl.getAttribute("id");
            String laneName = laneEl.getAttribute("name");
            if (!laneId.isEmpty() && !laneName.isEmpty()) {
                actors.add(new Actor(laneId, laneName, Actor.LANE));
            }
        }

        List<Edge> messageFlows = parseMessageFlows(doc, lanes);

        log.debug("Parsed {} diagram '{}': {} lanes, {} message flows",
                type.label(), source, lanes.size(), messageFlows.size());

        return new ProcessGraph(definitionsEl.getAttribute("id"), type, lanes, messageFlows, actors);
    }

    /**
     * Parses a process element into a lane holding its nodes and sequence flows.
     */
    private static Lane parseLane(String laneId, String laneName, Element processEl) {
        Map<String, Node> nodesById = parseFlowNodes(processEl, laneId);
        List<Edge> sequenceFlows = parseSequenceFlows(processEl, laneId);
        return new Lane(laneId, laneName, processEl.getAttribute("id"), nodesById, sequenceFlows);
    }

    /**
     * Parses tasks, start/end events and gateways of a process element, in document order per type.
     */
    private static Map<String, Node> parseFlowNodes(Element processEl, String laneId) {
        Map<String, Node> nodesById = new LinkedHashMap<>();

        for (String taskType : TASK_TYPES) {
            collectNodes(processEl, taskType, NodeKind.TASK, laneId, nodesById);
        }
        collectNodes(processEl, "startEvent", NodeKind.START_EVENT, laneId, nodesById);
        collectNodes(processEl, "endEvent", NodeKind.END_EVENT, laneId, nodesById);
        for (String gatewayType : GATEWAY_TYPES) {
            collectNodes(processEl, gatewayType, NodeKind.GATEWAY, laneId, nodesById);
        }

        return nodesById;
    }

    private static void collectNodes(Element processEl, String elementName, NodeKind kind,
                                     String laneId, Map<String, Node> nodesById) {
        NodeList nodes = processEl.getElementsByTagNameNS(BPMN_NS, elementName);
        for (int i = 0; i < nodes.getLength(); i++) {
            Element nodeEl = (Element) nodes.item(i);
            String nodeId = nodeEl.getAttribute("id");
            if (nodeId.isEmpty()) {
                continue;
            }
            Node node = Node.builder()
                    .id(nodeId)
                    .kind(kind)
                    .name(nodeEl.getAttribute("name"))
                    .laneId(laneId)
                    .bpmnType(elementName)
                    .gatewayType(kind == NodeKind.GATEWAY ? GatewayType.from(elementName) : null)
                    .build();
            nodesById.putIfAbsent(nodeId, node);
        }
    }

    /**
     * Parses the sequence flows of a process element. Flows missing either endpoint are ignored.
     */
    private static List<Edge> parseSequenceFlows(Element processEl, String laneId) {
        List<Edge> flows = new ArrayList<>();

        NodeList flowNodes = processEl.getElementsByTagNameNS(BPMN_NS, "sequenceFlow");
        for (int i = 0; i < flowNodes.getLength(); i++) {
            Element flowEl = (Element) flowNodes.item(i);
            String sourceRef = flowEl.getAttribute("sourceRef");
            String targetRef = flowEl.getAttribute("targetRef");
            if (sourceRef.isEmpty() || targetRef.isEmpty()) {
                log.debug("Ignoring sequence flow '{}' without both endpoints", flowEl.getAttribute("id"));
                continue;
            }
            String flowId = flowEl.getAttribute("id");
            if (flowId.isEmpty()) {
                flowId = "sf_" + sourceRef + "_" + targetRef;
            }
            flows.add(new Edge(flowId, sourceRef, targetRef, FlowKind.SEQUENCE, laneId));
        }

        return flows;
    }

    /**
     * Parses all message flows of the document. The owning lane is the lane of the source node, if known.
     */
    private static List<Edge> parseMessageFlows(Document doc, List<Lane> lanes) {
        Map<String, String> laneByNode = new HashMap<>();
        for (Lane lane : lanes) {
            lane.nodesById().keySet().forEach(nodeId -> laneByNode.putIfAbsent(nodeId, lane.id()));
        }

        List<Edge> flows = new ArrayList<>();
        NodeList flowNodes = doc.getElementsByTagNameNS(BPMN_NS, "messageFlow");
        for (int i = 0; i < flowNodes.getLength(); i++) {
            Element flowEl = (Element) flowNodes.item(i);
            String sourceRef = flowEl.getAttribute("sourceRef");
            String targetRef = flowEl.getAttribute("targetRef");
            if (sourceRef.isEmpty() || targetRef.isEmpty()) {
                continue;
            }
            String flowId = flowEl.getAttribute("id");
            if (flowId.isEmpty()) {
                flowId = "mf_" + sourceRef + "_" + targetRef;
            }
            flows.add(new Edge(flowId, sourceRef, targetRef, FlowKind.MESSAGE, laneByNode.get(sourceRef)));
        }
        return flows;
    }
}
