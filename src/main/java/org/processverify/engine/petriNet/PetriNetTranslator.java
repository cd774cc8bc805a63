package org.processverify.engine.petriNet;

import org.processverify.engine.bpmn.BpmnHelper;
import org.processverify.engine.bpmn.BpmnValidator;
import org.processverify.engine.bpmn.models.Edge;
import org.processverify.engine.bpmn.models.Lane;
import org.processverify.engine.bpmn.models.Node;
import org.processverify.engine.bpmn.models.ProcessGraph;
import org.processverify.engine.config.models.EngineConfig;
import org.processverify.engine.config.models.NamingConvention;
import org.processverify.engine.errors.GraphEngineException;
import org.processverify.engine.errors.Stage;
import org.processverify.engine.errors.StructuralParseException;
import org.processverify.engine.petriNet.models.PetriNet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Translates a BPMN process graph into a single Petri net.
 * <p>
 * Every lane gets a start place holding one token and an end place. Every task and gateway
 * becomes {@code pre-place -> transition -> post-place}; all gateway types share this pattern,
 * so split and join semantics are not encoded. Sequence flows become direct place-to-place arcs
 * (start events map to the lane start place, end events to the lane end place). Lane nets are
 * merged and each message flow gets its own message place wired to the sending and receiving
 * transitions.
 */
public class PetriNetTranslator {
    private static final Logger log = LoggerFactory.getLogger(PetriNetTranslator.class);

    private final EngineConfig config;
    private final NamingConvention naming;

    public PetriNetTranslator() {
        this(new EngineConfig());
    }

    public PetriNetTranslator(EngineConfig config) {
        this.config = config;
        this.naming = config.namingConvention;
    }

    public PetriNet translate(ProcessGraph graph) {
        Map<String, String> laneNames = lanePlaceNames(graph.lanes());
        List<PetriNet> laneNets = new ArrayList<>();
        for (Lane lane : graph.lanes()) {
            laneNets.add(translateLane(lane, laneNames.get(lane.id())));
        }
        PetriNet net = merge(laneNets, graph.messageFlows());
        log.info("Translated {} diagram '{}': {} places, {} transitions, {} arcs, initial marking {}",
                graph.type().label(), graph.id(), net.places().size(), net.transitions().size(),
                net.arcs().size(), net.initialMarking());
        return net;
    }

    public PetriNet translateLane(Lane lane) {
        return translateLane(lane, placeSafe(lane.displayName()));
    }

    /**
     * @param laneName suffix of the lane's start and end places, unique within the merged net
     */
    public PetriNet translateLane(Lane lane, String laneName) {
        PetriNet.Builder builder = PetriNet.builder();

        String startPlace = naming.startPlace(laneName);
        String endPlace = naming.endPlace(laneName);
        builder.markedPlace(startPlace, 1);
        builder.place(endPlace);

        List<Node> activities = new ArrayList<>(lane.tasks());
        activities.addAll(lane.gateways());
        for (Node node : activities) {
            String prePlace = naming.prePlace(node.id());
            String postPlace = naming.postPlace(node.id());
            String transition = naming.transition(node.id());
            builder.place(prePlace)
                    .place(postPlace)
                    .transition(transition, transition)
                    .arc(prePlace, transition)
                    .arc(transition, postPlace);
        }

        for (Edge flow : lane.sequenceFlows()) {
            String sourcePlace = lane.isStartEvent(flow.sourceRef())
                    ? startPlace
                    : naming.postPlace(flow.sourceRef());
            String targetPlace = lane.isEndEvent(flow.targetRef())
                    ? endPlace
                    : naming.prePlace(flow.targetRef());

            if (builder.hasPlace(sourcePlace) && builder.hasPlace(targetPlace)) {
                builder.arc(sourcePlace, targetPlace);
            } else {
                log.debug("Sequence flow '{}' in lane '{}' has no place pair, skipping it", flow.id(), lane.id());
            }
        }

        return builder.build();
    }

    /**
     * Unions the lane nets and adds one message place per message flow. A message flow whose
     * sender or receiver has no transition keeps its place but loses that arc.
     */
    public PetriNet merge(List<PetriNet> laneNets, List<Edge> messageFlows) {
        PetriNet.Builder builder = PetriNet.builder();
        laneNets.forEach(builder::merge);

        for (Edge flow : messageFlows) {
            String messagePlace = naming.messagePlace(flow.id());
            builder.place(messagePlace);

            String sourceTransition = naming.transition(flow.sourceRef());
            if (builder.hasTransition(sourceTransition)) {
                builder.arc(sourceTransition, messagePlace);
            } else {
                log.warn("Message flow '{}': no transition '{}' for its source, arc skipped",
                        flow.id(), sourceTransition);
            }

            String targetTransition = naming.transition(flow.targetRef());
            if (builder.hasTransition(targetTransition)) {
                builder.arc(messagePlace, targetTransition);
            } else {
                log.warn("Message flow '{}': no transition '{}' for its target, arc skipped",
                        flow.id(), targetTransition);
            }
        }

        return builder.build();
    }

    /**
     * Translates a BPMN file. An unreadable or malformed file yields an empty net.
     */
    public PetriNet translateBpmnFile(String bpmnFilePath) {
        try {
            if (config.validateBpmnInput) {
                BpmnValidator.validate(new File(bpmnFilePath));
            }
            return translate(BpmnHelper.parseBpmnFile(bpmnFilePath));
        } catch (StructuralParseException e) {
            log.warn("Cannot translate '{}', returning an empty net: {}", bpmnFilePath, e.getMessage());
            return PetriNet.empty();
        }
    }

    /**
     * Translates a BPMN file and writes the net next to it as {@code <name>_petri_net.pnml}.
     *
     * @return the written PNML path
     */
    public Path convertBpmnFile(String bpmnFilePath) {
        PetriNet net = translateBpmnFile(bpmnFilePath);
        Path output = pnmlPathFor(bpmnFilePath);
        try {
            new PnmlWriter(config.petriNet, naming).write(net, output);
        } catch (IOException e) {
            throw new GraphEngineException("Failed to write PNML", output.toString(), Stage.TRANSLATION, e);
        }
        return output;
    }

    public Path pnmlPathFor(String bpmnFilePath) {
        Path bpmnPath = Paths.get(bpmnFilePath);
        String fileName = bpmnPath.getFileName().toString();
        String baseName = fileName.endsWith(".bpmn")
                ? fileName.substring(0, fileName.length() - ".bpmn".length())
                : fileName;
        return bpmnPath.resolveSibling(baseName + config.outputFiles.pnmlSuffix);
    }

    /**
     * Maps each lane id to its place suffix. Lanes whose display names collide after
     * sanitizing get their id appended: two "Clerk" participants P1 and P2 yield
     * {@code Clerk_P1} and {@code Clerk_P2}.
     */
    static Map<String, String> lanePlaceNames(List<Lane> lanes) {
        Map<String, Long> occurrences = lanes.stream()
                .collect(Collectors.groupingBy(lane -> placeSafe(lane.displayName()), Collectors.counting()));

        Map<String, String> names = new LinkedHashMap<>();
        for (Lane lane : lanes) {
            String name = placeSafe(lane.displayName());
            if (occurrences.get(name) > 1) {
                name = name + "_" + placeSafe(lane.id());
                log.debug("Lane name '{}' is shared, using '{}' for lane '{}'", lane.displayName(), name, lane.id());
            }
            names.put(lane.id(), name);
        }
        return names;
    }

    private static String placeSafe(String name) {
        return name.trim().replaceAll("\\s+", "_");
    }
}
