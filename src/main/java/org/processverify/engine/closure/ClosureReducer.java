package org.processverify.engine.closure;

import org.processverify.engine.closure.models.ControlFlow;
import org.processverify.engine.closure.models.GatewaySpec;
import org.processverify.engine.config.models.ClosureSettings;
import org.processverify.engine.errors.StructuralInconsistencyException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;

/**
 * Makes gateway routing explicit in a control-flow edge set.
 * <p>
 * For every gateway g the input closure IC(g) and output closure OC(g) are the leaf symbols
 * reached by expanding nested gateways among its inputs and outputs. A flow (u, v) with
 * u in IC(g) and v in OC(g) for some g is subsumed by g and removed. Then every missing
 * (input, g) and (g, output) flow is appended, tagged with the routing actor.
 * <p>
 * Surviving flows keep their input order; synthesized flows follow in gateway order.
 * Applying the reduction to its own output returns it unchanged.
 */
public class ClosureReducer {
    private static final Logger log = LoggerFactory.getLogger(ClosureReducer.class);

    public static final String DEFAULT_ROUTING_ACTOR = new ClosureSettings().routingActor;

    public static List<ControlFlow> reduce(List<ControlFlow> controlFlow, List<GatewaySpec> gateways) {
        return reduce(controlFlow, gateways, DEFAULT_ROUTING_ACTOR);
    }

    /**
     * @param controlFlow  author-asserted flows
     * @param gateways     gateways with their (possibly nested) inputs and outputs
     * @param routingActor actor written on synthesized flows
     * @return the reduced and augmented flow list
     * @throws StructuralInconsistencyException if gateways reference each other in a cycle
     */
    public static List<ControlFlow> reduce(List<ControlFlow> controlFlow, List<GatewaySpec> gateways,
                                           String routingActor) {
        Objects.requireNonNull(controlFlow, "controlFlow must not be null");
        Objects.requireNonNull(gateways, "gateways must not be null");

        Map<String, GatewaySpec> gatewayMap = indexGateways(gateways);

        Map<String, Set<String>> inputClosures = closures(gatewayMap, GatewaySpec::fromTasks);
        Map<String, Set<String>> outputClosures = closures(gatewayMap, GatewaySpec::toTasks);

        List<ControlFlow> reduced = new ArrayList<>();
        int removed = 0;
        for (ControlFlow flow : controlFlow) {
            if (isSubsumed(flow, gatewayMap.keySet(), inputClosures, outputClosures)) {
                log.debug("Removing flow {} subsumed by a gateway", flow.key());
                removed++;
            } else {
                reduced.add(flow);
            }
        }

        int added = 0;
        for (GatewaySpec gateway : gateways) {
            String symbol = gateway.gatewaySymbol();
            for (String input : gateway.fromTasks()) {
                if (!containsFlow(reduced, input, symbol)) {
                    reduced.add(new ControlFlow(input, symbol, routingActor));
                    added++;
                }
            }
            for (String output : gateway.toTasks()) {
                if (!containsFlow(reduced, symbol, output)) {
                    reduced.add(new ControlFlow(symbol, output, routingActor));
                    added++;
                }
            }
        }

        log.info("Closure reduction over {} gateways: {} flows in, {} removed, {} added, {} out",
                gatewayMap.size(), controlFlow.size(), removed, added, reduced.size());
        return reduced;
    }

    /**
     * Input closure of a single gateway: the leaf symbols feeding it, nested gateways expanded.
     */
    public static Set<String> inputClosure(String gatewaySymbol, List<GatewaySpec> gateways) {
        return closureOf(gatewaySymbol, indexGateways(gateways), GatewaySpec::fromTasks, new HashMap<>());
    }

    /**
     * Output closure of a single gateway: the leaf symbols it routes to, nested gateways expanded.
     */
    public static Set<String> outputClosure(String gatewaySymbol, List<GatewaySpec> gateways) {
        return closureOf(gatewaySymbol, indexGateways(gateways), GatewaySpec::toTasks, new HashMap<>());
    }

    private static Map<String, GatewaySpec> indexGateways(List<GatewaySpec> gateways) {
        Map<String, GatewaySpec> gatewayMap = new LinkedHashMap<>();
        for (GatewaySpec gateway : gateways) {
            if (gateway.gatewaySymbol() == null || gateway.gatewaySymbol().isBlank()) {
                throw new IllegalArgumentException("Gateway without a symbol: " + gateway);
            }
            if (gatewayMap.putIfAbsent(gateway.gatewaySymbol(), gateway) != null) {
                log.warn("Duplicate gateway symbol '{}', keeping its first definition for closures",
                        gateway.gatewaySymbol());
            }
        }
        return gatewayMap;
    }

    private static Map<String, Set<String>> closures(Map<String, GatewaySpec> gatewayMap,
                                                     Function<GatewaySpec, List<String>> members) {
        Map<String, Set<String>> memo = new HashMap<>();
        for (String symbol : gatewayMap.keySet()) {
            closureOf(symbol, gatewayMap, members, memo);
        }
        return memo;
    }

    /**
     * Depth-first expansion with an explicit stack. Finished gateways are memoized, so a gateway
     * shared by several parents is expanded once; meeting a gateway that is still on the stack is a cycle.
     */
    private static Set<String> closureOf(String root, Map<String, GatewaySpec> gatewayMap,
                                         Function<GatewaySpec, List<String>> members,
                                         Map<String, Set<String>> memo) {
        if (memo.containsKey(root)) {
            return memo.get(root);
        }
        if (!gatewayMap.containsKey(root)) {
            return Set.of(root);
        }

        List<Frame> stack = new ArrayList<>();
        Set<String> inProgress = new HashSet<>();
        stack.add(new Frame(root, members.apply(gatewayMap.get(root))));
        inProgress.add(root);

        while (!stack.isEmpty()) {
            Frame frame = stack.get(stack.size() - 1);
            if (frame.next < frame.members.size()) {
                String member = frame.members.get(frame.next++);
                if (member == null) {
                    continue;
                }
                if (!gatewayMap.containsKey(member)) {
                    frame.leaves.add(member);
                } else if (memo.containsKey(member)) {
                    frame.leaves.addAll(memo.get(member));
                } else if (inProgress.contains(member)) {
                    throw new StructuralInconsistencyException(
                            "Cyclic gateway nesting", member, cyclePath(stack, member));
                } else {
                    stack.add(new Frame(member, members.apply(gatewayMap.get(member))));
                    inProgress.add(member);
                }
            } else {
                stack.remove(stack.size() - 1);
                inProgress.remove(frame.symbol);
                memo.put(frame.symbol, Collections.unmodifiableSet(frame.leaves));
                if (!stack.isEmpty()) {
                    stack.get(stack.size() - 1).leaves.addAll(frame.leaves);
                }
            }
        }
        return memo.get(root);
    }

    private static List<String> cyclePath(List<Frame> stack, String repeated) {
        List<String> path = new ArrayList<>();
        boolean inCycle = false;
        for (Frame frame : stack) {
            if (frame.symbol.equals(repeated)) {
                inCycle = true;
            }
            if (inCycle) {
                path.add(frame.symbol);
            }
        }
        path.add(repeated);
        return path;
    }

    private static boolean isSubsumed(ControlFlow flow, Set<String> gatewaySymbols,
                                      Map<String, Set<String>> inputClosures,
                                      Map<String, Set<String>> outputClosures) {
        if (flow.from() == null || flow.to() == null) {
            return false;
        }
        for (String symbol : gatewaySymbols) {
            if (inputClosures.get(symbol).contains(flow.from()) && outputClosures.get(symbol).contains(flow.to())) {
                return true;
            }
        }
        return false;
    }

    private static boolean containsFlow(List<ControlFlow> flows, String from, String to) {
        return flows.stream().anyMatch(flow -> flow.connects(from, to));
    }

    private static final class Frame {
        private final String symbol;
        private final List<String> members;
        private final Set<String> leaves = new LinkedHashSet<>();
        private int next;

        private Frame(String symbol, List<String> members) {
            this.symbol = symbol;
            this.members = members;
        }
    }
}
