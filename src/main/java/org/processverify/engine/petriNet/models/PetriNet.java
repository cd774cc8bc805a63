package org.processverify.engine.petriNet.models;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable place/transition net.
 *
 * @param places         place ids in insertion order
 * @param transitions    transition ids in insertion order
 * @param arcs           arcs in insertion order, without duplicates
 * @param initialMarking tokens per place; only lane start places carry a token
 * @param labels         display text per transition id
 */
public record PetriNet(
        List<String> places,
        List<String> transitions,
        List<Arc> arcs,
        Map<String, Integer> initialMarking,
        Map<String, String> labels
) {
    public PetriNet {
        places = places == null ? List.of() : List.copyOf(places);
        transitions = transitions == null ? List.of() : List.copyOf(transitions);
        arcs = arcs == null ? List.of() : List.copyOf(new LinkedHashSet<>(arcs));
        initialMarking = initialMarking == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(initialMarking));
        labels = labels == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(labels));
    }

    public static PetriNet empty() {
        return new PetriNet(List.of(), List.of(), List.of(), Map.of(), Map.of());
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean isEmpty() {
        return places.isEmpty() && transitions.isEmpty();
    }

    public boolean hasPlace(String placeId) {
        return places.contains(placeId);
    }

    public boolean hasTransition(String transitionId) {
        return transitions.contains(transitionId);
    }

    public String label(String transitionId) {
        return labels.getOrDefault(transitionId, transitionId);
    }

    /**
     * Finds a transition whose label equals the given text.
     */
    public Optional<String> findTransitionByLabel(String text) {
        return transitions.stream()
                .filter(t -> text.equals(label(t)))
                .findFirst();
    }

    /**
     * Places targeted by arcs leaving the transition, in arc order.
     */
    public List<String> postSet(String transitionId) {
        List<String> post = new ArrayList<>();
        for (Arc arc : arcs) {
            if (arc.source().equals(transitionId) && hasPlace(arc.target()) && !post.contains(arc.target())) {
                post.add(arc.target());
            }
        }
        return post;
    }

    /**
     * Places with an arc into the transition, in arc order.
     */
    public List<String> preSet(String transitionId) {
        List<String> pre = new ArrayList<>();
        for (Arc arc : arcs) {
            if (arc.target().equals(transitionId) && hasPlace(arc.source()) && !pre.contains(arc.source())) {
                pre.add(arc.source());
            }
        }
        return pre;
    }

    public int tokenCount() {
        return initialMarking.values().stream().mapToInt(Integer::intValue).sum();
    }

    /**
     * Collects elements while a net is being built. Places, transitions and arcs keep their
     * first insertion and ignore repeats.
     */
    public static final class Builder {
        private final LinkedHashSet<String> places = new LinkedHashSet<>();
        private final LinkedHashSet<String> transitions = new LinkedHashSet<>();
        private final LinkedHashSet<Arc> arcs = new LinkedHashSet<>();
        private final Map<String, Integer> initialMarking = new LinkedHashMap<>();
        private final Map<String, String> labels = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder place(String placeId) {
            places.add(placeId);
            return this;
        }

        public Builder markedPlace(String placeId, int tokens) {
            places.add(placeId);
            initialMarking.put(placeId, tokens);
            return this;
        }

        public Builder transition(String transitionId, String label) {
            transitions.add(transitionId);
            labels.putIfAbsent(transitionId, label);
            return this;
        }

        public Builder arc(String source, String target) {
            arcs.add(new Arc(source, target));
            return this;
        }

        public boolean hasPlace(String placeId) {
            return places.contains(placeId);
        }

        public boolean hasTransition(String transitionId) {
            return transitions.contains(transitionId);
        }

        /**
         * Adds every element of another net. Markings of distinct lanes never overlap.
         */
        public Builder merge(PetriNet net) {
            places.addAll(net.places());
            net.transitions().forEach(t -> transition(t, net.label(t)));
            arcs.addAll(net.arcs());
            initialMarking.putAll(net.initialMarking());
            return this;
        }

        public PetriNet build() {
            return new PetriNet(new ArrayList<>(places), new ArrayList<>(transitions),
                    new ArrayList<>(arcs), initialMarking, labels);
        }
    }
}
