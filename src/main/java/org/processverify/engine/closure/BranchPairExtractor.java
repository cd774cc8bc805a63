package org.processverify.engine.closure;

import org.processverify.engine.closure.models.BranchPair;
import org.processverify.engine.closure.models.ControlFlow;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Finds the positions in a control flow where a gateway is needed: several sources joining
 * into one target (convergent) and one source splitting into several targets (divergent).
 */
public class BranchPairExtractor {

    /**
     * @return convergent pairs in order of first target appearance, then divergent pairs in
     * order of first source appearance; member lists are deduplicated and sorted
     */
    public static List<BranchPair> extract(List<ControlFlow> controlFlow) {
        Map<String, List<String>> sourcesByTarget = new LinkedHashMap<>();
        Map<String, List<String>> targetsBySource = new LinkedHashMap<>();
        for (ControlFlow flow : controlFlow) {
            if (flow.from() == null || flow.to() == null) {
                continue;
            }
            sourcesByTarget.computeIfAbsent(flow.to(), k -> new ArrayList<>()).add(flow.from());
            targetsBySource.computeIfAbsent(flow.from(), k -> new ArrayList<>()).add(flow.to());
        }

        List<BranchPair> pairs = new ArrayList<>();
        // a repeated identical flow still counts as several incoming flows
        sourcesByTarget.forEach((target, sources) -> {
            if (sources.size() > 1) {
                pairs.add(BranchPair.convergent(sortedUnique(sources), target));
            }
        });
        targetsBySource.forEach((source, targets) -> {
            if (targets.size() > 1) {
                pairs.add(BranchPair.divergent(source, sortedUnique(targets)));
            }
        });
        return pairs;
    }

    private static List<String> sortedUnique(List<String> symbols) {
        return new ArrayList<>(new TreeSet<>(symbols));
    }
}
