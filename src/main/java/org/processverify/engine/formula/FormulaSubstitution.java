package org.processverify.engine.formula;

import org.processverify.engine.config.models.NamingConvention;
import org.processverify.engine.errors.LookupMissException;
import org.processverify.engine.errors.Stage;
import org.processverify.engine.formula.models.CtlConstraint;
import org.processverify.engine.formula.models.TransformedConstraint;
import org.processverify.engine.formula.models.TransformedCtlDocument;
import org.processverify.engine.petriNet.models.PetriNet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Rewrites CTL formulas over task symbols into formulas over Petri-net places.
 * <p>
 * A symbol {@code s} maps to transition {@code t_s} (or to the transition labelled {@code s}).
 * Its expression is the transition's only post-place, or {@code (p1 AND ... AND pn)} for several.
 * Symbols are replaced as whole identifiers in one pass, so {@code T1} never matches inside
 * {@code T10} and inserted place names are not rescanned.
 */
public class FormulaSubstitution {
    private static final Logger log = LoggerFactory.getLogger(FormulaSubstitution.class);

    private static final String IDENTIFIER_CHAR = "[A-Za-z0-9_]";
    private static final Pattern IDENTIFIER = Pattern.compile(IDENTIFIER_CHAR + "+");

    private final NamingConvention naming;

    public FormulaSubstitution() {
        this(new NamingConvention());
    }

    public FormulaSubstitution(NamingConvention naming) {
        this.naming = naming;
    }

    /**
     * @throws LookupMissException if no transition belongs to the symbol
     */
    public String resolveTransition(PetriNet net, String symbol) {
        String expected = naming.transition(symbol);
        if (net.hasTransition(expected)) {
            return expected;
        }
        return net.findTransitionByLabel(symbol)
                .orElseThrow(() -> new LookupMissException(
                        "No transition '" + expected + "' or transition labelled with the symbol",
                        symbol, Stage.SUBSTITUTION));
    }

    /**
     * @throws LookupMissException if the symbol has no transition or its transition has no post-place
     */
    public String expressionFor(PetriNet net, String symbol) {
        String transition = resolveTransition(net, symbol);
        List<String> postPlaces = net.postSet(transition);
        if (postPlaces.isEmpty()) {
            throw new LookupMissException(
                    "Transition '" + transition + "' has no post-place", symbol, Stage.SUBSTITUTION);
        }
        if (postPlaces.size() == 1) {
            return postPlaces.get(0);
        }
        return "(" + String.join(" AND ", postPlaces) + ")";
    }

    /**
     * Expressions for every symbol that resolves in the net. Symbols that do not resolve are
     * left out; {@link #transform} reports them once a formula actually uses them.
     */
    public Map<String, String> substitutions(PetriNet net, Collection<String> symbols) {
        Map<String, String> substitutions = new LinkedHashMap<>();
        for (String symbol : new LinkedHashSet<>(symbols)) {
            try {
                substitutions.put(symbol, expressionFor(net, symbol));
            } catch (LookupMissException e) {
                log.debug("Symbol '{}' has no place expression: {}", symbol, e.getMessage());
            }
        }
        return substitutions;
    }

    /**
     * Replaces every whole-identifier occurrence of a mapped symbol in one pass.
     */
    public static String rewrite(String formula, Map<String, String> substitutions) {
        if (formula == null || formula.isEmpty() || substitutions.isEmpty()) {
            return formula;
        }
        // longest first, so that alternation prefers "T10" over "T1"
        String alternation = substitutions.keySet().stream()
                .sorted(Comparator.comparingInt(String::length).reversed().thenComparing(Comparator.naturalOrder()))
                .map(Pattern::quote)
                .collect(Collectors.joining("|"));
        Pattern pattern = Pattern.compile(
                "(?<!" + IDENTIFIER_CHAR + ")(?:" + alternation + ")(?!" + IDENTIFIER_CHAR + ")");

        Matcher matcher = pattern.matcher(formula);
        StringBuilder rewritten = new StringBuilder();
        while (matcher.find()) {
            matcher.appendReplacement(rewritten, Matcher.quoteReplacement(substitutions.get(matcher.group())));
        }
        matcher.appendTail(rewritten);
        return rewritten.toString();
    }

    /**
     * Rewrites a single formula.
     *
     * @throws LookupMissException if the formula uses one of {@code symbols} that has no place expression
     */
    public String substitute(PetriNet net, String formula, Collection<String> symbols) {
        Map<String, String> substitutions = substitutions(net, symbols);
        requireMapped(formula, null, symbols, substitutions);
        return rewrite(formula, substitutions);
    }

    /**
     * Rewrites every constraint formula.
     *
     * @param net         translated net
     * @param symbols     task symbols of the symbol table
     * @param constraints constraints over those symbols
     * @throws LookupMissException if a formula uses a symbol that has no place expression
     */
    public TransformedCtlDocument transform(PetriNet net, Collection<String> symbols, List<CtlConstraint> constraints) {
        Map<String, String> substitutions = substitutions(net, symbols);

        List<TransformedConstraint> transformed = new ArrayList<>();
        for (CtlConstraint constraint : constraints) {
            requireMapped(constraint.ctlFormula(), constraint.constraintId(), symbols, substitutions);
            transformed.add(new TransformedConstraint(constraint.constraintId(), constraint.ctlFormula(),
                    rewrite(constraint.ctlFormula(), substitutions)));
        }

        log.info("Transformed {} CTL constraints with {} of {} symbols mapped to places",
                transformed.size(), substitutions.size(), new LinkedHashSet<>(symbols).size());
        return new TransformedCtlDocument(substitutions, transformed);
    }

    private static void requireMapped(String formula, String constraintId, Collection<String> symbols,
                                      Map<String, String> substitutions) {
        if (formula == null) {
            return;
        }
        Set<String> known = new LinkedHashSet<>(symbols);
        Matcher matcher = IDENTIFIER.matcher(formula);
        while (matcher.find()) {
            String token = matcher.group();
            if (known.contains(token) && !substitutions.containsKey(token)) {
                String where = constraintId == null ? "" : " in constraint " + constraintId;
                throw new LookupMissException(
                        "Symbol used" + where + " has no place expression", token, Stage.SUBSTITUTION);
            }
        }
    }
}
