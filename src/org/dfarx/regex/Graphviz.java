/* @LICENSE@  
 */
package org.dfarx.regex;

import java.util.Collection;

/**
 * Renders an automaton as a GraphViz "dot" digraph: a point shaped
 * <code>start</code> node leading to the start state, accept states drawn
 * as double circles, and one labeled edge per transition.
 * <p>
 * The output uses <code>\n</code> line endings regardless of platform, and
 * lists accept states and edges in the order given.
 */
public final class Graphviz {

    private Graphviz() {}   // not instantiable.

    public static String generate(int start, Collection<Integer> acceptStates,
            Collection<Transition> edges) {
        StringBuilder sb = new StringBuilder();
        sb.append("digraph {\n");
        sb.append("rankdir=LR;\n");
        sb.append("node [shape=point]; start;\n");
        sb.append("node [shape=doublecircle]; ");
        for (int state : acceptStates) {
            sb.append(state).append("; ");
        }
        sb.append('\n');
        sb.append("node [shape=circle];\n");
        sb.append("start -> ").append(start).append(";\n");
        for (Transition t : edges) {
            sb
                .append(t.from()).append(" -> ").append(t.to())
                .append(" [label=\"").append(t.symbol()).append("\"];\n");
        }
        sb.append('}');
        return sb.toString();
    }

    /**
     * @return the graph of the reachable part of <code>dfa</code>.
     */
    public static String generate(DFA dfa) {
        return generate(0, dfa.reachableAcceptStates(), dfa.transitions());
    }

    /**
     * @return the graph of <code>nfa</code>, epsilon closures folded in.
     */
    public static String generate(NFA nfa) {
        return generate(0, nfa.acceptStates(), nfa.transitions());
    }
}
