/* @LICENSE@  
 */

/**
 * NFA: Nondeterministic Finite Automata, with epsilon closures folded in as
 * they are built.
 */
package org.dfarx.regex;

import static org.dfarx.regex.Misc.LS;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.dfarx.regex.AST.And;
import org.dfarx.regex.AST.Leaf;
import org.dfarx.regex.AST.LeafCharClass;
import org.dfarx.regex.AST.Node;
import org.dfarx.regex.AST.Or;
import org.dfarx.regex.AST.RepeatPlus;
import org.dfarx.regex.AST.RepeatStar;

/**
 * A nondeterministic automaton built from an {@link AST}. State 0 is the
 * start state; there is exactly one accept state, the state the traversal of
 * the root node ends in.
 * <p>
 * Implementation notes:
 * <p>
 * Epsilon edges are never stored as edges. Instead the epsilon table maps
 * each state to the set of states it can be reached from through epsilon
 * moves alone (its epsilon sources), and every insertion keeps two things
 * true:
 * <ul>
 * <li>the epsilon sources of a state are transitively closed;</li>
 * <li>the transition map of a state holds every transition of every state in
 * its epsilon closure.</li>
 * </ul>
 * So no closure is ever computed after construction: the transition map of a
 * state <em>is</em> the transition map of its closure, and the accept states
 * are the accept state plus its epsilon sources.
 * <p>
 * Loops reuse the state they start from as their anchor when that state has
 * no outgoing transitions yet. A state may not be reused while it is
 * "pinned": the shared input of an alternation is pinned while its branches
 * are built (both branches leave from it), and the anchor of a star is pinned
 * while its body is built (the body comes back to it).
 */
public final class NFA {

    private static final Logger logger = Logger.getLogger("org.dfarx.regex");
    private static final Level level = Level.FINER;

    /**
     * State ids are 16 bit.
     */
    static final int MAX_STATE_COUNT = 1 << 16;

    private final List<MultiMap<Character, Integer>> table = 
        new ArrayList<MultiMap<Character, Integer>>();
    
    /*
     * state -> epsilon sources of the state
     */
    private final MultiMap<Integer, Integer> epsilonTable = 
        new MultiMap<Integer, Integer>();
    
    /*
     * state -> pin count, construction only
     */
    private final Map<Integer, Integer> pinned = new HashMap<Integer, Integer>();
    
    private final int accept;

    /**
     * Construct the NFA by a post-order traversal of <code>ast</code>,
     * starting from the root node with a fresh start state and no fixed
     * output state.
     * 
     * @throws ConstructionException
     *             if the state count exceeds {@link #MAX_STATE_COUNT}.
     */
    NFA(final AST ast) {
        final int start = addState();
        assert start == 0;
        accept = build(ast, ast.rootId(), start, null);
        assert pinned.isEmpty() : pinned;
        
        if (logger.isLoggable(level)) {
            logger.log(level, "nfa: " + toString());
        }
    }

    /**
     * Build the automaton fragment for one node.
     * 
     * @param id
     *            the node
     * @param input
     *            the state the fragment starts from
     * @param output
     *            the state the fragment must end in, or null to let the
     *            fragment choose
     * @return the state the fragment ends in; <code>output</code> if it was
     *         given.
     */
    private int build(AST ast, int id, int input, Integer output) {
        final Node node = ast.get(id);
        
        if (node instanceof Leaf) {
            final int out = stateOrNew(output);
            addTransition(input, out, ((Leaf) node).letter);
            return out;
            
        } else if (node instanceof LeafCharClass) {
            final CharClass cc = ((LeafCharClass) node).cc;
            final int out = stateOrNew(output);
            for (char c = cc.first; c <= cc.last; ++c) {
                addTransition(input, out, c);
            }
            return out;
            
        } else if (node instanceof And) {
            // the chain x (y (z ...)) is walked, not recursed into
            int intermediate = input;
            int current = id;
            while (ast.get(current) instanceof And) {
                final And and = (And) ast.get(current);
                intermediate = build(ast, and.first, intermediate, null);
                current = and.second;
            }
            return build(ast, current, intermediate, output);
            
        } else if (node instanceof Or) {
            /*
             * every branch leaves from input, so none may take it over as a
             * loop anchor. Chains share the input and the join state.
             */
            pin(input);
            try {
                final int join = stateOrNew(output);
                int current = id;
                while (ast.get(current) instanceof Or) {
                    final Or or = (Or) ast.get(current);
                    build(ast, or.first, input, join);
                    current = or.second;
                }
                build(ast, current, input, join);
                return join;
            } finally {
                unpin(input);
            }
            
        } else if (node instanceof RepeatStar) {
            final int anchor = loopAnchor(input);
            pin(anchor);
            try {
                build(ast, ((RepeatStar) node).child, anchor, anchor);
            } finally {
                unpin(anchor);
            }
            if (output != null) {
                addEpsilon(anchor, output);
                return output;
            }
            return anchor;
            
        } else if (node instanceof RepeatPlus) {
            final int anchor = loopAnchor(input);
            final int loopOutput = build(
                ast, ((RepeatPlus) node).child, anchor, null);
            addEpsilon(loopOutput, anchor);
            if (output != null) {
                addEpsilon(loopOutput, output);
                return output;
            }
            return loopOutput;
        }
        throw new AssertionError("unknown node type " + node);
    }

    private int addState() {
        if (table.size() == MAX_STATE_COUNT) {
            throw new ConstructionException(
                "NFA state count exceeded: " + MAX_STATE_COUNT);
        }
        table.add(new MultiMap<Character, Integer>());
        return table.size() - 1;
    }

    private int stateOrNew(Integer state) {
        return state != null ? state : addState();
    }

    /**
     * @return <code>state</code> itself if it is reusable, otherwise a new
     *         state linked from <code>state</code> by an epsilon move.
     */
    private int loopAnchor(int state) {
        if (isLeafState(state) && !pinned.containsKey(state)) {
            return state;
        }
        final int anchor = addState();
        addEpsilon(state, anchor);
        return anchor;
    }

    private void pin(int state) {
        Integer count = pinned.get(state);
        pinned.put(state, count == null ? 1 : count + 1);
    }

    private void unpin(int state) {
        Integer count = pinned.get(state);
        assert count != null : state;
        if (count == 1) {
            pinned.remove(state);
        } else {
            pinned.put(state, count - 1);
        }
    }

    /**
     * Add a labeled transition, and the same transition out of every state
     * <code>from</code> is epsilon reachable from.
     */
    void addTransition(int from, int to, char symbol) {
        assert from < table.size() && to < table.size();
        table.get(from).add(symbol, to);
        for (int source : epsilonTable.get(from)) {
            table.get(source).add(symbol, to);
        }
    }

    /**
     * Add an epsilon move. Every state that reaches <code>from</code> (and
     * <code>from</code> itself) now reaches everything <code>to</code>
     * reaches: the transitions of <code>to</code> are copied onto them, and
     * they become epsilon sources of <code>to</code> and of every state in
     * the closure of <code>to</code>.
     */
    void addEpsilon(int from, int to) {
        assert from < table.size() && to < table.size();
        if (from == to) return;

        final Set<Integer> sources = epsilonTable.get(from);
        sources.add(from);

        final Set<Integer> targets = new LinkedHashSet<Integer>();
        targets.add(to);
        for (Map.Entry<Integer, Set<Integer>> e 
                : epsilonTable.asMap().entrySet()) {
            if (e.getValue().contains(to)) targets.add(e.getKey());
        }
        for (int target : targets) {
            Set<Integer> newSources = new LinkedHashSet<Integer>(sources);
            newSources.remove(target);
            epsilonTable.addAll(target, newSources);
        }

        final MultiMap<Character, Integer> closure = 
            new MultiMap<Character, Integer>(table.get(to));
        for (int source : sources) {
            table.get(source).addAll(closure);
        }
    }

    private boolean isLeafState(int state) {
        return table.get(state).isEmpty();
    }

    /**
     * The transition relation of one state, epsilon closure included. The
     * returned map is live and must not be modified.
     */
    MultiMap<Character, Integer> transitionsFrom(int state) {
        return table.get(state);
    }

    /**
     * @return a copy of the set of states <code>state</code> can be reached
     *         from by epsilon moves alone.
     */
    Set<Integer> epsilonSources(int state) {
        return epsilonTable.get(state);
    }

    /**
     * @return the number of states.
     */
    public int size() {
        return table.size();
    }

    /**
     * @return the single state the automaton accepts in, not counting the
     *         states which reach it by epsilon moves.
     */
    public int acceptState() {
        return accept;
    }

    /**
     * @return the accept state and every state it can be reached from by
     *         epsilon moves, in ascending order.
     */
    public SortedSet<Integer> acceptStates() {
        SortedSet<Integer> states = new TreeSet<Integer>(
            epsilonTable.get(accept));
        states.add(accept);
        return Collections.unmodifiableSortedSet(states);
    }

    /**
     * @return every transition of the automaton, in their natural order.
     */
    public List<Transition> transitions() {
        List<Transition> ret = new ArrayList<Transition>();
        for (int state = 0; state < table.size(); ++state) {
            for (Map.Entry<Character, Set<Integer>> e 
                    : table.get(state).asMap().entrySet()) {
                for (int to : e.getValue()) {
                    ret.add(new Transition(state, to, e.getKey()));
                }
            }
        }
        Collections.sort(ret);
        return ret;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb
            .append("total states: ").append(size())
            .append(" accept: ").append(acceptStates())
            .append(LS);
        for (int state = 0; state < table.size(); ++state) {
            sb.append("state: ").append(state);
            if (state == accept) sb.append(" (accept)");
            if (epsilonTable.containsKey(state)) {
                sb.append(" eps<-").append(epsilonTable.get(state));
            }
            sb.append(LS);
            sb.append("    ").append(table.get(state)).append(LS);
        }
        return sb.toString();
    }
}
