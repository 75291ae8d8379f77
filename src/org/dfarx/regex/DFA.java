/* @LICENSE@  
 */
package org.dfarx.regex;

import static org.dfarx.regex.Misc.LS;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * A deterministic automaton: at most one transition per state and symbol.
 * State 0 is the start state. A missing transition rejects; no dead state is
 * ever materialized. Instances are immutable and safe for concurrent use.
 */
public final class DFA {

    private static final Logger logger = Logger.getLogger("org.dfarx.regex");
    // private static final Level level = Level.INFO;
    private static final Level level = Level.FINEST;

    private final List<Map<Character, Integer>> table;
    private final SortedSet<Integer> acceptStates;
    private final int compositeCount;

    /**
     * Construct a DFA from an NFA by subset construction.
     * <p>
     * The ids of the NFA states are kept: state <i>n</i> of the DFA stands for
     * state <i>n</i> of the NFA (whose transitions already include its epsilon
     * closure). Whenever a symbol leads to more than one NFA state, a
     * composite state standing for that set is allocated past the highest id
     * so far, unless one for the same set already exists. States are
     * processed in id order until the high-water mark stops moving.
     * 
     * @throws ConstructionException
     *             if the state count exceeds what a 16 bit id addresses.
     */
    DFA(final NFA nfa) {
        
        final List<Map<Character, Integer>> table = 
            new ArrayList<Map<Character, Integer>>();
        final Map<Integer, Set<Integer>> compositeStates = 
            new LinkedHashMap<Integer, Set<Integer>>();
        final Map<Set<Integer>, Integer> compositeIds = 
            new HashMap<Set<Integer>, Integer>();
        
        int highest = nfa.size() - 1;
        for (int current = 0; current <= highest; ++current) {
            
            final MultiMap<Character, Integer> nfaTransitions;
            final Set<Integer> constituents = compositeStates.get(current);
            if (constituents == null) {
                nfaTransitions = nfa.transitionsFrom(current);
            } else {
                List<MultiMap<Character, Integer>> maps = 
                    new ArrayList<MultiMap<Character, Integer>>();
                for (int state : constituents) {
                    maps.add(nfa.transitionsFrom(state));
                }
                nfaTransitions = MultiMap.union(maps);
            }
            
            final Map<Character, Integer> transitions = 
                new LinkedHashMap<Character, Integer>();
            for (Map.Entry<Character, Set<Integer>> e 
                    : nfaTransitions.asMap().entrySet()) {
                final Set<Integer> next = e.getValue();
                assert !next.isEmpty();
                int ns;
                if (next.size() == 1) {
                    ns = next.iterator().next();
                } else {
                    Integer existing = compositeIds.get(next);
                    if (existing != null) {
                        ns = existing;
                    } else {
                        if (highest + 1 == NFA.MAX_STATE_COUNT) {
                            throw new ConstructionException(
                                "DFA state count exceeded: " 
                                + NFA.MAX_STATE_COUNT);
                        }
                        ns = ++highest;
                        Set<Integer> composite = new LinkedHashSet<Integer>(next);
                        compositeStates.put(ns, composite);
                        compositeIds.put(composite, ns);
                    }
                }
                transitions.put(e.getKey(), ns);
            }
            table.add(Collections.unmodifiableMap(transitions));
        }
        
        final SortedSet<Integer> acceptStates = 
            new TreeSet<Integer>(nfa.acceptStates());
        for (Map.Entry<Integer, Set<Integer>> e : compositeStates.entrySet()) {
            if (!Collections.disjoint(e.getValue(), acceptStates)) {
                acceptStates.add(e.getKey());
            }
        }
        
        this.table = Collections.unmodifiableList(table);
        this.acceptStates = Collections.unmodifiableSortedSet(acceptStates);
        this.compositeCount = compositeStates.size();
        
        if (logger.isLoggable(level)) {
            logger.log(level, "composite states: " + compositeStates);
            logger.log(level, "dfa: " + toString());
        }
    }

    /**
     * Run <code>input</code> through the automaton from the start state.
     * 
     * @return true if every character has a transition and the last state
     *         reached is an accept state.
     */
    public boolean accepts(CharSequence input) {
        int state = 0;
        for (int i = 0; i < input.length(); ++i) {
            Integer next = table.get(state).get(input.charAt(i));
            if (next == null) return false;
            state = next;
        }
        return acceptStates.contains(state);
    }

    /**
     * @return the number of states, reachable or not.
     */
    public int size() {
        return table.size();
    }

    /**
     * @return the number of composite states allocated during construction.
     */
    public int compositeCount() {
        return compositeCount;
    }

    /**
     * @return the transitions out of <code>state</code>, symbol to next
     *         state, unmodifiable.
     */
    public Map<Character, Integer> transitionsFrom(int state) {
        return table.get(state);
    }

    /**
     * @return every accept state, reachable or not, in ascending order.
     */
    public SortedSet<Integer> acceptStates() {
        return acceptStates;
    }

    /**
     * The states reachable from the start state. Composite state allocation
     * can leave states behind that nothing leads to; they are excluded here.
     * 
     * @return the reachable states in ascending order.
     */
    public SortedSet<Integer> reachableStates() {
        final SortedSet<Integer> reachable = new TreeSet<Integer>();
        final Deque<Integer> gray = new ArrayDeque<Integer>();
        gray.push(0);
        while (!gray.isEmpty()) {
            int state = gray.pop();
            if (reachable.add(state)) {
                for (int next : table.get(state).values()) {
                    if (!reachable.contains(next)) gray.push(next);
                }
            }
        }
        return Collections.unmodifiableSortedSet(reachable);
    }

    /**
     * @return the accept states reachable from the start state.
     */
    public SortedSet<Integer> reachableAcceptStates() {
        SortedSet<Integer> ret = new TreeSet<Integer>(acceptStates);
        ret.retainAll(reachableStates());
        return Collections.unmodifiableSortedSet(ret);
    }

    /**
     * @return the transitions between reachable states, in their natural
     *         order.
     */
    public List<Transition> transitions() {
        final Set<Integer> reachable = reachableStates();
        final List<Transition> ret = new ArrayList<Transition>();
        for (int state : reachable) {
            for (Map.Entry<Character, Integer> e : table.get(state).entrySet()) {
                if (reachable.contains(e.getValue())) {
                    ret.add(new Transition(state, e.getValue(), e.getKey()));
                }
            }
        }
        Collections.sort(ret);
        return ret;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        int nArcs = 0;
        for (Map<Character, Integer> transitions : table) {
            nArcs += transitions.size();
        }
        sb
            .append("total states: ").append(size())
            .append(" total arcs ").append(nArcs)
            .append(" accept: ").append(acceptStates)
            .append(LS);
        for (int state = 0; state < table.size(); ++state) {
            sb.append("state: ").append(state);
            if (acceptStates.contains(state)) sb.append(" (accept)");
            sb.append(LS).append("    ").append(table.get(state)).append(LS);
        }
        return sb.toString();
    }
}
