/* @LICENSE@  
 */
package org.dfarx.regex;

/**
 * An edge of an automaton graph: a move from one state to another on a
 * symbol. Instances are immutable; the natural order is by source state, then
 * symbol, then destination state.
 */
public final class Transition implements Comparable<Transition> {

    private final int from;
    private final int to;
    private final char symbol;

    public Transition(int from, int to, char symbol) {
        this.from = from;
        this.to = to;
        this.symbol = symbol;
    }

    public int from() {
        return from;
    }

    public int to() {
        return to;
    }

    public char symbol() {
        return symbol;
    }

    public int compareTo(Transition t) {
        if (from != t.from) return from < t.from ? -1 : 1;
        if (symbol != t.symbol) return symbol < t.symbol ? -1 : 1;
        if (to != t.to) return to < t.to ? -1 : 1;
        return 0;
    }

    @Override
    public int hashCode() {
        final int prime = 31;
        int result = 1;
        result = prime * result + from;
        result = prime * result + to;
        result = prime * result + symbol;
        return result;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (!(obj instanceof Transition))
            return false;
        final Transition other = (Transition) obj;
        return from == other.from && to == other.to && symbol == other.symbol;
    }

    @Override
    public String toString() {
        return from + " -" + symbol + "-> " + to;
    }
}
