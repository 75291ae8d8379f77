/*
 * @LICENSE@
 */

package org.dfarx.regex;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * A compiled representation of a regular expression; analog to the
 * {@link java.util.regex.Pattern} class, restricted to whole-input membership
 * tests. Like the Pattern class of the standard library, instances of this
 * class are immutable and thread safe.
 * <p>
 * <strong>Syntax:</strong>
 * <ul>
 * <li>Literals: the lower case letters <code>a-z</code>, the digits
 * <code>0-9</code>, and space.</li>
 * <li>Character classes: <code>\w</code> matches any lower case letter,
 * <code>\d</code> any digit.</li>
 * <li>Operators: <code>|</code> (alternation), <code>*</code> (zero or
 * more), <code>+</code> (one or more), and implicit concatenation.</li>
 * <li>Grouping: <code>( )</code>. Groups do not capture.</li>
 * </ul>
 * Any other character, escape sequence, or unbalanced parenthesis is a
 * syntax error. Character ranges, anchors, capturing groups, back references
 * and look-around are <em>not</em> supported.
 * <p>
 * Compilation goes through tokens, a syntax tree, an NFA and finally a DFA;
 * only the DFA is kept for matching. Compilation either produces a complete
 * automaton or throws.
 */
public final class Pattern {

    private static final Logger logger = Logger.getLogger("org.dfarx.regex");
    private static final Level level = Level.FINE;

    private final String regex;
    private final NFA nfa;
    private final DFA dfa;

    private Pattern(String regex) {
        this.regex = regex;
        logger.log(level, "regex: " + regex);
        AST ast = RegexParser.parse(regex);
        this.nfa = new NFA(ast);
        this.dfa = new DFA(nfa);
        logger.log(level, "states: nfa " + nfa.size() + ", dfa " + dfa.size()
            + " (" + dfa.compositeCount() + " composite)");
    }

    /**
     * Compiles the given regular expression into a pattern.
     * 
     * @param regex
     *            the expression to be compiled.
     * @return the pattern.
     * @throws LexException
     *             if the expression contains a character or escape outside
     *             the syntax.
     * @throws ParseException
     *             if the expression is not well formed.
     * @throws ConstructionException
     *             if the automaton would need more than 65536 states.
     */
    public static Pattern compile(String regex) {
        if (regex == null) throw new NullPointerException("regex");
        return new Pattern(regex);
    }

    /**
     * @return true if the whole of <code>input</code> is in the language of
     *         this pattern.
     */
    public boolean matches(CharSequence input) {
        return dfa.accepts(input);
    }

    public static boolean matches(String regex, CharSequence input) {
        return compile(regex).matches(input);
    }

    /**
     * @return the automaton used for matching.
     */
    public DFA dfa() {
        return dfa;
    }

    /**
     * @return the intermediate automaton the DFA was built from.
     */
    public NFA nfa() {
        return nfa;
    }

    /**
     * @return the GraphViz rendering of the reachable part of the DFA.
     */
    public String toGraph() {
        return Graphviz.generate(dfa);
    }

    public String pattern() {
        return regex;
    }

    @Override
    public String toString() {
        return regex;
    }
}
