/*
 * @LICENSE@
 */

/**
 * <h3><b>dfarx</b> - compiles a small regular expression language into a
 * deterministic finite automaton.</h3>
 * <p>
 * <h4>Pipeline.</h4>
 * <p>
 * An expression goes through four stages, each consuming the product of the
 * one before:
 * <ol>
 * <li>the lexer turns the string into tokens, a parenthesized sub
 * expression becoming a single group token;</li>
 * <li>the parser builds a syntax tree in a flat, append-only arena, splitting
 * token slices at the loosest binding operator;</li>
 * <li>the NFA builder walks the tree post-order, threading states through
 * sibling subtrees. Epsilon moves are folded into the transition maps as they
 * are added, so closures are never computed later;</li>
 * <li>the DFA builder runs a subset construction which allocates a
 * "composite" state only when a symbol actually leads to more than one NFA
 * state.</li>
 * </ol>
 * The resulting {@link org.dfarx.regex.DFA} tests membership of whole
 * strings; its reachable part can be rendered with
 * {@link org.dfarx.regex.Graphviz}.
 * <p>
 * <h4>Errors.</h4>
 * <p>
 * Characters or escapes outside the language raise a
 * {@link org.dfarx.regex.LexException}; token sequences outside the grammar
 * (empty operands, dangling operators, unbalanced parenthesis) raise a
 * {@link org.dfarx.regex.ParseException}. Both are
 * {@link java.util.regex.PatternSyntaxException}s. No partially built
 * automaton is ever returned.
 * <p>
 * <h4>Logging.</h4>
 * <p>
 * All classes log to the <code>org.dfarx.regex</code> logger: FINE for the
 * expression and state counts, FINER for the syntax tree and the NFA, FINEST
 * for tokens and the DFA.
 * <p>
 * <h4>References:</h4>
 * <ul>
 * <li>For an introduction to the theory behind regular expressions and their
 * implementation as automata, including subset construction, see the first
 * chapters of the <a
 * href="http://en.wikipedia.org/wiki/Compilers:_Principles,_Techniques,_and_Tools">Dragon
 * Book.</a></li>
 * </ul>
 */
package org.dfarx.regex;
