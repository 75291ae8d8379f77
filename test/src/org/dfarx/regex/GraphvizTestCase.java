/* @LICENSE@  
 */

package org.dfarx.regex;

import java.util.Arrays;
import java.util.Collections;

public class GraphvizTestCase extends AbstractRxTestCase {

    public GraphvizTestCase(String name) {
        super(name);
    }

    public void testSingleLetter() {
        assertEquals(
            "digraph {\n"
            + "rankdir=LR;\n"
            + "node [shape=point]; start;\n"
            + "node [shape=doublecircle]; 1; \n"
            + "node [shape=circle];\n"
            + "start -> 0;\n"
            + "0 -> 1 [label=\"a\"];\n"
            + "}", 
            Graphviz.generate(dfaOf("a")));
    }
    
    public void testUnreachableStatesAreLeftOut() {
        assertEquals(
            "digraph {\n"
            + "rankdir=LR;\n"
            + "node [shape=point]; start;\n"
            + "node [shape=doublecircle]; 1; \n"
            + "node [shape=circle];\n"
            + "start -> 0;\n"
            + "0 -> 4 [label=\"a\"];\n"
            + "4 -> 1 [label=\"b\"];\n"
            + "4 -> 1 [label=\"c\"];\n"
            + "}", 
            Graphviz.generate(dfaOf("ab|ac")));
        
        // 3 accepts but nothing leads there
        String dot = Graphviz.generate(dfaOf("(a|b)*abb"));
        assertTrue(dot, dot.contains("node [shape=doublecircle]; 6; \n"));
        assertFalse(dot, dot.contains("-> 3 "));
    }
    
    public void testEmptyLanguageOfEdges() {
        assertEquals(
            "digraph {\n"
            + "rankdir=LR;\n"
            + "node [shape=point]; start;\n"
            + "node [shape=doublecircle]; 0; \n"
            + "node [shape=circle];\n"
            + "start -> 0;\n"
            + "}", 
            Graphviz.generate(0, Collections.singleton(0), 
                Collections.<Transition>emptyList()));
    }
    
    public void testNFA() {
        String dot = Graphviz.generate(nfaOf("ab|ac"));
        assertTrue(dot, dot.contains("node [shape=doublecircle]; 1; \n"));
        assertTrue(dot, dot.endsWith(
            "0 -> 2 [label=\"a\"];\n"
            + "0 -> 3 [label=\"a\"];\n"
            + "2 -> 1 [label=\"b\"];\n"
            + "3 -> 1 [label=\"c\"];\n"
            + "}"));
    }
    
    public void testSeveralAcceptStates() {
        String dot = Graphviz.generate(
            0, Arrays.asList(0, 1), dfaOf("a*b*").transitions());
        assertTrue(dot, dot.contains("node [shape=doublecircle]; 0; 1; \n"));
        assertEquals(dot, Pattern.compile("a*b*").toGraph());
    }
}
