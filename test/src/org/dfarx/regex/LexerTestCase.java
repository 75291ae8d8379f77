/* @LICENSE@  
 */

package org.dfarx.regex;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

public class LexerTestCase extends AbstractRxTestCase {

    public LexerTestCase(String name) {
        super(name);
    }
    
    private static List<Token> tokens(Object... objs) {
        List<Token> ret = new ArrayList<Token>();
        for (Object o : objs) {
            ret.add(o instanceof Character ? Token.letter((Character) o) : (Token) o);
        }
        return ret;
    }
    
    private static void assertLexFails(String regex, int index, String desc) {
        try {
            Lexer.tokenize(regex);
            fail("should throw: " + regex);
        } catch (LexException e) {
            assertEquals(index, e.getIndex());
            assertEquals(desc, e.getDescription());
            assertEquals(regex, e.getPattern());
        }
    }
    
    public void testLetters() {
        assertEquals(tokens('a', 'b', '0', ' ', 'z'), Lexer.tokenize("ab0 z"));
        assertTrue(Lexer.tokenize("").isEmpty());
    }
    
    public void testOperators() {
        assertEquals(
            tokens('a', Token.UNION, 'b', Token.STAR, 'c', Token.PLUS), 
            Lexer.tokenize("a|b*c+"));
    }
    
    public void testCharClasses() {
        assertEquals(tokens(Token.ANY_LETTER, Token.ANY_DIGIT, 'x'), 
            Lexer.tokenize("\\w\\dx"));
    }
    
    public void testGroups() {
        assertEquals(
            tokens(Token.group(tokens('a', 'b')), 'c'), 
            Lexer.tokenize("(ab)c"));
        assertEquals(
            tokens(Token.group(tokens(Token.group(tokens('a')), Token.STAR))), 
            Lexer.tokenize("((a)*)"));
        assertEquals(
            tokens(Token.group(tokens(Token.ANY_LETTER, Token.UNION, 'b'))), 
            Lexer.tokenize("(\\w|b)"));
        assertEquals(tokens(Token.group(tokens())), Lexer.tokenize("()"));
    }
    
    public void testUnbalanced() {
        assertEquals(tokens('a', Token.UNBALANCED, 'b'), Lexer.tokenize("a)b"));
        // an unclosed group swallows the rest of the expression
        assertEquals(tokens('a', Token.UNBALANCED), Lexer.tokenize("a(b|c"));
        assertEquals(tokens(Token.UNBALANCED), Lexer.tokenize("((a)"));
    }
    
    public void testErrors() {
        assertLexFails("aB", 1, "Unrecognized character `B`");
        assertLexFails("a.b", 1, "Unrecognized character `.`");
        assertLexFails("a\\s", 2, "Unrecognized escape sequence `\\s`");
        assertLexFails("ab\\", 2, "Dangling escape");
        // group contents are tokenized when the group closes
        assertLexFails("x(a?)", 3, "Unrecognized character `?`");
    }
    
    public void testEscapedParenInGroup() {
        // an escaped paren does not close the group, and is no escape we know
        assertLexFails("(a\\))", 3, "Unrecognized escape sequence `\\)`");
    }
    
    public void testNestingLimit() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < Lexer.MAX_NESTING; ++i) sb.append('(');
        sb.append('a');
        for (int i = 0; i < Lexer.MAX_NESTING; ++i) sb.append(')');
        assertEquals(1, Lexer.tokenize(sb.toString()).size());
        
        String tooDeep = "x(" + sb + ")";
        try {
            Lexer.tokenize(tooDeep);
            fail("should throw");
        } catch (ParseException e) {
            // the innermost open paren
            assertEquals(1 + Lexer.MAX_NESTING, e.getIndex());
            assertEquals(tooDeep, e.getPattern());
        }
    }
    
    public void testFind() {
        List<Token> tokens = Lexer.tokenize("a*b|c");
        assertEquals(1, Lexer.find(tokens, Token.Kind.STAR));
        assertEquals(3, Lexer.find(tokens, Token.Kind.UNION));
        assertEquals(-1, Lexer.find(tokens, Token.Kind.PLUS));
    }
    
    public void testFindAdjacentValues() {
        assertEquals(1, Lexer.findAdjacentValues(Lexer.tokenize("ab")));
        assertEquals(2, Lexer.findAdjacentValues(Lexer.tokenize("a*b")));
        assertEquals(2, Lexer.findAdjacentValues(Lexer.tokenize("a+(b)")));
        assertEquals(-1, Lexer.findAdjacentValues(Lexer.tokenize("a|b")));
        assertEquals(-1, Lexer.findAdjacentValues(Lexer.tokenize("a*")));
        assertEquals(-1, Lexer.findAdjacentValues(Arrays.asList(Token.STAR)));
    }
    
    public void testTokenValues() {
        assertTrue(Token.letter('a').isValue());
        assertTrue(Token.ANY_DIGIT.isValue());
        assertFalse(Token.STAR.isValue());
        assertFalse(Token.UNBALANCED.isValue());
        assertTrue(Token.STAR.isLeftValue());
        assertFalse(Token.UNION.isLeftValue());
    }
}
