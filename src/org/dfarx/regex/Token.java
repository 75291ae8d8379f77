/* @LICENSE@  
 */
package org.dfarx.regex;

import java.util.Collections;
import java.util.List;

/**
 * A symbol of the expression language. Tokens carry no position; a GROUP
 * token holds the tokens of a parenthesized sub expression.
 */
final class Token {

    enum Kind {
        LETTER, GROUP, UNION, STAR, PLUS, ANY_LETTER, ANY_DIGIT,
        /*
         * a parenthesis without a partner: neither value nor operator, so
         * the parser can only reject the slice it appears in.
         */
        UNBALANCED;
    }

    static final Token UNION = new Token(Kind.UNION, '|', null);
    static final Token STAR = new Token(Kind.STAR, '*', null);
    static final Token PLUS = new Token(Kind.PLUS, '+', null);
    static final Token ANY_LETTER = new Token(Kind.ANY_LETTER, 'w', null);
    static final Token ANY_DIGIT = new Token(Kind.ANY_DIGIT, 'd', null);
    static final Token UNBALANCED = new Token(Kind.UNBALANCED, '(', null);

    final Kind kind;
    final char letter;
    private final List<Token> group;

    private Token(Kind kind, char letter, List<Token> group) {
        this.kind = kind;
        this.letter = letter;
        this.group = group;
    }

    static Token letter(char c) {
        return new Token(Kind.LETTER, c, null);
    }

    static Token group(List<Token> tokens) {
        return new Token(Kind.GROUP, '(', 
            Collections.unmodifiableList(tokens));
    }

    List<Token> tokens() {
        assert kind == Kind.GROUP : kind;
        return group;
    }

    /**
     * @return true for tokens that denote something to match (letter, group,
     *         char class), false for operators.
     */
    boolean isValue() {
        switch (kind) {
        case LETTER:
        case GROUP:
        case ANY_LETTER:
        case ANY_DIGIT:
            return true;
        default:
            return false;
        }
    }

    /**
     * @return true for tokens which can end the left operand of an implicit
     *         concatenation: everything but the union operator.
     */
    boolean isLeftValue() {
        return kind != Kind.UNION;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Token)) return false;
        final Token t = (Token) o;
        return kind == t.kind 
            && letter == t.letter
            && (group == null ? t.group == null : group.equals(t.group));
    }

    @Override
    public int hashCode() {
        final int prime = 31;
        int result = kind.hashCode();
        result = prime * result + letter;
        result = prime * result + (group == null ? 0 : group.hashCode());
        return result;
    }

    @Override
    public String toString() {
        switch (kind) {
        case LETTER:
            return String.valueOf(letter);
        case GROUP:
            StringBuilder sb = new StringBuilder();
            sb.append('(');
            for (Token t : group) sb.append(t);
            return sb.append(')').toString();
        case ANY_LETTER:
        case ANY_DIGIT:
            return "\\" + letter;
        case UNBALANCED:
            return "<unbalanced>";
        default:
            return String.valueOf(letter);
        }
    }
}
