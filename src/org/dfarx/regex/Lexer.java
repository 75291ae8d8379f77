/* @LICENSE@  
 */
package org.dfarx.regex;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Turns an expression into a flat token sequence. Parenthesized sub
 * expressions are tokenized recursively and come back as a single
 * {@linkplain Token.Kind#GROUP group} token.
 */
final class Lexer {

    private static final Logger logger = Logger.getLogger("org.dfarx.regex");
    private static final Level level = Level.FINEST;

    private static final int BACKSLASH = 0x80000000;

    /**
     * Deepest group nesting accepted. Every stage from here to the NFA
     * recurses once per level.
     */
    static final int MAX_NESTING = 500;

    private final String regex;

    private Lexer(String regex) {
        this.regex = regex;
    }

    /**
     * Tokenize a complete expression.
     * 
     * @param regex
     *            the expression
     * @return the top level tokens
     * @throws LexException
     *             on a character or escape sequence outside the language
     * @throws ParseException
     *             if groups nest deeper than {@link #MAX_NESTING}
     */
    static List<Token> tokenize(String regex) {
        List<Token> tokens = new Lexer(regex).tokenize(0, regex.length());
        if (logger.isLoggable(level)) {
            logger.log(level, "tokens: " + tokens);
        }
        return tokens;
    }

    private List<Token> tokenize(final int begin, final int end) {
        final List<Token> tokens = new ArrayList<Token>();
        int depth = 0;
        int groupStart = begin;
        for (int i = begin; i < end; ++i) {
            int c = regex.charAt(i);
            if (c == '\\') {
                if (i + 1 == end) {
                    throw new LexException("Dangling escape", regex, i);
                }
                c = regex.charAt(++i) | BACKSLASH;
            }
            if (depth > 0) {
                switch (c) {
                case '(':
                    if (++depth > MAX_NESTING) {
                        throw new ParseException(
                            "Groups nested deeper than " + MAX_NESTING, 
                            regex, i);
                    }
                    break;
                case ')':
                    if (--depth == 0) {
                        tokens.add(Token.group(tokenize(groupStart, i)));
                    }
                    break;
                default:
                    break;  // buffered until the group closes
                }
                continue;
            }
            switch (c) {
            case '(':
                depth = 1;
                groupStart = i + 1;
                break;
            case ')':
                tokens.add(Token.UNBALANCED);
                break;
            case '|':
                tokens.add(Token.UNION);
                break;
            case '*':
                tokens.add(Token.STAR);
                break;
            case '+':
                tokens.add(Token.PLUS);
                break;
            case BACKSLASH | 'w':
                tokens.add(Token.ANY_LETTER);
                break;
            case BACKSLASH | 'd':
                tokens.add(Token.ANY_DIGIT);
                break;
            default:
                if ((c & BACKSLASH) != 0) {
                    throw new LexException(
                        "Unrecognized escape sequence `\\" 
                        + (char) (c & ~BACKSLASH) + '`', regex, i);
                } else if (('a' <= c && c <= 'z') 
                        || ('0' <= c && c <= '9') || c == ' ') {
                    tokens.add(Token.letter((char) c));
                } else {
                    throw new LexException(
                        "Unrecognized character `" + (char) c + '`', regex, i);
                }
            }
        }
        if (depth > 0) {
            tokens.add(Token.UNBALANCED);
        }
        return tokens;
    }

    /**
     * @return index of the first token of <code>kind</code>, or -1.
     */
    static int find(List<Token> tokens, Token.Kind kind) {
        for (int i = 0; i < tokens.size(); ++i) {
            if (tokens.get(i).kind == kind) return i;
        }
        return -1;
    }

    /**
     * Find the first implicit concatenation: a left-value immediately
     * followed by a value.
     * 
     * @return index of the value token which starts the right operand, or -1.
     */
    static int findAdjacentValues(List<Token> tokens) {
        for (int i = 1; i < tokens.size(); ++i) {
            if (tokens.get(i - 1).isLeftValue() && tokens.get(i).isValue()) {
                return i;
            }
        }
        return -1;
    }
}
