/* @LICENSE@  
 */
package org.dfarx.regex;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.dfarx.regex.AST.And;
import org.dfarx.regex.AST.Leaf;
import org.dfarx.regex.AST.LeafCharClass;
import org.dfarx.regex.AST.Or;
import org.dfarx.regex.AST.RepeatPlus;
import org.dfarx.regex.AST.RepeatStar;

/**
 * Builds an {@link AST} from a token sequence, bottom up. Precedence is
 * resolved top down: each call looks for the loosest binding operator in its
 * own slice of tokens, splits there, and recurses into the parts.
 * <p>
 * From loosest to tightest:
 * <ol>
 * <li>union, split at every <code>|</code>; chains associate to the
 * right</li>
 * <li>implicit concatenation, split at every left-value / value pair; chains
 * associate to the right</li>
 * <li>star, applied to everything before the first <code>*</code></li>
 * <li>plus, likewise</li>
 * <li>a single letter, char class, or group</li>
 * </ol>
 */
final class RegexParser {

    private static final Logger logger = Logger.getLogger("org.dfarx.regex");
    private static final Level level = Level.FINER;

    private final String regex;
    private final AST ast;

    /**
     * @param regex
     *            the expression the tokens came from, for diagnostics only.
     * @param ast
     *            the arena new nodes are appended to.
     */
    RegexParser(String regex, AST ast) {
        this.regex = regex;
        this.ast = ast;
    }

    /**
     * Parse a complete expression into a fresh tree.
     * 
     * @throws LexException
     * @throws ParseException
     */
    static AST parse(String regex) {
        AST ast = new AST();
        new RegexParser(regex, ast).parse(Lexer.tokenize(regex));
        if (logger.isLoggable(level)) {
            logger.log(level, "ast: " + ast);
            logger.log(level, "astTree: " + Misc.LS + ast.toTreeString());
        }
        return ast;
    }

    /**
     * @return the id of the node representing <code>tokens</code>.
     * @throws ParseException
     *             if the slice has none of the shapes of the grammar.
     */
    int parse(List<Token> tokens) {
        int i;
        if ((i = Lexer.find(tokens, Token.Kind.UNION)) != -1) {
            List<Integer> alternatives = new ArrayList<Integer>();
            int begin = 0;
            do {
                alternatives.add(parse(tokens.subList(begin, begin + i)));
                begin += i + 1;
            } while ((i = Lexer.find(tokens.subList(begin, tokens.size()), 
                    Token.Kind.UNION)) != -1);
            alternatives.add(parse(tokens.subList(begin, tokens.size())));
            return foldRight(alternatives, true);

        } else if ((i = Lexer.findAdjacentValues(tokens)) != -1) {
            List<Integer> factors = new ArrayList<Integer>();
            int begin = 0;
            do {
                factors.add(parse(tokens.subList(begin, begin + i)));
                begin += i;
            } while ((i = Lexer.findAdjacentValues(
                    tokens.subList(begin, tokens.size()))) != -1);
            factors.add(parse(tokens.subList(begin, tokens.size())));
            return foldRight(factors, false);

        } else if ((i = Lexer.find(tokens, Token.Kind.STAR)) != -1) {
            return ast.add(new RepeatStar(parse(tokens.subList(0, i))));

        } else if ((i = Lexer.find(tokens, Token.Kind.PLUS)) != -1) {
            return ast.add(new RepeatPlus(parse(tokens.subList(0, i))));

        } else if (tokens.size() == 1) {
            Token token = tokens.get(0);
            switch (token.kind) {
            case LETTER:
                return ast.add(new Leaf(token.letter));
            case ANY_LETTER:
                return ast.add(new LeafCharClass(CharClass.ANY_LETTER));
            case ANY_DIGIT:
                return ast.add(new LeafCharClass(CharClass.ANY_DIGIT));
            case GROUP:
                // no node for the group itself
                return parse(token.tokens());
            default:
                break;
            }
        }
        throw new ParseException(
            tokens.isEmpty() 
                ? "Malformed regex: missing operand" 
                : "Malformed regex: " + tokens, 
            regex);
    }

    /*
     * x y z becomes x (y z), operands already in the arena.
     */
    private int foldRight(List<Integer> operands, boolean union) {
        int right = operands.get(operands.size() - 1);
        for (int k = operands.size() - 2; k >= 0; --k) {
            right = ast.add(union 
                ? new Or(operands.get(k), right) 
                : new And(operands.get(k), right));
        }
        return right;
    }
}
