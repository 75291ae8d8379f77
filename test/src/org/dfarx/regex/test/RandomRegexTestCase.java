/* @LICENSE@  
 */

package org.dfarx.regex.test;

import static org.dfarx.regex.RegexAssert.*;

import java.util.Random;

import org.dfarx.regex.AbstractRxTestCase;

/**
 * Random expressions checked against java.util.regex on every short string
 * over a small alphabet.
 */
public class RandomRegexTestCase extends AbstractRxTestCase {

    private static final String[] ATOMS = {"a", "b", "1", "\\w", "\\d"};
    private static final String ALPHABET = "ab1";
    
    /*
     * precedence of a rendered expression
     */
    private static final int UNION = 0;
    private static final int CONCAT = 1;
    private static final int REPEAT = 2;
    private static final int ATOM = 3;
    
    private Random random;
    
    public RandomRegexTestCase(String name) {
        super(name);
    }

    protected void setUp() throws Exception {
        super.setUp();
        random = new Random(20241018L);
    }
    
    private String generate(int depth, int minLevel, boolean parenthesize) {
        StringBuilder sb = new StringBuilder();
        int level = generate(sb, depth, parenthesize);
        if (level < minLevel || (parenthesize && level != ATOM)) {
            sb.insert(0, '(').append(')');
        }
        return sb.toString();
    }
    
    private int generate(StringBuilder sb, int depth, boolean parenthesize) {
        if (depth == 0 || random.nextInt(10) < 3) {
            sb.append(ATOMS[random.nextInt(ATOMS.length)]);
            return ATOM;
        }
        switch (random.nextInt(4)) {
        case 0:
            sb
                .append(generate(depth - 1, UNION, parenthesize))
                .append('|')
                .append(generate(depth - 1, UNION, parenthesize));
            return UNION;
        case 1:
            sb
                .append(generate(depth - 1, CONCAT, parenthesize))
                .append(generate(depth - 1, CONCAT, parenthesize));
            return CONCAT;
        default:
            sb
                .append(generate(depth - 1, ATOM, parenthesize))
                .append(random.nextBoolean() ? '*' : '+');
            return REPEAT;
        }
    }
    
    public void testMinimalParens() {
        for (int i = 0; i < 300; ++i) {
            assertSameAsJava(generate(4, UNION, false), ALPHABET, 4);
        }
    }
    
    public void testFullParens() {
        for (int i = 0; i < 300; ++i) {
            assertSameAsJava(generate(4, UNION, true), ALPHABET, 4);
        }
    }
}
