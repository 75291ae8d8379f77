/* @LICENSE@  
 */
package org.dfarx.regex;

import java.util.regex.PatternSyntaxException;

/**
 * Thrown when a token sequence matches none of the shapes of the grammar:
 * empty operands, dangling operators, unbalanced parenthesis. Tokens carry no
 * position, so the index is -1, except for groups nested too deeply, which
 * the lexer reports at the offending parenthesis.
 */
public final class ParseException extends PatternSyntaxException {

    private static final long serialVersionUID = 1L;

    public ParseException(String desc, String regex) {
        super(desc, regex, -1);
    }

    public ParseException(String desc, String regex, int index) {
        super(desc, regex, index);
    }
}
