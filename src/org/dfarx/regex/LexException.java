/* @LICENSE@  
 */
package org.dfarx.regex;

import java.util.regex.PatternSyntaxException;

/**
 * Thrown when an expression contains a character or escape sequence outside
 * the expression language.
 */
public final class LexException extends PatternSyntaxException {

    private static final long serialVersionUID = 1L;

    public LexException(String desc, String regex, int index) {
        super(desc, regex, index);
    }
}
