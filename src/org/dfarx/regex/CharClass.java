/* @LICENSE@  
 */
package org.dfarx.regex;

/**
 * The predefined character classes of the expression language. Each class is
 * a contiguous range of <code>char</code>s.
 */
enum CharClass {

    /**
     * <code>\w</code>: a lower case letter.
     */
    ANY_LETTER('a', 'z', "\\w"),

    /**
     * <code>\d</code>: a decimal digit.
     */
    ANY_DIGIT('0', '9', "\\d");

    final char first;
    final char last;
    final String glyph;

    CharClass(char first, char last, String glyph) {
        this.first = first;
        this.last = last;
        this.glyph = glyph;
    }

    @Override
    public String toString() {
        return glyph;
    }
}
