/*
 * @LICENSE@
 */

package org.dfarx.regex;

/**
 * A few reusable, miscellaneous static constants.
 */
final class Misc {

    private Misc() {
    } // never instantiated

    public static final String LS = System.getProperty("line.separator");
    public static final String FS = System.getProperty("file.separator");
}
