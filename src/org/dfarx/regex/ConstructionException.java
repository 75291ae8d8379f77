/* @LICENSE@  
 */
package org.dfarx.regex;

/**
 * A runtime exception thrown when an automaton cannot be constructed for an
 * otherwise well formed expression: the state count would exceed what a 16
 * bit state id can address.
 */
public final class ConstructionException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public ConstructionException(String msg) {
        super(msg);
    }
}
