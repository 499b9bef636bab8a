package nl.bytesoflife.oxur.builder;

/**
 * How an {@link AstBuilder} reconciles explicit {@code :id} values with the ids it generates.
 */
public enum IdPolicy {

    /**
     * Explicit ids are used verbatim and raise the counter past themselves, so a
     * generated id never repeats an explicit one seen earlier.
     */
    HIGH_WATER_MARK,

    /**
     * A builder either takes every id from the input or generates every id;
     * mixing the two is an error.
     */
    FORBID_MIXING,

    /**
     * Explicit ids are used verbatim and never checked. Generated ids may collide with them.
     */
    UNCHECKED
}
