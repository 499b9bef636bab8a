package nl.bytesoflife.oxur.ast;

/**
 * What an {@link Item} declares. Only functions are supported so far; new kinds
 * are added as new permitted types.
 */
public sealed interface ItemKind permits Fn {
}
