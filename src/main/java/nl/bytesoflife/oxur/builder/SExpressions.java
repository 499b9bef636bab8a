package nl.bytesoflife.oxur.builder;

import nl.bytesoflife.oxur.parser.ParseException;
import nl.bytesoflife.oxur.parser.SNode;

import java.math.BigInteger;

/**
 * Shape checks shared by the builder. Every failure is a {@link ParseException}
 * of kind EXPECTED positioned at the offending node.
 */
final class SExpressions {

    private SExpressions() {
    }

    static SNode.SList expectList(SNode node) {
        if (node instanceof SNode.SList list) {
            return list;
        }
        throw ParseException.expected("list", node.describe(), node.position());
    }

    static SNode.SSymbol expectSymbol(SNode node) {
        if (node instanceof SNode.SSymbol symbol) {
            return symbol;
        }
        throw ParseException.expected("symbol", node.describe(), node.position());
    }

    static String expectString(SNode node) {
        if (node instanceof SNode.SString string) {
            return string.value();
        }
        throw ParseException.expected("string", node.describe(), node.position());
    }

    static BigInteger expectNumber(SNode node) {
        if (node instanceof SNode.SNumber number) {
            try {
                return new BigInteger(number.value());
            } catch (NumberFormatException e) {
                throw ParseException.expected("valid number", number.value(), number.position());
            }
        }
        throw ParseException.expected("number", node.describe(), node.position());
    }

    /**
     * A number in {@code [0, max)}.
     */
    static int expectIndex(SNode node, int max, String what) {
        BigInteger value = expectNumber(node);
        if (value.signum() < 0 || value.compareTo(BigInteger.valueOf(max)) >= 0) {
            throw ParseException.expected(what + " between 0 and " + (max - 1), value.toString(), node.position());
        }
        return value.intValueExact();
    }

    /**
     * The symbols {@code true} and {@code false}.
     */
    static boolean expectBoolean(SNode node) {
        SNode.SSymbol symbol = expectSymbol(node);
        return switch (symbol.value()) {
            case "true" -> true;
            case "false" -> false;
            default -> throw ParseException.expected("true or false", symbol.value(), symbol.position());
        };
    }

    static boolean isNil(SNode node) {
        return node instanceof SNode.SNil;
    }

    /**
     * The leading symbol of a non-empty list, used to dispatch on variant lists such as {@code (Semi ...)}.
     */
    static SNode.SSymbol head(SNode.SList list, String expected) {
        if (list.isEmpty()) {
            throw ParseException.expected(expected, "empty list", list.position());
        }
        SNode first = list.get(0);
        if (first instanceof SNode.SSymbol symbol) {
            return symbol;
        }
        throw ParseException.expected(expected, first.describe(), first.position());
    }

    /**
     * Checks that {@code node} is a list tagged {@code tag} and returns its keyword pairs.
     */
    static Kwargs open(SNode node, String tag) {
        SNode.SList list = expectList(node);
        SNode.SSymbol symbol = head(list, tag);
        if (!symbol.value().equals(tag)) {
            throw ParseException.expected(tag, symbol.value(), symbol.position());
        }
        return Kwargs.of(tag, list);
    }
}
