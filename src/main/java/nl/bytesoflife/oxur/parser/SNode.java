package nl.bytesoflife.oxur.parser;

import nl.bytesoflife.oxur.lexer.Position;

import java.util.List;

/**
 * Untyped S-expression tree. Every node remembers where it started in the source;
 * for lists that is the opening parenthesis.
 */
public sealed interface SNode permits SNode.SSymbol, SNode.SKeyword, SNode.SString,
        SNode.SNumber, SNode.SNil, SNode.SList {

    Position position();

    /**
     * Short description used as the "found" part of error messages.
     */
    String describe();

    /**
     * Compares value and shape, ignoring positions.
     */
    boolean sameStructure(SNode other);

    record SSymbol(String value, Position position) implements SNode {
        @Override
        public String describe() {
            return "symbol " + value;
        }

        @Override
        public boolean sameStructure(SNode other) {
            return other instanceof SSymbol symbol && value.equals(symbol.value);
        }

        @Override
        public String toString() {
            return value;
        }
    }

    /**
     * A {@code :name} token; the name is stored without the colon.
     */
    record SKeyword(String name, Position position) implements SNode {
        @Override
        public String describe() {
            return "keyword :" + name;
        }

        @Override
        public boolean sameStructure(SNode other) {
            return other instanceof SKeyword keyword && name.equals(keyword.name);
        }

        @Override
        public String toString() {
            return ":" + name;
        }
    }

    record SString(String value, Position position) implements SNode {
        @Override
        public String describe() {
            return "string \"" + value + "\"";
        }

        @Override
        public boolean sameStructure(SNode other) {
            return other instanceof SString string && value.equals(string.value);
        }

        @Override
        public String toString() {
            return SExpressionPrinter.quote(value);
        }
    }

    /**
     * A number kept as its raw digits (sign included); conversion happens in the builder.
     */
    record SNumber(String value, Position position) implements SNode {
        @Override
        public String describe() {
            return "number " + value;
        }

        @Override
        public boolean sameStructure(SNode other) {
            return other instanceof SNumber number && value.equals(number.value);
        }

        @Override
        public String toString() {
            return value;
        }
    }

    record SNil(Position position) implements SNode {
        @Override
        public String describe() {
            return "nil";
        }

        @Override
        public boolean sameStructure(SNode other) {
            return other instanceof SNil;
        }

        @Override
        public String toString() {
            return "nil";
        }
    }

    record SList(List<SNode> children, Position position) implements SNode {

        public SList {
            children = List.copyOf(children);
        }

        public boolean isEmpty() {
            return children.isEmpty();
        }

        public int size() {
            return children.size();
        }

        public SNode get(int index) {
            return children.get(index);
        }

        @Override
        public String describe() {
            if (children.isEmpty()) {
                return "empty list";
            }
            if (children.get(0) instanceof SSymbol head) {
                return "list (" + head.value() + " ...)";
            }
            return "list";
        }

        @Override
        public boolean sameStructure(SNode other) {
            if (!(other instanceof SList list) || list.children.size() != children.size()) {
                return false;
            }
            for (int i = 0; i < children.size(); i++) {
                if (!children.get(i).sameStructure(list.children.get(i))) {
                    return false;
                }
            }
            return true;
        }

        @Override
        public String toString() {
            StringBuilder sb = new StringBuilder("(");
            for (int i = 0; i < children.size(); i++) {
                if (i > 0) sb.append(' ');
                sb.append(children.get(i));
            }
            sb.append(')');
            return sb.toString();
        }
    }
}
