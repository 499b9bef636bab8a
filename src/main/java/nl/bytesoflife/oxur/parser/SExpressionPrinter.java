package nl.bytesoflife.oxur.parser;

/**
 * Renders {@link SNode} trees back to text.
 * Short lists without nested lists stay on one line; anything else puts each
 * element after the head on its own indented line. Output always reparses to a
 * structurally equal tree.
 */
public class SExpressionPrinter {

    private final int indent;
    private int inlineLimit = 3;

    public SExpressionPrinter() {
        this(2);
    }

    public SExpressionPrinter(int indent) {
        if (indent < 0) {
            throw new IllegalArgumentException("Indent must not be negative: " + indent);
        }
        this.indent = indent;
    }

    /**
     * Maximum number of elements a list may have to be printed on a single line.
     */
    public SExpressionPrinter setInlineLimit(int inlineLimit) {
        this.inlineLimit = inlineLimit;
        return this;
    }

    public int getIndent() {
        return indent;
    }

    public String print(SNode node) {
        StringBuilder sb = new StringBuilder();
        print(node, 0, sb);
        return sb.toString();
    }

    private void print(SNode node, int depth, StringBuilder sb) {
        if (node instanceof SNode.SList list) {
            printList(list, depth, sb);
        } else {
            // atoms render through their toString
            sb.append(node);
        }
    }

    private void printList(SNode.SList list, int depth, StringBuilder sb) {
        if (list.isEmpty()) {
            sb.append("()");
            return;
        }

        if (isSimple(list)) {
            sb.append('(');
            for (int i = 0; i < list.size(); i++) {
                if (i > 0) sb.append(' ');
                print(list.get(i), depth + 1, sb);
            }
            sb.append(')');
            return;
        }

        sb.append('(');
        print(list.get(0), depth + 1, sb);
        for (int i = 1; i < list.size(); i++) {
            sb.append('\n');
            sb.append(" ".repeat((depth + 1) * indent));
            print(list.get(i), depth + 1, sb);
        }
        sb.append(')');
    }

    private boolean isSimple(SNode.SList list) {
        if (list.size() > inlineLimit) {
            return false;
        }
        for (SNode child : list.children()) {
            if (child instanceof SNode.SList) {
                return false;
            }
        }
        return true;
    }

    static String quote(String value) {
        StringBuilder sb = new StringBuilder(value.length() + 2);
        sb.append('"');
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '\n' -> sb.append("\\n");
                case '\t' -> sb.append("\\t");
                case '\r' -> sb.append("\\r");
                case '\\' -> sb.append("\\\\");
                case '"' -> sb.append("\\\"");
                default -> sb.append(c);
            }
        }
        sb.append('"');
        return sb.toString();
    }
}
