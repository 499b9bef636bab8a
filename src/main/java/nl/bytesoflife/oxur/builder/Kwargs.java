package nl.bytesoflife.oxur.builder;

import nl.bytesoflife.oxur.lexer.Position;
import nl.bytesoflife.oxur.parser.ParseException;
import nl.bytesoflife.oxur.parser.SNode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The {@code :keyword value} pairs following the tag of a node list.
 * Keywords are stored without the colon; a keyword may appear only once.
 */
public final class Kwargs {

    private final String tag;
    private final Position position;
    private final Map<String, SNode> values;

    private Kwargs(String tag, Position position, Map<String, SNode> values) {
        this.tag = tag;
        this.position = position;
        this.values = values;
    }

    /**
     * Reads pairs starting at index 1 of {@code list}; index 0 is the tag.
     */
    public static Kwargs of(String tag, SNode.SList list) {
        Map<String, SNode> values = new LinkedHashMap<>();
        for (int i = 1; i < list.size(); i += 2) {
            SNode key = list.get(i);
            if (!(key instanceof SNode.SKeyword keyword)) {
                throw ParseException.expected("keyword", key.describe(), key.position());
            }
            if (i + 1 >= list.size()) {
                throw ParseException.expected("value after :" + keyword.name(), "end of list", list.position());
            }
            if (values.containsKey(keyword.name())) {
                throw ParseException.expected("at most one :" + keyword.name() + " in " + tag,
                        "duplicate :" + keyword.name(), keyword.position());
            }
            values.put(keyword.name(), list.get(i + 1));
        }
        return new Kwargs(tag, list.position(), values);
    }

    public String tag() {
        return tag;
    }

    /**
     * Position of the node list the pairs belong to.
     */
    public Position position() {
        return position;
    }

    public boolean has(String name) {
        return values.containsKey(name);
    }

    /**
     * The value for {@code name}, or null when the keyword is absent.
     */
    public SNode get(String name) {
        return values.get(name);
    }

    public SNode require(String name) {
        SNode value = values.get(name);
        if (value == null) {
            throw ParseException.expected(":" + name + " field in " + tag, "missing field", position);
        }
        return value;
    }

    public Map<String, SNode> asMap() {
        return Collections.unmodifiableMap(values);
    }
}
