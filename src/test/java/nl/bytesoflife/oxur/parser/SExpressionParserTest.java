package nl.bytesoflife.oxur.parser;

import nl.bytesoflife.oxur.lexer.LexException;
import nl.bytesoflife.oxur.lexer.Position;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SExpressionParserTest {

    private final SExpressionParser parser = new SExpressionParser();

    @Test
    void parseSimpleList() {
        SNode node = parser.parse("(Span :lo 0 :hi 5)");
        assertInstanceOf(SNode.SList.class, node);
        SNode.SList list = (SNode.SList) node;
        assertEquals(5, list.size());
        assertEquals("Span", ((SNode.SSymbol) list.get(0)).value());
        assertEquals("lo", ((SNode.SKeyword) list.get(1)).name());
        assertEquals("0", ((SNode.SNumber) list.get(2)).value());
        assertEquals("hi", ((SNode.SKeyword) list.get(3)).name());
        assertEquals("5", ((SNode.SNumber) list.get(4)).value());
    }

    @Test
    void parseNestedLists() {
        SNode.SList list = (SNode.SList) parser.parse("(defn add ((a i32) (b i32)) i32 (+ a b))");
        assertEquals(5, list.size());
        SNode.SList params = (SNode.SList) list.get(2);
        assertEquals(2, params.size());
        assertInstanceOf(SNode.SList.class, params.get(0));
        assertEquals("(+ a b)", list.get(4).toString());
    }

    @Test
    void parseAtoms() {
        assertEquals(new SNode.SSymbol("foo", Position.START), parser.parse("foo"));
        assertEquals(new SNode.SKeyword("id", Position.START), parser.parse(":id"));
        assertEquals(new SNode.SString("a b", Position.START), parser.parse("\"a b\""));
        assertEquals(new SNode.SNumber("-3", Position.START), parser.parse("-3"));
        assertEquals(new SNode.SNil(Position.START), parser.parse("nil"));
    }

    @Test
    void parseEmptyList() {
        SNode node = parser.parse("()");
        assertInstanceOf(SNode.SList.class, node);
        assertTrue(((SNode.SList) node).isEmpty());
        assertEquals("empty list", node.describe());
    }

    @Test
    void listPositionIsOpeningParen() {
        SNode.SList list = (SNode.SList) parser.parse("  ; comment\n  (a (b))");
        assertEquals(new Position(14, 2, 3), list.position());
        assertEquals(new Position(17, 2, 6), list.get(1).position());
    }

    @Test
    void parseReturnsFirstExpressionOnly() {
        SNode node = parser.parse("(a) (b)");
        assertEquals("(a)", node.toString());
    }

    @Test
    void trailingCloseParenIsIgnoredByParse() {
        SNode node = parser.parse("(foo))");
        assertEquals("(foo)", node.toString());
    }

    @Test
    void parseEmptyInput() {
        ParseException e = assertThrows(ParseException.class, () -> parser.parse(""));
        assertEquals(ParseException.Kind.EMPTY_INPUT, e.getKind());
        assertNull(e.getPosition());
    }

    @Test
    void parseWhitespaceOnlyInput() {
        ParseException e = assertThrows(ParseException.class, () -> parser.parse("   \n\n  ; comment only\n  "));
        assertEquals(ParseException.Kind.EMPTY_INPUT, e.getKind());
    }

    @Test
    void unterminatedListReportsOpeningParen() {
        ParseException e = assertThrows(ParseException.class, () -> parser.parse("(foo bar"));
        assertEquals(ParseException.Kind.UNTERMINATED_LIST, e.getKind());
        assertEquals(1, e.getPosition().line());
        assertEquals(1, e.getPosition().column());
    }

    @Test
    void unterminatedNestedListReportsInnermostParen() {
        ParseException e = assertThrows(ParseException.class, () -> parser.parse("(a\n  (b c"));
        assertEquals(ParseException.Kind.UNTERMINATED_LIST, e.getKind());
        assertEquals(new Position(5, 2, 3), e.getPosition());
    }

    @Test
    void leadingCloseParen() {
        ParseException e = assertThrows(ParseException.class, () -> parser.parse(")"));
        assertEquals(ParseException.Kind.UNEXPECTED_CLOSE_PAREN, e.getKind());
        assertEquals(Position.START, e.getPosition());
    }

    @Test
    void lexErrorsAreWrapped() {
        ParseException e = assertThrows(ParseException.class, () -> parser.parse("(a \"b\\x\")"));
        assertEquals(ParseException.Kind.LEX_ERROR, e.getKind());
        assertInstanceOf(LexException.class, e.getCause());
        assertEquals(LexException.Kind.INVALID_ESCAPE, ((LexException) e.getCause()).getKind());
        assertTrue(e.getMessage().startsWith("Lexer error: "));
        assertEquals(new Position(6, 1, 7), e.getPosition());
    }

    @Test
    void parseMultipleTopLevelExpressions() {
        String input = """
                ; two items
                (Item :ident (Ident :name "a"))
                (Item :ident (Ident :name "b"))
                """;
        List<SNode> nodes = parser.parseAll(input);
        assertEquals(2, nodes.size());
        assertEquals("list (Item ...)", nodes.get(1).describe());
    }

    @Test
    void parseAllOnEmptyInput() {
        assertTrue(parser.parseAll("").isEmpty());
        assertTrue(parser.parseAll("  ; nothing\n").isEmpty());
    }

    @Test
    void parseAllRejectsStrayCloseParen() {
        ParseException e = assertThrows(ParseException.class, () -> parser.parseAll("(foo))"));
        assertEquals(ParseException.Kind.UNEXPECTED_CLOSE_PAREN, e.getKind());
        assertEquals(new Position(5, 1, 6), e.getPosition());
    }

    @Test
    void structuralEqualityIgnoresPositions() {
        SNode a = parser.parse("(a :b \"c\" 1 nil ())");
        SNode b = parser.parse("\n  (a\n :b \"c\"   1 nil ( ))");
        assertNotEquals(a, b);
        assertTrue(a.sameStructure(b));
        assertFalse(a.sameStructure(parser.parse("(a :b \"c\" 2 nil ())")));
    }

    @Test
    void parserIsReusable() {
        assertThrows(ParseException.class, () -> parser.parse("(oops"));
        assertEquals("(ok)", parser.parse("(ok)").toString());
    }
}
