package nl.bytesoflife.oxur.parser;

import nl.bytesoflife.oxur.lexer.LexException;
import nl.bytesoflife.oxur.lexer.Position;
import nl.bytesoflife.oxur.lexer.SExpressionLexer;
import nl.bytesoflife.oxur.lexer.Token;
import nl.bytesoflife.oxur.lexer.TokenType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Recursive-descent reader turning S-expression text into {@link SNode} trees.
 *
 * <pre>
 * sexp := atom | list
 * list := '(' sexp* ')'
 * atom := Symbol | Keyword | String | Number | Nil
 * </pre>
 */
public class SExpressionParser {

    private static final Logger log = LoggerFactory.getLogger(SExpressionParser.class);

    private List<Token> tokens;
    private int current;

    /**
     * Reads the first complete S-expression in {@code text}.
     * Anything after it, including an unbalanced {@code )}, is not looked at:
     * {@code "(foo))"} reads as {@code (foo)}. Use {@link #parseAll(String)} to
     * validate the whole input.
     *
     * @throws ParseException EMPTY_INPUT when the text holds only whitespace and comments
     */
    public SNode parse(String text) {
        reset(text);
        if (isAtEnd()) {
            throw ParseException.emptyInput();
        }
        return parseNode();
    }

    /**
     * Reads every top-level S-expression up to end of input. Empty input yields an empty list.
     */
    public List<SNode> parseAll(String text) {
        reset(text);
        List<SNode> nodes = new ArrayList<>();
        while (!isAtEnd()) {
            nodes.add(parseNode());
        }
        log.debug("Parsed {} top-level expressions", nodes.size());
        return nodes;
    }

    private void reset(String text) {
        try {
            this.tokens = new SExpressionLexer().tokenize(text);
        } catch (LexException e) {
            throw ParseException.lexError(e);
        }
        this.current = 0;
    }

    private SNode parseNode() {
        Token token = tokens.get(current);
        return switch (token.type()) {
            case LPAREN -> parseList();
            case SYMBOL -> {
                advance();
                yield new SNode.SSymbol(token.lexeme(), token.position());
            }
            case KEYWORD -> {
                advance();
                yield new SNode.SKeyword(token.lexeme(), token.position());
            }
            case STRING -> {
                advance();
                yield new SNode.SString(token.lexeme(), token.position());
            }
            case NUMBER -> {
                advance();
                yield new SNode.SNumber(token.lexeme(), token.position());
            }
            case NIL -> {
                advance();
                yield new SNode.SNil(token.position());
            }
            case RPAREN -> throw ParseException.unexpectedCloseParen(token.position());
            case EOF -> throw ParseException.emptyInput();
        };
    }

    private SNode.SList parseList() {
        Position open = tokens.get(current).position();
        advance(); // '('

        List<SNode> children = new ArrayList<>();
        while (true) {
            if (isAtEnd()) {
                throw ParseException.unterminatedList(open);
            }
            if (check(TokenType.RPAREN)) {
                advance();
                return new SNode.SList(children, open);
            }
            children.add(parseNode());
        }
    }

    private boolean check(TokenType type) {
        return tokens.get(current).is(type);
    }

    private void advance() {
        if (!isAtEnd()) {
            current++;
        }
    }

    private boolean isAtEnd() {
        return current >= tokens.size() || tokens.get(current).is(TokenType.EOF);
    }
}
