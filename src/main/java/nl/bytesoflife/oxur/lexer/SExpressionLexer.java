package nl.bytesoflife.oxur.lexer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Lexer for the S-expression AST notation.
 * Tokenizes the whole input eagerly into a token list that always ends with {@link TokenType#EOF}.
 */
public class SExpressionLexer {

    private static final Logger log = LoggerFactory.getLogger(SExpressionLexer.class);

    private int[] input;
    private int current;
    private int offset;
    private int line;
    private int column;

    public List<Token> tokenize(String content) {
        this.input = content.codePoints().toArray();
        this.current = 0;
        this.offset = 0;
        this.line = 1;
        this.column = 1;

        List<Token> tokens = new ArrayList<>();
        while (true) {
            skipWhitespaceAndComments();
            if (isAtEnd()) {
                tokens.add(new Token(TokenType.EOF, "", currentPosition()));
                break;
            }
            tokens.add(nextToken());
        }

        log.debug("Tokenized {} code points into {} tokens", input.length, tokens.size());
        return tokens;
    }

    private Token nextToken() {
        Position pos = currentPosition();
        int ch = input[current];

        if (ch == '(') {
            advance();
            return new Token(TokenType.LPAREN, "(", pos);
        } else if (ch == ')') {
            advance();
            return new Token(TokenType.RPAREN, ")", pos);
        } else if (ch == ':') {
            return readKeyword(pos);
        } else if (ch == '"') {
            return readString(pos);
        } else if (isAsciiDigit(ch) || (ch == '-' && isAsciiDigit(peek()))) {
            return readNumber(pos);
        } else if (isSymbolStart(ch)) {
            return readSymbol(pos);
        }
        throw LexException.unexpectedChar(ch, pos);
    }

    private Token readKeyword(Position pos) {
        advance(); // ':'
        int start = current;
        while (!isAtEnd() && isSymbolChar(input[current])) {
            advance();
        }
        return new Token(TokenType.KEYWORD, text(start, current), pos);
    }

    private Token readString(Position pos) {
        advance(); // opening quote
        StringBuilder value = new StringBuilder();

        while (true) {
            if (isAtEnd()) {
                throw LexException.unterminatedString(pos);
            }
            int ch = input[current];
            if (ch == '"') {
                advance();
                break;
            }
            if (ch == '\\') {
                advance();
                if (isAtEnd()) {
                    throw LexException.unterminatedString(pos);
                }
                int escaped = input[current];
                switch (escaped) {
                    case 'n' -> value.append('\n');
                    case 't' -> value.append('\t');
                    case 'r' -> value.append('\r');
                    case '\\' -> value.append('\\');
                    case '"' -> value.append('"');
                    default -> throw LexException.invalidEscape(escaped, currentPosition());
                }
                advance();
            } else {
                value.appendCodePoint(ch);
                advance();
            }
        }

        return new Token(TokenType.STRING, value.toString(), pos);
    }

    private Token readNumber(Position pos) {
        int start = current;
        if (input[current] == '-') {
            advance();
        }
        while (!isAtEnd() && isAsciiDigit(input[current])) {
            advance();
        }
        return new Token(TokenType.NUMBER, text(start, current), pos);
    }

    private Token readSymbol(Position pos) {
        int start = current;
        while (!isAtEnd() && isSymbolChar(input[current])) {
            advance();
        }
        String lexeme = text(start, current);
        TokenType type = "nil".equals(lexeme) ? TokenType.NIL : TokenType.SYMBOL;
        return new Token(type, lexeme, pos);
    }

    private void skipWhitespaceAndComments() {
        while (!isAtEnd()) {
            int ch = input[current];
            // isSpaceChar covers the no-break spaces isWhitespace leaves out
            if (Character.isWhitespace(ch) || Character.isSpaceChar(ch)) {
                advance();
            } else if (ch == ';') {
                // Comment runs to end of line; the newline is consumed with it
                while (!isAtEnd()) {
                    int skipped = input[current];
                    advance();
                    if (skipped == '\n') {
                        break;
                    }
                }
            } else {
                break;
            }
        }
    }

    static boolean isSymbolStart(int ch) {
        return Character.isAlphabetic(ch) || isSymbolPunctuation(ch);
    }

    static boolean isSymbolChar(int ch) {
        return Character.isAlphabetic(ch) || isNumeric(ch) || isSymbolPunctuation(ch) || ch == '\'';
    }

    /**
     * Any Unicode number: decimal digits, letter numbers and other numbers such as {@code ²}.
     */
    private static boolean isNumeric(int ch) {
        int type = Character.getType(ch);
        return type == Character.DECIMAL_DIGIT_NUMBER
                || type == Character.LETTER_NUMBER
                || type == Character.OTHER_NUMBER;
    }

    private static boolean isSymbolPunctuation(int ch) {
        return switch (ch) {
            case '_', '-', '+', '*', '/', '=', '<', '>', '!', '?', '&' -> true;
            default -> false;
        };
    }

    private static boolean isAsciiDigit(int ch) {
        return ch >= '0' && ch <= '9';
    }

    private int peek() {
        return current + 1 < input.length ? input[current + 1] : -1;
    }

    private void advance() {
        if (isAtEnd()) {
            return;
        }
        int ch = input[current];
        current++;
        offset += utf8Width(ch);
        if (ch == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
    }

    private static int utf8Width(int codePoint) {
        if (codePoint < 0x80) return 1;
        if (codePoint < 0x800) return 2;
        if (codePoint < 0x10000) return 3;
        return 4;
    }

    private String text(int start, int end) {
        return new String(input, start, end - start);
    }

    private boolean isAtEnd() {
        return current >= input.length;
    }

    private Position currentPosition() {
        return new Position(offset, line, column);
    }
}
