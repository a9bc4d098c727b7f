package com.toolgraph.engine.guard;

import java.util.ArrayList;
import java.util.List;

/**
 * Tokenizer for the guard expression language.
 * Converts a guard string into a list of tokens ending with EOF.
 */
public class GuardTokenizer {

    private final String input;
    private int pos = 0;

    public GuardTokenizer(String input) {
        this.input = input != null ? input : "";
    }

    /**
     * Tokenizes the entire input string.
     *
     * @return list of tokens (includes EOF token at end)
     * @throws GuardSyntaxException if a character outside the language is found
     */
    public List<GuardToken> tokenize() {
        List<GuardToken> tokens = new ArrayList<>();

        while (!isAtEnd()) {
            skipWhitespace();
            if (isAtEnd()) break;

            tokens.add(nextToken());
        }

        tokens.add(new GuardToken(GuardToken.TokenType.EOF, "", pos));
        return tokens;
    }

    private GuardToken nextToken() {
        int start = pos;
        char c = peek();

        return switch (c) {
            case '(' -> single(GuardToken.TokenType.LPAREN, start);
            case ')' -> single(GuardToken.TokenType.RPAREN, start);
            case '[' -> single(GuardToken.TokenType.LBRACKET, start);
            case ']' -> single(GuardToken.TokenType.RBRACKET, start);
            case ',' -> single(GuardToken.TokenType.COMMA, start);
            case '\'', '"' -> scanString(c);
            case '+', '-', '*', '/', '%' -> {
                advance();
                yield new GuardToken(GuardToken.TokenType.OPERATOR, String.valueOf(c), start);
            }
            case '<', '>' -> {
                advance();
                if (peek() == '=') {
                    advance();
                    yield new GuardToken(GuardToken.TokenType.OPERATOR, c + "=", start);
                }
                yield new GuardToken(GuardToken.TokenType.OPERATOR, String.valueOf(c), start);
            }
            case '=' -> {
                advance();
                if (peek() != '=') {
                    throw new GuardSyntaxException(
                            "Assignment is not allowed at position " + start + "; use '==' to compare");
                }
                advance();
                yield new GuardToken(GuardToken.TokenType.OPERATOR, "==", start);
            }
            case '!' -> {
                advance();
                if (peek() == '=') {
                    advance();
                    yield new GuardToken(GuardToken.TokenType.OPERATOR, "!=", start);
                }
                yield new GuardToken(GuardToken.TokenType.OPERATOR, "!", start);
            }
            case '&', '|' -> {
                advance();
                if (peek() != c) {
                    throw new GuardSyntaxException(
                            "Unexpected character: '" + c + "' at position " + start
                                    + "; use '" + c + c + "' for boolean logic");
                }
                advance();
                yield new GuardToken(GuardToken.TokenType.OPERATOR, "" + c + c, start);
            }
            case '.' -> {
                if (pos + 1 < input.length() && isDigit(input.charAt(pos + 1))) {
                    yield scanNumber();
                }
                yield single(GuardToken.TokenType.DOT, start);
            }
            default -> {
                if (isDigit(c)) {
                    yield scanNumber();
                } else if (isIdentifierStart(c)) {
                    yield scanIdentifier();
                } else {
                    throw new GuardSyntaxException("Unexpected character: '" + c + "' at position " + pos);
                }
            }
        };
    }

    private GuardToken single(GuardToken.TokenType type, int start) {
        char c = advance();
        return new GuardToken(type, String.valueOf(c), start);
    }

    private GuardToken scanString(char quote) {
        int start = pos;
        advance(); // consume opening quote

        StringBuilder sb = new StringBuilder();
        while (!isAtEnd() && peek() != quote) {
            char c = advance();
            if (c == '\\' && !isAtEnd()) {
                char next = advance();
                sb.append(switch (next) {
                    case 'n' -> '\n';
                    case 't' -> '\t';
                    case 'r' -> '\r';
                    default -> next;
                });
            } else {
                sb.append(c);
            }
        }

        if (isAtEnd()) {
            throw new GuardSyntaxException("Unterminated string at position " + start);
        }

        advance(); // consume closing quote
        return new GuardToken(GuardToken.TokenType.STRING, sb.toString(), start);
    }

    private GuardToken scanNumber() {
        int start = pos;

        while (!isAtEnd() && isDigit(peek())) {
            advance();
        }

        if (!isAtEnd() && peek() == '.' && pos + 1 < input.length() && isDigit(input.charAt(pos + 1))) {
            advance(); // consume '.'
            while (!isAtEnd() && isDigit(peek())) {
                advance();
            }
        }

        String value = input.substring(start, pos);
        return new GuardToken(GuardToken.TokenType.NUMBER, value, start);
    }

    private GuardToken scanIdentifier() {
        int start = pos;

        while (!isAtEnd() && isIdentifierChar(peek())) {
            advance();
        }

        String value = input.substring(start, pos);
        return new GuardToken(GuardToken.TokenType.IDENTIFIER, value, start);
    }

    private void skipWhitespace() {
        while (!isAtEnd() && isWhitespace(peek())) {
            advance();
        }
    }

    private char peek() {
        return isAtEnd() ? '\0' : input.charAt(pos);
    }

    private char advance() {
        return input.charAt(pos++);
    }

    private boolean isAtEnd() {
        return pos >= input.length();
    }

    private boolean isWhitespace(char c) {
        return c == ' ' || c == '\t' || c == '\n' || c == '\r';
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private boolean isIdentifierStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private boolean isIdentifierChar(char c) {
        return isIdentifierStart(c) || isDigit(c);
    }
}
