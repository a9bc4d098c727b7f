package com.toolgraph.engine.guard;

/**
 * A token of the guard expression language.
 *
 * @param type     the token type
 * @param value    the token text (string literals are already unescaped)
 * @param position the character position in the source expression
 */
public record GuardToken(TokenType type, String value, int position) {

    public enum TokenType {
        IDENTIFIER,    // state, get, len, and/or/not/in, true/false/null
        STRING,        // 'single' or "double" quoted
        NUMBER,        // integers and decimals, unsigned
        OPERATOR,      // == != < <= > >= + - * / % ! && ||
        LPAREN,        // (
        RPAREN,        // )
        LBRACKET,      // [
        RBRACKET,      // ]
        DOT,           // .
        COMMA,         // ,
        EOF            // end of input
    }

    @Override
    public String toString() {
        return switch (type) {
            case STRING -> "STRING('" + value + "')";
            case NUMBER, IDENTIFIER, OPERATOR -> type + "(" + value + ")";
            default -> type.toString();
        };
    }

    public boolean isIdentifier(String expected) {
        return type == TokenType.IDENTIFIER && value.equals(expected);
    }

    public boolean isOperator(String expected) {
        return type == TokenType.OPERATOR && value.equals(expected);
    }
}
