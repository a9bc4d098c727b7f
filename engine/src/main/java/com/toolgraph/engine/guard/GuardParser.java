package com.toolgraph.engine.guard;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Recursive-descent parser for guard expressions.
 *
 * Grammar, lowest precedence first:
 * <pre>
 *   expr           := or
 *   or             := and (('or' | '||') and)*
 *   and            := not (('and' | '&&') not)*
 *   not            := ('not' | '!') not | comparison
 *   comparison     := additive (compOp additive)*
 *   compOp         := '==' | '!=' | '<' | '<=' | '>' | '>=' | 'in' | 'not' 'in'
 *   additive       := multiplicative (('+' | '-') multiplicative)*
 *   multiplicative := unary (('*' | '/' | '%') unary)*
 *   unary          := '-' unary | postfix
 *   postfix        := primary ('[' expr ']' | '.' IDENT | '.' 'get' '(' expr (',' expr)? ')')*
 *   primary        := NUMBER | STRING | true | false | null | True | False | None
 *                   | 'state' | 'len' '(' expr ')' | '(' expr ')'
 * </pre>
 * Any other name is rejected, which is what keeps guards confined to the
 * run state.
 */
public class GuardParser {

    /** Longest accepted guard source, in characters. */
    public static final int MAX_LENGTH = 2000;

    /** Deepest accepted nesting of sub-expressions. */
    public static final int MAX_DEPTH = 64;

    private static final Set<String> COMPARISON_OPERATORS = Set.of("==", "!=", "<", "<=", ">", ">=");

    private final List<GuardToken> tokens;
    private int current = 0;
    private int depth = 0;

    public GuardParser(List<GuardToken> tokens) {
        this.tokens = tokens != null && !tokens.isEmpty()
                ? tokens
                : List.of(new GuardToken(GuardToken.TokenType.EOF, "", 0));
    }

    /**
     * Tokenize and parse {@code source} in one go.
     *
     * @throws GuardSyntaxException if the source is blank, too long or not in the grammar
     */
    public static GuardExpression parse(String source) {
        if (source == null || source.isBlank()) {
            throw new GuardSyntaxException("Guard expression is empty");
        }
        if (source.length() > MAX_LENGTH) {
            throw new GuardSyntaxException(
                    "Guard expression is " + source.length() + " characters (limit: " + MAX_LENGTH + ")");
        }
        return new GuardParser(new GuardTokenizer(source).tokenize()).parseExpression();
    }

    /**
     * Parses the tokens into a single expression; trailing tokens are an error.
     */
    public GuardExpression parseExpression() {
        GuardExpression expr = parseOr();
        if (!isAtEnd()) {
            GuardToken unexpected = peek();
            throw new GuardSyntaxException(
                    "Unexpected " + unexpected + " at position " + unexpected.position());
        }
        return expr;
    }

    private GuardExpression parseOr() {
        GuardExpression left = parseAnd();
        while (peek().isIdentifier("or") || peek().isOperator("||")) {
            advance();
            left = new GuardExpression.Logical(false, left, parseAnd());
        }
        return left;
    }

    private GuardExpression parseAnd() {
        GuardExpression left = parseNot();
        while (peek().isIdentifier("and") || peek().isOperator("&&")) {
            advance();
            left = new GuardExpression.Logical(true, left, parseNot());
        }
        return left;
    }

    private GuardExpression parseNot() {
        if (peek().isIdentifier("not") || peek().isOperator("!")) {
            advance();
            enter();
            try {
                return new GuardExpression.Not(parseNot());
            } finally {
                depth--;
            }
        }
        return parseComparison();
    }

    private GuardExpression parseComparison() {
        GuardExpression first = parseAdditive();
        List<GuardExpression> operands = new ArrayList<>();
        List<String> operators = new ArrayList<>();
        operands.add(first);

        while (true) {
            GuardToken token = peek();
            String op;
            if (token.type() == GuardToken.TokenType.OPERATOR && COMPARISON_OPERATORS.contains(token.value())) {
                advance();
                op = token.value();
            } else if (token.isIdentifier("in")) {
                advance();
                op = "in";
            } else if (token.isIdentifier("not") && peekNext().isIdentifier("in")) {
                advance();
                advance();
                op = "not in";
            } else {
                break;
            }
            operators.add(op);
            operands.add(parseAdditive());
        }

        return operators.isEmpty() ? first : new GuardExpression.Comparison(operands, operators);
    }

    private GuardExpression parseAdditive() {
        GuardExpression left = parseMultiplicative();
        while (peek().isOperator("+") || peek().isOperator("-")) {
            String op = advance().value();
            left = new GuardExpression.Arithmetic(op, left, parseMultiplicative());
        }
        return left;
    }

    private GuardExpression parseMultiplicative() {
        GuardExpression left = parseUnary();
        while (peek().isOperator("*") || peek().isOperator("/") || peek().isOperator("%")) {
            String op = advance().value();
            left = new GuardExpression.Arithmetic(op, left, parseUnary());
        }
        return left;
    }

    private GuardExpression parseUnary() {
        if (peek().isOperator("-")) {
            advance();
            enter();
            try {
                GuardExpression operand = parseUnary();
                if (operand instanceof GuardExpression.Literal lit && lit.value() instanceof BigDecimal d) {
                    return new GuardExpression.Literal(d.negate());
                }
                return new GuardExpression.Negate(operand);
            } finally {
                depth--;
            }
        }
        return parsePostfix();
    }

    private GuardExpression parsePostfix() {
        GuardExpression expr = parsePrimary();
        while (true) {
            if (check(GuardToken.TokenType.LBRACKET)) {
                int start = advance().position();
                GuardExpression key = parseNested();
                expect(GuardToken.TokenType.RBRACKET, "']' to close '[' at position " + start);
                expr = new GuardExpression.Index(expr, key);
            } else if (check(GuardToken.TokenType.DOT)) {
                advance();
                GuardToken name = expect(GuardToken.TokenType.IDENTIFIER, "a key name after '.'");
                if (name.value().equals("get") && check(GuardToken.TokenType.LPAREN)) {
                    expr = parseGetCall(expr, name.position());
                } else {
                    expr = new GuardExpression.Index(expr, new GuardExpression.Literal(name.value()));
                }
            } else {
                return expr;
            }
        }
    }

    private GuardExpression parseGetCall(GuardExpression target, int position) {
        advance(); // consume '('
        GuardExpression key = parseNested();
        GuardExpression fallback = null;
        if (check(GuardToken.TokenType.COMMA)) {
            advance();
            fallback = parseNested();
        }
        expect(GuardToken.TokenType.RPAREN, "')' to close get( at position " + position);
        return new GuardExpression.MapGet(target, key, fallback);
    }

    private GuardExpression parsePrimary() {
        GuardToken token = peek();

        return switch (token.type()) {
            case NUMBER -> {
                advance();
                yield new GuardExpression.Literal(new BigDecimal(token.value()));
            }
            case STRING -> {
                advance();
                yield new GuardExpression.Literal(token.value());
            }
            case LPAREN -> {
                advance();
                GuardExpression inner = parseNested();
                expect(GuardToken.TokenType.RPAREN, "')' to close '(' at position " + token.position());
                yield inner;
            }
            case IDENTIFIER -> parseName(token);
            case EOF -> throw new GuardSyntaxException("Unexpected end of guard expression");
            default -> throw new GuardSyntaxException(
                    "Unexpected " + token + " at position " + token.position());
        };
    }

    private GuardExpression parseName(GuardToken token) {
        advance();
        return switch (token.value()) {
            case "state" -> new GuardExpression.StateRef();
            case "true", "True" -> new GuardExpression.Literal(Boolean.TRUE);
            case "false", "False" -> new GuardExpression.Literal(Boolean.FALSE);
            case "null", "None" -> new GuardExpression.Literal(null);
            case "len" -> {
                expect(GuardToken.TokenType.LPAREN, "'(' after len");
                GuardExpression arg = parseNested();
                expect(GuardToken.TokenType.RPAREN, "')' to close len(");
                yield new GuardExpression.Length(arg);
            }
            default -> throw new GuardSyntaxException(
                    "Unknown name '" + token.value() + "' at position " + token.position()
                            + "; guards may only read 'state'");
        };
    }

    private GuardExpression parseNested() {
        enter();
        try {
            return parseOr();
        } finally {
            depth--;
        }
    }

    private void enter() {
        if (++depth > MAX_DEPTH) {
            throw new GuardSyntaxException("Guard expression nests deeper than " + MAX_DEPTH + " levels");
        }
    }

    private GuardToken expect(GuardToken.TokenType type, String what) {
        GuardToken token = peek();
        if (token.type() != type) {
            throw new GuardSyntaxException(
                    "Expected " + what + ", found " + token + " at position " + token.position());
        }
        return advance();
    }

    private GuardToken peek() {
        return tokens.get(current);
    }

    private GuardToken peekNext() {
        return current + 1 < tokens.size() ? tokens.get(current + 1) : tokens.get(tokens.size() - 1);
    }

    private GuardToken advance() {
        GuardToken token = tokens.get(current);
        if (!isAtEnd()) {
            current++;
        }
        return token;
    }

    private boolean check(GuardToken.TokenType type) {
        return peek().type() == type;
    }

    private boolean isAtEnd() {
        return peek().type() == GuardToken.TokenType.EOF;
    }
}
