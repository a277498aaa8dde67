package com.jmau.template;

import com.jmau.template.ExpressionLexer.Token;
import com.jmau.template.ExpressionLexer.TokenType;
import com.jmau.value.Value;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.set.ImmutableSet;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.factory.Sets;

import java.math.BigInteger;

/**
 * Recursive-descent parser for the source of a single {@code {{ }}} or {@code {% %}} span.
 *
 * <p>Precedence, lowest first: {@code or ||}, {@code and &&}, {@code not}, comparisons,
 * {@code + -}, {@code * / %}, unary minus, filter pipes, primaries. Every failure is a
 * {@link TemplateSyntaxException}.
 */
public final class ExpressionParser {

    private static final ImmutableSet<String> KEYWORDS = Sets.immutable.of("and", "or", "not", "true", "false", "null");
    private static final ImmutableSet<String> COMPARISONS = Sets.immutable.of("==", "!=", "<", "<=", ">", ">=");
    static final int MAX_DEPTH = 256;

    private final ImmutableList<Token> tokens;
    private int pos;
    private int depth;

    private ExpressionParser(String source) {
        this.tokens = ExpressionLexer.tokenize(source);
    }

    /** Parses a complete expression, the body of an expression span. */
    public static Expression parseExpression(String source) {
        ExpressionParser parser = new ExpressionParser(source);
        Expression expression = parser.expression();
        parser.expectEnd();
        return expression;
    }

    /** Parses a complete tag, the body of a tag span. */
    public static Tag parseTag(String source) {
        ExpressionParser parser = new ExpressionParser(source);
        Tag tag = parser.tag();
        parser.expectEnd();
        return tag;
    }

    private Tag tag() {
        Token keyword = advance();
        if (keyword.type() != TokenType.IDENTIFIER) {
            throw error("Expected a tag name", keyword);
        }
        return switch (keyword.text()) {
            case "assign" -> {
                String name = plainIdentifier("variable name");
                expectOperator("=");
                yield new Tag.Assign(name, expression());
            }
            case "if" -> new Tag.If(expression());
            case "elsif" -> new Tag.Elsif(expression());
            case "else" -> new Tag.Else();
            case "endif" -> new Tag.EndIf();
            case "for" -> {
                String variable = plainIdentifier("loop variable");
                if (!peek().isKeyword("in")) {
                    throw error("Expected 'in'", peek());
                }
                advance();
                yield new Tag.For(variable, expression());
            }
            case "endfor" -> new Tag.EndFor();
            default -> throw error("Unknown tag '" + keyword.text() + "'", keyword);
        };
    }

    private String plainIdentifier(String what) {
        Token token = advance();
        if (token.type() != TokenType.IDENTIFIER || token.text().startsWith("$") || KEYWORDS.contains(token.text())) {
            throw error("Expected " + what, token);
        }
        return token.text();
    }

    private Expression expression() {
        descend();
        try {
            return or();
        } finally {
            depth--;
        }
    }

    /** Bounds the recursion of nested groups, arrays, arguments and prefix operators. */
    private void descend() {
        if (++depth > MAX_DEPTH) {
            depth--;
            throw error("Expression nested too deeply", peek());
        }
    }

    private Expression or() {
        Expression left = and();
        while (peek().isKeyword("or") || peek().isOperator("||")) {
            String operator = advance().text();
            left = new Expression.LogicalOp(operator, left, and());
        }
        return left;
    }

    private Expression and() {
        Expression left = not();
        while (peek().isKeyword("and") || peek().isOperator("&&")) {
            String operator = advance().text();
            left = new Expression.LogicalOp(operator, left, not());
        }
        return left;
    }

    private Expression not() {
        if (peek().isKeyword("not")) {
            advance();
            descend();
            try {
                return new Expression.Not(not());
            } finally {
                depth--;
            }
        }
        return comparison();
    }

    private Expression comparison() {
        Expression left = additive();
        while (peek().type() == TokenType.OPERATOR && COMPARISONS.contains(peek().text())) {
            String operator = advance().text();
            left = new Expression.BinaryOp(operator, left, additive());
        }
        return left;
    }

    private Expression additive() {
        Expression left = multiplicative();
        while (peek().isOperator("+") || peek().isOperator("-")) {
            String operator = advance().text();
            left = new Expression.BinaryOp(operator, left, multiplicative());
        }
        return left;
    }

    private Expression multiplicative() {
        Expression left = unary();
        while (peek().isOperator("*") || peek().isOperator("/") || peek().isOperator("%")) {
            String operator = advance().text();
            left = new Expression.BinaryOp(operator, left, unary());
        }
        return left;
    }

    private Expression unary() {
        if (peek().isOperator("-")) {
            if (startsNegativeNumber()) {
                return pipes(negativeNumber());
            }
            advance();
            descend();
            try {
                return new Expression.BinaryOp("-", new Expression.Literal(Value.of(0L)), unary());
            } finally {
                depth--;
            }
        }
        return pipes(primary());
    }

    private Expression pipes(Expression subject) {
        Expression result = subject;
        while (peek().isOperator("|")) {
            advance();
            Token name = advance();
            if (name.type() != TokenType.IDENTIFIER || name.text().startsWith("$")) {
                throw error("Expected a filter name after '|'", name);
            }
            MutableList<Expression> arguments = Lists.mutable.of(result);
            if (peek().isOperator("(")) {
                arguments.addAll(argumentList().castToList());
            }
            result = new Expression.Call(name.text(), arguments.toImmutable());
        }
        return result;
    }

    private Expression primary() {
        Token token = peek();
        switch (token.type()) {
            case NUMBER, STRING, ATOM -> {
                advance();
                return literal(token);
            }
            case IDENTIFIER -> {
                return identifierExpression();
            }
            case OPERATOR -> {
                if (token.isOperator("(")) {
                    advance();
                    Expression inner = expression();
                    expectOperator(")");
                    return inner;
                }
                if (token.isOperator("[")) {
                    return arrayLiteral();
                }
                throw error("Unexpected '" + token.text() + "'", token);
            }
            default -> throw error("Unexpected end of expression", token);
        }
    }

    private Expression identifierExpression() {
        Token token = peek();
        switch (token.text()) {
            case "true" -> {
                advance();
                return new Expression.Literal(Value.TRUE);
            }
            case "false" -> {
                advance();
                return new Expression.Literal(Value.FALSE);
            }
            case "null" -> {
                advance();
                return new Expression.Literal(Value.NULL);
            }
            default -> {
                if (KEYWORDS.contains(token.text())) {
                    throw error("Unexpected keyword '" + token.text() + "'", token);
                }
            }
        }
        if (!token.text().startsWith("$") && peekAt(1).isOperator("(")) {
            advance();
            return new Expression.Call(token.text(), argumentList());
        }
        return variablePath();
    }

    private ImmutableList<Expression> argumentList() {
        expectOperator("(");
        MutableList<Expression> arguments = Lists.mutable.empty();
        if (!peek().isOperator(")")) {
            arguments.add(expression());
            while (peek().isOperator(",")) {
                advance();
                arguments.add(expression());
            }
        }
        expectOperator(")");
        return arguments.toImmutable();
    }

    private Expression arrayLiteral() {
        expectOperator("[");
        MutableList<Expression> elements = Lists.mutable.empty();
        if (!peek().isOperator("]")) {
            elements.add(expression());
            while (peek().isOperator(",")) {
                advance();
                elements.add(expression());
            }
        }
        expectOperator("]");
        return new Expression.ArrayLiteral(elements.toImmutable());
    }

    private Expression.Variable variablePath() {
        Token root = advance();
        if (root.type() != TokenType.IDENTIFIER || KEYWORDS.contains(root.text())) {
            throw error("Expected a variable", root);
        }
        MutableList<PathSegment> path = Lists.mutable.of(new PathSegment.Root(root.text()));
        while (true) {
            if (peek().isOperator(".")) {
                advance();
                Token property = advance();
                if (property.type() != TokenType.IDENTIFIER || property.text().startsWith("$")) {
                    throw error("Expected a property name after '.'", property);
                }
                path.add(new PathSegment.Property(property.text()));
            } else if (peek().isOperator("[")) {
                advance();
                descend();
                try {
                    path.add(new PathSegment.Index(indexKey()));
                } finally {
                    depth--;
                }
                expectOperator("]");
            } else {
                return new Expression.Variable(path.toImmutable());
            }
        }
    }

    /** Index keys are restricted to literals and variable paths. */
    private Expression indexKey() {
        Token token = peek();
        if (token.isOperator("-") && startsNegativeNumber()) {
            return negativeNumber();
        }
        switch (token.type()) {
            case NUMBER, STRING, ATOM -> {
                advance();
                return literal(token);
            }
            case IDENTIFIER -> {
                if (token.isKeyword("true") || token.isKeyword("false") || token.isKeyword("null")) {
                    return identifierExpression();
                }
                return variablePath();
            }
            default -> throw error("Index must be a literal or a variable path", token);
        }
    }

    private boolean startsNegativeNumber() {
        Token minus = peek();
        Token number = peekAt(1);
        return minus.isOperator("-") && number.type() == TokenType.NUMBER && number.start() == minus.end();
    }

    private Expression negativeNumber() {
        Token minus = advance();
        Token number = advance();
        if (number.value() instanceof Value.FloatValue f) {
            return new Expression.Literal(Value.of(-f.value()));
        }
        BigInteger negated = new BigInteger(number.text()).negate();
        if (negated.bitLength() >= 64) {
            throw error("Number out of range: -" + number.text(), minus);
        }
        return new Expression.Literal(Value.of(negated.longValue()));
    }

    private Expression literal(Token token) {
        if (token.value() == null) {
            throw error("Number out of range: " + token.text(), token);
        }
        return new Expression.Literal(token.value());
    }

    private void expectOperator(String operator) {
        Token token = advance();
        if (!token.isOperator(operator)) {
            throw error("Expected '" + operator + "'", token);
        }
    }

    private void expectEnd() {
        Token token = peek();
        if (token.type() != TokenType.END) {
            throw error("Unexpected '" + token.text() + "'", token);
        }
    }

    private Token peek() {
        return peekAt(0);
    }

    private Token peekAt(int offset) {
        int index = Math.min(pos + offset, tokens.size() - 1);
        return tokens.get(index);
    }

    private Token advance() {
        Token token = peek();
        if (token.type() != TokenType.END) {
            pos++;
        }
        return token;
    }

    private static TemplateSyntaxException error(String message, Token token) {
        return new TemplateSyntaxException(message, token.start());
    }
}
