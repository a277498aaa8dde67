package com.jmau.template;

import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns template text into a flat node sequence. Never fails: a span whose body does not parse is
 * kept, delimiters included, as literal text.
 */
public final class TemplateParser {

    private static final Logger LOG = LoggerFactory.getLogger(TemplateParser.class);

    private TemplateParser() {
    }

    public static ImmutableList<Node> parse(String template) {
        MutableList<Node> nodes = Lists.mutable.empty();
        int length = template.length();
        int textStart = 0;
        int pos = 0;
        while (pos < length) {
            int open = template.indexOf('{', pos);
            if (open < 0 || open + 1 >= length) {
                break;
            }
            char kind = template.charAt(open + 1);
            if (kind != '{' && kind != '%' && kind != '#') {
                pos = open + 1;
                continue;
            }
            int close = findClose(template, open + 2, kind);
            if (close < 0) {
                break;
            }
            appendText(nodes, template.substring(textStart, open));
            String span = template.substring(open, close + 2);
            if (kind != '#') {
                Node node = parseSpan(kind, template.substring(open + 2, close), span);
                if (node instanceof Node.Text text) {
                    appendText(nodes, text.content());
                } else {
                    nodes.add(node);
                }
            }
            pos = close + 2;
            textStart = pos;
        }
        appendText(nodes, template.substring(textStart));
        return nodes.toImmutable();
    }

    private static Node parseSpan(char kind, String inner, String span) {
        String body = inner;
        boolean trimLeft = false;
        boolean trimRight = false;
        if (body.startsWith("-") && !(body.length() > 1 && ExpressionLexer.isDigit(body.charAt(1)))) {
            trimLeft = true;
            body = body.substring(1);
        }
        if (body.endsWith("-")) {
            trimRight = true;
            body = body.substring(0, body.length() - 1);
        }
        try {
            if (kind == '{') {
                return new Node.ExpressionNode(ExpressionParser.parseExpression(body), trimLeft, trimRight);
            }
            return new Node.TagNode(ExpressionParser.parseTag(body), trimLeft, trimRight);
        } catch (TemplateSyntaxException e) {
            LOG.debug("Keeping unparseable span {} as text: {}", span, e.getMessage());
            return new Node.Text(span);
        }
    }

    /**
     * Finds the closing delimiter of a span opened with {@code kind}. Quoted strings inside
     * expression and tag spans are skipped, so a closing delimiter inside a string literal does
     * not end the span.
     */
    private static int findClose(String template, int from, char kind) {
        String close = kind == '{' ? "}}" : kind == '%' ? "%}" : "#}";
        if (kind == '#') {
            return template.indexOf(close, from);
        }
        int pos = from;
        while (pos < template.length()) {
            char c = template.charAt(pos);
            if (c == '"' || c == '\'') {
                int end = skipString(template, pos);
                if (end < 0) {
                    return template.indexOf(close, from);
                }
                pos = end;
            } else if (template.startsWith(close, pos)) {
                return pos;
            } else {
                pos++;
            }
        }
        return -1;
    }

    private static int skipString(String template, int start) {
        char quote = template.charAt(start);
        int pos = start + 1;
        while (pos < template.length()) {
            char c = template.charAt(pos);
            if (c == '\\') {
                pos += 2;
            } else if (c == quote) {
                return pos + 1;
            } else {
                pos++;
            }
        }
        return -1;
    }

    private static void appendText(MutableList<Node> nodes, String content) {
        if (content.isEmpty()) {
            return;
        }
        if (!nodes.isEmpty() && nodes.getLast() instanceof Node.Text previous) {
            nodes.set(nodes.size() - 1, new Node.Text(previous.content() + content));
        } else {
            nodes.add(new Node.Text(content));
        }
    }
}
