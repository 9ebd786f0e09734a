package com.evently.service.core.path;

import java.util.ArrayList;
import java.util.List;

/**
 * Recursive-descent parser for field path expressions.
 *
 * <pre>
 *   union   := term ('|' term)*
 *   term    := '(' union ')' | path
 *   path    := '$' ('.' step)? rest | step rest
 *   rest    := ('.' step | '[' bracket ']')*
 *   step    := IDENT | QUOTED | '*'
 *   bracket := IDENT | QUOTED | INT | '*'
 * </pre>
 *
 * IDENT is {@code [A-Za-z_@][A-Za-z0-9_@-]*}; QUOTED uses single or double quotes with backslash escapes.
 * Whitespace is allowed around operators.
 */
final class PathExpressionParser {

    private final String source;
    private int pos;

    private PathExpressionParser(String source) {
        this.source = source;
    }

    /** Parses one expression into its alternatives, each a list of segments. */
    static List<List<PathSegment>> parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new PathSyntaxException(String.valueOf(expression), 0, "empty path expression");
        }
        PathExpressionParser parser = new PathExpressionParser(expression);
        List<List<PathSegment>> alternatives = parser.union();
        parser.skipWhitespace();
        if (!parser.atEnd()) {
            throw parser.error("unexpected character '" + parser.peek() + "'");
        }
        return alternatives;
    }

    private List<List<PathSegment>> union() {
        List<List<PathSegment>> alternatives = new ArrayList<>(term());
        skipWhitespace();
        while (!atEnd() && peek() == '|') {
            pos++;
            alternatives.addAll(term());
            skipWhitespace();
        }
        return alternatives;
    }

    private List<List<PathSegment>> term() {
        skipWhitespace();
        if (!atEnd() && peek() == '(') {
            pos++;
            List<List<PathSegment>> inner = union();
            skipWhitespace();
            expect(')');
            return inner;
        }
        return List.of(path());
    }

    private List<PathSegment> path() {
        List<PathSegment> segments = new ArrayList<>();
        if (!atEnd() && peek() == '$') {
            pos++;
            if (!atEnd() && peek() == '.') {
                pos++;
                segments.add(step());
            }
        } else {
            segments.add(step());
        }
        while (true) {
            skipWhitespace();
            if (atEnd()) break;
            char c = peek();
            if (c == '.') {
                pos++;
                segments.add(step());
            } else if (c == '[') {
                pos++;
                segments.add(bracket());
                skipWhitespace();
                expect(']');
            } else {
                break;
            }
        }
        return List.copyOf(segments);
    }

    private PathSegment step() {
        skipWhitespace();
        if (atEnd()) {
            throw error("expected field name");
        }
        char c = peek();
        if (c == '*') {
            pos++;
            return new PathSegment.Wildcard();
        }
        if (c == '\'' || c == '"') {
            return new PathSegment.Field(quoted());
        }
        if (isIdentStart(c)) {
            return new PathSegment.Field(identifier());
        }
        throw error("expected field name but found '" + c + "'");
    }

    private PathSegment bracket() {
        skipWhitespace();
        if (atEnd()) {
            throw error("unterminated '['");
        }
        char c = peek();
        if (c == '*') {
            pos++;
            return new PathSegment.Wildcard();
        }
        if (c == '\'' || c == '"') {
            return new PathSegment.Field(quoted());
        }
        if (Character.isDigit(c)) {
            return new PathSegment.Index(integer());
        }
        if (isIdentStart(c)) {
            return new PathSegment.Field(identifier());
        }
        throw error("unexpected '" + c + "' inside brackets");
    }

    private String identifier() {
        int start = pos;
        pos++;
        while (!atEnd() && isIdentPart(peek())) {
            pos++;
        }
        return source.substring(start, pos);
    }

    private int integer() {
        int start = pos;
        while (!atEnd() && Character.isDigit(peek())) {
            pos++;
        }
        try {
            return Integer.parseInt(source.substring(start, pos));
        } catch (NumberFormatException ex) {
            throw new PathSyntaxException(source, start, "index out of range");
        }
    }

    private String quoted() {
        int start = pos;
        char quote = source.charAt(pos++);
        StringBuilder sb = new StringBuilder();
        while (!atEnd()) {
            char c = source.charAt(pos++);
            if (c == quote) {
                return sb.toString();
            }
            if (c == '\\' && !atEnd()) {
                c = source.charAt(pos++);
            }
            sb.append(c);
        }
        throw new PathSyntaxException(source, start, "unterminated quoted name");
    }

    private void expect(char expected) {
        if (atEnd() || peek() != expected) {
            throw error("expected '" + expected + "'");
        }
        pos++;
    }

    private void skipWhitespace() {
        while (!atEnd() && Character.isWhitespace(peek())) {
            pos++;
        }
    }

    private boolean atEnd() {
        return pos >= source.length();
    }

    private char peek() {
        return source.charAt(pos);
    }

    private PathSyntaxException error(String reason) {
        return new PathSyntaxException(source, pos, reason);
    }

    private static boolean isIdentStart(char c) {
        return Character.isLetter(c) || c == '_' || c == '@';
    }

    private static boolean isIdentPart(char c) {
        return isIdentStart(c) || Character.isDigit(c) || c == '-';
    }
}
