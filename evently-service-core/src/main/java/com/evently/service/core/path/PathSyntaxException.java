package com.evently.service.core.path;

/** Raised when a field path expression cannot be parsed. */
public class PathSyntaxException extends IllegalArgumentException {

    private final String expression;
    private final int position;

    public PathSyntaxException(String expression, int position, String reason) {
        super("Invalid path expression '" + expression + "' at offset " + position + ": " + reason);
        this.expression = expression;
        this.position = position;
    }

    public String getExpression() {
        return expression;
    }

    public int getPosition() {
        return position;
    }
}
