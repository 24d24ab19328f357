package com.labsweep.expression;

/**
 * Thrown when a value-list expression cannot be turned into a sequence of values.
 * Carries the failure {@link Kind}, the source text and, when evaluated inside a sequence tree,
 * the parameter name and depth of the offending node.
 */
public final class EvaluationException extends RuntimeException {

    /** Failure category. */
    public enum Kind {
        /** No expression text was entered. */
        EMPTY,
        /** The text does not parse (e.g. unbalanced brackets). */
        SYNTAX,
        /** Wrong argument count or type for an allowed function or operator, or a non-sequence result. */
        TYPE,
        /** An allowed function or operator rejected an argument value. */
        VALUE,
        /** Any other failure, e.g. an identifier outside the allowed set. */
        OTHER
    }

    private final Kind kind;
    private final String detail;
    private final String expression;
    private final String parameter;
    private final int depth;

    EvaluationException(Kind kind, String detail) {
        this(kind, detail, null, null, -1, null);
    }

    EvaluationException(Kind kind, String detail, Throwable cause) {
        this(kind, detail, null, null, -1, cause);
    }

    private EvaluationException(Kind kind, String detail, String expression, String parameter, int depth,
                                Throwable cause) {
        super(formatMessage(kind, detail, parameter, depth), cause);
        this.kind = kind;
        this.detail = detail;
        this.expression = expression;
        this.parameter = parameter;
        this.depth = depth;
    }

    /** Factories for custom {@link SweepFunction}s; the evaluator adds the location. */
    public static EvaluationException syntax(String detail) {
        return new EvaluationException(Kind.SYNTAX, detail);
    }

    public static EvaluationException type(String detail) {
        return new EvaluationException(Kind.TYPE, detail);
    }

    public static EvaluationException value(String detail) {
        return new EvaluationException(Kind.VALUE, detail);
    }

    public static EvaluationException other(String detail) {
        return new EvaluationException(Kind.OTHER, detail);
    }

    /** Returns a copy of this failure located at the given expression, parameter and depth. */
    EvaluationException locate(String expression, String parameter, int depth) {
        EvaluationException located = new EvaluationException(kind, detail, expression, parameter, depth, getCause());
        located.setStackTrace(getStackTrace());
        return located;
    }

    private static String formatMessage(Kind kind, String detail, String parameter, int depth) {
        StringBuilder sb = new StringBuilder(kind.name()).append(": ").append(detail);
        if (parameter != null || depth >= 0) {
            sb.append(" (parameter '").append(parameter).append("', depth ").append(depth).append(')');
        }
        return sb.toString();
    }

    public Kind getKind() {
        return kind;
    }

    /** Failure description without the location suffix. */
    public String getDetail() {
        return detail;
    }

    /** Source text that failed; null when not yet located. */
    public String getExpression() {
        return expression;
    }

    /** Parameter name of the node whose expression failed; null outside a sequence tree. */
    public String getParameter() {
        return parameter;
    }

    /** Tree depth of the node whose expression failed; -1 outside a sequence tree. */
    public int getDepth() {
        return depth;
    }
}
