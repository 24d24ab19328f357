package com.labsweep.sequence;

/** A loaded line names a parameter outside the caller's allowed set. */
public final class ParameterValidationException extends RuntimeException {

    private final String parameter;
    private final int lineNumber;

    public ParameterValidationException(String parameter, int lineNumber) {
        super("Unknown parameter name '" + parameter + "' at line " + lineNumber);
        this.parameter = parameter;
        this.lineNumber = lineNumber;
    }

    public String getParameter() {
        return parameter;
    }

    public int getLineNumber() {
        return lineNumber;
    }
}
