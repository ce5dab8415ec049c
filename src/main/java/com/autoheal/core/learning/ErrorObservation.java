package com.autoheal.core.learning;

/**
 * One error to learn from, optionally with the outcome of the fix that was tried.
 */
public final class ErrorObservation {

    private final String  type;
    private final String  message;
    private final String  fixAction;
    private final boolean succeeded;

    private ErrorObservation(String type, String message, String fixAction, boolean succeeded) {
        this.type      = type == null || type.isEmpty() ? "unknown" : type;
        this.message   = message;
        this.fixAction = fixAction;
        this.succeeded = succeeded;
    }

    public static ErrorObservation of(String type, String message) {
        return new ErrorObservation(type, message, null, false);
    }

    public static ErrorObservation withFix(String type, String message, String fixAction, boolean succeeded) {
        return new ErrorObservation(type, message, fixAction, succeeded);
    }

    public String getType()      { return type; }
    public String getMessage()   { return message; }
    public String getFixAction() { return fixAction; }
    public boolean isSucceeded() { return succeeded; }

    public boolean hasFix() {
        return fixAction != null;
    }
}
