package com.rcpilot.core.diagnostic;

/**
 * One classified verifier complaint. Either the annotation itself is rejected
 * ({@link InvalidAnnotation}) or it was accepted and the property behind it
 * could not be proved ({@link ProofFailure}).
 */
public abstract class Diagnostic {

    private final String rawLine;

    protected Diagnostic(String rawLine) {
        this.rawLine = rawLine != null ? rawLine : "";
    }

    /** The output line that triggered this diagnostic. */
    public String getRawLine() {
        return rawLine;
    }

    public abstract boolean isSyntaxError();

    // =========================================================================

    public static final class InvalidAnnotation extends Diagnostic {

        private final String location;
        private final String reason;

        public InvalidAnnotation(String location, String reason, String rawLine) {
            super(rawLine);
            this.location = location != null ? location : "unknown";
            this.reason   = reason != null ? reason : "";
        }

        public String getLocation() { return location; }
        public String getReason()   { return reason; }

        @Override
        public boolean isSyntaxError() {
            return true;
        }

        @Override
        public String toString() {
            return "InvalidAnnotation{location=" + location + ", reason=" + reason + "}";
        }
    }

    public static final class ProofFailure extends Diagnostic {

        private final String symbol;
        private final String message;

        public ProofFailure(String symbol, String message, String rawLine) {
            super(rawLine);
            this.symbol  = symbol != null ? symbol : "unknown";
            this.message = message != null ? message : "";
        }

        public String getSymbol()  { return symbol; }
        public String getMessage() { return message; }

        @Override
        public boolean isSyntaxError() {
            return false;
        }

        @Override
        public String toString() {
            return "ProofFailure{symbol=" + symbol + ", message=" + message + "}";
        }
    }
}
