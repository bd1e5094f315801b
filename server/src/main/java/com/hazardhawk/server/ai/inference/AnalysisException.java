package com.hazardhawk.server.ai.inference;

public class AnalysisException extends Exception {

    private final AnalysisErrorKind kind;

    public AnalysisException(AnalysisErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public AnalysisException(AnalysisErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public AnalysisErrorKind getKind() {
        return kind;
    }

    public static AnalysisException configuration(String message) {
        return new AnalysisException(AnalysisErrorKind.CONFIGURATION, message);
    }

    public static AnalysisException configuration(String message, Throwable cause) {
        return new AnalysisException(AnalysisErrorKind.CONFIGURATION, message, cause);
    }

    public static AnalysisException unavailable(String message) {
        return new AnalysisException(AnalysisErrorKind.UNAVAILABLE, message);
    }

    public static AnalysisException timeout(String message) {
        return new AnalysisException(AnalysisErrorKind.TIMEOUT, message);
    }

    public static AnalysisException thermalThrottling(String message) {
        return new AnalysisException(AnalysisErrorKind.THERMAL_THROTTLING, message);
    }

    public static AnalysisException outOfMemory(String message, Throwable cause) {
        return new AnalysisException(AnalysisErrorKind.OUT_OF_MEMORY, message, cause);
    }

    public static AnalysisException inference(String message) {
        return new AnalysisException(AnalysisErrorKind.INFERENCE, message);
    }

    public static AnalysisException inference(String message, Throwable cause) {
        return new AnalysisException(AnalysisErrorKind.INFERENCE, message, cause);
    }
}
