package com.hazardhawk.server.ai.inference;

public class BackendSelection {
    private final Backend backend;
    private final boolean thermallyForced;
    private final String reason;

    public BackendSelection(Backend backend, boolean thermallyForced, String reason) {
        this.backend = backend;
        this.thermallyForced = thermallyForced;
        this.reason = reason;
    }

    public Backend getBackend() {
        return backend;
    }

    /** The ThermalThrottling condition: a better backend was eligible but heat forced CPU. */
    public boolean isThermallyForced() {
        return thermallyForced;
    }

    public String getReason() {
        return reason;
    }

    @Override
    public String toString() {
        return backend + (thermallyForced ? " (thermal)" : "") + ": " + reason;
    }
}
