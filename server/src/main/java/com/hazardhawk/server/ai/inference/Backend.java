package com.hazardhawk.server.ai.inference;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Execution unit for the on-device model engine. AUTO leaves the choice to the engine itself.
 */
public enum Backend {
    CPU,
    GPU,
    NPU,
    AUTO;

    /** Most preferred first. */
    public static final List<Backend> PREFERENCE_ORDER = Collections.unmodifiableList(Arrays.asList(GPU, NPU, CPU));
}
