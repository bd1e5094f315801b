package com.hazardhawk.server.ai.dispatch;

import com.hazardhawk.server.ai.inference.AnalysisErrorKind;
import com.hazardhawk.server.ai.inference.AnalysisException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Terminal failure of a cascade. The message separates strategies that were skipped from those
 * that ran and failed; the last concrete strategy error is the cause.
 */
public class AllStrategiesExhaustedException extends AnalysisException {

    private final List<StrategyAttempt> attempts;

    public AllStrategiesExhaustedException(List<StrategyAttempt> attempts, Throwable lastError) {
        super(AnalysisErrorKind.ALL_STRATEGIES_EXHAUSTED, describe(attempts, lastError), lastError);
        this.attempts = Collections.unmodifiableList(new ArrayList<>(attempts));
    }

    public List<StrategyAttempt> getAttempts() {
        return attempts;
    }

    public List<StrategyAttempt> getSkipped() {
        List<StrategyAttempt> skipped = new ArrayList<>();
        for (StrategyAttempt a : attempts) {
            if (a.getOutcome().isSkipped()) {
                skipped.add(a);
            }
        }
        return skipped;
    }

    public List<StrategyAttempt> getFailed() {
        List<StrategyAttempt> failed = new ArrayList<>();
        for (StrategyAttempt a : attempts) {
            if (!a.getOutcome().isSkipped()) {
                failed.add(a);
            }
        }
        return failed;
    }

    private static String describe(List<StrategyAttempt> attempts, Throwable lastError) {
        List<StrategyAttempt> skipped = new ArrayList<>();
        List<StrategyAttempt> failed = new ArrayList<>();
        for (StrategyAttempt a : attempts) {
            if (a.getOutcome().isSkipped()) {
                skipped.add(a);
            } else {
                failed.add(a);
            }
        }
        StringBuilder sb = new StringBuilder("All analysis strategies exhausted");
        if (attempts.isEmpty()) {
            sb.append(": no strategies configured");
        }
        sb.append("; skipped ").append(skipped);
        sb.append("; failed ").append(failed);
        if (lastError != null) {
            sb.append("; last error: ").append(lastError.getMessage());
        }
        return sb.toString();
    }
}
