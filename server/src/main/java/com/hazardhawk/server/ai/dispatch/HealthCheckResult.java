package com.hazardhawk.server.ai.dispatch;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class HealthCheckResult {
    private final List<StrategyHealth> strategies;
    private final boolean networkConnected;
    private final double successFloor;
    private final long checkedAt;

    public HealthCheckResult(List<StrategyHealth> strategies, boolean networkConnected, double successFloor,
            long checkedAt) {
        this.strategies = Collections.unmodifiableList(new ArrayList<>(strategies));
        this.networkConnected = networkConnected;
        this.successFloor = successFloor;
        this.checkedAt = checkedAt;
    }

    public List<StrategyHealth> getStrategies() {
        return strategies;
    }

    public boolean isNetworkConnected() {
        return networkConnected;
    }

    public double getSuccessFloor() {
        return successFloor;
    }

    public long getCheckedAt() {
        return checkedAt;
    }

    /** True when at least one enabled strategy reports itself available. */
    public boolean isOverallHealthy() {
        for (StrategyHealth s : strategies) {
            if (s.isAvailable() && !s.isDisabled()) {
                return true;
            }
        }
        return false;
    }

    public List<String> getStrategiesBelowFloor() {
        List<String> names = new ArrayList<>();
        for (StrategyHealth s : strategies) {
            if (s.isBelowSuccessFloor()) {
                names.add(s.getName());
            }
        }
        return names;
    }
}
