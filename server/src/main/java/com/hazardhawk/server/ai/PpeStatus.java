package com.hazardhawk.server.ai;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * PPE compliance summary for the people visible in a photo.
 */
public class PpeStatus {
    private final Map<PpeItem, PpeItemStatus> items;
    private final float overallCompliance;

    public PpeStatus(Map<PpeItem, PpeItemStatus> items, float overallCompliance) {
        EnumMap<PpeItem, PpeItemStatus> copy = new EnumMap<>(PpeItem.class);
        if (items != null) {
            copy.putAll(items);
        }
        this.items = Collections.unmodifiableMap(copy);
        this.overallCompliance = overallCompliance;
    }

    public Map<PpeItem, PpeItemStatus> getItems() {
        return items;
    }

    public float getOverallCompliance() {
        return overallCompliance;
    }

    public PpeItemStatus statusOf(PpeItem item) {
        return items.getOrDefault(item, PpeItemStatus.UNKNOWN);
    }
}
