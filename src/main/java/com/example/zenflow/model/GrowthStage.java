package com.example.zenflow.model;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Default tree growth stages, ordered by the minutes they require.
 */
public enum GrowthStage {
    SEED("Seed", 0, "circle.fill"),
    SPROUT("Sprout", 30, "leaf.fill"),
    SAPLING("Sapling", 120, "tree"),
    YOUNG_TREE("Young Tree", 300, "tree.fill"),
    MATURE_TREE("Mature Tree", 600, "tree.fill"),
    ANCIENT_TREE("Ancient Tree", 1200, "sparkles");

    private final String title;
    private final int requiredMinutes;
    private final String symbolName;

    GrowthStage(String title, int requiredMinutes, String symbolName) {
        this.title = title;
        this.requiredMinutes = requiredMinutes;
        this.symbolName = symbolName;
    }

    public String getTitle() { return title; }
    public int getRequiredMinutes() { return requiredMinutes; }
    public String getSymbolName() { return symbolName; }

    public MilestoneThreshold toThreshold() {
        return new MilestoneThreshold(title, requiredMinutes, symbolName);
    }

    public static List<MilestoneThreshold> defaultTable() {
        return Arrays.stream(values())
                .map(GrowthStage::toThreshold)
                .collect(Collectors.toList());
    }
}
