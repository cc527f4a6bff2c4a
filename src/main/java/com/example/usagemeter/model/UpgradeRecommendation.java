package com.example.usagemeter.model;

import java.util.List;

public class UpgradeRecommendation {

    private final UsageAction action;
    private final String reason;
    private final long currentUsage;
    private final long currentLimit;
    private final double percentUsed;
    private final TierId currentTier;
    private final TierId recommendedTier;
    private final UsageLimit recommendedLimit;
    private final List<String> benefits;

    public UpgradeRecommendation(UsageAction action, String reason, long currentUsage, long currentLimit,
                                 double percentUsed, TierId currentTier, TierId recommendedTier,
                                 UsageLimit recommendedLimit, List<String> benefits) {
        this.action = action;
        this.reason = reason;
        this.currentUsage = currentUsage;
        this.currentLimit = currentLimit;
        this.percentUsed = percentUsed;
        this.currentTier = currentTier;
        this.recommendedTier = recommendedTier;
        this.recommendedLimit = recommendedLimit;
        this.benefits = List.copyOf(benefits);
    }

    public UsageAction getAction() {
        return action;
    }

    public String getReason() {
        return reason;
    }

    public long getCurrentUsage() {
        return currentUsage;
    }

    public long getCurrentLimit() {
        return currentLimit;
    }

    public double getPercentUsed() {
        return percentUsed;
    }

    public TierId getCurrentTier() {
        return currentTier;
    }

    public TierId getRecommendedTier() {
        return recommendedTier;
    }

    public UsageLimit getRecommendedLimit() {
        return recommendedLimit;
    }

    public List<String> getBenefits() {
        return benefits;
    }
}
