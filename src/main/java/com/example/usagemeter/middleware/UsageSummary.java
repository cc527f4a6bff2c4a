package com.example.usagemeter.middleware;

import com.example.usagemeter.model.RateLimitStatus;
import com.example.usagemeter.model.TierStatus;
import com.example.usagemeter.model.UpgradeRecommendation;
import com.example.usagemeter.model.UsageStatistics;

import java.util.List;

/**
 * Everything a tenant-facing usage page needs in one object.
 */
public class UsageSummary {

    private final TierStatus tierStatus;
    private final UsageStatistics monthToDate;
    private final List<RateLimitStatus> rateLimits;
    private final List<UpgradeRecommendation> recommendations;

    public UsageSummary(TierStatus tierStatus, UsageStatistics monthToDate, List<RateLimitStatus> rateLimits,
                        List<UpgradeRecommendation> recommendations) {
        this.tierStatus = tierStatus;
        this.monthToDate = monthToDate;
        this.rateLimits = List.copyOf(rateLimits);
        this.recommendations = List.copyOf(recommendations);
    }

    public TierStatus getTierStatus() {
        return tierStatus;
    }

    public UsageStatistics getMonthToDate() {
        return monthToDate;
    }

    /**
     * Empty when the counter store could not be read.
     */
    public List<RateLimitStatus> getRateLimits() {
        return rateLimits;
    }

    public List<UpgradeRecommendation> getRecommendations() {
        return recommendations;
    }
}
