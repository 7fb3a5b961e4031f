package com.fermata.common.guard;

import java.time.Duration;

/**
 * Tunables of a {@link RepetitionGuard}.
 *
 * @param recentWordCapacity     size of the recent-name and recent-word queues
 * @param recentTemplateCapacity size of the recent-template queue
 * @param sharedWordFraction     share of recent names a candidate may overlap before rejection
 * @param decayInterval          idle time after which usage counts are halved
 * @param categoryThreshold      category uses tolerated within the decay window before penalties
 * @param subcategoryThreshold   subcategory uses tolerated within the decay window before penalties
 */
public record GuardSettings(
    int recentWordCapacity,
    int recentTemplateCapacity,
    double sharedWordFraction,
    Duration decayInterval,
    int categoryThreshold,
    int subcategoryThreshold
) {

    public GuardSettings {
        if (recentWordCapacity <= 0 || recentTemplateCapacity <= 0) {
            throw new IllegalArgumentException("guard capacities must be positive");
        }
        if (sharedWordFraction < 0.0 || sharedWordFraction > 1.0) {
            throw new IllegalArgumentException("sharedWordFraction must be within [0, 1]: " + sharedWordFraction);
        }
        if (decayInterval == null || decayInterval.isNegative() || decayInterval.isZero()) {
            throw new IllegalArgumentException("decayInterval must be positive");
        }
    }

    public static GuardSettings defaults() {
        return new GuardSettings(30, 20, 0.5, Duration.ofMinutes(5), 3, 2);
    }
}
