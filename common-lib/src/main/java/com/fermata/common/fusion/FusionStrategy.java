package com.fermata.common.fusion;

import java.util.Optional;

/**
 * One way of building a fused name. Strategies are tried in order until one produces a
 * candidate that passes validation; an empty result means "not applicable here".
 */
@FunctionalInterface
public interface FusionStrategy {

    Optional<FusionCandidate> attempt(FusionContext context);
}
