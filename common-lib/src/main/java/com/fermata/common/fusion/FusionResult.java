package com.fermata.common.fusion;

/**
 * One accepted fused name.
 *
 * @param qualityScore overall quality in [0, 1]
 */
public record FusionResult(String name, FusionMetadata metadata, double qualityScore, FusionExplanations explanations) {
}
