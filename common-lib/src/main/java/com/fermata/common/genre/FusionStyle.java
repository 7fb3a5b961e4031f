package com.fermata.common.genre;

import java.util.Locale;

/** How two genres relate when fused. */
public enum FusionStyle {
    COMPLEMENT,
    CONTRAST,
    HYBRID,
    EVOLUTION;

    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }
}
