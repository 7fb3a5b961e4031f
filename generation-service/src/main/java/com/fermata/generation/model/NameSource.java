package com.fermata.generation.model;

import java.util.Locale;

/** Which generation path produced a name. */
public enum NameSource {
    TEMPLATE,
    FUSION,
    DYNAMIC,
    FALLBACK;

    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }
}
