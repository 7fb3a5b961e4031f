package com.fermata.common.template;

import java.util.Locale;

public enum NameType {
    BAND,
    SONG;

    /** Lenient parse; anything unrecognised is treated as {@link #BAND}. */
    public static NameType fromString(String value) {
        if (value == null) return BAND;
        return "song".equals(value.trim().toLowerCase(Locale.ROOT)) ? SONG : BAND;
    }
}
