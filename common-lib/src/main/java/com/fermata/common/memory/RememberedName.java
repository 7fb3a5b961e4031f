package com.fermata.common.memory;

import com.fermata.common.template.NameType;

import java.time.Instant;

/** One name held by {@link GlobalNameMemory}. */
public record RememberedName(String name, String genre, NameType type, double qualityScore, Instant createdAt) {
}
