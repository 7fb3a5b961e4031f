package com.fermata.generation.service;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.stream.Collectors;

/**
 * Hand-curated names used when every generative path came up short. These bypass the
 * repetition guard; the only rule is no duplicates within one response.
 */
@Component
public class FallbackNamePool {

    static final List<String> NAMES = List.of(
        "Electric Dreams", "Midnight Echo", "Golden Hour", "Neon Lights",
        "Silver Storm", "Crystal Vision", "Velvet Thunder", "Rainbow Fire",
        "Azure Wave", "Diamond Dust", "Cosmic Dance", "Starlight Symphony"
    );

    public int size() {
        return NAMES.size();
    }

    /**
     * Up to {@code n} pool names absent from {@code exclude} (case-insensitive), in random order.
     */
    public List<String> draw(int n, Collection<String> exclude, Random rng) {
        List<String> taken = exclude.stream().map(String::toLowerCase).collect(Collectors.toList());
        List<String> available = new ArrayList<>();
        for (String name : NAMES) {
            if (!taken.contains(name.toLowerCase())) available.add(name);
        }
        Collections.shuffle(available, rng);
        return List.copyOf(available.subList(0, Math.min(Math.max(n, 0), available.size())));
    }
}
