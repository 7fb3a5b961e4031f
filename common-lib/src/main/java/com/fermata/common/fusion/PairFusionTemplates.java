package com.fermata.common.fusion;

import com.fermata.common.fusion.PairFusionTemplate.Slot;
import com.fermata.common.genre.FusionStyle;

import java.util.List;
import java.util.stream.Collectors;

/** Curated fusion templates for the genre pairs that have them. */
public final class PairFusionTemplates {

    private PairFusionTemplates() {}

    private static final List<PairFusionTemplate> TEMPLATES = List.of(
        new PairFusionTemplate("electro_jazz_synthesis", "electronic", "jazz", FusionStyle.HYBRID, 2, 3,
            List.of(Slot.of("Digital", "Cyber", "Synthetic", "Virtual", "Electric"),
                    Slot.of("Bebop", "Swing", "Improvisation", "Harmony", "Rhythm"),
                    Slot.optional("Matrix", "Protocol", "System", "Engine", "Network")),
            List.of("Digital Bebop Matrix", "Cyber Swing Protocol", "Synthetic Harmony Engine")),
        new PairFusionTemplate("harmonic_synthesis_fusion", "jazz", "electronic", FusionStyle.COMPLEMENT, 2, 4,
            List.of(Slot.of("Harmonic", "Melodic", "Rhythmic", "Tonal", "Modal"),
                    Slot.of("Synthesis", "Modulation", "Processing", "Algorithm", "Transformation"),
                    Slot.optional("Collective", "Laboratory", "Institute", "Network")),
            List.of("Harmonic Synthesis Collective", "Modal Processing Laboratory", "Tonal Modulation")),

        new PairFusionTemplate("digital_folklore", "folk", "electronic", FusionStyle.CONTRAST, 2, 3,
            List.of(Slot.of("Digital", "Electronic", "Cyber", "Virtual", "Binary"),
                    Slot.of("Folk", "Heritage", "Roots", "Ballads", "Lore", "Tales")),
            List.of("Digital Folk", "Electronic Heritage", "Binary Ballads")),
        new PairFusionTemplate("organic_synthetic_bridge", "folk", "electronic", FusionStyle.EVOLUTION, 2, 4,
            List.of(Slot.of("Organic", "Natural", "Acoustic", "Wooden", "Earthen"),
                    Slot.optional("Meets", "Bridges", "Crosses", "Connects"),
                    Slot.of("Digital", "Synthetic", "Electronic", "Virtual", "Circuit")),
            List.of("Organic Meets Digital", "Natural Bridges Synthetic", "Acoustic Circuit")),

        new PairFusionTemplate("symphonic_power", "rock", "classical", FusionStyle.COMPLEMENT, 2, 3,
            List.of(Slot.of("Symphonic", "Orchestral", "Chamber", "Philharmonic", "Concerto"),
                    Slot.of("Thunder", "Storm", "Power", "Force", "Fury")),
            List.of("Symphonic Thunder", "Orchestral Storm", "Chamber Fury")),
        new PairFusionTemplate("classical_rebellion", "classical", "rock", FusionStyle.CONTRAST, 2, 4,
            List.of(Slot.of("Sonata", "Concerto", "Symphony", "Prelude", "Fugue"),
                    Slot.of("Rebellion", "Revolution", "Uprising", "Revolt", "Defiance"),
                    Slot.optional("Society", "Collective", "Alliance", "Union", "League")),
            List.of("Sonata Rebellion Society", "Symphony Revolution", "Fugue Defiance League")),

        new PairFusionTemplate("flow_improvisation", "hip-hop", "jazz", FusionStyle.HYBRID, 2, 3,
            List.of(Slot.of("Flow", "Cipher", "Rhythm", "Beats", "Groove"),
                    Slot.of("Improvisation", "Freestyle", "Swing", "Bebop", "Jazz")),
            List.of("Flow Improvisation", "Cipher Swing", "Groove Freestyle")),
        new PairFusionTemplate("urban_sophistication", "hip-hop", "jazz", FusionStyle.EVOLUTION, 2, 4,
            List.of(Slot.of("Urban", "Street", "Underground", "Metro", "City"),
                    Slot.of("Sophistication", "Elegance", "Refinement", "Class", "Style"),
                    Slot.optional("Collective", "Society", "Institute", "Academy")),
            List.of("Urban Sophistication Collective", "Street Elegance", "Metro Refinement Academy"))
    );

    public static List<PairFusionTemplate> all() {
        return TEMPLATES;
    }

    /** Templates authored for the pair, in either order. */
    public static List<PairFusionTemplate> forPair(String a, String b) {
        return TEMPLATES.stream().filter(t -> t.covers(a, b)).collect(Collectors.toList());
    }
}
