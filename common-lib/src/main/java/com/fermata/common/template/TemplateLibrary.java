package com.fermata.common.template;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Fixed catalog of phrase templates.
 *
 * <p>One-, two- and three-word templates each produce exactly that many words. Longer templates
 * declare an inclusive range and stretch their phrase to whatever count inside it is requested.
 *
 * <p>The catalog is built once and never mutated, so a single instance can be shared freely
 * across threads. Repeated lookups with the same arguments return equal lists.
 */
public final class TemplateLibrary {

    private static final TemplateLibrary STANDARD = new TemplateLibrary(standardTemplates());

    private static final Map<String, GenreModifiers> GENRE_MODIFIERS = Map.of(
        "rock", new GenreModifiers(
            List.of("raw", "wild", "electric", "fierce", "bold", "heavy", "hard", "rough", "loud", "strong"),
            List.of("thunder", "storm", "fire", "steel", "stone", "mountain", "lightning", "power", "force", "energy"),
            List.of("rock", "roll", "smash", "crash", "bang", "roar", "scream", "shake", "break", "burn"),
            List.of("rebellion", "freedom", "power", "energy", "raw_emotion")),
        "jazz", new GenreModifiers(
            List.of("smooth", "cool", "blue", "mellow", "sweet", "sophisticated", "elegant", "rich", "deep", "velvet"),
            List.of("note", "rhythm", "harmony", "melody", "tempo", "groove", "soul", "spirit", "heart", "blues"),
            List.of("swing", "flow", "improvise", "glide", "weave", "dance", "sing", "play", "feel", "express"),
            List.of("improvisation", "sophistication", "emotion", "soul", "expression")),
        "electronic", new GenreModifiers(
            List.of("digital", "synthetic", "electric", "neon", "cyber", "virtual", "holographic", "neural"),
            List.of("code", "signal", "frequency", "wave", "pulse", "circuit", "network", "grid"),
            List.of("process", "generate", "transmit", "stream", "sync", "connect", "pulse", "glitch"),
            List.of("technology", "future", "digital", "synthetic", "artificial")),
        "folk", new GenreModifiers(
            List.of("ancient", "wise", "simple", "pure", "natural", "gentle", "peaceful", "earthy", "rustic", "traditional"),
            List.of("story", "tale", "song", "ballad", "legend", "myth", "memory", "heritage", "root", "branch"),
            List.of("tell", "sing", "remember", "share", "pass", "keep", "honor", "preserve", "celebrate", "cherish"),
            List.of("tradition", "storytelling", "heritage", "nature", "simplicity")),
        "pop", new GenreModifiers(
            List.of("bright", "catchy", "fun", "happy", "upbeat", "colorful", "sparkling", "shining", "glowing", "radiant"),
            List.of("star", "dream", "love", "heart", "life", "world", "sky", "sun", "moon", "rainbow"),
            List.of("shine", "glow", "sparkle", "dance", "sing", "love", "dream", "hope", "wish", "celebrate"),
            List.of("accessibility", "mainstream", "catchy", "memorable", "uplifting"))
    );

    private final List<Template> templates;
    private final Map<String, Template> byId;

    public TemplateLibrary(List<Template> templates) {
        this.templates = List.copyOf(templates);
        Map<String, Template> index = new LinkedHashMap<>();
        for (Template template : this.templates) {
            if (index.put(template.id(), template) != null) {
                throw new IllegalArgumentException("duplicate template id: " + template.id());
            }
        }
        this.byId = Collections.unmodifiableMap(index);
    }

    /** The shared built-in catalog. */
    public static TemplateLibrary standard() {
        return STANDARD;
    }

    public List<Template> all() {
        return templates;
    }

    /** Every template whose inclusive range contains {@code wordCount}. */
    public List<Template> getTemplates(int wordCount) {
        List<Template> result = new ArrayList<>();
        for (Template template : templates) {
            if (template.covers(wordCount)) result.add(template);
        }
        return Collections.unmodifiableList(result);
    }

    /**
     * Templates in {@code category}, optionally narrowed to those covering {@code wordCount}.
     *
     * @param wordCount {@code null} to ignore length
     */
    public List<Template> getTemplatesByCategory(String category, Integer wordCount) {
        List<Template> result = new ArrayList<>();
        for (Template template : templates) {
            if (!template.category().equals(category)) continue;
            if (wordCount != null && !template.covers(wordCount)) continue;
            result.add(template);
        }
        return Collections.unmodifiableList(result);
    }

    /** @return the template, or {@code null} when the id is unknown */
    public Template byId(String id) {
        return byId.get(id);
    }

    public Set<String> categories() {
        Set<String> categories = new LinkedHashSet<>();
        for (Template template : templates) categories.add(template.category());
        return Collections.unmodifiableSet(categories);
    }

    /** Template counts by word-count key ({@code "2"} or {@code "4-8"}) and by category. */
    public LibraryStatistics statistics() {
        Map<String, Integer> byWordCount = new TreeMap<>();
        Map<String, Integer> byCategory = new TreeMap<>();
        for (Template template : templates) {
            String key = template.isFixedLength()
                ? String.valueOf(template.minWordCount())
                : template.minWordCount() + "-" + template.maxWordCount();
            byWordCount.merge(key, 1, Integer::sum);
            byCategory.merge(template.category(), 1, Integer::sum);
        }
        return new LibraryStatistics(templates.size(), byWordCount, byCategory);
    }

    /** Genre-flavoured slot vocabulary; {@link GenreModifiers#none()} for unlisted genres. */
    public static GenreModifiers genreModifiers(String genre) {
        if (genre == null) return GenreModifiers.none();
        return GENRE_MODIFIERS.getOrDefault(genre, GenreModifiers.none());
    }

    public record LibraryStatistics(int totalTemplates, Map<String, Integer> byWordCount, Map<String, Integer> byCategory) {
        public LibraryStatistics {
            byWordCount = Collections.unmodifiableMap(new TreeMap<>(byWordCount));
            byCategory = Collections.unmodifiableMap(new TreeMap<>(byCategory));
        }
    }

    // ── catalog ─────────────────────────────────────────────────────────────

    private static List<Template> standardTemplates() {
        List<Template> list = new ArrayList<>();

        // single word
        list.add(fixed("abstract_concept", TemplateKind.ABSTRACT_CONCEPT, "conceptual", "abstract", 0.25, 1,
            "{concept}", "Paradox", "Nexus", "Zenith", "Void"));
        list.add(fixed("compound_creation", TemplateKind.COMPOUND_CREATION, "linguistic", "compound", 0.30, 1,
            "{prefix}{base}", "Neowave", "Hypercore", "Metasound"));
        list.add(fixed("suffix_evolution", TemplateKind.SUFFIX_EVOLUTION, "linguistic", "morphology", 0.20, 1,
            "{base}{suffix}", "Beatology", "Soundism", "Rhythmcore"));
        list.add(fixed("numeric_mystique", TemplateKind.NUMERIC_MYSTIQUE, "symbolic", "numeric", 0.15, 1,
            "{number}", "XIII", "808", "Binary", "Infinite"));
        list.add(fixed("rare_singular", TemplateKind.RARE_SINGULAR, "vocabulary", "rare", 0.10, 1,
            "{rare_word}", "Lumina", "Tempest", "Aurora", "Cosmos"));

        // two words
        list.add(fixed("dynamic_adjective_noun", TemplateKind.DYNAMIC_ADJECTIVE_NOUN, "descriptive", "quality", 0.20, 2,
            "{dynamic_adjective} {powerful_noun}", "Electric Storm", "Sonic Bloom", "Primal Echo"));
        list.add(fixed("contrasting_elements", TemplateKind.CONTRASTING_ELEMENTS, "conceptual", "contrast", 0.15, 2,
            "{element1} {element2}", "Fire Ice", "Silent Thunder", "Dark Light"));
        list.add(fixed("action_object", TemplateKind.ACTION_OBJECT, "narrative", "action", 0.18, 2,
            "{action_verb} {target_noun}", "Chasing Shadows", "Breaking Chains", "Riding Thunder"));
        list.add(new Template("techno_organic", TemplateKind.TECHNO_ORGANIC, "fusion", "tech_nature", 0.12, 2, 2,
            Set.of("electronic", "indie", "pop", "hip-hop", "ambient", "industrial", "synthpop"), Set.of(),
            "{tech_element} {organic_element}", List.of("Digital Forest", "Cyber Rain", "Neon Garden")));
        list.add(fixed("emotional_landscape", TemplateKind.EMOTIONAL_LANDSCAPE, "emotional", "landscape", 0.15, 2,
            "{emotion} {landscape}", "Melancholy Hills", "Euphoric Valleys", "Restless Seas"));
        list.add(fixed("temporal_concept", TemplateKind.TEMPORAL_CONCEPT, "temporal", "time", 0.10, 2,
            "{time_element} {concept}", "Forever Young", "Yesterday Dreams", "Tomorrow Calling"));
        list.add(fixed("numbered_concept", TemplateKind.NUMBERED_CONCEPT, "symbolic", "enumerated", 0.10, 2,
            "{number} {concept}", "Seven Sins", "Thirteen Moons", "Zero Hour"));

        // three words
        list.add(fixed("classic_the_adjective_noun", TemplateKind.CLASSIC_THE_ADJECTIVE_NOUN, "traditional", "band_classic", 0.25, 3,
            "The {adjective} {noun}", "The Electric Storm", "The Broken Hearts", "The Rising Sun"));
        list.add(fixed("narrative_sequence", TemplateKind.NARRATIVE_SEQUENCE, "narrative", "story", 0.20, 3,
            "{subject} {verb} {object}", "Hearts Beat Fast", "Dreams Come True", "Fire Burns Bright"));
        list.add(fixed("question_format", TemplateKind.QUESTION_FORMAT, "interrogative", "question", 0.15, 3,
            "{question_word} {verb} {noun}", "Who Are You", "Where Is Love", "Why So Serious"));
        list.add(fixed("location_action", TemplateKind.LOCATION_ACTION, "spatial", "place_action", 0.15, 3,
            "{preposition} {location} {action}", "Beyond Starlight Dancing", "Under Water Dreaming", "Through Fire Walking"));
        list.add(fixed("emotional_journey", TemplateKind.EMOTIONAL_JOURNEY, "emotional", "progression", 0.12, 3,
            "{emotion} {transition} {outcome}", "Love Becomes Pain", "Joy Turns Sorrow", "Hope Finds Light"));
        list.add(fixed("compound_modifier", TemplateKind.COMPOUND_MODIFIER, "linguistic", "compound", 0.08, 3,
            "{compound_word} {modifier} {noun}", "Firelight Dancing Shadows", "Moonbeam Silver Dreams", "Stardust Golden Rain"));
        list.add(fixed("sensory_experience", TemplateKind.SENSORY_EXPERIENCE, "sensory", "perception", 0.05, 3,
            "{sense} {intensity} {experience}", "Taste Sweet Victory", "Feel Deep Rhythm", "Hear Silent Screams"));

        // four or more words
        list.add(ranged("complete_narrative", TemplateKind.COMPLETE_NARRATIVE, "narrative", "story", 0.30, 4, 8,
            Set.of(), "{article} {adjective} {noun} {verb} {adverb}",
            "The Wild Heart Beats Forever", "A Broken Dream Shines Bright"));
        list.add(ranged("poetic_sequence", TemplateKind.POETIC_SEQUENCE, "poetic", "verse", 0.25, 4, 6,
            Set.of(), "{noun} {verb} {preposition} {article} {noun}",
            "Dreams Flow Through the Night", "Love Burns in the Dark"));
        list.add(ranged("philosophical_statement", TemplateKind.PHILOSOPHICAL_STATEMENT, "philosophical", "wisdom", 0.20, 5, 8,
            Set.of(), "{concept} {verb} {modifier} Than {comparison}",
            "Truth Speaks Louder Than Words", "Love Grows Stronger Than Fear"));
        list.add(ranged("temporal_journey", TemplateKind.TEMPORAL_JOURNEY, "temporal", "journey", 0.15, 5, 7,
            Set.of(), "{time_start} {connector} {time_end} {outcome}",
            "Dawn Breaks Into Endless Day", "Midnight Flows Into Golden Light"));
        list.add(ranged("conditional_narrative", TemplateKind.CONDITIONAL_NARRATIVE, "conditional", "if_then", 0.10, 6, 10,
            Set.of("romantic", "nostalgic", "melancholic", "uplifting", "peaceful", "euphoric"),
            "{condition} {outcome}",
            "When Hearts Stop Beating Love Remains", "If Dreams Could Fly We'd Touch Stars"));

        return list;
    }

    private static Template fixed(String id, TemplateKind kind, String category, String subcategory,
                                  double weight, int words, String shape, String... examples) {
        return new Template(id, kind, category, subcategory, weight, words, words,
            Set.of(), Set.of(), shape, List.of(examples));
    }

    private static Template ranged(String id, TemplateKind kind, String category, String subcategory,
                                   double weight, int min, int max, Set<String> moods, String shape,
                                   String... examples) {
        return new Template(id, kind, category, subcategory, weight, min, max,
            Set.of(), moods, shape, List.of(examples));
    }
}
