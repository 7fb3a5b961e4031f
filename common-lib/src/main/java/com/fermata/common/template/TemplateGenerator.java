package com.fermata.common.template;

import com.fermata.common.wordsource.WordCategory;
import com.fermata.common.wordsource.WordSource;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static com.fermata.common.template.PhraseText.capitalize;
import static com.fermata.common.template.PhraseText.gerund;
import static com.fermata.common.template.PhraseText.pick;
import static com.fermata.common.template.PhraseText.pickAny;
import static com.fermata.common.template.PhraseText.singularize;
import static com.fermata.common.template.PhraseText.thirdPerson;

/**
 * Builds a phrase for a {@link Template} by dispatching on its {@link TemplateKind}.
 *
 * <p>Generation is a pure function of {@code (template, source, context, rng)}: no shared state is
 * read or written, so the same seed reproduces the same phrase. Every slot is filled with a single
 * token, which keeps the output word count exact:
 * <ul>
 *   <li>fixed-length templates always emit {@code minWordCount} words;</li>
 *   <li>range templates emit {@code context.wordCount()} words when it lies in range, and
 *       {@code minWordCount} words otherwise.</li>
 * </ul>
 */
public final class TemplateGenerator {

    private static final List<String> CONCEPTS = List.of(
        "Paradox", "Nexus", "Zenith", "Void", "Prism", "Echo", "Flux", "Cipher",
        "Apex", "Vortex", "Enigma", "Spectrum", "Resonance", "Catalyst", "Synthesis");
    private static final List<String> PREFIXES = List.of(
        "neo", "hyper", "ultra", "meta", "proto", "omni", "anti", "poly", "multi", "pseudo");
    private static final List<String> SUFFIXES = List.of(
        "ism", "ology", "esque", "onic", "atic", "morphic", "core", "wave", "sphere", "verse");
    private static final List<String> NUMBERS = List.of(
        "Zero", "Seven", "Eleven", "XIII", "XXIV", "404", "808", "Binary", "Infinite", "Omega", "Alpha");
    private static final List<String> RARE_WORDS = List.of(
        "Lumina", "Tempest", "Aurora", "Cosmos", "Ethereal", "Nebula", "Solaris",
        "Vesper", "Celeste", "Astral", "Phantom", "Mirage", "Radiant", "Sublime");
    private static final List<String> DYNAMIC_ADJECTIVES = List.of(
        "Electric", "Sonic", "Primal", "Vital", "Raw", "Pure", "Fierce", "Wild",
        "Blazing", "Liquid", "Crystalline", "Volatile", "Kinetic", "Magnetic");
    private static final List<String> POWERFUL_NOUNS = List.of(
        "Storm", "Bloom", "Echo", "Fire", "Wave", "Force", "Energy", "Pulse",
        "Surge", "Rhythm", "Current", "Flow", "Impact", "Resonance");
    private static final List<List<String>> CONTRASTS = List.of(
        List.of("Fire", "Ice"), List.of("Silent", "Thunder"), List.of("Dark", "Light"), List.of("Smooth", "Edge"),
        List.of("Gentle", "Storm"), List.of("Bright", "Shadow"), List.of("Fast", "Slow"), List.of("High", "Low"),
        List.of("Ancient", "Future"), List.of("Natural", "Digital"), List.of("Warm", "Cold"), List.of("Soft", "Steel"));
    private static final List<String> ACTIONS = List.of(
        "Chasing", "Breaking", "Riding", "Crossing", "Climbing", "Diving", "Flying",
        "Dancing", "Singing", "Burning", "Flowing", "Rising", "Falling", "Spinning");
    private static final List<String> TARGETS = List.of(
        "Shadows", "Chains", "Thunder", "Dreams", "Stars", "Waves", "Mountains",
        "Rivers", "Clouds", "Fire", "Light", "Time", "Space", "Hearts");
    private static final List<String> TECH_ELEMENTS = List.of(
        "Digital", "Cyber", "Neon", "Pixel", "Binary", "Neural", "Virtual",
        "Hologram", "Laser", "Circuit", "Code", "Signal", "Chrome", "Static");
    private static final List<String> ORGANIC_ELEMENTS = List.of(
        "Forest", "Rain", "Garden", "Ocean", "Mountain", "River", "Desert",
        "Valley", "Meadow", "Grove", "Lake", "Storm", "Wind", "Earth");
    private static final List<String> EMOTIONS = List.of(
        "Melancholy", "Euphoric", "Restless", "Serene", "Passionate", "Nostalgic",
        "Turbulent", "Peaceful", "Intense", "Gentle", "Fierce", "Tender");
    private static final List<String> LANDSCAPES = List.of(
        "Hills", "Valleys", "Seas", "Plains", "Peaks", "Shores", "Fields",
        "Cliffs", "Canyons", "Meadows", "Horizons", "Depths", "Heights", "Paths");
    private static final List<String> TIME_ELEMENTS = List.of(
        "Forever", "Yesterday", "Tomorrow", "Midnight", "Dawn", "Twilight",
        "Eternal", "Timeless", "Ancient", "Future", "Present", "Infinite");
    private static final List<String> TIME_CONCEPTS = List.of(
        "Young", "Dreams", "Calling", "Memories", "Hopes", "Echoes", "Shadows",
        "Light", "Love", "Peace", "Fire", "Storm", "Rain", "Sun");
    private static final List<String> COUNTS = List.of(
        "Zero", "One", "Seven", "Thirteen", "Hundred", "Thousand", "Million", "First", "Last");
    private static final List<String> COUNTED = List.of(
        "Sins", "Moons", "Hour", "Stars", "Dreams", "Hearts", "Souls", "Lives",
        "Chances", "Wishes", "Tears", "Smiles", "Songs", "Stories");
    private static final List<String> SUBJECTS = List.of(
        "Hearts", "Dreams", "Fire", "Stars", "Waves", "Winds", "Souls", "Eyes", "Hands", "Voices");
    private static final List<String> SEQUENCE_VERBS = List.of(
        "Beat", "Come", "Burn", "Shine", "Flow", "Dance", "Sing", "Rise", "Fall", "Call");
    private static final List<String> SEQUENCE_OBJECTS = List.of(
        "Fast", "True", "Bright", "High", "Deep", "Strong", "Free", "Wild", "Pure", "Bold");
    private static final List<String> QUESTION_WORDS = List.of("Who", "What", "Where", "When", "Why", "How");
    private static final List<String> QUESTION_VERBS = List.of(
        "Are", "Is", "Were", "Was", "Do", "Did", "Can", "Will", "Should");
    private static final List<String> QUESTION_NOUNS = List.of(
        "You", "Love", "Serious", "This", "That", "We", "They", "Time", "Life", "Hope");
    private static final List<String> PREPOSITIONS = List.of(
        "Beyond", "Under", "Through", "Above", "Below", "Within", "Behind", "Across");
    private static final List<String> LOCATIONS = List.of(
        "Horizon", "Starlight", "Fire", "Water", "Mountains", "Valleys", "Skies", "Seas");
    private static final List<String> LOCATION_ACTIONS = List.of(
        "Dancing", "Walking", "Running", "Flying", "Singing", "Dreaming", "Waiting", "Calling");
    private static final List<String> JOURNEY_EMOTIONS = List.of(
        "Love", "Joy", "Hope", "Fear", "Pain", "Peace", "Rage", "Calm", "Doubt", "Faith");
    private static final List<String> TRANSITIONS = List.of(
        "Becomes", "Turns", "Finds", "Meets", "Brings", "Takes", "Makes", "Gives");
    private static final List<String> OUTCOMES = List.of(
        "Pain", "Sorrow", "Light", "Dark", "Peace", "War", "Life", "Death", "Truth", "Lies");
    private static final List<String> COMPOUNDS = List.of(
        "Firelight", "Moonbeam", "Stardust", "Sunlight", "Rainfall", "Snowfall", "Windstorm");
    private static final List<String> MODIFIERS = List.of(
        "Dancing", "Silver", "Golden", "Crystal", "Diamond", "Velvet", "Silk", "Steel");
    private static final List<String> COMPOUND_NOUNS = List.of(
        "Shadows", "Dreams", "Rain", "Snow", "Wind", "Fire", "Water", "Earth", "Sky", "Stars");
    private static final List<String> SENSES = List.of("Taste", "Feel", "Hear", "See", "Touch", "Smell", "Sense", "Know");
    private static final List<String> SENSE_INTENSITIES = List.of(
        "Sweet", "Deep", "Silent", "Loud", "Soft", "Hard", "Sharp", "Smooth");
    private static final List<String> EXPERIENCES = List.of(
        "Victory", "Rhythm", "Screams", "Colors", "Music", "Love", "Pain", "Joy");
    private static final List<String> ARTICLES = List.of("The", "A", "This", "That", "Every", "Each");
    private static final List<String> ADVERBS = List.of(
        "Forever", "Always", "Never", "Sometimes", "Often", "Rarely", "Softly", "Loudly");
    private static final List<String> POETIC_PREPOSITIONS = List.of(
        "through", "in", "on", "under", "over", "beside", "beyond", "within");
    private static final List<String> PHILOSOPHY_CONCEPTS = List.of(
        "Truth", "Love", "Hope", "Faith", "Peace", "Joy", "Light", "Time", "Life", "Death");
    private static final List<String> PHILOSOPHY_VERBS = List.of(
        "Speaks", "Grows", "Shines", "Burns", "Flows", "Rises", "Falls", "Lives", "Dies", "Wins");
    private static final List<String> COMPARATIVES = List.of(
        "Louder", "Stronger", "Brighter", "Deeper", "Higher", "Faster", "Slower", "Better");
    private static final List<String> COMPARISONS = List.of(
        "Words", "Fear", "Darkness", "Hate", "War", "Pain", "Sorrow", "Death", "Time");
    private static final List<String> TIME_STARTS = List.of(
        "Yesterday", "Dawn", "Midnight", "Twilight", "Morning", "Evening", "Today");
    private static final List<List<String>> CONNECTORS = List.of(
        List.of("Breaks", "Into"), List.of("Flows", "Into"), List.of("Turns", "Into"),
        List.of("Leads", "To"), List.of("Fades", "Into"));
    private static final List<String> TIME_ENDS = List.of(
        "Tomorrow's", "Endless", "Eternal", "Infinite", "Golden", "Silver", "Crystal");
    private static final List<String> JOURNEY_OUTCOMES = List.of(
        "Dream", "Day", "Night", "Light", "Hope", "Peace", "Love", "Song", "Dance");
    private static final List<String> CONDITIONS = List.of(
        "When Hearts Stop Beating", "If Dreams Could Fly", "Should Time Stand Still",
        "Where Love Goes Deep", "While Stars Keep Shining");
    private static final List<String> SHORT_RESOLUTIONS = List.of(
        "Love Remains", "Silence Answers", "Echoes Linger", "Fire Returns", "Hope Survives");
    private static final List<String> LONG_RESOLUTIONS = List.of(
        "We'd Touch Stars", "We'd Dance Forever", "Hope Lives On", "Peace Will Come", "Nothing Stays Lost");
    private static final List<String> CLOSERS = List.of("Tonight", "Again", "Alone", "Forever", "Still");

    private TemplateGenerator() {}

    /**
     * Generates one phrase.
     *
     * @param template template to realise
     * @param source   vocabulary; empty categories fall back to built-in pools
     * @param context  request shape; {@code wordCount} selects the length for range templates
     * @param rng      randomness source; the only input that varies between calls
     * @return a non-blank phrase whose word count honours the template's range
     */
    public static String generate(Template template, WordSource source, GenerationContext context, Random rng) {
        int target = template.covers(context.wordCount()) ? context.wordCount() : template.minWordCount();
        Slots s = new Slots(source, TemplateLibrary.genreModifiers(context.genre()), rng);

        return switch (template.kind()) {
            // single word
            case ABSTRACT_CONCEPT -> capitalize(pickAny(rng, "Echo", CONCEPTS, s.filtered(WordCategory.MUSICAL_TERMS)));
            case COMPOUND_CREATION -> capitalize(pick(PREFIXES, rng, "neo") + pickAny(rng, "wave",
                s.filtered(WordCategory.NOUNS), s.filtered(WordCategory.GENRE_TERMS),
                s.filtered(WordCategory.MUSICAL_TERMS), s.modifiers.nouns()));
            case SUFFIX_EVOLUTION -> capitalize(pickAny(rng, "rhythm",
                shorterThan(s.filtered(WordCategory.NOUNS), 8), s.filtered(WordCategory.GENRE_TERMS))
                + pick(SUFFIXES, rng, "core"));
            case NUMERIC_MYSTIQUE -> pick(NUMBERS, rng, "808");
            case RARE_SINGULAR -> capitalize(pickAny(rng, "Aurora", RARE_WORDS, shorterThan(source.longWords(), 9)));

            // two words
            case DYNAMIC_ADJECTIVE_NOUN -> phrase(
                pickAny(rng, "Electric", DYNAMIC_ADJECTIVES,
                    longerThan(s.filtered(WordCategory.ADJECTIVES), 5), s.modifiers.adjectives()),
                singularize(pickAny(rng, "Storm", POWERFUL_NOUNS, s.filtered(WordCategory.NOUNS), s.modifiers.nouns())));
            case CONTRASTING_ELEMENTS -> {
                List<String> pair = CONTRASTS.get(rng.nextInt(CONTRASTS.size()));
                yield phrase(pair.get(0), pair.get(1));
            }
            case ACTION_OBJECT -> phrase(
                pickAny(rng, "Chasing", ACTIONS, gerunds(s.filtered(WordCategory.VERBS))),
                pickAny(rng, "Shadows", TARGETS, s.filtered(WordCategory.NOUNS)));
            case TECHNO_ORGANIC -> phrase(
                pick(TECH_ELEMENTS, rng, "Digital"),
                pickAny(rng, "Forest", ORGANIC_ELEMENTS, s.filtered(WordCategory.CONTEXTUAL_WORDS)));
            case EMOTIONAL_LANDSCAPE -> phrase(
                pick(EMOTIONS, rng, "Melancholy"),
                pickAny(rng, "Hills", LANDSCAPES, s.filtered(WordCategory.CONTEXTUAL_WORDS)));
            case TEMPORAL_CONCEPT -> phrase(
                pick(TIME_ELEMENTS, rng, "Forever"),
                pickAny(rng, "Young", TIME_CONCEPTS, s.filtered(WordCategory.NOUNS)));
            case NUMBERED_CONCEPT -> phrase(
                pick(COUNTS, rng, "Seven"),
                pickAny(rng, "Stars", COUNTED, s.filtered(WordCategory.NOUNS)));

            // three words
            case CLASSIC_THE_ADJECTIVE_NOUN -> phrase("The", s.adjective(), singularize(s.noun()));
            case NARRATIVE_SEQUENCE -> phrase(
                pickAny(rng, "Hearts", SUBJECTS, s.filtered(WordCategory.NOUNS)),
                pickAny(rng, "Beat", SEQUENCE_VERBS, s.filtered(WordCategory.VERBS), s.modifiers.verbs()),
                pickAny(rng, "Fast", SEQUENCE_OBJECTS, s.filtered(WordCategory.ADJECTIVES)));
            case QUESTION_FORMAT -> phrase(
                pick(QUESTION_WORDS, rng, "Who"),
                pick(QUESTION_VERBS, rng, "Are"),
                pickAny(rng, "You", QUESTION_NOUNS, s.filtered(WordCategory.NOUNS)));
            case LOCATION_ACTION -> phrase(
                pick(PREPOSITIONS, rng, "Beyond"),
                pickAny(rng, "Horizon", LOCATIONS, s.filtered(WordCategory.CONTEXTUAL_WORDS)),
                pickAny(rng, "Dancing", LOCATION_ACTIONS, gerunds(s.filtered(WordCategory.VERBS))));
            case EMOTIONAL_JOURNEY -> phrase(
                pick(JOURNEY_EMOTIONS, rng, "Love"),
                pick(TRANSITIONS, rng, "Becomes"),
                pickAny(rng, "Pain", OUTCOMES, s.filtered(WordCategory.NOUNS)));
            case COMPOUND_MODIFIER -> phrase(
                pick(COMPOUNDS, rng, "Firelight"),
                pickAny(rng, "Silver", MODIFIERS, s.filtered(WordCategory.ADJECTIVES)),
                pickAny(rng, "Shadows", COMPOUND_NOUNS, s.filtered(WordCategory.NOUNS)));
            case SENSORY_EXPERIENCE -> phrase(
                pick(SENSES, rng, "Feel"),
                pickAny(rng, "Deep", SENSE_INTENSITIES, s.filtered(WordCategory.ADJECTIVES)),
                pickAny(rng, "Rhythm", EXPERIENCES, s.filtered(WordCategory.NOUNS)));

            // four or more words
            case COMPLETE_NARRATIVE -> completeNarrative(target, s);
            case POETIC_SEQUENCE -> poeticSequence(target, s);
            case PHILOSOPHICAL_STATEMENT -> philosophicalStatement(target, s);
            case TEMPORAL_JOURNEY -> temporalJourney(target, s);
            case CONDITIONAL_NARRATIVE -> conditionalNarrative(target, s);
        };
    }

    // ── range templates ─────────────────────────────────────────────────────

    private static String completeNarrative(int target, Slots s) {
        List<String> words = new ArrayList<>();
        if (target >= 5) words.add(pick(ARTICLES, s.rng, "The"));
        words.add(s.adjective());
        words.add(singularize(s.noun()));
        words.add(finiteVerb(s.verb()));
        words.add(pick(ADVERBS, s.rng, "Forever"));
        words.addAll(tail(target - words.size(), s));
        return titled(words);
    }

    private static String poeticSequence(int target, Slots s) {
        List<String> words = new ArrayList<>();
        words.add(capitalize(s.noun()));
        words.add(capitalize(s.verb()));
        words.add(pick(POETIC_PREPOSITIONS, s.rng, "through"));
        int remaining = target - 3;
        if (remaining >= 2) {
            words.add(s.rng.nextBoolean() ? "the" : "a");
            for (int i = 0; i < remaining - 2; i++) words.add(capitalize(s.adjective()));
        }
        words.add(capitalize(singularize(s.noun())));
        return String.join(" ", words);
    }

    private static String philosophicalStatement(int target, Slots s) {
        List<String> words = new ArrayList<>();
        words.add(pickAny(s.rng, "Truth", PHILOSOPHY_CONCEPTS, s.filtered(WordCategory.NOUNS)));
        words.add(pickAny(s.rng, "Speaks", PHILOSOPHY_VERBS, thirdPersons(s.filtered(WordCategory.VERBS))));
        words.add(pick(COMPARATIVES, s.rng, "Louder"));
        words.add("Than");
        words.addAll(nounPhrase(target - 4, s, pickAny(s.rng, "Words", COMPARISONS, s.filtered(WordCategory.NOUNS))));
        return titled(words);
    }

    private static String temporalJourney(int target, Slots s) {
        List<String> words = new ArrayList<>();
        words.add(pick(TIME_STARTS, s.rng, "Dawn"));
        words.addAll(CONNECTORS.get(s.rng.nextInt(CONNECTORS.size())));
        words.add(pick(TIME_ENDS, s.rng, "Endless"));
        for (int i = 0; i < target - 5; i++) words.add(s.adjective());
        words.add(pickAny(s.rng, "Dream", JOURNEY_OUTCOMES, s.filtered(WordCategory.NOUNS)));
        return titled(words);
    }

    private static String conditionalNarrative(int target, Slots s) {
        List<String> words = new ArrayList<>(PhraseText.words(pick(CONDITIONS, s.rng, "When Hearts Stop Beating")));
        if (target <= 6) {
            words.addAll(PhraseText.words(pick(SHORT_RESOLUTIONS, s.rng, "Love Remains")));
        } else {
            words.addAll(PhraseText.words(pick(LONG_RESOLUTIONS, s.rng, "Hope Lives On")));
            words.addAll(tail(target - words.size(), s));
        }
        return titled(words);
    }

    /**
     * Trailing words that extend a finished clause by exactly {@code count} words:
     * a closing adverb, a prepositional pair, or "prep the adj... noun".
     */
    static List<String> tail(int count, Slots s) {
        List<String> words = new ArrayList<>();
        if (count <= 0) return words;
        if (count == 1) {
            words.add(pick(CLOSERS, s.rng, "Tonight"));
            return words;
        }
        words.add(pick(PREPOSITIONS, s.rng, "Through"));
        words.addAll(nounPhrase(count - 1, s, s.noun()));
        return words;
    }

    /** Exactly {@code count} words ending in {@code head}: "head", "adj head", "the adj.. head". */
    private static List<String> nounPhrase(int count, Slots s, String head) {
        List<String> words = new ArrayList<>();
        if (count <= 0) return words;
        if (count >= 3) {
            words.add("The");
            for (int i = 0; i < count - 2; i++) words.add(s.adjective());
        } else if (count == 2) {
            words.add(s.adjective());
        }
        words.add(head);
        return words;
    }

    // ── helpers ─────────────────────────────────────────────────────────────

    private static String phrase(String... words) {
        return titled(List.of(words));
    }

    private static String titled(List<String> words) {
        List<String> out = new ArrayList<>(words.size());
        for (String word : words) {
            out.add(Character.isDigit(word.charAt(0)) || isRoman(word) ? word : capitalize(word));
        }
        return String.join(" ", out);
    }

    private static boolean isRoman(String word) {
        return word.length() > 1 && word.chars().allMatch(c -> "IVXLCDM".indexOf(c) >= 0);
    }

    static String finiteVerb(String verb) {
        String lower = verb.toLowerCase();
        if (lower.endsWith("ing") || lower.endsWith("ed") || lower.endsWith("s")) return verb;
        return thirdPerson(verb);
    }

    private static List<String> gerunds(List<String> verbs) {
        List<String> result = new ArrayList<>(verbs.size());
        for (String verb : verbs) result.add(capitalize(gerund(verb)));
        return result;
    }

    private static List<String> thirdPersons(List<String> verbs) {
        List<String> result = new ArrayList<>(verbs.size());
        for (String verb : verbs) result.add(finiteVerb(verb));
        return result;
    }

    private static List<String> shorterThan(List<String> words, int limit) {
        List<String> result = new ArrayList<>();
        for (String word : words) if (word.length() < limit) result.add(word);
        return result;
    }

    private static List<String> longerThan(List<String> words, int limit) {
        List<String> result = new ArrayList<>();
        for (String word : words) if (word.length() > limit) result.add(word);
        return result;
    }

    /** Per-call slot sources: the word source, the request genre's modifiers and the rng. */
    static final class Slots {
        final WordSource source;
        final GenreModifiers modifiers;
        final Random rng;

        Slots(WordSource source, GenreModifiers modifiers, Random rng) {
            this.source = source;
            this.modifiers = modifiers;
            this.rng = rng;
        }

        List<String> filtered(WordCategory category) {
            return source.filtered(category);
        }

        String adjective() {
            return pickAny(rng, "Electric", source.words(WordCategory.ADJECTIVES), modifiers.adjectives());
        }

        String noun() {
            return pickAny(rng, "Storm", source.words(WordCategory.NOUNS), modifiers.nouns());
        }

        String verb() {
            return pickAny(rng, "Rise", source.words(WordCategory.VERBS), modifiers.verbs());
        }
    }
}
