package com.fermata.common.selection;

import com.fermata.common.guard.RepetitionGuard;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * Request-scoped state of one generation call: the random source, the guard it reports to,
 * and the names accepted so far.
 *
 * <p>Not thread-safe; a session belongs to one request. The guard it references may be shared.
 */
public class SelectionSession {

    private final RepetitionGuard guard;
    private final Random random;
    private final List<String> accepted = new ArrayList<>();

    public SelectionSession(RepetitionGuard guard, Random random) {
        this.guard = guard;
        this.random = random;
    }

    /** A session with its own guard, for isolated callers and tests. */
    public static SelectionSession isolated(long seed) {
        return new SelectionSession(new RepetitionGuard(), new Random(seed));
    }

    public RepetitionGuard guard() {
        return guard;
    }

    public Random random() {
        return random;
    }

    public List<String> accepted() {
        return Collections.unmodifiableList(accepted);
    }

    /**
     * Accepts the name unless the guard rejects it; check and record are one atomic guard call.
     * Only the name's words are recorded here, templates are recorded separately.
     *
     * @return whether the name was accepted
     */
    public boolean tryAccept(String name) {
        if (!guard.tryAccept(name, null)) return false;
        accepted.add(name);
        return true;
    }
}
