package io.chatrelay.core.session;

import io.chatrelay.core.model.Turn;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * Ordered turns of one session, bounded to the most recent {@code maxTurns} entries.
 * All access is serialized on the instance, which gives the store per-key mutual exclusion.
 */
public final class Transcript {
    private final int maxTurns;
    private final Deque<Turn> turns;

    Transcript(int maxTurns) {
        if (maxTurns < 1) {
            throw new IllegalArgumentException("maxTurns must be positive");
        }
        this.maxTurns = maxTurns;
        this.turns = new ArrayDeque<>();
    }

    public synchronized void append(Turn turn) {
        turns.addLast(Objects.requireNonNull(turn, "turn must not be null"));
        while (turns.size() > maxTurns) {
            turns.removeFirst();
        }
    }

    public synchronized List<Turn> snapshot() {
        return List.copyOf(turns);
    }
}
