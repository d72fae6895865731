package com.gnovoa.livematch.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/** Side effects collected during a transaction and run after it commits. */
final class PostCommitHooks {

    private static final Logger log = LoggerFactory.getLogger(PostCommitHooks.class);

    private record Hook(String description, Runnable action) {}

    private final String matchId;
    private final List<Hook> hooks = new ArrayList<>();

    PostCommitHooks(String matchId) {
        this.matchId = matchId;
    }

    void add(String description, Runnable action) {
        hooks.add(new Hook(description, action));
    }

    boolean isEmpty() {
        return hooks.isEmpty();
    }

    /** Runs every hook in registration order; one failing hook does not stop the others. */
    void runAll() {
        for (Hook h : hooks) {
            try {
                h.action().run();
            } catch (RuntimeException e) {
                log.warn("Post-commit hook '{}' failed for match {}", h.description(), matchId, e);
            }
        }
    }
}
