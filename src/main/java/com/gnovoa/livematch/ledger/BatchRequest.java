package com.gnovoa.livematch.ledger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Offline outbox flush: creates, updates and deletes applied one by one. Entries may be null; they
 * are reported as malformed in the result.
 */
public record BatchRequest(List<EventDraft> creates, List<Update> updates, List<String> deletes) {

    public BatchRequest {
        creates = copy(creates);
        updates = copy(updates);
        deletes = copy(deletes);
    }

    private static <T> List<T> copy(List<T> entries) {
        return entries == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(entries));
    }

    public record Update(String eventId, EventPatch patch) {}
}
