package com.gnovoa.livematch.ledger;

import com.gnovoa.livematch.error.FailureKind;
import com.gnovoa.livematch.events.MatchEvent;

import java.util.List;

public record BatchResult(List<Item> items) {

    public enum Operation { CREATE, UPDATE, DELETE }

    /** Outcome of one batch entry; {@code failure} is null on success. */
    public record Item(Operation operation, int index, String eventId, MatchEvent event, FailureKind failure, String message) {

        public boolean isSuccess() {
            return failure == null;
        }
    }

    public long failures() {
        return items.stream().filter(i -> !i.isSuccess()).count();
    }
}
