package com.gnovoa.livematch.core;

import com.gnovoa.livematch.access.MatchAuthorizer;
import com.gnovoa.livematch.error.FailureKind;
import com.gnovoa.livematch.error.MatchOperationException;
import com.gnovoa.livematch.model.Match;
import com.gnovoa.livematch.model.Requester;
import com.gnovoa.livematch.store.MatchTransaction;

/** Loads the match of a transaction and applies the {@link MatchAuthorizer} rule to it. */
public final class MatchGuard {

    private final MatchAuthorizer authorizer;

    public MatchGuard(MatchAuthorizer authorizer) {
        this.authorizer = authorizer;
    }

    public Match requireWritable(MatchTransaction tx, Requester requester) {
        Match match = tx.match();
        require(match, requester);
        return match;
    }

    /** Private views use the write rule. */
    public void require(Match match, Requester requester) {
        if (!authorizer.canMutate(match, requester)) {
            throw new MatchOperationException(FailureKind.ACCESS_DENIED,
                    "User " + requester.userId() + " has no access to match " + match.matchId());
        }
    }
}
