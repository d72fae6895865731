package com.gnovoa.livematch.access;

import com.gnovoa.livematch.model.Match;
import com.gnovoa.livematch.model.Requester;

/** Admins may touch every match; everyone else only the matches they created. */
public final class OwnershipMatchAuthorizer implements MatchAuthorizer {

    @Override
    public boolean canMutate(Match match, Requester requester) {
        if (requester == null || match == null) return false;
        return requester.isAdmin() || requester.userId().equals(match.createdBy());
    }
}
