package com.gnovoa.livematch.access;

import com.gnovoa.livematch.model.Match;
import com.gnovoa.livematch.model.Requester;

/** Decides whether a requester may mutate (and read the private views of) a match. */
public interface MatchAuthorizer {

    boolean canMutate(Match match, Requester requester);
}
