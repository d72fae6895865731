package com.gnovoa.livematch.lineup;

import com.gnovoa.livematch.events.MatchEvent;
import com.gnovoa.livematch.model.FormationSnapshot;

import java.util.List;

/**
 * @param snapshot the open snapshot after the call
 * @param previous snapshot closed by the call, null on replay or for the first formation
 * @param replayed true when the idempotency key was already recorded and nothing was written
 */
public record FormationChangeResult(
        FormationSnapshot snapshot,
        FormationSnapshot previous,
        String formationFrom,
        String formationTo,
        List<SubstitutionPair> substitutions,
        MatchEvent event,
        boolean replayed
) {}
