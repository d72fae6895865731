package com.gnovoa.livematch.lineup;

import com.gnovoa.livematch.model.FormationPlayer;

import java.util.List;

/** Body of the notes of a {@code formation_change} event, stored as JSON. */
public record FormationChangeNotes(
        String reason,
        String formationFrom,
        String formationTo,
        List<SubstitutionPair> substitutions,
        Formation formation
) {

    public record Formation(List<FormationPlayer> players) {}
}
