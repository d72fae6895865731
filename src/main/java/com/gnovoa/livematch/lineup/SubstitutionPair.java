package com.gnovoa.livematch.lineup;

/** Inferred substitution; either side is null when the counts of outgoing and incoming differ. */
public record SubstitutionPair(PlayerRef out, PlayerRef in) {

    public record PlayerRef(String id, String name) {}
}
