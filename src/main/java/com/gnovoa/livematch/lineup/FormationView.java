package com.gnovoa.livematch.lineup;

import com.gnovoa.livematch.model.FormationPlayer;

import java.math.BigDecimal;
import java.util.List;

/** Current formation; {@code source} tells whether it comes from a snapshot or the open lineup. */
public record FormationView(String matchId, Source source, BigDecimal startMin, String shape, List<FormationPlayer> players) {

    public enum Source { SNAPSHOT, LINEUP, NONE }
}
