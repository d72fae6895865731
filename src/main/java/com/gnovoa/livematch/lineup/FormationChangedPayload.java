package com.gnovoa.livematch.lineup;

import com.gnovoa.livematch.model.FormationPlayer;
import com.gnovoa.livematch.model.PeriodType;

import java.time.Instant;
import java.util.List;

/** Body of the {@code formation_changed} notification. */
public record FormationChangedPayload(
        String matchId,
        Instant createdAt,
        Integer periodNumber,
        PeriodType periodType,
        long clockMs,
        String reason,
        List<FormationPlayer> formation,
        List<FormationPlayer> prevFormation,
        List<SubstitutionPair> substitutions
) {}
