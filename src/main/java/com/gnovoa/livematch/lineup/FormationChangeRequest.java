package com.gnovoa.livematch.lineup;

import com.gnovoa.livematch.model.FormationPlayer;
import com.gnovoa.livematch.model.Minutes;

import java.math.BigDecimal;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * New whole-squad formation from {@code atMinute}. {@code idempotencyKey}, when given, becomes the
 * id of the {@code formation_change} event so retries are detected.
 */
public record FormationChangeRequest(
        String matchId,
        BigDecimal atMinute,
        List<FormationPlayer> formation,
        String reason,
        String idempotencyKey
) {

    public FormationChangeRequest {
        if (atMinute == null) throw new IllegalArgumentException("atMinute is required");
        atMinute = Minutes.of(atMinute);
        if (formation == null || formation.isEmpty()) throw new IllegalArgumentException("formation must list players");
        Set<String> seen = new HashSet<>();
        for (FormationPlayer p : formation) {
            if (!p.hasCoordinates()) throw new IllegalArgumentException("Player " + p.playerId() + " has no coordinates");
            if (!seen.add(p.playerId())) throw new IllegalArgumentException("Player " + p.playerId() + " listed twice");
        }
        formation = List.copyOf(formation);
        if (idempotencyKey != null && idempotencyKey.isBlank()) idempotencyKey = null;
    }
}
