package com.gnovoa.livematch.lineup;

import com.gnovoa.livematch.model.Minutes;

import java.math.BigDecimal;

public record SubstitutionRequest(
        String matchId,
        String playerOffId,
        String playerOnId,
        String position,
        BigDecimal atMinute,
        String reason
) {

    public SubstitutionRequest {
        if (playerOffId == null || playerOnId == null) throw new IllegalArgumentException("Both players are required");
        if (playerOffId.equals(playerOnId)) throw new IllegalArgumentException("playerOffId and playerOnId must differ");
        if (atMinute == null) throw new IllegalArgumentException("atMinute is required");
        atMinute = Minutes.of(atMinute);
    }
}
