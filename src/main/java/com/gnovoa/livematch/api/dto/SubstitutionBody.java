package com.gnovoa.livematch.api.dto;

import com.gnovoa.livematch.lineup.SubstitutionRequest;

import java.math.BigDecimal;

public record SubstitutionBody(String playerOffId, String playerOnId, String position, BigDecimal atMinute, String reason) {
    public SubstitutionRequest toRequest(String matchId) {
        return new SubstitutionRequest(matchId, playerOffId, playerOnId, position, atMinute, reason);
    }
}
