package com.gnovoa.livematch.api.dto;

import com.gnovoa.livematch.lineup.FormationChangeRequest;
import com.gnovoa.livematch.model.FormationPlayer;

import java.math.BigDecimal;
import java.util.List;

public record FormationChangeBody(BigDecimal atMinute, List<FormationPlayer> formation, String reason, String idempotencyKey) {
    public FormationChangeRequest toRequest(String matchId) {
        return new FormationChangeRequest(matchId, atMinute, formation, reason, idempotencyKey);
    }
}
