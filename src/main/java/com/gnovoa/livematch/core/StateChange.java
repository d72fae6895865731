package com.gnovoa.livematch.core;

import com.gnovoa.livematch.events.MatchClockSnapshot;
import com.gnovoa.livematch.model.MatchStatus;

/** Body of the {@code state_changed} notification. */
public record StateChange(String matchId, MatchStatus from, MatchStatus to, String reason, MatchClockSnapshot clock) {}
