package com.gnovoa.livematch.lineup;

import com.gnovoa.livematch.events.MatchEvent;
import com.gnovoa.livematch.model.LineupEntry;

import java.util.List;

/** Closed entry of the outgoing player, new entry of the incoming one and the two timeline events. */
public record SubstitutionResult(LineupEntry closed, LineupEntry opened, List<MatchEvent> events) {}
