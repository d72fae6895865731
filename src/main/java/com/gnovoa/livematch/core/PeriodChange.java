package com.gnovoa.livematch.core;

import com.gnovoa.livematch.events.MatchClockSnapshot;
import com.gnovoa.livematch.model.Period;

/** Body of the {@code period_started} and {@code period_ended} notifications. */
public record PeriodChange(String matchId, Period period, MatchClockSnapshot clock) {}
