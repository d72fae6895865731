package com.gnovoa.livematch.query;

import com.gnovoa.livematch.ledger.EventView;
import com.gnovoa.livematch.model.Period;

import java.util.List;

/** Everything a viewer needs before it starts receiving pushes. */
public record MatchSnapshot(MatchStatusView summary, List<Period> periods, List<EventView> events) {}
