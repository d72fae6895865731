package com.gnovoa.livematch.api.dto;

import com.gnovoa.livematch.model.PeriodType;

public record StartPeriodRequest(PeriodType type) {}
