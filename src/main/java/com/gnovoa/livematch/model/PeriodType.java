package com.gnovoa.livematch.model;

public enum PeriodType {
    REGULAR,
    EXTRA_TIME,
    PENALTY_SHOOTOUT
}
