package com.gnovoa.livematch.quota;

public enum PlanType {
    FREE,
    PREMIUM
}
