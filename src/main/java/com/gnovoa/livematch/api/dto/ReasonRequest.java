package com.gnovoa.livematch.api.dto;

public record ReasonRequest(String reason) {}
