package com.gnovoa.livematch.api.dto;

/** Body of every non-2xx answer; {@code error} is the failure kind or {@code BAD_REQUEST}. */
public record ErrorResponse(String error, String message) {}
