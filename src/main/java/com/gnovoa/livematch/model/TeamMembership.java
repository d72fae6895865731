package com.gnovoa.livematch.model;

public record TeamMembership(String playerId, String teamId, boolean active) {}
