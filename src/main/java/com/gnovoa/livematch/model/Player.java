package com.gnovoa.livematch.model;

public record Player(String playerId, String name, Integer squadNumber) {}
