package com.gnovoa.livematch.model;

public record Team(String teamId, String name, String createdBy) {}
