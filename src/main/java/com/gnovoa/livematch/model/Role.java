package com.gnovoa.livematch.model;

public enum Role {
    USER,
    ADMIN
}
