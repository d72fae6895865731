package com.gnovoa.livematch.model;

import java.time.Instant;

/** Soft-delete marker carried by every persisted row. A null tombstone means the row is live. */
public record Tombstone(Instant deletedAt, String deletedBy) {}
