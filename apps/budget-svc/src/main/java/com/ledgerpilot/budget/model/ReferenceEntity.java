package com.ledgerpilot.budget.model;

/**
 * Reference data addressed by a stable id. A deleted entity keeps its id and arrives as a tombstone
 * ({@link #deleted()} is true) in delta responses.
 */
public interface ReferenceEntity {

    String id();

    String name();

    boolean deleted();
}
