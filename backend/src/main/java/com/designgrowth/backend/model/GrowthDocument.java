package com.designgrowth.backend.model;

/**
 * Common contract of every document persisted by the platform.
 * The id is assigned by MongoDB on insert and exposed to clients as a hex string.
 */
public interface GrowthDocument {

    String getId();
}
