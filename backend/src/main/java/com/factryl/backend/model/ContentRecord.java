package com.factryl.backend.model;

/**
 * Minimal view of an item shared by raw and standardized records.
 */
public interface ContentRecord {

    String getTitle();

    String getContent();

    String getSource();
}
