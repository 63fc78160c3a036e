package dev.leaddispatch.model;

/**
 * Lifecycle of a lead. The matching engine only ever moves a lead from
 * {@link #NEW} to {@link #CONTACTED}; the other states belong to outreach.
 */
public enum LeadStatus {
    NEW,
    CONTACTED,
    CONVERTED,
    INVALID
}
