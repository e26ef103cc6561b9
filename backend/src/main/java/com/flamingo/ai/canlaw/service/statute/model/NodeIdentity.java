package com.flamingo.ai.canlaw.service.statute.model;

/**
 * Canonical identifier and citation derived for a node from its ancestry.
 *
 * @param id identifier unique within one Act's tree, e.g. {@code cbca_s122_1_a}
 * @param citation legal citation string, e.g. {@code CBCA s. 122(1)(a)}
 */
public record NodeIdentity(String id, String citation) {}
