package org.releven.query.model;

/**
 * Classification of a schema path element.
 */
public enum PathClassification {
    /** A top-level model (root class). */
    ROOT,

    /** A grouping element below a model. */
    GROUP,

    /** A field that references another entity. */
    REFERENCE,

    /** A plain value field. */
    FIELD
}
