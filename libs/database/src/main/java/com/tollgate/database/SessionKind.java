package com.tollgate.database;

/**
 * The kind of session handle a capability handler receives.
 */
public enum SessionKind {

    /** A {@link DataSession} with query helpers. */
    MANAGED,

    /** The bare {@link java.sql.Connection}. */
    RAW
}
