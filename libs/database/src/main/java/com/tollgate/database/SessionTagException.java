package com.tollgate.database;

/**
 * The backend refused to apply a trace tag to a session.
 */
public class SessionTagException extends Exception {

    public SessionTagException(String message, Throwable cause) {
        super(message, cause);
    }
}
