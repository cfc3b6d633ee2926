package com.vrfradar.query;

/**
 * A refresh was asked for before any query made a key active.
 */
public class NoActiveQueryException extends IllegalStateException {

    public NoActiveQueryException() {
        super("no query has been run yet");
    }
}
