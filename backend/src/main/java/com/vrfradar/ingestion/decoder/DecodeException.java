package com.vrfradar.ingestion.decoder;

/**
 * A raw log did not match the shape of any known coordinator event. Local to the decoder batch: the log is skipped.
 */
public class DecodeException extends Exception {

    public DecodeException(String message) {
        super(message);
    }

    public DecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
