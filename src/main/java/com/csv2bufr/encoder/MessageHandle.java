package com.csv2bufr.encoder;

/**
 * Opaque reference to a message under construction, valid until released.
 */
public interface MessageHandle {

    /**
     * Identifier for log output.
     */
    long getId();

    /**
     * Name of the template the message was created from.
     */
    String getTemplate();
}
