package com.paperbot.output;

/**
 * Accepts finished message units one at a time.
 */
public interface TransportSink {

    /**
     * Delivers one unit synchronously.
     *
     * @throws com.paperbot.core.CollaboratorException when the unit was not accepted
     */
    void send(String unit);
}
