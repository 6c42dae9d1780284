package com.paperbot.core;

/**
 * Base type of every fatal error raised by a digest run.
 */
public class PaperBotException extends RuntimeException {

    public PaperBotException(String message) {
        super(message);
    }

    public PaperBotException(String message, Throwable cause) {
        super(message, cause);
    }
}
