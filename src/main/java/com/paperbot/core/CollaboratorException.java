package com.paperbot.core;

/**
 * Fetch or transport failure. Fatal to the run; the ledger is not committed.
 */
public class CollaboratorException extends PaperBotException {

    public CollaboratorException(String message) {
        super(message);
    }

    public CollaboratorException(String message, Throwable cause) {
        super(message, cause);
    }
}
