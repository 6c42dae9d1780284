package com.paperbot.state;

import com.paperbot.core.PaperBotException;

/**
 * The persisted ledger exists but does not have the expected shape.
 * Never recovered automatically: discarding history would re-announce everything.
 */
public class LedgerCorruptionException extends PaperBotException {

    public LedgerCorruptionException(String message) {
        super(message);
    }

    public LedgerCorruptionException(String message, Throwable cause) {
        super(message, cause);
    }
}
