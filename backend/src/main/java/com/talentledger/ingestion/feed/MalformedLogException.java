package com.talentledger.ingestion.feed;

/**
 * Thrown by {@link ContractEventDecoder} when a log carries a supported topic but its body cannot be decoded.
 */
public class MalformedLogException extends RuntimeException {

    private final MalformedLog malformedLog;

    public MalformedLogException(MalformedLog malformedLog, Throwable cause) {
        super("Malformed " + malformedLog.type() + " log " + malformedLog.idempotencyKey() + ": "
                + malformedLog.reason(), cause);
        this.malformedLog = malformedLog;
    }

    public MalformedLog getMalformedLog() {
        return malformedLog;
    }
}
