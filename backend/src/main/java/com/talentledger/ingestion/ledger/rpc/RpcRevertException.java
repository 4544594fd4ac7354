package com.talentledger.ingestion.ledger.rpc;

/**
 * The node answered, but the contract call reverted. Not retried: asking again yields the same revert.
 */
public class RpcRevertException extends RpcException {

    public RpcRevertException(String message) {
        super(message);
    }
}
