package com.pagesmith.orchestrator.repository;

/**
 * Thrown when a second record is stored under a nonce that is already taken.
 */
public class DuplicateNonceException extends RuntimeException {

    private final String nonce;

    public DuplicateNonceException(String nonce) {
        super("Task already exists for nonce " + nonce);
        this.nonce = nonce;
    }

    public String getNonce() { return nonce; }
}
