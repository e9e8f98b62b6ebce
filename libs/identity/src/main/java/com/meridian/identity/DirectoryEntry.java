package com.meridian.identity;

/**
 * Raw answer of the central directory for one node. Nothing is parsed yet: an entry can still turn
 * out to be unusable.
 *
 * @param certificatePem the node certificate, PEM encoded
 * @param publicKeyPem the node public key, PEM encoded
 */
public record DirectoryEntry(String certificatePem, String publicKeyPem) {}
