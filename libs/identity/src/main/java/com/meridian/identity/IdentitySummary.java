package com.meridian.identity;

/**
 * What startup code reports after the identity has been published.
 *
 * @param keyId formatted certificate serial
 * @param commonName subject CN of the node certificate
 */
public record IdentitySummary(String keyId, String commonName) {}
