package com.meridian.identity;

import com.meridian.common.NodeId;
import java.security.cert.X509Certificate;
import java.util.Objects;

/**
 * The public half of a node's identity as published by the central directory.
 *
 * @param nodeId the node the certificate was issued to
 * @param certificate the node's X.509 certificate
 * @param publicKeyPem the certificate's public key, PEM encoded
 */
public record CryptoPublicPortion(NodeId nodeId, X509Certificate certificate, String publicKeyPem) {

    public CryptoPublicPortion {
        Objects.requireNonNull(nodeId, "nodeId must not be null");
        Objects.requireNonNull(certificate, "certificate must not be null");
        Objects.requireNonNull(publicKeyPem, "publicKeyPem must not be null");
    }
}
