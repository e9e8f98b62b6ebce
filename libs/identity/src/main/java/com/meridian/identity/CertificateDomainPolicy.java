package com.meridian.identity;

import com.meridian.common.ConfigurationFailedException;
import com.meridian.common.NodeId;
import java.security.cert.X509Certificate;

/**
 * Checks that the certificate the directory returned belongs to this node and to the broker it is
 * configured for.
 *
 * <p>The subject CN must equal the node id exactly (case-insensitively), and the node id must lie
 * inside the broker domain on a label boundary. Subject alternative names are not consulted.
 */
public final class CertificateDomainPolicy {

    private CertificateDomainPolicy() {
        // utility class
    }

    /**
     * @throws ConfigurationFailedException if the certificate or node id does not match the domain
     */
    public static void verify(X509Certificate certificate, NodeId nodeId, String brokerDomain)
            throws ConfigurationFailedException {
        String commonName = CertificatePem.commonName(certificate)
                .orElseThrow(() -> new ConfigurationFailedException(
                        "Certificate for node %s has no common name".formatted(nodeId)));
        if (!commonName.equalsIgnoreCase(nodeId.value())) {
            throw new ConfigurationFailedException("Certificate common name '%s' does not match node id %s"
                    .formatted(commonName, nodeId));
        }
        if (!nodeId.isWithin(brokerDomain)) {
            throw new ConfigurationFailedException("Node id %s is not within the broker domain '%s'"
                    .formatted(nodeId, brokerDomain));
        }
    }
}
