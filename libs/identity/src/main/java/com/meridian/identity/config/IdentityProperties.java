package com.meridian.identity.config;

import com.meridian.common.NodeId;
import jakarta.validation.constraints.Pattern;
import java.nio.file.Path;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Where this node finds its key material and who it claims to be.
 *
 * <p>Bound from the {@code meridian.identity.*} prefix:
 *
 * <pre>{@code
 * meridian:
 *   identity:
 *     node-id: proxy1.broker.example.org
 *     broker-domain: broker.example.org
 *     privkey-file: /run/secrets/privkey.pem
 *     rootcert-file: /etc/meridian/root-ca.crt
 *     certificates-dir: /etc/meridian/certs
 * }</pre>
 *
 * @param nodeId this node's id; unset on brokers, which have no node identity
 * @param brokerDomain domain the node id must belong to; unset to skip the check
 * @param privkeyFile PEM private key (PKCS#1 or PKCS#8)
 * @param rootcertFile root CA certificate(s) the node certificate must be signed by
 * @param certificatesDir directory of peer certificates used for lookups
 */
@ConfigurationProperties(prefix = "meridian.identity")
@Validated
public record IdentityProperties(
        @Pattern(regexp = NodeId.SYNTAX, flags = Pattern.Flag.CASE_INSENSITIVE, message = "must be a dot-separated node id")
                String nodeId,
        @Pattern(regexp = NodeId.SYNTAX, flags = Pattern.Flag.CASE_INSENSITIVE, message = "must be a dot-separated domain")
                String brokerDomain,
        Path privkeyFile,
        Path rootcertFile,
        Path certificatesDir) {

    public static final Path DEFAULT_PRIVKEY_FILE = Path.of("/run/secrets/privkey.pem");
    public static final Path DEFAULT_ROOTCERT_FILE = Path.of("/etc/meridian/root-ca.crt");
    public static final Path DEFAULT_CERTIFICATES_DIR = Path.of("/etc/meridian/certs");

    /** Applies defaults for the file locations. */
    public IdentityProperties {
        if (privkeyFile == null) {
            privkeyFile = DEFAULT_PRIVKEY_FILE;
        }
        if (rootcertFile == null) {
            rootcertFile = DEFAULT_ROOTCERT_FILE;
        }
        if (certificatesDir == null) {
            certificatesDir = DEFAULT_CERTIFICATES_DIR;
        }
    }
}
