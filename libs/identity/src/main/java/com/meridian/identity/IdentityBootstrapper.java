package com.meridian.identity;

import com.meridian.common.ConfigurationFailedException;
import com.meridian.common.MeridianException;
import com.meridian.common.NodeId;
import com.meridian.common.SignEncryptException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.cert.X509Certificate;
import java.security.interfaces.RSAPrivateKey;
import java.security.interfaces.RSAPublicKey;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds this node's {@link CryptoIdentity} from its private key file and the certificate the
 * directory holds for it.
 *
 * <p>Loading performs one file read and one directory call and never retries: the first failure is
 * returned to the caller. Bad external input is reported as a {@link MeridianException}; calling
 * {@link #load} without a node id is a sequencing bug and fails with {@link IllegalStateException}.
 *
 * <p>Optional checks, enabled through the constructor:
 *
 * <ul>
 *   <li>trusted roots: the node certificate must be currently valid and signed by one of them
 *   <li>broker domain: see {@link CertificateDomainPolicy}
 * </ul>
 */
public class IdentityBootstrapper {

    private static final Logger log = LoggerFactory.getLogger(IdentityBootstrapper.class);

    private final DirectoryLookup directory;
    private final List<X509Certificate> trustedRoots;
    private final String brokerDomain;

    public IdentityBootstrapper(DirectoryLookup directory) {
        this(directory, List.of(), null);
    }

    /**
     * @param directory where to look up the node certificate
     * @param trustedRoots root certificates the node certificate must chain to directly; empty to skip
     * @param brokerDomain domain the node id must belong to; null to skip
     */
    public IdentityBootstrapper(DirectoryLookup directory, List<X509Certificate> trustedRoots, String brokerDomain) {
        this.directory = Objects.requireNonNull(directory, "directory must not be null");
        this.trustedRoots = List.copyOf(trustedRoots);
        this.brokerDomain = brokerDomain == null || brokerDomain.isBlank() ? null : brokerDomain;
    }

    /**
     * Loads the identity.
     *
     * @param privateKeyFile PEM file holding the node's RSA private key (PKCS#1 or PKCS#8)
     * @param nodeId this node's id; must be set
     * @throws ConfigurationFailedException if the key file is unreadable or not a supported key, or
     *     the node id or certificate does not fit the configuration
     * @throws SignEncryptException if the directory has no usable certificate for the node
     * @throws IllegalStateException if {@code nodeId} is null
     */
    public CryptoIdentity load(Path privateKeyFile, String nodeId) throws MeridianException {
        if (nodeId == null) {
            throw new IllegalStateException(
                    "load() has been called without setting a node id (maybe in a broker?). This should not happen.");
        }

        String pem = readKeyFile(privateKeyFile, nodeId);
        RSAPrivateKey privateKey = PrivateKeyPemReader.readPrivateKey(pem);
        SigningKey signingKey = PrivateKeyPemReader.readSigningKey(pem);

        NodeId id = parseNodeId(nodeId);
        CryptoPublicPortion publicPortion = fetchPublicPortion(id);
        X509Certificate certificate = publicPortion.certificate();

        if (!trustedRoots.isEmpty()) {
            verifyIssuedByTrustedRoot(certificate, id);
        }
        if (brokerDomain != null) {
            CertificateDomainPolicy.verify(certificate, id, brokerDomain);
        }
        verifyKeyMatchesCertificate(privateKey, certificate, id);

        String keyId = SerialFormatter.format(certificate);
        return new CryptoIdentity(signingKey.withKeyId(keyId), privateKey, publicPortion);
    }

    /**
     * Loads the identity and publishes it.
     *
     * @throws IllegalStateException if {@code nodeId} is null or an identity was already published
     */
    public IdentitySummary bootstrapAndPublish(Path privateKeyFile, String nodeId, IdentityPublisher publisher)
            throws MeridianException {
        CryptoIdentity identity = load(privateKeyFile, nodeId);
        publisher.publish(identity);

        X509Certificate certificate = identity.publicPortion().certificate();
        String commonName = CertificatePem.commonName(certificate)
                .orElse(identity.publicPortion().nodeId().value());
        log.info("Published crypto identity for node {} [ keyId = {} ]", commonName, identity.keyId());
        return new IdentitySummary(identity.keyId(), commonName);
    }

    private static String readKeyFile(Path privateKeyFile, String nodeId) throws ConfigurationFailedException {
        try {
            return Files.readString(privateKeyFile, StandardCharsets.UTF_8).strip();
        } catch (IOException e) {
            throw new ConfigurationFailedException(
                    "Unable to load private key from file %s: %s%n%s"
                            .formatted(privateKeyFile, e, EnrollmentGuidance.message(nodeId)),
                    e);
        }
    }

    private static NodeId parseNodeId(String nodeId) throws ConfigurationFailedException {
        try {
            return NodeId.of(nodeId);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationFailedException(e.getMessage(), e);
        }
    }

    private CryptoPublicPortion fetchPublicPortion(NodeId nodeId) throws SignEncryptException {
        Optional<DirectoryEntry> entry;
        try {
            entry = directory.lookup(nodeId);
        } catch (IOException e) {
            throw new SignEncryptException(
                    "Unable to parse your certificate: directory lookup for %s failed: %s".formatted(nodeId, e.getMessage()),
                    e);
        }
        if (entry.isEmpty() || entry.get().certificatePem() == null || entry.get().publicKeyPem() == null) {
            throw new SignEncryptException("Unable to parse your certificate: no certificate found for " + nodeId);
        }

        try {
            X509Certificate certificate = CertificatePem.readCertificate(entry.get().certificatePem());
            return new CryptoPublicPortion(nodeId, certificate, entry.get().publicKeyPem());
        } catch (IOException e) {
            throw new SignEncryptException("Unable to parse your certificate: " + e.getMessage(), e);
        }
    }

    private void verifyIssuedByTrustedRoot(X509Certificate certificate, NodeId nodeId) throws SignEncryptException {
        try {
            certificate.checkValidity();
        } catch (GeneralSecurityException e) {
            throw new SignEncryptException(
                    "Certificate for %s is not valid at this time: %s".formatted(nodeId, e.getMessage()), e);
        }
        for (X509Certificate root : trustedRoots) {
            try {
                certificate.verify(root.getPublicKey());
                return;
            } catch (GeneralSecurityException e) {
                log.debug("Certificate for {} not signed by {}: {}", nodeId, root.getSubjectX500Principal(), e.getMessage());
            }
        }
        throw new SignEncryptException("Certificate for %s is not signed by a trusted root CA".formatted(nodeId));
    }

    private static void verifyKeyMatchesCertificate(
            RSAPrivateKey privateKey, X509Certificate certificate, NodeId nodeId) throws ConfigurationFailedException {
        if (certificate.getPublicKey() instanceof RSAPublicKey publicKey
                && publicKey.getModulus().equals(privateKey.getModulus())) {
            return;
        }
        throw new ConfigurationFailedException("Private key does not belong to the certificate of node %s%n%s"
                .formatted(nodeId, EnrollmentGuidance.message(nodeId.value())));
    }
}
