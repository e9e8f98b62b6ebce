package com.meridian.identity.config;

import com.meridian.common.ConfigurationFailedException;
import com.meridian.common.MeridianException;
import com.meridian.identity.CertificatePem;
import com.meridian.identity.CryptoIdentity;
import com.meridian.identity.DirectoryLookup;
import com.meridian.identity.IdentityBootstrapper;
import com.meridian.identity.IdentityPublisher;
import com.meridian.identity.PemDirectoryLookup;
import java.io.IOException;
import java.nio.file.Files;
import java.security.cert.X509Certificate;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Bootstraps and publishes the node identity while the application context starts.
 *
 * <p>Only active when {@code meridian.identity.node-id} is set. Any bootstrap failure aborts context
 * startup, so a node never runs without its identity. Consumers inject {@link CryptoIdentity} or
 * the {@link IdentityPublisher}.
 *
 * @see IdentityProperties
 */
@Configuration
@EnableConfigurationProperties(IdentityProperties.class)
@ConditionalOnProperty(prefix = "meridian.identity", name = "node-id")
public class IdentityConfiguration {

    private static final Logger log = LoggerFactory.getLogger(IdentityConfiguration.class);

    @Bean
    public DirectoryLookup directoryLookup(IdentityProperties properties) {
        return new PemDirectoryLookup(properties.certificatesDir());
    }

    @Bean
    public IdentityPublisher identityPublisher() {
        return new IdentityPublisher();
    }

    @Bean
    public IdentityBootstrapper identityBootstrapper(DirectoryLookup directoryLookup, IdentityProperties properties)
            throws ConfigurationFailedException {
        return new IdentityBootstrapper(directoryLookup, trustedRoots(properties), properties.brokerDomain());
    }

    @Bean
    public CryptoIdentity cryptoIdentity(
            IdentityBootstrapper bootstrapper, IdentityPublisher publisher, IdentityProperties properties)
            throws MeridianException {
        bootstrapper.bootstrapAndPublish(properties.privkeyFile(), properties.nodeId(), publisher);
        return publisher.current();
    }

    private static List<X509Certificate> trustedRoots(IdentityProperties properties)
            throws ConfigurationFailedException {
        if (!Files.exists(properties.rootcertFile())) {
            log.warn("Root certificate {} not found; node certificate will not be checked against a root CA",
                    properties.rootcertFile());
            return List.of();
        }
        try {
            List<X509Certificate> roots = CertificatePem.readCertificates(properties.rootcertFile());
            if (roots.isEmpty()) {
                throw new ConfigurationFailedException(
                        "No certificate found in root certificate file " + properties.rootcertFile());
            }
            return roots;
        } catch (IOException e) {
            throw new ConfigurationFailedException(
                    "Unable to load root certificate from file %s: %s".formatted(properties.rootcertFile(), e.getMessage()),
                    e);
        }
    }
}
