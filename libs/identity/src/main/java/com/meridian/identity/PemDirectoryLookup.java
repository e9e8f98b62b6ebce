package com.meridian.identity;

import com.meridian.common.NodeId;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.cert.X509Certificate;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link DirectoryLookup} over a local directory of certificate files ({@code *.pem}, {@code
 * *.crt}), matched by subject CN. Used where certificates are distributed as files rather than
 * fetched from the central directory.
 */
public class PemDirectoryLookup implements DirectoryLookup {

    private static final Logger log = LoggerFactory.getLogger(PemDirectoryLookup.class);

    private final Path directory;

    public PemDirectoryLookup(Path directory) {
        this.directory = Objects.requireNonNull(directory, "directory must not be null");
    }

    @Override
    public Optional<DirectoryEntry> lookup(NodeId nodeId) throws IOException {
        if (!Files.isDirectory(directory)) {
            throw new IOException("Certificate directory does not exist: " + directory);
        }
        List<Path> files;
        try (Stream<Path> listing = Files.list(directory)) {
            files = listing.filter(PemDirectoryLookup::isCertificateFile).sorted().toList();
        }

        for (Path file : files) {
            X509Certificate certificate;
            try {
                certificate = CertificatePem.readCertificate(Files.readString(file));
            } catch (IOException e) {
                log.warn("Skipping unreadable certificate file {}: {}", file.getFileName(), e.getMessage());
                continue;
            }
            boolean matches = CertificatePem.commonName(certificate)
                    .map(nodeId.value()::equalsIgnoreCase)
                    .orElse(false);
            if (matches) {
                log.debug("Found certificate for {} in {}", nodeId, file.getFileName());
                return Optional.of(new DirectoryEntry(
                        CertificatePem.encode(certificate), CertificatePem.encodePublicKey(certificate.getPublicKey())));
            }
        }
        return Optional.empty();
    }

    private static boolean isCertificateFile(Path file) {
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        return Files.isRegularFile(file) && (name.endsWith(".pem") || name.endsWith(".crt"));
    }
}
