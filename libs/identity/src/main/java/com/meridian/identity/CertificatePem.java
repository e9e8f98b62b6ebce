package com.meridian.identity;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.PublicKey;
import java.security.cert.CertificateException;
import java.security.cert.X509Certificate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.bouncycastle.asn1.x500.RDN;
import org.bouncycastle.asn1.x500.X500Name;
import org.bouncycastle.asn1.x500.style.BCStyle;
import org.bouncycastle.asn1.x500.style.IETFUtils;
import org.bouncycastle.cert.X509CertificateHolder;
import org.bouncycastle.cert.jcajce.JcaX509CertificateConverter;
import org.bouncycastle.openssl.PEMParser;
import org.bouncycastle.util.encoders.DecoderException;
import org.bouncycastle.util.io.pem.PemObject;
import org.bouncycastle.util.io.pem.PemWriter;

/** PEM encoding and decoding of X.509 certificates and public keys. */
public final class CertificatePem {

    private static final JcaX509CertificateConverter CONVERTER = new JcaX509CertificateConverter();

    private CertificatePem() {
        // utility class
    }

    /**
     * Reads the first certificate in {@code pem}.
     *
     * @throws IOException if there is no certificate or it cannot be decoded
     */
    public static X509Certificate readCertificate(String pem) throws IOException {
        List<X509Certificate> certificates = readAll(new StringReader(pem));
        if (certificates.isEmpty()) {
            throw new IOException("No certificate found in PEM input");
        }
        return certificates.get(0);
    }

    /**
     * Reads every certificate in a PEM file, e.g. a root CA bundle.
     *
     * @throws IOException if the file cannot be read or a certificate cannot be decoded
     */
    public static List<X509Certificate> readCertificates(Path file) throws IOException {
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return readAll(reader);
        }
    }

    private static List<X509Certificate> readAll(Reader reader) throws IOException {
        try (PEMParser parser = new PEMParser(reader)) {
            List<X509Certificate> certificates = new ArrayList<>();
            Object entry;
            while ((entry = parser.readObject()) != null) {
                if (entry instanceof X509CertificateHolder holder) {
                    certificates.add(CONVERTER.getCertificate(holder));
                }
            }
            return certificates;
        } catch (CertificateException e) {
            throw new IOException("Unable to decode certificate: " + e.getMessage(), e);
        } catch (DecoderException | IllegalArgumentException e) {
            throw new IOException("Malformed certificate PEM: " + e.getMessage(), e);
        }
    }

    /** Returns the first CN of the certificate subject, if there is one. */
    public static Optional<String> commonName(X509Certificate certificate) {
        X500Name subject = X500Name.getInstance(certificate.getSubjectX500Principal().getEncoded());
        RDN[] cns = subject.getRDNs(BCStyle.CN);
        if (cns.length == 0) {
            return Optional.empty();
        }
        return Optional.of(IETFUtils.valueToString(cns[0].getFirst().getValue()));
    }

    /** PEM-encodes a certificate. */
    public static String encode(X509Certificate certificate) throws IOException {
        try {
            return write(new PemObject("CERTIFICATE", certificate.getEncoded()));
        } catch (CertificateException e) {
            throw new IOException("Unable to encode certificate: " + e.getMessage(), e);
        }
    }

    /** PEM-encodes a public key as {@code PUBLIC KEY} (X.509 SubjectPublicKeyInfo). */
    public static String encodePublicKey(PublicKey publicKey) throws IOException {
        return write(new PemObject("PUBLIC KEY", publicKey.getEncoded()));
    }

    static String write(PemObject object) throws IOException {
        StringWriter out = new StringWriter();
        try (PemWriter writer = new PemWriter(out)) {
            writer.writeObject(object);
        }
        return out.toString();
    }
}
