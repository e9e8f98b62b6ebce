package com.meridian.identity;

import com.meridian.common.SignEncryptException;
import java.math.BigInteger;
import java.security.cert.X509Certificate;
import java.util.Locale;

/**
 * Renders certificate serial numbers the way the central directory displays them: lowercase hex
 * in two-character groups separated by colons, e.g. {@code 44:0e:0d:94}. The result is used as the
 * key id of the node's signing key.
 */
public final class SerialFormatter {

    private SerialFormatter() {
        // utility class
    }

    /**
     * Formats a serial number. Odd-length hex gets a leading zero so every group is one byte.
     *
     * @throws SignEncryptException if the serial is missing or negative
     */
    public static String format(BigInteger serial) throws SignEncryptException {
        if (serial == null) {
            throw new SignEncryptException("Unable to parse your certificate: missing serial number");
        }
        if (serial.signum() < 0) {
            throw new SignEncryptException("Unable to parse your certificate: negative serial number " + serial);
        }
        String hex = serial.toString(16).toLowerCase(Locale.ROOT);
        if (hex.length() % 2 != 0) {
            hex = "0" + hex;
        }

        StringBuilder formatted = new StringBuilder(hex.length() + hex.length() / 2);
        for (int i = 0; i < hex.length(); i += 2) {
            if (i > 0) {
                formatted.append(':');
            }
            formatted.append(hex, i, i + 2);
        }
        return formatted.toString();
    }

    /** Formats the serial number of {@code certificate}. */
    public static String format(X509Certificate certificate) throws SignEncryptException {
        return format(certificate.getSerialNumber());
    }
}
