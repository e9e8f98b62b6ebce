package com.meridian.common;

/**
 * Failure in the sign/encrypt domain: an unparsable certificate or serial number, a directory
 * lookup without a usable certificate, or a payload that could not be encrypted or decrypted.
 */
public final class SignEncryptException extends MeridianException {

    public SignEncryptException(String message) {
        super(message);
    }

    public SignEncryptException(String message, Throwable cause) {
        super(message, cause);
    }
}
