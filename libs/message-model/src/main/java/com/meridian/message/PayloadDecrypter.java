package com.meridian.message;

import com.meridian.common.SignEncryptException;

/** Decrypts a ciphertext payload addressed to this node. Supplied by the crypto layer. */
@FunctionalInterface
public interface PayloadDecrypter {

    /**
     * @throws SignEncryptException on a wrong key or corrupted ciphertext
     */
    Plain decrypt(Encrypted secret) throws SignEncryptException;
}
