package com.meridian.message;

import com.meridian.common.NodeId;
import com.meridian.common.SignEncryptException;
import java.util.List;

/** Encrypts a cleartext payload for a set of recipients. Supplied by the crypto layer. */
@FunctionalInterface
public interface PayloadEncrypter {

    /**
     * @param secret cleartext to encrypt
     * @param recipients nodes that must be able to decrypt the result, in sender order
     * @throws SignEncryptException if the payload cannot be encrypted for these recipients
     */
    Encrypted encrypt(Plain secret, List<NodeId> recipients) throws SignEncryptException;
}
