/**
 * Cryptographic identity of a Meridian node.
 *
 * <p>At startup {@link com.meridian.identity.IdentityBootstrapper} reads the node's private key,
 * looks up its certificate through a {@link com.meridian.identity.DirectoryLookup}, and builds a
 * {@link com.meridian.identity.CryptoIdentity}, which {@link com.meridian.identity.IdentityPublisher}
 * then holds, read-only, for the rest of the process.
 */
package com.meridian.identity;
