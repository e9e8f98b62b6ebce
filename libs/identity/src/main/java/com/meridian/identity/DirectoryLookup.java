package com.meridian.identity;

import com.meridian.common.NodeId;
import java.io.IOException;
import java.util.Optional;

/**
 * Resolves a node id to the certificate and public key the central directory holds for it.
 *
 * <p>Implementations may go over the network. Callers query once and do not retry.
 */
@FunctionalInterface
public interface DirectoryLookup {

    /**
     * @return the directory entry, or empty if the directory does not know {@code nodeId}
     * @throws IOException if the directory cannot be reached
     */
    Optional<DirectoryEntry> lookup(NodeId nodeId) throws IOException;
}
