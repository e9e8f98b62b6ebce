package com.meridian.identity.testing;

import static org.assertj.core.api.Assertions.assertThat;

import com.meridian.common.NodeId;
import com.meridian.identity.DirectoryEntry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("InMemoryDirectoryLookup")
class InMemoryDirectoryLookupTest {

    private static final NodeId NODE = new NodeId("proxy1.broker.example.org");

    @Test
    @DisplayName("returns registered entries and counts lookups")
    void returnsRegistered() {
        var entry = new DirectoryEntry("cert", "key");
        var lookup = new InMemoryDirectoryLookup().register(NODE, entry);

        assertThat(lookup.lookup(NODE)).contains(entry);
        assertThat(lookup.lookup(new NodeId("proxy2.broker.example.org"))).isEmpty();
        assertThat(lookup.lookupCount()).isEqualTo(2);
    }

    @Test
    @DisplayName("later registrations replace earlier ones")
    void replaces() {
        var lookup = new InMemoryDirectoryLookup()
                .register(NODE, new DirectoryEntry("old", "old"))
                .register(NODE, new DirectoryEntry("new", "new"));

        assertThat(lookup.lookup(NODE)).map(DirectoryEntry::certificatePem).contains("new");
    }
}
