package com.meridian.common;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

@DisplayName("NodeId")
class NodeIdTest {

    @Nested
    @DisplayName("construction")
    class Construction {

        @Test
        @DisplayName("accepts dot-separated lowercase labels")
        void acceptsLabels() {
            var id = new NodeId("proxy1.broker.example.org");
            assertThat(id.value()).isEqualTo("proxy1.broker.example.org");
            assertThat(id).hasToString("proxy1.broker.example.org");
        }

        @Test
        @DisplayName("of() normalizes case and surrounding whitespace")
        void ofNormalizes() {
            assertThat(NodeId.of("  Proxy1.Broker.Example.ORG "))
                    .isEqualTo(new NodeId("proxy1.broker.example.org"));
        }

        @ParameterizedTest
        @NullAndEmptySource
        @ValueSource(strings = {"proxy..broker", ".proxy", "proxy.", "-proxy.broker", "pro xy", "proxy_1.broker"})
        @DisplayName("rejects malformed ids")
        void rejectsMalformed(String value) {
            assertThatThrownBy(() -> NodeId.of(value))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("Invalid node id");
        }
    }

    @Nested
    @DisplayName("isWithin()")
    class IsWithin {

        private final NodeId proxy = new NodeId("proxy1.broker.example.org");

        @Test
        @DisplayName("matches a parent domain")
        void matchesParent() {
            assertThat(proxy.isWithin("broker.example.org")).isTrue();
            assertThat(proxy.isWithin("Example.ORG")).isTrue();
        }

        @Test
        @DisplayName("does not match across a label boundary")
        void labelBoundary() {
            assertThat(proxy.isWithin("roker.example.org")).isFalse();
        }

        @Test
        @DisplayName("an id is not within itself")
        void notWithinItself() {
            assertThat(proxy.isWithin("proxy1.broker.example.org")).isFalse();
        }

        @Test
        @DisplayName("blank domain never matches")
        void blankDomain() {
            assertThat(proxy.isWithin(" ")).isFalse();
            assertThat(proxy.isWithin(null)).isFalse();
        }
    }

    @Test
    @DisplayName("serializes as a bare JSON string")
    void jsonShape() throws Exception {
        var mapper = new ObjectMapper();
        var id = new NodeId("app.proxy1.broker");

        String json = mapper.writeValueAsString(id);

        assertThat(json).isEqualTo("\"app.proxy1.broker\"");
        assertThat(mapper.readValue(json, NodeId.class)).isEqualTo(id);
    }
}
