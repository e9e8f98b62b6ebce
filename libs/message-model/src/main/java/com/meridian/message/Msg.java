package com.meridian.message;

import com.fasterxml.jackson.databind.JsonNode;
import com.meridian.common.NodeId;
import java.util.List;

/** Routing view shared by every message, whatever its payload state. */
public interface Msg {

    NodeId from();

    /** Recipients, in the order the sender listed them. */
    List<NodeId> to();

    JsonNode metadata();
}
