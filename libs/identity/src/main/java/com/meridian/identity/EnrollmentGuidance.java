package com.meridian.identity;

/** Operator instructions appended to key-loading errors. */
public final class EnrollmentGuidance {

    static final String ENROLLMENT_TOOL_URL = "https://github.com/meridian-network/meridian-enroll";

    private EnrollmentGuidance() {
        // utility class
    }

    /**
     * Explains how to obtain a key and certificate, naming the node id when it is known.
     *
     * @param nodeId the configured node id, or null
     */
    public static String message(String nodeId) {
        String withId = nodeId == null || nodeId.isBlank() ? "" : " with the node id " + nodeId;
        return ("If you are not yet enrolled in the central directory, please run the meridian-enroll companion tool"
                        + " (%s)%s and follow the steps on the screen.%n"
                        + "After your enrollment, please restart this node; this message should disappear.")
                .formatted(ENROLLMENT_TOOL_URL, withId);
    }
}
