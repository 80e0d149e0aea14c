package com.openstay.booking.token;

/**
 * Where a token was requested from. Both parts are optional.
 */
public record IssueContext(String ipAddress, String deviceFingerprint) {

    private static final IssueContext NONE = new IssueContext(null, null);

    public static IssueContext none() {
        return NONE;
    }
}
