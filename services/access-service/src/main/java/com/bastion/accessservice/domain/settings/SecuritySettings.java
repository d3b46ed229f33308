package com.bastion.accessservice.domain.settings;

import java.time.Instant;
import java.util.List;

/**
 * Instance-wide security configuration.
 *
 * @param allowedOrigins origins allowed to embed the UI in an iframe, in the order they were set
 * @param sequence       instance aggregate sequence of the last change, 0 when never set
 */
public record SecuritySettings(
        boolean embeddedIframeEnabled,
        List<String> allowedOrigins,
        boolean impersonationEnabled,
        Instant changeDate,
        String resourceOwner,
        long sequence) {

    public SecuritySettings {
        allowedOrigins = allowedOrigins == null ? List.of() : List.copyOf(allowedOrigins);
    }

    /** Settings of an instance where nothing was ever set. */
    public static SecuritySettings defaults(String instanceId) {
        return new SecuritySettings(false, List.of(), false, null, instanceId, 0);
    }
}
