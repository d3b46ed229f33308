package com.bastion.accessservice.domain.settings;

import java.util.List;

/**
 * Event payload carrying the complete security settings after a change.
 */
public record SecurityPolicySet(boolean embeddedIframeEnabled, List<String> allowedOrigins,
                                boolean impersonationEnabled) {
}
