package com.bastion.accessservice.domain.settings;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Partial update of the security settings. An empty field keeps the current value; a present one
 * replaces it. A present empty origin list clears the origins.
 */
public record SecuritySettingsUpdate(
        Optional<Boolean> embeddedIframeEnabled,
        Optional<List<String>> allowedOrigins,
        Optional<Boolean> impersonationEnabled) {

    public SecuritySettingsUpdate {
        embeddedIframeEnabled = embeddedIframeEnabled == null ? Optional.empty() : embeddedIframeEnabled;
        allowedOrigins = allowedOrigins == null
                ? Optional.empty()
                : allowedOrigins.map(origins -> Collections.unmodifiableList(new ArrayList<>(origins)));
        impersonationEnabled = impersonationEnabled == null ? Optional.empty() : impersonationEnabled;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Boolean embeddedIframeEnabled;
        private List<String> allowedOrigins;
        private Boolean impersonationEnabled;

        private Builder() {
        }

        public Builder embeddedIframeEnabled(boolean value) {
            this.embeddedIframeEnabled = value;
            return this;
        }

        public Builder allowedOrigins(List<String> value) {
            this.allowedOrigins = value;
            return this;
        }

        public Builder impersonationEnabled(boolean value) {
            this.impersonationEnabled = value;
            return this;
        }

        public SecuritySettingsUpdate build() {
            return new SecuritySettingsUpdate(Optional.ofNullable(embeddedIframeEnabled),
                    Optional.ofNullable(allowedOrigins), Optional.ofNullable(impersonationEnabled));
        }
    }
}
