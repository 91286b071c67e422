package com.chaincollector.broker;

import lombok.Builder;
import lombok.Value;

/**
 * Immutable credential snapshot. Updates produce a new snapshot; the manager swaps its
 * reference.
 */
@Value
@Builder(toBuilder = true)
public class ProviderCredentials {

    String apiKey;
    String accessToken;

    /** True when the values came from the environment after startup. */
    boolean discovered;

    public static ProviderCredentials empty() {
        return ProviderCredentials.builder().build();
    }

    public boolean isComplete() {
        return hasText(apiKey) && hasText(accessToken);
    }

    /** Copy with the given non-blank values applied; blank arguments keep the current value. */
    public ProviderCredentials withUpdates(String newApiKey, String newAccessToken) {
        return toBuilder()
                .apiKey(hasText(newApiKey) ? newApiKey : apiKey)
                .accessToken(hasText(newAccessToken) ? newAccessToken : accessToken)
                .build();
    }

    @Override
    public String toString() {
        return "ProviderCredentials(apiKey=" + mask(apiKey) + ", accessToken=" + (hasText(accessToken) ? "****" : "<none>")
                + ", discovered=" + discovered + ")";
    }

    static String mask(String key) {
        if (key == null || key.length() < 4) {
            return "****";
        }
        return key.substring(0, 4) + "****";
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
