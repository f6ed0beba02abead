package com.larpmanager.server.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;

/**
 * Token signing knobs, bound from the {@code SECURITY_*} variables.
 *
 * @param secretKey signing secret
 * @param algorithm signing algorithm name
 * @param accessTokenExpireMinutes access token lifetime
 * @param refreshTokenExpireDays refresh token lifetime
 */
public record SecuritySettings(
    @NotBlank String secretKey,
    @NotBlank String algorithm,
    @Min(1) int accessTokenExpireMinutes,
    @Min(1) int refreshTokenExpireDays
) {

    /** Placeholder secret shipped in the default configuration. */
    public static final String DEFAULT_SECRET_KEY = "your-secret-key-here-change-in-production";

    public boolean usesDefaultSecret() {
        return DEFAULT_SECRET_KEY.equals(secretKey);
    }

    @Override
    public String toString() {
        return "SecuritySettings[algorithm=" + algorithm
            + ", accessTokenExpireMinutes=" + accessTokenExpireMinutes
            + ", refreshTokenExpireDays=" + refreshTokenExpireDays + "]";
    }
}
