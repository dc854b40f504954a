package com.kubelab.api.config;

import com.kubelab.security.PasswordHasher;
import com.kubelab.security.SigningAlgorithm;
import com.kubelab.security.TokenSettings;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Token signing and password hashing settings, bound from {@code kubelab.security.*}.
 *
 * <p>The secret comes from {@code SECRET_KEY}. A secret shorter than the algorithm's key size
 * fails startup when {@link #tokenSettings()} is built.
 *
 * @param jwt token signing settings.
 * @param bcryptStrength bcrypt cost factor (4 to 31, default 12).
 */
@ConfigurationProperties(prefix = "kubelab.security")
@Validated
public record SecurityProperties(@NotNull @Valid Jwt jwt, @Min(4) @Max(31) int bcryptStrength) {

    public SecurityProperties {
        if (bcryptStrength == 0) {
            bcryptStrength = PasswordHasher.DEFAULT_STRENGTH;
        }
    }

    /**
     * @param secret HMAC signing secret.
     * @param algorithm JWT {@code alg} identifier (HS256, HS384 or HS512).
     * @param accessTokenExpireMinutes lifetime of tokens issued at login.
     */
    public record Jwt(@NotBlank String secret, String algorithm, int accessTokenExpireMinutes) {

        public Jwt {
            if (algorithm == null || algorithm.isBlank()) {
                algorithm = "HS256";
            }
            if (accessTokenExpireMinutes <= 0) {
                accessTokenExpireMinutes = 30;
            }
        }
    }

    /** Converts the bound values into the token service settings. */
    public TokenSettings tokenSettings() {
        return new TokenSettings(
                jwt.secret(),
                SigningAlgorithm.fromId(jwt.algorithm()),
                Duration.ofMinutes(jwt.accessTokenExpireMinutes()));
    }
}
