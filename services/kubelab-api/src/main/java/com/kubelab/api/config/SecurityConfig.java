package com.kubelab.api.config;

import com.kubelab.security.CredentialService;
import com.kubelab.security.PasswordHasher;
import com.kubelab.security.TokenService;
import com.kubelab.security.UserDirectory;
import com.kubelab.security.UserSeed;
import java.time.Clock;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the credential and token services from {@link SecurityProperties}.
 *
 * <p>The user directory is seeded once at startup and is read-only afterwards.
 */
@Configuration
public class SecurityConfig {

    private static final Logger log = LoggerFactory.getLogger(SecurityConfig.class);

    static final List<UserSeed> SEED_USERS =
            List.of(new UserSeed("testuser", "test@example.com", "testpassword"));

    @Bean
    public PasswordHasher passwordHasher(SecurityProperties properties) {
        return new PasswordHasher(properties.bcryptStrength());
    }

    @Bean
    public UserDirectory userDirectory(PasswordHasher passwordHasher) {
        UserDirectory directory = UserDirectory.seed(passwordHasher, SEED_USERS);
        log.info("User directory seeded with {} user(s)", directory.size());
        return directory;
    }

    @Bean
    public CredentialService credentialService(UserDirectory userDirectory, PasswordHasher passwordHasher) {
        return new CredentialService(userDirectory, passwordHasher);
    }

    @Bean
    public TokenService tokenService(
            SecurityProperties properties, UserDirectory userDirectory, Clock clock) {
        var settings = properties.tokenSettings();
        log.info("Token service configured: {}", settings);
        return new TokenService(settings, userDirectory, clock);
    }
}
