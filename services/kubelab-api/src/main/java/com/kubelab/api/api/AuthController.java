package com.kubelab.api.api;

import com.kubelab.api.infrastructure.web.CurrentUser;
import com.kubelab.security.AuthenticatedUser;
import com.kubelab.security.CredentialService;
import com.kubelab.security.TokenService;
import com.kubelab.security.UserRecord;
import jakarta.validation.Valid;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Login and a protected echo endpoint.
 *
 * <p>Failures are raised as exceptions from {@code kubelab-security} and turned into 401/403
 * responses by the exception handler.
 */
@RestController
@RequestMapping("/auth")
public class AuthController {

    private static final Logger log = LoggerFactory.getLogger(AuthController.class);

    private final CredentialService credentialService;
    private final TokenService tokenService;
    private final Clock clock;

    public AuthController(CredentialService credentialService, TokenService tokenService, Clock clock) {
        this.credentialService = credentialService;
        this.tokenService = tokenService;
        this.clock = clock;
    }

    @PostMapping("/login")
    public TokenResponse login(@Valid @RequestBody LoginRequest request) {
        UserRecord user = credentialService.authenticate(request.username(), request.password());
        String token = tokenService.issueToken(user.username(), tokenService.accessTokenTtl());
        log.info("Login succeeded for user={}", user.username());
        return TokenResponse.bearer(token);
    }

    @GetMapping("/protected")
    public Map<String, Object> protectedRoute(@CurrentUser AuthenticatedUser user) {
        Map<String, Object> userView = new LinkedHashMap<>();
        userView.put("username", user.username());
        userView.put("email", user.email());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("message", "Hello " + user.username() + "! This is a protected endpoint.");
        body.put("user", userView);
        body.put("timestamp", clock.instant().toString());
        return body;
    }
}
