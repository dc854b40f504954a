package com.kubelab.api.infrastructure.web;

import com.kubelab.observability.CorrelationContextHolder;
import com.kubelab.security.AuthenticatedUser;
import com.kubelab.security.BearerTokenExtractor;
import com.kubelab.security.TokenService;
import com.kubelab.security.UserRecord;
import org.springframework.core.MethodParameter;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.bind.support.WebDataBinderFactory;
import org.springframework.web.context.request.NativeWebRequest;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.method.support.ModelAndViewContainer;

/**
 * Resolves {@link CurrentUser} parameters by running the two guard stages of a protected route.
 *
 * <ol>
 *   <li>Extraction: the {@code Authorization} header must carry Bearer credentials, otherwise
 *       {@link com.kubelab.security.MissingCredentialsException} (403).
 *   <li>Verification: the token must verify and name a known user, otherwise
 *       {@link com.kubelab.security.UnauthorizedException} (401).
 * </ol>
 *
 * <p>The verified username is bound to the correlation context so later log lines carry it.
 */
@Component
public class AuthenticatedUserArgumentResolver implements HandlerMethodArgumentResolver {

    private final TokenService tokenService;

    public AuthenticatedUserArgumentResolver(TokenService tokenService) {
        this.tokenService = tokenService;
    }

    @Override
    public boolean supportsParameter(MethodParameter parameter) {
        return parameter.hasParameterAnnotation(CurrentUser.class)
                && AuthenticatedUser.class.isAssignableFrom(parameter.getParameterType());
    }

    @Override
    public AuthenticatedUser resolveArgument(
            MethodParameter parameter,
            ModelAndViewContainer mavContainer,
            NativeWebRequest webRequest,
            WebDataBinderFactory binderFactory) {
        String token = BearerTokenExtractor.require(webRequest.getHeader(HttpHeaders.AUTHORIZATION));
        UserRecord user = tokenService.verifyToken(token);
        CorrelationContextHolder.bindUser(user.username());
        return user.toAuthenticatedUser();
    }
}
