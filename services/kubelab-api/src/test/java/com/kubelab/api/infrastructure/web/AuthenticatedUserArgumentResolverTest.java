package com.kubelab.api.infrastructure.web;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.kubelab.observability.CorrelationContext;
import com.kubelab.observability.CorrelationContextHolder;
import com.kubelab.security.AuthenticatedUser;
import com.kubelab.security.MissingCredentialsException;
import com.kubelab.security.TokenService;
import com.kubelab.security.UnauthorizedException;
import com.kubelab.security.UserRecord;
import java.lang.reflect.Method;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.core.MethodParameter;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.web.context.request.ServletWebRequest;

@DisplayName("AuthenticatedUserArgumentResolver")
class AuthenticatedUserArgumentResolverTest {

    private TokenService tokenService;
    private AuthenticatedUserArgumentResolver resolver;
    private MockHttpServletRequest request;

    @SuppressWarnings("unused")
    void handler(@CurrentUser AuthenticatedUser user, AuthenticatedUser unannotated) {
    }

    @BeforeEach
    void setUp() {
        tokenService = mock(TokenService.class);
        resolver = new AuthenticatedUserArgumentResolver(tokenService);
        request = new MockHttpServletRequest("GET", "/auth/protected");
    }

    @AfterEach
    void cleanup() {
        CorrelationContextHolder.clear();
    }

    private static MethodParameter parameter(int index) throws NoSuchMethodException {
        Method method = AuthenticatedUserArgumentResolverTest.class.getDeclaredMethod(
                "handler", AuthenticatedUser.class, AuthenticatedUser.class);
        return new MethodParameter(method, index);
    }

    private AuthenticatedUser resolve() throws Exception {
        return resolver.resolveArgument(parameter(0), null, new ServletWebRequest(request), null);
    }

    @Test
    @DisplayName("supports only @CurrentUser parameters")
    void supportsAnnotatedParameters() throws Exception {
        assertThat(resolver.supportsParameter(parameter(0))).isTrue();
        assertThat(resolver.supportsParameter(parameter(1))).isFalse();
    }

    @Test
    @DisplayName("resolves the verified user and binds it to the log context")
    void resolvesVerifiedUser() throws Exception {
        CorrelationContextHolder.set(CorrelationContext.of("corr-1"));
        request.addHeader("Authorization", "Bearer good-token");
        when(tokenService.verifyToken("good-token"))
                .thenReturn(new UserRecord("testuser", "test@example.com", "$2b$04$hash"));

        AuthenticatedUser user = resolve();

        assertThat(user).isEqualTo(new AuthenticatedUser("testuser", "test@example.com"));
        assertThat(CorrelationContextHolder.get())
                .map(CorrelationContext::userId)
                .contains("testuser");
    }

    @Test
    @DisplayName("fails extraction without calling the token service")
    void extractionStageRunsFirst() {
        assertThatThrownBy(this::resolve)
                .isInstanceOf(MissingCredentialsException.class)
                .hasMessage("Not authenticated");

        verify(tokenService, never()).verifyToken(anyString());
    }

    @Test
    @DisplayName("propagates verification failures")
    void verificationFailurePropagates() {
        request.addHeader("Authorization", "Bearer bad-token");
        when(tokenService.verifyToken("bad-token"))
                .thenThrow(new UnauthorizedException(UnauthorizedException.Reason.EXPIRED));

        assertThatThrownBy(this::resolve).isInstanceOf(UnauthorizedException.class);
        assertThat(CorrelationContextHolder.get()).isEmpty();
    }
}
