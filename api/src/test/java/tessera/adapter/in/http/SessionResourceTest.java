package tessera.adapter.in.http;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.time.Instant;

import jakarta.ws.rs.core.Response;

import io.smallrye.mutiny.Uni;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import tessera.adapter.in.dto.ChangePasswordRequest;
import tessera.adapter.in.dto.LoginRequest;
import tessera.adapter.in.dto.RefreshRequest;
import tessera.adapter.in.dto.TokenResponse;
import tessera.adapter.in.problem.AuthProblem;
import tessera.adapter.out.auth.ConfigSigningKeySupplier;
import tessera.core.model.auth.AuthError;
import tessera.core.model.auth.Credential;
import tessera.core.model.auth.Identity;
import tessera.core.model.auth.StrategyKind;
import tessera.core.model.session.SessionResult;
import tessera.core.model.session.TokenPair;
import tessera.core.port.in.PasswordManagement;
import tessera.core.port.in.SessionManagement;
import tessera.core.service.token.TokenIssuer;
import tessera.core.service.token.TokenVerifier;
import tessera.support.MutableClock;
import tessera.support.TestConfigs;

@DisplayName("SessionResource")
class SessionResourceTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(1);

    private MutableClock clock;
    private SessionManagement sessions;
    private PasswordManagement passwords;
    private TokenIssuer issuer;
    private SessionResource resource;

    @BeforeEach
    void setUp() {
        clock = MutableClock.atEpochSecond(1_700_000_000L);
        sessions = mock(SessionManagement.class);
        passwords = mock(PasswordManagement.class);
        final var config = TestConfigs.token();
        final var keys = new ConfigSigningKeySupplier(config);
        issuer = new TokenIssuer(config, keys, clock);
        resource = new SessionResource(sessions, passwords, new TokenVerifier(config, keys, clock), clock);
    }

    private SessionResult.Issued issued() {
        final var now = clock.instant();
        final var pair = new TokenPair("access", now.plusSeconds(300), "refresh", now.plus(Duration.ofDays(14)));
        return new SessionResult.Issued(pair, Identity.of("alice"));
    }

    private static LoginRequest passwordLogin(String identifier, String password) {
        return new LoginRequest(
                "local-password", new LoginRequest.CredentialDto(identifier, password, null));
    }

    private String bearer() {
        return "Bearer " + issuer.issue(Identity.of("alice")).token();
    }

    @Nested
    @DisplayName("POST /auth/login")
    class LoginTests {

        @Test
        @DisplayName("should return 200 with the token pair")
        void shouldReturnTokens() {
            when(sessions.login(eq(StrategyKind.LOCAL_PASSWORD), any(Credential.class), isNull()))
                    .thenReturn(Uni.createFrom().item(issued()));

            final var response = resource.login(passwordLogin("alice", "pw"), null).await().atMost(TIMEOUT);

            assertEquals(200, response.getStatus());
            final var body = assertInstanceOf(TokenResponse.class, response.getEntity());
            assertEquals("access", body.accessToken());
            assertEquals("Bearer", body.tokenType());
            assertEquals(300, body.expiresIn());
            assertEquals("refresh", body.refreshToken());
            verify(sessions).login(StrategyKind.LOCAL_PASSWORD, new Credential.Password("alice", "pw"), null);
        }

        @Test
        @DisplayName("should return a generic 401 whatever the failure reason")
        void shouldHideFailureReason() {
            when(sessions.login(any(), any(), any()))
                    .thenReturn(Uni.createFrom().item(SessionResult.Failed.of(AuthError.INVALID_CREDENTIALS)));

            final var problem = assertThrows(
                    AuthProblem.class,
                    () -> resource.login(passwordLogin("alice", "bad"), null).await().atMost(TIMEOUT));

            assertEquals(Response.Status.UNAUTHORIZED, problem.getStatus());
            assertEquals("Invalid credentials", problem.getMessage());
        }

        @Test
        @DisplayName("should return 429 with Retry-After when locked out")
        void shouldReturnTooManyRequests() {
            final var retryAt = clock.instant().plus(Duration.ofMinutes(15));
            when(sessions.login(any(), any(), any()))
                    .thenReturn(Uni.createFrom().item(new SessionResult.Failed(AuthError.LOCKED_OUT, retryAt)));

            final var problem = assertThrows(
                    AuthProblem.class,
                    () -> resource.login(passwordLogin("alice", "pw"), null).await().atMost(TIMEOUT));

            assertEquals(Response.Status.TOO_MANY_REQUESTS, problem.getStatus());
            assertEquals(Duration.ofMinutes(15), problem.getRetryAfter());
        }

        @Test
        @DisplayName("should map bearer tokens to credentials")
        void shouldMapBearerToken() {
            when(sessions.login(any(), any(), any())).thenReturn(Uni.createFrom().item(issued()));

            resource.login(
                            new LoginRequest("bearer-token", new LoginRequest.CredentialDto(null, null, "t")),
                            null)
                    .await()
                    .atMost(TIMEOUT);

            verify(sessions).login(StrategyKind.BEARER_TOKEN, new Credential.PresentedToken("t"), null);
        }

        @Test
        @DisplayName("should refuse provider assertions presented by a client with a generic 401")
        void shouldRefuseClientAssertions() {
            final var request =
                    new LoginRequest("external-provider", new LoginRequest.CredentialDto(null, null, null));

            final var problem = assertThrows(AuthProblem.class, () -> resource.login(request, null));

            assertEquals(Response.Status.UNAUTHORIZED, problem.getStatus());
            assertEquals("Invalid credentials", problem.getMessage());
            verify(sessions, never()).login(any(), any(), any());
        }

        @Test
        @DisplayName("should return 400 for an unknown strategy or missing credential")
        void shouldRejectBadRequests() {
            final var empty = new LoginRequest.CredentialDto(null, null, null);
            final var unknown = assertThrows(
                    AuthProblem.class, () -> resource.login(new LoginRequest("magic-link", empty), null));
            final var missing = assertThrows(
                    AuthProblem.class, () -> resource.login(new LoginRequest("local-password", null), null));

            assertEquals(Response.Status.BAD_REQUEST, unknown.getStatus());
            assertEquals(Response.Status.BAD_REQUEST, missing.getStatus());
            verify(sessions, never()).login(any(), any(), any());
        }
    }

    @Nested
    @DisplayName("POST /auth/refresh")
    class RefreshTests {

        @Test
        @DisplayName("should return 200 with the rotated pair")
        void shouldReturnTokens() {
            when(sessions.refresh("refresh-1", null)).thenReturn(Uni.createFrom().item(issued()));

            final var response =
                    resource.refresh(new RefreshRequest("refresh-1"), null).await().atMost(TIMEOUT);

            assertEquals(200, response.getStatus());
        }

        @Test
        @DisplayName("should return the same 401 for reuse and unknown tokens")
        void shouldHideReuse() {
            when(sessions.refresh("replayed", null))
                    .thenReturn(Uni.createFrom().item(SessionResult.Failed.of(AuthError.REUSE_DETECTED)));
            when(sessions.refresh("unknown", null))
                    .thenReturn(Uni.createFrom().item(SessionResult.Failed.of(AuthError.UNKNOWN_TOKEN)));

            final var reuse = assertThrows(
                    AuthProblem.class,
                    () -> resource.refresh(new RefreshRequest("replayed"), null).await().atMost(TIMEOUT));
            final var unknown = assertThrows(
                    AuthProblem.class,
                    () -> resource.refresh(new RefreshRequest("unknown"), null).await().atMost(TIMEOUT));

            assertEquals(Response.Status.UNAUTHORIZED, reuse.getStatus());
            assertEquals(reuse.getMessage(), unknown.getMessage());
            assertEquals("Invalid session", reuse.getMessage());
        }

        @Test
        @DisplayName("should return 401 without a token")
        void shouldRejectMissingToken() {
            assertThrows(AuthProblem.class, () -> resource.refresh(new RefreshRequest(" "), null));
            assertThrows(AuthProblem.class, () -> resource.refresh(null, null));
        }
    }

    @Nested
    @DisplayName("logout")
    class LogoutTests {

        @Test
        @DisplayName("POST /auth/logout should return 204")
        void shouldLogout() {
            when(sessions.logout("refresh-1")).thenReturn(Uni.createFrom().voidItem());

            final var response = resource.logout(new RefreshRequest("refresh-1")).await().atMost(TIMEOUT);

            assertEquals(204, response.getStatus());
            verify(sessions).logout("refresh-1");
        }

        @Test
        @DisplayName("POST /auth/logout should return 204 even without a token")
        void shouldLogoutWithoutToken() {
            assertEquals(204, resource.logout(null).await().atMost(TIMEOUT).getStatus());
            verify(sessions, never()).logout(any());
        }

        @Test
        @DisplayName("POST /auth/logout-all should revoke the bearer's sessions")
        void shouldLogoutAll() {
            when(sessions.logoutAll("alice")).thenReturn(Uni.createFrom().item(3));

            final var response = resource.logoutAll(bearer()).await().atMost(TIMEOUT);

            assertEquals(204, response.getStatus());
            verify(sessions).logoutAll("alice");
        }

        @Test
        @DisplayName("POST /auth/logout-all should return 401 without a valid bearer token")
        void shouldRequireBearer() {
            assertThrows(AuthProblem.class, () -> resource.logoutAll(null));
            assertThrows(AuthProblem.class, () -> resource.logoutAll("Basic abc"));
            assertThrows(AuthProblem.class, () -> resource.logoutAll("Bearer not-a-token"));

            final var expired = bearer();
            clock.advance(Duration.ofMinutes(10));
            assertThrows(AuthProblem.class, () -> resource.logoutAll(expired));
            verify(sessions, never()).logoutAll(any());
        }
    }

    @Nested
    @DisplayName("POST /auth/password")
    class ChangePasswordTests {

        @Test
        @DisplayName("should return 204 when the password changed")
        void shouldChangePassword() {
            when(passwords.changePassword("alice", "old", "new")).thenReturn(Uni.createFrom().item(true));

            final var response = resource.changePassword(new ChangePasswordRequest("old", "new"), bearer())
                    .await()
                    .atMost(TIMEOUT);

            assertEquals(204, response.getStatus());
        }

        @Test
        @DisplayName("should return 401 when the current password is wrong")
        void shouldRejectWrongCurrentPassword() {
            when(passwords.changePassword("alice", "wrong", "new")).thenReturn(Uni.createFrom().item(false));
            final var authorization = bearer();

            final var problem = assertThrows(
                    AuthProblem.class,
                    () -> resource.changePassword(new ChangePasswordRequest("wrong", "new"), authorization)
                            .await()
                            .atMost(TIMEOUT));

            assertEquals(Response.Status.UNAUTHORIZED, problem.getStatus());
        }

        @Test
        @DisplayName("should return 400 without a new password")
        void shouldRequireNewPassword() {
            final var authorization = bearer();

            final var problem = assertThrows(
                    AuthProblem.class,
                    () -> resource.changePassword(new ChangePasswordRequest("old", ""), authorization));

            assertEquals(Response.Status.BAD_REQUEST, problem.getStatus());
        }
    }

    @Test
    @DisplayName("TokenResponse should never report a negative lifetime")
    void shouldClampLifetimes() {
        final var past = Instant.EPOCH;
        final var body = TokenResponse.from(new TokenPair("a", past, "r", past), clock);

        assertEquals(0, body.expiresIn());
        assertEquals(0, body.refreshExpiresIn());
    }
}
