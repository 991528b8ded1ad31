package tessera.core.service.session;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import tessera.adapter.out.auth.ConfigSigningKeySupplier;
import tessera.adapter.out.storage.memory.InMemoryExternalIdentityRepository;
import tessera.adapter.out.storage.memory.InMemoryFailedAttemptRepository;
import tessera.adapter.out.storage.memory.InMemoryPasswordRecordRepository;
import tessera.adapter.out.storage.memory.InMemoryRefreshTokenRepository;
import tessera.core.model.auth.AuthError;
import tessera.core.model.auth.Credential;
import tessera.core.model.auth.Identity;
import tessera.core.model.auth.PasswordRecord;
import tessera.core.model.auth.StrategyKind;
import tessera.core.model.auth.TokenVerificationResult;
import tessera.core.model.session.RefreshStatus;
import tessera.core.model.session.SessionResult;
import tessera.core.port.out.SecurityEventPublisher;
import tessera.core.service.auth.AuthRateLimitService;
import tessera.core.service.credential.BearerTokenVerifier;
import tessera.core.service.credential.CredentialVerifierRegistry;
import tessera.core.service.credential.ExternalProviderVerifier;
import tessera.core.service.credential.LocalPasswordVerifier;
import tessera.core.service.password.PasswordHasher;
import tessera.core.service.refresh.RefreshTokenGenerator;
import tessera.core.service.refresh.RefreshTokenService;
import tessera.core.service.token.TokenIssuer;
import tessera.core.service.token.TokenVerifier;
import tessera.spi.SecurityEvent;
import tessera.support.MutableClock;
import tessera.support.TestConfigs;

@DisplayName("SessionService")
class SessionServiceTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(10);
    private static final String IP = "192.0.2.10";
    private static final String PASSWORD = "correct horse";

    private MutableClock clock;
    private InMemoryRefreshTokenRepository refreshRepository;
    private InMemoryFailedAttemptRepository failedAttempts;
    private RefreshTokenGenerator generator;
    private TokenIssuer tokenIssuer;
    private TokenVerifier tokenVerifier;
    private RefreshTokenService refreshTokens;
    private AuthRateLimitService rateLimiter;
    private SecurityEventPublisher events;
    private SessionService service;

    @BeforeEach
    void setUp() {
        clock = MutableClock.atEpochSecond(1_700_000_000L);
        events = mock(SecurityEventPublisher.class);

        final var hasher = new PasswordHasher(TestConfigs.password(4));
        final var passwords = new InMemoryPasswordRecordRepository();
        final var hash = hasher.hash(PASSWORD).await().atMost(TIMEOUT);
        passwords.save(new PasswordRecord("alice", hash, 4, "2b")).await().atMost(TIMEOUT);

        final var tokenConfig = TestConfigs.token();
        final var keys = new ConfigSigningKeySupplier(tokenConfig);
        tokenIssuer = new TokenIssuer(tokenConfig, keys, clock);
        tokenVerifier = new TokenVerifier(tokenConfig, keys, clock);

        final var sessionConfig = TestConfigs.session();
        final var registry = new CredentialVerifierRegistry(
                List.of(new LocalPasswordVerifier(passwords, hasher), new BearerTokenVerifier(tokenVerifier)),
                sessionConfig);

        refreshRepository = new InMemoryRefreshTokenRepository();
        generator = new RefreshTokenGenerator();
        refreshTokens = new RefreshTokenService(refreshRepository, generator, sessionConfig, events, clock);

        failedAttempts = new InMemoryFailedAttemptRepository(clock);
        rateLimiter = new AuthRateLimitService(TestConfigs.rateLimit(), failedAttempts, clock);

        service = new SessionService(registry, tokenIssuer, refreshTokens, rateLimiter, events, clock);
    }

    @AfterEach
    void tearDown() {
        failedAttempts.shutdown();
    }

    private SessionResult login(String identifier, String secret) {
        return service.login(StrategyKind.LOCAL_PASSWORD, new Credential.Password(identifier, secret), IP)
                .await()
                .atMost(TIMEOUT);
    }

    private SessionResult refresh(String refreshToken) {
        return service.refresh(refreshToken, IP).await().atMost(TIMEOUT);
    }

    private RefreshStatus statusOf(String rawToken) {
        return refreshRepository
                .findById(generator.tokenId(rawToken))
                .await()
                .atMost(TIMEOUT)
                .orElseThrow()
                .status();
    }

    private static AuthError errorOf(SessionResult result) {
        return assertInstanceOf(SessionResult.Failed.class, result).error();
    }

    @Nested
    @DisplayName("login()")
    class LoginTests {

        @Test
        @DisplayName("should issue a verifiable access token and an active refresh token")
        void shouldIssueTokens() {
            final var issued = assertInstanceOf(SessionResult.Issued.class, login("alice", PASSWORD));

            final var verified = tokenVerifier.verify(issued.tokens().accessToken());
            final var valid = assertInstanceOf(TokenVerificationResult.Valid.class, verified);
            assertEquals("alice", valid.identity().subjectId());
            assertEquals(RefreshStatus.ACTIVE, statusOf(issued.tokens().refreshToken()));
            assertEquals(clock.instant().plus(Duration.ofMinutes(5)), issued.tokens().accessTokenExpiresAt());
        }

        @Test
        @DisplayName("should return the same error for a wrong password and an unknown subject")
        void shouldNotRevealAccountExistence() {
            assertEquals(AuthError.INVALID_CREDENTIALS, errorOf(login("alice", "wrong")));
            assertEquals(AuthError.INVALID_CREDENTIALS, errorOf(login("mallory", PASSWORD)));
        }

        @Test
        @DisplayName("should publish an authentication failure event")
        void shouldPublishFailure() {
            login("alice", "wrong");

            final var captor = ArgumentCaptor.forClass(SecurityEvent.class);
            verify(events).publish(captor.capture());
            final var failure = assertInstanceOf(SecurityEvent.AuthenticationFailure.class, captor.getValue());
            assertEquals("invalid_credentials", failure.reason());
            assertEquals("local-password", failure.attemptedMethod());
            assertEquals(1, failure.failureCount());
        }

        @Test
        @DisplayName("should lock out after repeated failures, even with the right password")
        void shouldLockOut() {
            login("alice", "wrong");
            login("alice", "wrong");
            login("alice", "wrong");

            final var result = login("alice", PASSWORD);

            final var failed = assertInstanceOf(SessionResult.Failed.class, result);
            assertEquals(AuthError.LOCKED_OUT, failed.error());
            assertEquals(clock.instant().plus(Duration.ofMinutes(15)), failed.retryAfter());

            final var captor = ArgumentCaptor.forClass(SecurityEvent.class);
            verify(events, atLeastOnce()).publish(captor.capture());
            assertTrue(captor.getAllValues().stream().anyMatch(SecurityEvent.AuthenticationLockout.class::isInstance));
        }

        @Test
        @DisplayName("should reset the failure count after a successful login")
        void shouldResetFailuresOnSuccess() {
            login("alice", "wrong");
            login("alice", "wrong");
            assertInstanceOf(SessionResult.Issued.class, login("alice", PASSWORD));

            login("alice", "wrong");
            login("alice", "wrong");

            assertInstanceOf(SessionResult.Issued.class, login("alice", PASSWORD));
        }

        @Test
        @DisplayName("should accept an access token through the bearer strategy")
        void shouldLoginWithBearerToken() {
            final var first = (SessionResult.Issued) login("alice", PASSWORD);

            final var result = service.login(
                            StrategyKind.BEARER_TOKEN,
                            new Credential.PresentedToken(first.tokens().accessToken()),
                            IP)
                    .await()
                    .atMost(TIMEOUT);

            final var issued = assertInstanceOf(SessionResult.Issued.class, result);
            assertEquals("alice", issued.identity().subjectId());
            assertNotEquals(first.tokens().refreshToken(), issued.tokens().refreshToken());
        }

        @Test
        @DisplayName("should refuse a strategy that is not enabled")
        void shouldRefuseDisabledStrategy() {
            final var result = service.login(
                            StrategyKind.EXTERNAL_PROVIDER,
                            new Credential.ProviderAssertion("github", "42", Map.of()),
                            IP)
                    .await()
                    .atMost(TIMEOUT);

            assertEquals(AuthError.INVALID_CREDENTIALS, errorOf(result));
        }

        @Test
        @DisplayName("should refuse missing input")
        void shouldRefuseMissingInput() {
            assertEquals(
                    AuthError.INVALID_CREDENTIALS,
                    errorOf(service.login(null, null, IP).await().atMost(TIMEOUT)));
        }
    }

    @Nested
    @DisplayName("refresh()")
    class RefreshTests {

        @Test
        @DisplayName("should rotate, then revoke the whole family when the old token is replayed")
        void shouldDetectReplayAcrossTheFamily() {
            final var login = (SessionResult.Issued) login("alice", PASSWORD);
            final var original = login.tokens().refreshToken();

            final var refreshed = assertInstanceOf(SessionResult.Issued.class, refresh(original));
            final var successor = refreshed.tokens().refreshToken();
            assertEquals("alice", refreshed.identity().subjectId());
            assertEquals(RefreshStatus.ROTATED, statusOf(original));
            assertEquals(RefreshStatus.ACTIVE, statusOf(successor));

            assertEquals(AuthError.REUSE_DETECTED, errorOf(refresh(original)));
            assertEquals(RefreshStatus.REVOKED, statusOf(successor));
            assertEquals(AuthError.REUSE_DETECTED, errorOf(refresh(successor)));
        }

        @Test
        @DisplayName("should issue a verifiable access token on refresh")
        void shouldIssueAccessTokenOnRefresh() {
            final var login = (SessionResult.Issued) login("alice", PASSWORD);
            clock.advance(Duration.ofMinutes(10));

            final var refreshed = (SessionResult.Issued) refresh(login.tokens().refreshToken());

            assertInstanceOf(
                    TokenVerificationResult.Valid.class, tokenVerifier.verify(refreshed.tokens().accessToken()));
            assertInstanceOf(
                    TokenVerificationResult.Invalid.class, tokenVerifier.verify(login.tokens().accessToken()));
        }

        @Test
        @DisplayName("should reject unknown and expired refresh tokens")
        void shouldRejectUnknownAndExpired() {
            assertEquals(AuthError.UNKNOWN_TOKEN, errorOf(refresh("garbage")));

            final var login = (SessionResult.Issued) login("alice", PASSWORD);
            clock.advance(Duration.ofDays(15));

            assertEquals(AuthError.UNKNOWN_TOKEN, errorOf(refresh(login.tokens().refreshToken())));
        }
    }

    @Nested
    @DisplayName("logout")
    class LogoutTests {

        @Test
        @DisplayName("logout() should revoke only the presented token")
        void shouldRevokeSingleToken() {
            final var first = (SessionResult.Issued) login("alice", PASSWORD);
            final var second = (SessionResult.Issued) login("alice", PASSWORD);

            service.logout(first.tokens().refreshToken()).await().atMost(TIMEOUT);

            assertEquals(RefreshStatus.REVOKED, statusOf(first.tokens().refreshToken()));
            assertEquals(RefreshStatus.ACTIVE, statusOf(second.tokens().refreshToken()));
            assertNotNull(refresh(first.tokens().refreshToken()));
            assertInstanceOf(SessionResult.Issued.class, refresh(second.tokens().refreshToken()));
        }

        @Test
        @DisplayName("logout() should ignore unknown tokens")
        void shouldIgnoreUnknownToken() {
            service.logout("unknown").await().atMost(TIMEOUT);
            service.logout(null).await().atMost(TIMEOUT);
        }

        @Test
        @DisplayName("logoutAll() should revoke every family of the subject")
        void shouldRevokeEverySession() {
            final var first = (SessionResult.Issued) login("alice", PASSWORD);
            final var second = (SessionResult.Issued) login("alice", PASSWORD);

            final var revoked = service.logoutAll("alice").await().atMost(TIMEOUT);

            assertEquals(2, revoked);
            assertEquals(RefreshStatus.REVOKED, statusOf(first.tokens().refreshToken()));
            assertEquals(RefreshStatus.REVOKED, statusOf(second.tokens().refreshToken()));

            final var captor = ArgumentCaptor.forClass(SecurityEvent.class);
            verify(events, atLeastOnce()).publish(captor.capture());
            final var last = captor.getAllValues().get(captor.getAllValues().size() - 1);
            final var event = assertInstanceOf(SecurityEvent.SessionRevoked.class, last);
            assertEquals("logout_all", event.reason());
        }

        @Test
        @DisplayName("logoutAll() should reject a blank subject")
        void shouldRejectBlankSubject() {
            assertThrows(
                    IllegalArgumentException.class, () -> service.logoutAll(" ").await().atMost(TIMEOUT));
        }
    }

    @Nested
    @DisplayName("external provider login")
    class ExternalProviderLoginTests {

        private SessionService externalService(TokenIssuer issuer) {
            final var config = TestConfigs.session(List.of("external-provider"), true);
            final var registry = new CredentialVerifierRegistry(
                    List.of(new ExternalProviderVerifier(new InMemoryExternalIdentityRepository(), config)), config);
            return new SessionService(registry, issuer, refreshTokens, rateLimiter, events, clock);
        }

        private SessionResult loginWith(SessionService target, Map<String, Object> claims) {
            return target.login(
                            StrategyKind.EXTERNAL_PROVIDER,
                            new Credential.ProviderAssertion("oidc", "sub-7", claims),
                            IP)
                    .await()
                    .atMost(TIMEOUT);
        }

        @Test
        @DisplayName("should issue tokens when the provider asserts registered claim names")
        void shouldIssueDespiteRegisteredClaims() {
            final var result = loginWith(
                    externalService(tokenIssuer),
                    Map.of("iss", "https://idp.example", "aud", "web", "email", "a@example.com"));

            final var issued = assertInstanceOf(SessionResult.Issued.class, result);
            final var valid = assertInstanceOf(
                    TokenVerificationResult.Valid.class, tokenVerifier.verify(issued.tokens().accessToken()));
            assertEquals("a@example.com", valid.claims().get("email"));
            assertEquals(RefreshStatus.ACTIVE, statusOf(issued.tokens().refreshToken()));
        }

        @Test
        @DisplayName("should store no refresh token when the access token cannot be issued")
        void shouldStoreNothingWhenIssuanceFails() {
            final var failingIssuer = mock(TokenIssuer.class);
            when(failingIssuer.issue(any(Identity.class))).thenThrow(new IllegalArgumentException("refused"));

            assertThrows(
                    IllegalArgumentException.class,
                    () -> loginWith(externalService(failingIssuer), Map.of("email", "a@example.com")));

            assertEquals(0, refreshRepository.size());
        }
    }
}
