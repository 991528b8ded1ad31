package tessera.core.service.token;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import tessera.adapter.out.auth.ConfigSigningKeySupplier;
import tessera.core.model.auth.Identity;
import tessera.core.model.auth.TokenError;
import tessera.core.model.auth.TokenVerificationResult;
import tessera.support.MutableClock;
import tessera.support.TestConfigs;

@DisplayName("TokenIssuer and TokenVerifier")
class TokenVerifierTest {

    private MutableClock clock;
    private TestConfigs.Token config;
    private TokenIssuer issuer;
    private TokenVerifier verifier;

    @BeforeEach
    void setUp() {
        clock = MutableClock.atEpochSecond(1_700_000_000L);
        config = TestConfigs.token();
        rebuild(config);
    }

    private void rebuild(TestConfigs.Token tokenConfig) {
        final var keys = new ConfigSigningKeySupplier(tokenConfig);
        issuer = new TokenIssuer(tokenConfig, keys, clock);
        verifier = new TokenVerifier(tokenConfig, keys, clock);
    }

    private TokenVerificationResult.Invalid assertInvalid(TokenVerificationResult result, TokenError expected) {
        final var invalid = assertInstanceOf(TokenVerificationResult.Invalid.class, result);
        assertEquals(expected, invalid.error());
        return invalid;
    }

    @Nested
    @DisplayName("issue then verify")
    class RoundTripTests {

        @Test
        @DisplayName("should verify a freshly issued token")
        void shouldVerifyFreshToken() {
            final var issued = issuer.issue(Identity.of("alice"));

            final var valid =
                    assertInstanceOf(TokenVerificationResult.Valid.class, verifier.verify(issued.token()));

            assertEquals("alice", valid.subject());
            assertEquals(issued.issuedAt(), valid.issuedAt());
            assertEquals(issued.expiresAt(), valid.expiresAt());
        }

        @Test
        @DisplayName("should produce three base64url segments with typ AT")
        void shouldUseCompactForm() {
            final var token = issuer.issue(Identity.of("alice")).token();
            final var segments = token.split("\\.");

            assertEquals(3, segments.length);
            final var header = new String(Base64.getUrlDecoder().decode(segments[0]), StandardCharsets.UTF_8);
            assertEquals(true, header.contains("\"typ\":\"AT\""));
            assertEquals(true, header.contains("\"alg\":\"HS256\""));
        }

        @Test
        @DisplayName("should recover custom claims regardless of insertion order")
        void shouldRoundTripClaims() {
            final Map<String, Object> forward = new LinkedHashMap<>();
            forward.put("role", "admin");
            forward.put("tenant", "acme");
            forward.put("groups", List.of("ops", "dev"));
            final Map<String, Object> reverse = new LinkedHashMap<>();
            reverse.put("groups", List.of("ops", "dev"));
            reverse.put("tenant", "acme");
            reverse.put("role", "admin");

            final var first = (TokenVerificationResult.Valid)
                    verifier.verify(issuer.issue(new Identity("alice", forward)).token());
            final var second = (TokenVerificationResult.Valid)
                    verifier.verify(issuer.issue(new Identity("alice", reverse)).token());

            assertEquals(forward, first.claims());
            assertEquals(first.claims(), second.claims());
        }

        @Test
        @DisplayName("should recover numeric claims as an equal identity")
        void shouldRoundTripNumericClaims() {
            final Map<String, Object> claims = new LinkedHashMap<>();
            claims.put("level", 5);
            claims.put("score", 1.5f);
            claims.put("quota", List.of(1, 2));
            claims.put("limits", Map.of("daily", (short) 10));
            final var identity = new Identity("alice", claims);

            final var valid = assertInstanceOf(
                    TokenVerificationResult.Valid.class, verifier.verify(issuer.issue(identity).token()));

            assertEquals(5L, identity.claims().get("level"));
            assertEquals(1.5d, identity.claims().get("score"));
            assertEquals(identity.claims(), valid.claims());
            assertEquals(identity, valid.identity());
        }

        @Test
        @DisplayName("should refuse reserved claim names")
        void shouldRefuseReservedClaims() {
            final var identity = new Identity("alice", Map.of("exp", 1L));

            assertThrows(IllegalArgumentException.class, () -> issuer.issue(identity));
        }

        @Test
        @DisplayName("should refuse a TTL under one second")
        void shouldRefuseShortTtl() {
            assertThrows(
                    IllegalArgumentException.class, () -> issuer.issue(Identity.of("alice"), Duration.ofMillis(500)));
        }
    }

    @Nested
    @DisplayName("expiry")
    class ExpiryTests {

        @Test
        @DisplayName("should accept a token within the clock skew after expiry")
        void shouldHonourSkew() {
            final var token = issuer.issue(Identity.of("alice"), Duration.ofSeconds(60)).token();

            clock.advance(Duration.ofSeconds(60 + 30));

            assertInstanceOf(TokenVerificationResult.Valid.class, verifier.verify(token));
        }

        @Test
        @DisplayName("should reject a token past expiry plus skew")
        void shouldExpire() {
            final var token = issuer.issue(Identity.of("alice"), Duration.ofSeconds(60)).token();

            clock.advance(Duration.ofSeconds(60 + 31));

            assertInvalid(verifier.verify(token), TokenError.EXPIRED);
        }

        @Test
        @DisplayName("should reject a token issued in the future")
        void shouldRejectFutureToken() {
            final var token = issuer.issue(Identity.of("alice")).token();

            clock.advance(Duration.ofMinutes(-2));

            assertInvalid(verifier.verify(token), TokenError.CLAIM_MISMATCH);
        }

        @Test
        @DisplayName("should refuse a clock skew above 60 seconds")
        void shouldRefuseLargeSkew() {
            final var tokenConfig = config.withClockSkew(Duration.ofSeconds(61));
            final var keys = new ConfigSigningKeySupplier(tokenConfig);

            assertThrows(IllegalArgumentException.class, () -> new TokenVerifier(tokenConfig, keys, clock));
        }
    }

    @Nested
    @DisplayName("signature")
    class SignatureTests {

        @Test
        @DisplayName("should reject a token signed with another key")
        void shouldRejectForeignKey() {
            final var foreignConfig = config.withSigning("k1", Map.of("k1", TestConfigs.KEY_2));
            final var foreign =
                    new TokenIssuer(foreignConfig, new ConfigSigningKeySupplier(foreignConfig), clock);
            final var token = foreign.issue(Identity.of("alice")).token();

            assertInvalid(verifier.verify(token), TokenError.BAD_SIGNATURE);
        }

        @Test
        @DisplayName("should reject a tampered payload")
        void shouldRejectTamperedPayload() {
            final var segments = issuer.issue(Identity.of("alice")).token().split("\\.");
            final var payload = Base64.getUrlEncoder()
                    .withoutPadding()
                    .encodeToString("{\"sub\":\"mallory\",\"iat\":1700000000,\"exp\":1800000000}"
                            .getBytes(StandardCharsets.UTF_8));

            assertInvalid(
                    verifier.verify(segments[0] + "." + payload + "." + segments[2]), TokenError.BAD_SIGNATURE);
        }

        @Test
        @DisplayName("should reject an unknown key id")
        void shouldRejectUnknownKeyId() {
            final var otherConfig = config.withSigning("k9", Map.of("k9", TestConfigs.KEY_1));
            final var other = new TokenIssuer(otherConfig, new ConfigSigningKeySupplier(otherConfig), clock);

            assertInvalid(verifier.verify(other.issue(Identity.of("alice")).token()), TokenError.BAD_SIGNATURE);
        }

        @Test
        @DisplayName("should accept a token signed by a retired but configured key")
        void shouldAcceptRetiredKey() {
            final var oldToken = issuer.issue(Identity.of("alice")).token();

            rebuild(config.withSigning("k2", Map.of("k1", TestConfigs.KEY_1, "k2", TestConfigs.KEY_2)));

            assertInstanceOf(TokenVerificationResult.Valid.class, verifier.verify(oldToken));
        }

        @Test
        @DisplayName("should reject a token using a different algorithm")
        void shouldRejectOtherAlgorithm() {
            final var token = issuer.issue(Identity.of("alice")).token();

            rebuild(config.withAlgorithm("HS384")
                    .withSigning("k1", Map.of("k1", TestConfigs.KEY_384)));

            assertInvalid(verifier.verify(token), TokenError.BAD_SIGNATURE);
        }
    }

    @Nested
    @DisplayName("structure")
    class StructureTests {

        @Test
        @DisplayName("should reject empty and blank tokens")
        void shouldRejectEmpty() {
            assertInvalid(verifier.verify(""), TokenError.MALFORMED);
            assertInvalid(verifier.verify(null), TokenError.MALFORMED);
        }

        @Test
        @DisplayName("should reject the wrong number of segments")
        void shouldRejectSegmentCount() {
            assertInvalid(verifier.verify("a.b"), TokenError.MALFORMED);
            assertInvalid(verifier.verify("a.b.c.d"), TokenError.MALFORMED);
        }

        @Test
        @DisplayName("should reject segments that are not base64url")
        void shouldRejectBadEncoding() {
            assertInvalid(verifier.verify("abc.d+f.ghi"), TokenError.MALFORMED);
            assertInvalid(verifier.verify("abc..ghi"), TokenError.MALFORMED);
        }

        @Test
        @DisplayName("should reject a header that is not JSON")
        void shouldRejectGarbageHeader() {
            final var garbage = Base64.getUrlEncoder().withoutPadding().encodeToString("nope".getBytes());

            assertInvalid(verifier.verify(garbage + "." + garbage + "." + garbage), TokenError.MALFORMED);
        }
    }

    @Nested
    @DisplayName("issuer and audience")
    class ClaimTests {

        @Test
        @DisplayName("should accept matching issuer and audience")
        void shouldAcceptMatchingClaims() {
            rebuild(config.withIssuer("tessera").withAudience("web"));

            final var token = issuer.issue(Identity.of("alice")).token();

            assertInstanceOf(TokenVerificationResult.Valid.class, verifier.verify(token));
        }

        @Test
        @DisplayName("should reject an issuer mismatch")
        void shouldRejectIssuerMismatch() {
            rebuild(config.withIssuer("someone-else"));
            final var token = issuer.issue(Identity.of("alice")).token();

            rebuild(config.withIssuer("tessera"));

            assertInvalid(verifier.verify(token), TokenError.CLAIM_MISMATCH);
        }

        @Test
        @DisplayName("should reject an audience mismatch")
        void shouldRejectAudienceMismatch() {
            rebuild(config.withAudience("web"));
            final var token = issuer.issue(Identity.of("alice")).token();

            assertInvalid(verifier.verify(token, Optional.of("mobile")), TokenError.CLAIM_MISMATCH);
        }

        @Test
        @DisplayName("should reject a token without audience when one is expected")
        void shouldRejectMissingAudience() {
            final var token = issuer.issue(Identity.of("alice")).token();

            assertInvalid(verifier.verify(token, Optional.of("web")), TokenError.CLAIM_MISMATCH);
        }
    }
}
