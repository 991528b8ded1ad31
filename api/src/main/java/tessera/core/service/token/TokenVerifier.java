package tessera.core.service.token;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;

import org.jboss.logging.Logger;
import org.jose4j.jwa.AlgorithmConstraints;
import org.jose4j.jwa.AlgorithmConstraints.ConstraintType;
import org.jose4j.jws.JsonWebSignature;
import org.jose4j.jwt.JwtClaims;
import org.jose4j.jwt.MalformedClaimException;
import org.jose4j.jwt.consumer.InvalidJwtException;
import org.jose4j.jwx.HeaderParameterNames;
import org.jose4j.lang.JoseException;

import tessera.core.config.TokenConfig;
import tessera.core.model.auth.TokenError;
import tessera.core.model.auth.TokenVerificationResult;
import tessera.core.port.out.SigningKeySupplier;
import tessera.core.port.out.SigningKeySupplier.SigningKey;

/**
 * Verifies access tokens produced by {@link TokenIssuer}.
 *
 * <p>Checks run in a fixed order: structure, token type, algorithm and key id,
 * signature, required claims, time window, then issuer and audience. The first
 * failing check determines the {@link TokenError}. Verification never touches
 * storage and never logs token contents.
 */
@ApplicationScoped
public class TokenVerifier {

    private static final Logger LOG = Logger.getLogger(TokenVerifier.class);

    static final Duration MAX_CLOCK_SKEW = Duration.ofSeconds(60);

    private final TokenConfig config;
    private final SigningKeySupplier keySupplier;
    private final Clock clock;
    private final Duration clockSkew;

    public TokenVerifier(TokenConfig config, SigningKeySupplier keySupplier, Clock clock) {
        final var skew = config.clockSkew();
        if (skew.isNegative() || skew.compareTo(MAX_CLOCK_SKEW) > 0) {
            throw new IllegalArgumentException(
                    "tessera.token.clock-skew must be between 0 and 60 seconds, was " + skew);
        }
        this.config = config;
        this.keySupplier = keySupplier;
        this.clock = clock;
        this.clockSkew = skew;
    }

    /**
     * Verify a token against the configured audience, if any.
     */
    public TokenVerificationResult verify(String token) {
        return verify(token, Optional.empty());
    }

    /**
     * Verify a token.
     *
     * @param token            compact serialized token
     * @param expectedAudience audience the token must carry; falls back to the configured audience
     * @return {@link TokenVerificationResult.Valid} or {@link TokenVerificationResult.Invalid}
     */
    public TokenVerificationResult verify(String token, Optional<String> expectedAudience) {
        if (token == null || token.isBlank()) {
            return invalid(TokenError.MALFORMED, "empty token");
        }

        final var segments = token.split("\\.", -1);
        if (segments.length != 3) {
            return invalid(TokenError.MALFORMED, "expected 3 segments, found " + segments.length);
        }
        for (String segment : segments) {
            if (segment.isEmpty() || !isBase64Url(segment)) {
                return invalid(TokenError.MALFORMED, "segment is not base64url");
            }
        }

        final var jws = new JsonWebSignature();
        try {
            jws.setCompactSerialization(token);
        } catch (JoseException e) {
            return invalid(TokenError.MALFORMED, "undecodable header");
        }

        if (!TokenIssuer.TOKEN_TYPE.equals(jws.getHeader(HeaderParameterNames.TYPE))) {
            return invalid(TokenError.MALFORMED, "unexpected token type");
        }
        if (!config.algorithm().equals(jws.getAlgorithmHeaderValue())) {
            return invalid(TokenError.BAD_SIGNATURE, "algorithm not accepted: " + jws.getAlgorithmHeaderValue());
        }

        final var keyId = jws.getKeyIdHeaderValue();
        final Optional<SigningKey> key =
                keyId == null ? Optional.empty() : keySupplier.verificationKey(keyId);
        if (key.isEmpty()) {
            return invalid(TokenError.BAD_SIGNATURE, "unknown key id");
        }

        final JwtClaims claims;
        try {
            jws.setAlgorithmConstraints(new AlgorithmConstraints(ConstraintType.PERMIT, config.algorithm()));
            jws.setKey(key.get().key());
            if (!jws.verifySignature()) {
                return invalid(TokenError.BAD_SIGNATURE, "signature mismatch");
            }
            claims = JwtClaims.parse(jws.getPayload());
        } catch (InvalidJwtException e) {
            return invalid(TokenError.MALFORMED, "payload is not a claims set");
        } catch (JoseException e) {
            return invalid(TokenError.BAD_SIGNATURE, "signature check failed");
        }

        try {
            return checkClaims(claims, expectedAudience.or(config::audience));
        } catch (MalformedClaimException e) {
            return invalid(TokenError.MALFORMED, "malformed registered claim");
        }
    }

    private TokenVerificationResult checkClaims(JwtClaims claims, Optional<String> audience)
            throws MalformedClaimException {
        final var subject = claims.getSubject();
        final var iat = claims.getIssuedAt();
        final var exp = claims.getExpirationTime();
        if (subject == null || subject.isBlank() || iat == null || exp == null) {
            return invalid(TokenError.MALFORMED, "missing sub, iat or exp");
        }

        final var now = clock.instant();
        final var issuedAt = Instant.ofEpochSecond(iat.getValue());
        final var expiresAt = Instant.ofEpochSecond(exp.getValue());

        if (now.isAfter(expiresAt.plus(clockSkew))) {
            return invalid(TokenError.EXPIRED, "expired at " + expiresAt);
        }
        if (issuedAt.isAfter(now.plus(clockSkew))) {
            return invalid(TokenError.CLAIM_MISMATCH, "issued in the future");
        }

        final var expectedIssuer = config.issuer();
        if (expectedIssuer.isPresent() && !expectedIssuer.get().equals(claims.getIssuer())) {
            return invalid(TokenError.CLAIM_MISMATCH, "issuer mismatch");
        }
        if (audience.isPresent() && !claims.hasAudience()) {
            return invalid(TokenError.CLAIM_MISMATCH, "audience missing");
        }
        if (audience.isPresent() && !claims.getAudience().contains(audience.get())) {
            return invalid(TokenError.CLAIM_MISMATCH, "audience mismatch");
        }

        return new TokenVerificationResult.Valid(
                subject, claims.getClaimsMap(TokenIssuer.REGISTERED_CLAIMS), issuedAt, expiresAt);
    }

    private static boolean isBase64Url(String segment) {
        try {
            Base64.getUrlDecoder().decode(segment);
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    private static TokenVerificationResult invalid(TokenError error, String detail) {
        LOG.debugv("Access token rejected: {0} ({1})", error, detail);
        return new TokenVerificationResult.Invalid(error, detail);
    }
}
