package tessera.core.service.token;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Set;

import jakarta.enterprise.context.ApplicationScoped;

import org.jboss.logging.Logger;
import org.jose4j.jws.AlgorithmIdentifiers;
import org.jose4j.jws.JsonWebSignature;
import org.jose4j.jwt.JwtClaims;
import org.jose4j.jwt.NumericDate;
import org.jose4j.jwx.HeaderParameterNames;
import org.jose4j.lang.JoseException;

import tessera.core.config.TokenConfig;
import tessera.core.model.auth.Identity;
import tessera.core.model.auth.IssuedToken;
import tessera.core.port.out.SigningKeySupplier;

/**
 * Issues compact HMAC-signed access tokens.
 *
 * <p>Header: {@code {"alg":<alg>,"typ":"AT","kid":<key id>}}. Payload:
 * {@code sub}, {@code iat}, {@code exp}, optional {@code iss} and {@code aud},
 * followed by the identity's claims. Issuing is a pure in-memory computation.
 */
@ApplicationScoped
public class TokenIssuer {

    private static final Logger LOG = Logger.getLogger(TokenIssuer.class);

    /** Value of the {@code typ} header for access tokens. */
    public static final String TOKEN_TYPE = "AT";

    /** Claim names reserved for the token itself. */
    public static final Set<String> REGISTERED_CLAIMS = Set.of("sub", "iat", "exp", "iss", "aud", "nbf", "jti");

    static final Set<String> SUPPORTED_ALGORITHMS = Set.of(
            AlgorithmIdentifiers.HMAC_SHA256, AlgorithmIdentifiers.HMAC_SHA384, AlgorithmIdentifiers.HMAC_SHA512);

    private final TokenConfig config;
    private final SigningKeySupplier keySupplier;
    private final Clock clock;

    public TokenIssuer(TokenConfig config, SigningKeySupplier keySupplier, Clock clock) {
        if (!SUPPORTED_ALGORITHMS.contains(config.algorithm())) {
            throw new IllegalArgumentException("Unsupported token algorithm: " + config.algorithm());
        }
        this.config = config;
        this.keySupplier = keySupplier;
        this.clock = clock;
    }

    /**
     * Issue a token with the configured access-token TTL.
     */
    public IssuedToken issue(Identity identity) {
        return issue(identity, config.accessTokenTtl());
    }

    /**
     * Issue a token valid for {@code ttl}.
     *
     * @param identity subject and claims to embed
     * @param ttl      lifetime, at least one second
     * @return the signed token
     * @throws IllegalArgumentException if a claim uses a registered name or the TTL is below one second
     */
    public IssuedToken issue(Identity identity, Duration ttl) {
        if (ttl == null || ttl.getSeconds() < 1) {
            throw new IllegalArgumentException("Token TTL must be at least one second");
        }
        for (String name : identity.claims().keySet()) {
            if (REGISTERED_CLAIMS.contains(name)) {
                throw new IllegalArgumentException("Claim name is reserved: " + name);
            }
        }

        final var issuedAt = Instant.ofEpochSecond(clock.instant().getEpochSecond());
        final var expiresAt = issuedAt.plusSeconds(ttl.getSeconds());

        final var claims = new JwtClaims();
        claims.setSubject(identity.subjectId());
        claims.setIssuedAt(NumericDate.fromSeconds(issuedAt.getEpochSecond()));
        claims.setExpirationTime(NumericDate.fromSeconds(expiresAt.getEpochSecond()));
        config.issuer().ifPresent(claims::setIssuer);
        config.audience().ifPresent(claims::setAudience);
        identity.claims().forEach(claims::setClaim);

        final var signingKey = keySupplier.signingKey();
        final var jws = new JsonWebSignature();
        jws.setAlgorithmHeaderValue(config.algorithm());
        jws.setHeader(HeaderParameterNames.TYPE, TOKEN_TYPE);
        jws.setKeyIdHeaderValue(signingKey.keyId());
        jws.setPayload(claims.toJson());
        jws.setKey(signingKey.key());

        try {
            final var token = jws.getCompactSerialization();
            LOG.debugf(
                    "Issued access token for %s (kid=%s, expires=%s)",
                    identity.subjectId(), signingKey.keyId(), expiresAt);
            return new IssuedToken(token, identity.subjectId(), issuedAt, expiresAt);
        } catch (JoseException e) {
            throw new TokenIssuanceException("Failed to sign token: " + e.getMessage(), e);
        }
    }

    /**
     * Exception thrown when token signing fails, typically a key that is too
     * short for the configured algorithm.
     */
    public static class TokenIssuanceException extends RuntimeException {
        public TokenIssuanceException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
