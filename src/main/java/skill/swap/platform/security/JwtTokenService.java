package skill.swap.platform.security;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import skill.swap.platform.config.SkillSwapProperties;
import skill.swap.platform.exception.InvalidCredentialsException;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.Date;

/**
 * Issues and verifies HS256 bearer tokens whose subject is the user ID
 */
@Slf4j
@Service
public class JwtTokenService {

    @Autowired
    private SkillSwapProperties properties;

    @Autowired
    private Clock clock;

    private SkillSwapProperties.Jwt settings;
    private SecretKey signingKey;

    /**
     * Derive the signing key once the settings are bound
     */
    @PostConstruct
    public void initSigningKey() {
        settings = properties.jwt();
        signingKey = Keys.hmacShaKeyFor(settings.secret().getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Issued token plus its expiry
     */
    public record IssuedToken(String token, Instant expiresAt) {
    }

    public IssuedToken issue(Long userId) {
        Instant now = clock.instant();
        Instant expiresAt = now.plus(settings.expiration());
        String token = Jwts.builder()
                .issuer(settings.issuer())
                .subject(String.valueOf(userId))
                .issuedAt(Date.from(now))
                .expiration(Date.from(expiresAt))
                .signWith(signingKey)
                .compact();
        log.debug("Token issued: userId={}, expiresAt={}", userId, expiresAt);
        return new IssuedToken(token, expiresAt);
    }

    /**
     * Verify signature, issuer and expiry and return the identity the token carries
     *
     * @throws InvalidCredentialsException if the token is malformed, forged or expired
     */
    public Actor verify(String token) {
        try {
            Claims claims = Jwts.parser()
                    .verifyWith(signingKey)
                    .requireIssuer(settings.issuer())
                    .clock(() -> Date.from(clock.instant()))
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();
            return new Actor(Long.valueOf(claims.getSubject()));
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("Token rejected: {}", e.getMessage());
            throw new InvalidCredentialsException("Invalid or expired token");
        }
    }
}
