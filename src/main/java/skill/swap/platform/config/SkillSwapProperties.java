package skill.swap.platform.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * Application settings, bound once at startup and immutable afterwards.
 *
 * @param jwt          token signing settings
 * @param cors         browser origin allowed to call the API
 * @param swapRequests swap request policies
 */
@ConfigurationProperties(prefix = "skillswap")
public record SkillSwapProperties(Jwt jwt, Cors cors, SwapRequests swapRequests) {

    public SkillSwapProperties {
        jwt = jwt == null ? new Jwt(null, null, null) : jwt;
        cors = cors == null ? new Cors(null) : cors;
        swapRequests = swapRequests == null ? new SwapRequests(false) : swapRequests;
    }

    /**
     * @param secret     HMAC-SHA256 key material, at least 32 bytes
     * @param expiration token lifetime
     * @param issuer     value of the {@code iss} claim
     */
    public record Jwt(String secret, Duration expiration, String issuer) {

        static final int MIN_SECRET_BYTES = 32;

        public Jwt {
            if (secret == null || secret.getBytes(StandardCharsets.UTF_8).length < MIN_SECRET_BYTES) {
                throw new IllegalArgumentException(
                        "skillswap.jwt.secret must be at least " + MIN_SECRET_BYTES + " bytes");
            }
            expiration = expiration == null ? Duration.ofHours(24) : expiration;
            issuer = issuer == null || issuer.isBlank() ? "skill-swap-platform" : issuer;
        }
    }

    /**
     * @param allowedOrigin frontend origin, e.g. {@code http://localhost:3000}
     */
    public record Cors(String allowedOrigin) {

        public Cors {
            allowedOrigin = allowedOrigin == null || allowedOrigin.isBlank()
                    ? "http://localhost:3000" : allowedOrigin;
        }
    }

    /**
     * @param allowDuplicatePending when false, a second pending request with the same
     *                              requester, recipient and skill pair is refused
     */
    public record SwapRequests(boolean allowDuplicatePending) {
    }
}
