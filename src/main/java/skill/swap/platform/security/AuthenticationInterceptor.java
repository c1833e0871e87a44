package skill.swap.platform.security;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.servlet.HandlerInterceptor;
import skill.swap.platform.exception.InvalidCredentialsException;

/**
 * Bearer token check for protected API paths.
 * On success the verified {@link Actor} is stored as a request attribute.
 */
@Slf4j
@Component
public class AuthenticationInterceptor implements HandlerInterceptor {

    public static final String ACTOR_ATTRIBUTE = AuthenticationInterceptor.class.getName() + ".actor";

    private static final String BEARER_PREFIX = "Bearer ";

    @Autowired
    private JwtTokenService jwtTokenService;

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        // CORS preflight carries no credentials
        if (RequestMethod.OPTIONS.name().equals(request.getMethod())) {
            return true;
        }

        String header = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (header == null || !header.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
            log.debug("Missing bearer token for: {} {}", request.getMethod(), request.getRequestURI());
            throw new InvalidCredentialsException("Authentication required");
        }

        String token = header.substring(BEARER_PREFIX.length()).trim();
        if (token.isEmpty()) {
            throw new InvalidCredentialsException("Authentication required");
        }

        Actor actor = jwtTokenService.verify(token);
        request.setAttribute(ACTOR_ATTRIBUTE, actor);
        log.debug("Authenticated request: userId={}, URI={}", actor.userId(), request.getRequestURI());
        return true;
    }
}
