package skill.swap.platform.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import skill.swap.platform.enums.SwapRequestStatus;

import java.util.EnumMap;
import java.util.Map;

/**
 * Business counters for registrations, logins and swap request lifecycle
 */
@Component
public class SkillSwapMetrics {

    @Autowired
    private MeterRegistry meterRegistry;

    private Counter registrationsCounter;
    private Counter loginSuccessCounter;
    private Counter loginFailureCounter;
    private final Map<SwapRequestStatus, Counter> swapRequestCounters = new EnumMap<>(SwapRequestStatus.class);

    /**
     * Initialize metrics on application startup
     */
    @PostConstruct
    public void initMetrics() {
        registrationsCounter = Counter.builder("skillswap.users.registered")
                .description("Number of user registrations")
                .register(meterRegistry);

        loginSuccessCounter = Counter.builder("skillswap.auth.logins")
                .description("Number of login attempts")
                .tag("outcome", "success")
                .register(meterRegistry);

        loginFailureCounter = Counter.builder("skillswap.auth.logins")
                .description("Number of login attempts")
                .tag("outcome", "failure")
                .register(meterRegistry);

        // PENDING counts creations, the others count transitions into that state
        for (SwapRequestStatus status : SwapRequestStatus.values()) {
            swapRequestCounters.put(status, Counter.builder("skillswap.swap_requests")
                    .description("Swap requests entering each status")
                    .tag("status", status.name())
                    .register(meterRegistry));
        }
    }

    public void recordRegistration() {
        registrationsCounter.increment();
    }

    public void recordLogin(boolean success) {
        (success ? loginSuccessCounter : loginFailureCounter).increment();
    }

    public void recordSwapRequest(SwapRequestStatus status) {
        swapRequestCounters.get(status).increment();
    }
}
