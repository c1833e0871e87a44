package skill.swap.platform.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import skill.swap.platform.domain.User;
import skill.swap.platform.dto.ChangePasswordRequest;
import skill.swap.platform.dto.LoginRequest;
import skill.swap.platform.dto.RegisterRequest;
import skill.swap.platform.dto.UpdateProfileRequest;
import skill.swap.platform.exception.DuplicateEmailException;
import skill.swap.platform.exception.InvalidCredentialsException;
import skill.swap.platform.exception.UserNotFoundException;
import skill.swap.platform.exception.ValidationException;
import skill.swap.platform.mapper.UserMapper;
import skill.swap.platform.policy.AccessPolicy;
import skill.swap.platform.security.Actor;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * User management service: registration, credentials, profiles and browsing
 */
@Slf4j
@Service
public class UserService {

    static final String DEFAULT_AVAILABILITY = "Weekdays";

    @Autowired
    private UserMapper userMapper;

    @Autowired
    private PasswordEncoder passwordEncoder;

    @Autowired
    private SkillSwapMetrics metrics;

    @Autowired
    private Clock clock;

    /**
     * Create a new public user
     *
     * @throws DuplicateEmailException if the email is already registered
     * @throws ValidationException if required fields are blank after trimming
     */
    @Transactional
    public User register(RegisterRequest request) {
        String email = normalizeEmail(request.getEmail());
        String name = requireText(request.getName(), "Name is required");

        List<String> skillsOffered = normalizeSkills(request.getSkillsOffered());
        if (skillsOffered.isEmpty()) {
            throw new ValidationException("At least one skill offered is required");
        }
        List<String> skillsWanted = normalizeSkills(request.getSkillsWanted());
        if (skillsWanted.isEmpty()) {
            throw new ValidationException("At least one skill wanted is required");
        }

        if (userMapper.findByEmail(email) != null) {
            throw new DuplicateEmailException("User already exists with this email");
        }

        LocalDateTime now = LocalDateTime.now(clock);
        String availability = trimToNull(request.getAvailability());
        User user = User.builder()
                .name(name)
                .email(email)
                .passwordHash(passwordEncoder.encode(request.getPassword()))
                .location(trimToNull(request.getLocation()))
                .availability(availability == null ? DEFAULT_AVAILABILITY : availability)
                .profilePhoto(trimToNull(request.getProfilePhoto()))
                .skillsOffered(skillsOffered)
                .skillsWanted(skillsWanted)
                .isPublic(Boolean.TRUE)
                .createdAt(now)
                .updatedAt(now)
                .build();

        try {
            userMapper.insert(user);
        } catch (DuplicateKeyException e) {
            // Lost a race with a concurrent registration of the same email
            throw new DuplicateEmailException("User already exists with this email");
        }

        metrics.recordRegistration();
        log.info("User registered: userId={}", user.getUserId());
        return user;
    }

    /**
     * Check email and password
     *
     * @throws InvalidCredentialsException on unknown email or wrong password
     */
    public User authenticate(LoginRequest request) {
        User user = userMapper.findByEmail(normalizeEmail(request.getEmail()));
        if (user == null || !passwordEncoder.matches(request.getPassword(), user.getPasswordHash())) {
            metrics.recordLogin(false);
            log.warn("Login failed");
            throw new InvalidCredentialsException("Invalid email or password");
        }

        metrics.recordLogin(true);
        log.info("User logged in: userId={}", user.getUserId());
        return user;
    }

    /**
     * Get user by ID
     *
     * @throws UserNotFoundException if no such user
     */
    public User getUserById(Long userId) {
        User user = userMapper.findById(userId);
        if (user == null) {
            throw new UserNotFoundException("User not found: " + userId);
        }
        return user;
    }

    /**
     * The actor's own profile
     */
    public User getProfile(Actor actor) {
        return getUserById(actor.userId());
    }

    /**
     * Another user's profile, subject to its visibility
     */
    public User getVisibleUser(Actor actor, Long userId) {
        log.debug("Getting user: userId={}, viewer={}", userId, actor.userId());
        User user = getUserById(userId);
        AccessPolicy.checkCanViewUser(actor, user);
        return user;
    }

    /**
     * Apply the supplied (non-null) fields to the actor's profile.
     * With no fields supplied nothing is written and the stored record is returned as is.
     */
    @Transactional
    public User updateProfile(Actor actor, UpdateProfileRequest request) {
        User user = getUserById(actor.userId());
        AccessPolicy.checkCanMutateUser(actor, user);

        if (request.isEmpty()) {
            log.debug("Empty profile update ignored: userId={}", user.getUserId());
            return user;
        }

        if (request.getName() != null) {
            user.setName(requireText(request.getName(), "Name cannot be empty"));
        }
        if (request.getEmail() != null) {
            String email = normalizeEmail(request.getEmail());
            if (!email.equals(user.getEmail())) {
                User existing = userMapper.findByEmail(email);
                if (existing != null && !existing.getUserId().equals(user.getUserId())) {
                    throw new DuplicateEmailException("Email is already taken");
                }
                user.setEmail(email);
            }
        }
        if (request.getLocation() != null) {
            user.setLocation(trimToNull(request.getLocation()));
        }
        if (request.getAvailability() != null) {
            user.setAvailability(trimToNull(request.getAvailability()));
        }
        if (request.getProfilePhoto() != null) {
            user.setProfilePhoto(trimToNull(request.getProfilePhoto()));
        }
        if (request.getSkillsOffered() != null) {
            user.setSkillsOffered(normalizeSkills(request.getSkillsOffered()));
        }
        if (request.getSkillsWanted() != null) {
            user.setSkillsWanted(normalizeSkills(request.getSkillsWanted()));
        }
        if (request.getIsPublic() != null) {
            user.setIsPublic(request.getIsPublic());
        }

        user.setUpdatedAt(LocalDateTime.now(clock));
        try {
            userMapper.updateProfile(user);
        } catch (DuplicateKeyException e) {
            throw new DuplicateEmailException("Email is already taken");
        }

        log.info("Profile updated: userId={}, isPublic={}", user.getUserId(), user.getIsPublic());
        return user;
    }

    /**
     * Replace the actor's password after verifying the current one
     *
     * @throws InvalidCredentialsException if the current password does not match
     */
    @Transactional
    public void changePassword(Actor actor, ChangePasswordRequest request) {
        User user = getUserById(actor.userId());
        AccessPolicy.checkCanMutateUser(actor, user);

        if (!passwordEncoder.matches(request.getCurrentPassword(), user.getPasswordHash())) {
            log.warn("Password change refused, current password mismatch: userId={}", user.getUserId());
            throw new InvalidCredentialsException("Current password is incorrect");
        }

        userMapper.updatePassword(user.getUserId(), passwordEncoder.encode(request.getNewPassword()),
                LocalDateTime.now(clock));
        log.info("Password changed: userId={}", user.getUserId());
    }

    /**
     * Profiles the actor may see: every public profile plus their own
     *
     * @param skill optional case-insensitive exact match against offered or wanted skills
     * @param search optional case-insensitive name fragment
     */
    @Transactional(readOnly = true)
    public List<User> listVisibleUsers(Actor actor, String skill, String search) {
        String skillFilter = trimToNull(skill);
        List<User> users = userMapper.findViewable(actor.userId(), escapeLike(trimToNull(search))).stream()
                .filter(user -> AccessPolicy.canViewUser(actor, user))
                .filter(user -> skillFilter == null || hasSkill(user, skillFilter))
                .collect(Collectors.toList());
        log.debug("Listed users: viewer={}, count={}", actor.userId(), users.size());
        return users;
    }

    /**
     * Sorted union of all skills offered or wanted on public profiles
     */
    @Transactional(readOnly = true)
    public List<String> listPublicSkills() {
        Set<String> skills = new TreeSet<>();
        for (User user : userMapper.findPublic()) {
            skills.addAll(user.getSkillsOffered());
            skills.addAll(user.getSkillsWanted());
        }
        return new ArrayList<>(skills);
    }

    private static boolean hasSkill(User user, String skill) {
        return user.getSkillsOffered().stream().anyMatch(skill::equalsIgnoreCase)
                || user.getSkillsWanted().stream().anyMatch(skill::equalsIgnoreCase);
    }

    /**
     * Match '%' and '_' literally in a LIKE pattern escaped with '!'
     */
    static String escapeLike(String value) {
        if (value == null) {
            return null;
        }
        return value.replace("!", "!!").replace("%", "!%").replace("_", "!_");
    }

    static String normalizeEmail(String email) {
        if (email == null || email.isBlank()) {
            throw new ValidationException("Email is required");
        }
        return email.trim().toLowerCase(Locale.ROOT);
    }

    /**
     * Trim entries, drop blanks and duplicates, keep first-seen order
     */
    static List<String> normalizeSkills(List<String> skills) {
        if (skills == null) {
            return new ArrayList<>();
        }
        Set<String> unique = new LinkedHashSet<>();
        for (String skill : skills) {
            String trimmed = trimToNull(skill);
            if (trimmed != null) {
                unique.add(trimmed);
            }
        }
        return new ArrayList<>(unique);
    }

    private static String requireText(String value, String message) {
        String trimmed = trimToNull(value);
        if (trimmed == null) {
            throw new ValidationException(message);
        }
        return trimmed;
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
