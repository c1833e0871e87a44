package skill.swap.platform.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import skill.swap.platform.domain.User;
import skill.swap.platform.dto.ApiResponse;
import skill.swap.platform.dto.AuthResponse;
import skill.swap.platform.dto.ChangePasswordRequest;
import skill.swap.platform.dto.LoginRequest;
import skill.swap.platform.dto.RegisterRequest;
import skill.swap.platform.dto.UpdateProfileRequest;
import skill.swap.platform.dto.UserResponse;
import skill.swap.platform.security.Actor;
import skill.swap.platform.security.CurrentActor;
import skill.swap.platform.security.JwtTokenService;
import skill.swap.platform.service.UserService;

/**
 * REST Controller for registration, login and the caller's own account
 */
@Slf4j
@RestController
@RequestMapping("/api/auth")
@Validated
@Tag(name = "Authentication", description = "Registration, login and own profile")
public class AuthController {

    @Autowired
    private UserService userService;

    @Autowired
    private JwtTokenService jwtTokenService;

    /**
     * Register a new user and log them in
     *
     * @param request the registration request
     * @return API response with the new profile and a bearer token
     */
    @PostMapping("/register")
    @ResponseStatus(HttpStatus.CREATED)
    @Operation(summary = "Register", description = "Create an account and receive a bearer token")
    public ApiResponse<AuthResponse> register(@Valid @RequestBody RegisterRequest request) {
        log.info("Registering user");
        User user = userService.register(request);
        return ApiResponse.created("User registered successfully", toAuthResponse(user));
    }

    /**
     * Log in with email and password
     */
    @PostMapping("/login")
    @Operation(summary = "Login", description = "Exchange email and password for a bearer token")
    public ApiResponse<AuthResponse> login(@Valid @RequestBody LoginRequest request) {
        User user = userService.authenticate(request);
        return ApiResponse.success("Login successful", toAuthResponse(user));
    }

    /**
     * Tokens are stateless; the client discards its copy
     */
    @PostMapping("/logout")
    @Operation(summary = "Logout", description = "Acknowledge logout; the client discards the token")
    public ApiResponse<Void> logout(@Parameter(hidden = true) @CurrentActor Actor actor) {
        log.info("User logged out: userId={}", actor.userId());
        return ApiResponse.success("Logout successful", null);
    }

    @GetMapping("/profile")
    @Operation(summary = "Get own profile", description = "Retrieve the caller's profile including email")
    public ApiResponse<UserResponse> getProfile(@Parameter(hidden = true) @CurrentActor Actor actor) {
        log.debug("Getting profile: userId={}", actor.userId());
        return ApiResponse.success(UserResponse.fromUser(userService.getProfile(actor), true));
    }

    @PutMapping("/profile")
    @Operation(summary = "Update own profile", description = "Partial update; omitted fields are unchanged")
    public ApiResponse<UserResponse> updateProfile(@Parameter(hidden = true) @CurrentActor Actor actor,
                                                   @Valid @RequestBody UpdateProfileRequest request) {
        User user = userService.updateProfile(actor, request);
        return ApiResponse.success("Profile updated successfully", UserResponse.fromUser(user, true));
    }

    @PutMapping("/change-password")
    @Operation(summary = "Change password", description = "Requires the current password")
    public ApiResponse<Void> changePassword(@Parameter(hidden = true) @CurrentActor Actor actor,
                                            @Valid @RequestBody ChangePasswordRequest request) {
        userService.changePassword(actor, request);
        return ApiResponse.success("Password changed successfully", null);
    }

    private AuthResponse toAuthResponse(User user) {
        JwtTokenService.IssuedToken issued = jwtTokenService.issue(user.getUserId());
        return AuthResponse.builder()
                .user(UserResponse.fromUser(user, true))
                .token(issued.token())
                .expiresAt(issued.expiresAt())
                .build();
    }
}
