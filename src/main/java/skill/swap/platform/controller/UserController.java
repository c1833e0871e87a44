package skill.swap.platform.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.NotNull;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import skill.swap.platform.domain.User;
import skill.swap.platform.dto.ApiResponse;
import skill.swap.platform.dto.UserResponse;
import skill.swap.platform.security.Actor;
import skill.swap.platform.security.CurrentActor;
import skill.swap.platform.service.UserService;

import java.util.List;
import java.util.stream.Collectors;

/**
 * REST Controller for browsing user profiles
 */
@Slf4j
@RestController
@RequestMapping("/api/users")
@Validated
@Tag(name = "Users", description = "Browse skill profiles")
public class UserController {

    @Autowired
    private UserService userService;

    /**
     * List profiles visible to the caller
     *
     * @param skill optional skill filter
     * @param search optional name filter
     * @return API response with visible profiles
     */
    @GetMapping
    @Operation(summary = "List users", description = "Public profiles plus the caller's own")
    public ApiResponse<List<UserResponse>> listUsers(
            @Parameter(hidden = true) @CurrentActor Actor actor,
            @Parameter(description = "Skill offered or wanted (case-insensitive)")
            @RequestParam(name = "skill", required = false) String skill,
            @Parameter(description = "Name fragment (case-insensitive)")
            @RequestParam(name = "search", required = false) String search) {
        List<UserResponse> users = userService.listVisibleUsers(actor, skill, search).stream()
                .map(user -> UserResponse.fromUser(user, user.isOwnedBy(actor.userId())))
                .collect(Collectors.toList());
        return ApiResponse.success(users);
    }

    @GetMapping("/skills")
    @Operation(summary = "List skills", description = "Distinct skills across public profiles")
    public ApiResponse<List<String>> listSkills() {
        return ApiResponse.success(userService.listPublicSkills());
    }

    /**
     * Get user by ID
     */
    @GetMapping("/{userId}")
    @Operation(summary = "Get user by ID", description = "Public profiles, or the caller's own")
    public ApiResponse<UserResponse> getUser(
            @Parameter(hidden = true) @CurrentActor Actor actor,
            @Parameter(description = "User ID", required = true)
            @PathVariable("userId") @NotNull Long userId) {
        User user = userService.getVisibleUser(actor, userId);
        return ApiResponse.success(UserResponse.fromUser(user, user.isOwnedBy(actor.userId())));
    }
}
