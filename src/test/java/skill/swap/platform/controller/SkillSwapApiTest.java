package skill.swap.platform.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.transaction.annotation.Transactional;
import skill.swap.platform.dto.RegisterRequest;
import skill.swap.platform.testutil.RegisterRequestTestBuilder;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.not;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * End-to-end HTTP tests: authentication, status codes and the response envelope
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@Transactional
@DisplayName("Skill Swap API Tests")
class SkillSwapApiTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    private record Session(long userId, String token) {
        String bearer() {
            return "Bearer " + token;
        }
    }

    private Session register(RegisterRequest request) throws Exception {
        MvcResult result = mockMvc.perform(post("/api/auth/register")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isCreated())
                .andReturn();
        JsonNode data = objectMapper.readTree(result.getResponse().getContentAsString()).get("data");
        return new Session(data.get("user").get("userId").asLong(), data.get("token").asText());
    }

    private long createRequest(Session from, Session to) throws Exception {
        String body = objectMapper.writeValueAsString(Map.of(
                "recipientId", to.userId(),
                "skillOffered", "guitar",
                "skillWanted", "python"));
        MvcResult result = mockMvc.perform(post("/api/swap-requests")
                        .header(HttpHeaders.AUTHORIZATION, from.bearer())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.data.status").value("PENDING"))
                .andReturn();
        return objectMapper.readTree(result.getResponse().getContentAsString())
                .get("data").get("requestId").asLong();
    }

    @Test
    @DisplayName("Register, login and read own profile")
    void testRegisterLoginProfile() throws Exception {
        register(RegisterRequestTestBuilder.user("Alice").email("alice@example.com").build());

        MvcResult login = mockMvc.perform(post("/api/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"email\":\"ALICE@example.com\",\"password\":\"secret123\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.tokenType").value("Bearer"))
                .andExpect(jsonPath("$.data.user.email").value("alice@example.com"))
                .andReturn();
        String token = objectMapper.readTree(login.getResponse().getContentAsString())
                .get("data").get("token").asText();

        mockMvc.perform(get("/api/auth/profile").header(HttpHeaders.AUTHORIZATION, "Bearer " + token))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.name").value("Alice"))
                .andExpect(jsonPath("$.data.passwordHash").doesNotExist());
    }

    @Test
    @DisplayName("Duplicate registration is a conflict")
    void testDuplicateRegistration() throws Exception {
        register(RegisterRequestTestBuilder.user("Alice").email("alice@example.com").build());

        mockMvc.perform(post("/api/auth/register")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(
                                RegisterRequestTestBuilder.user("Alice").email("Alice@Example.com").build())))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.kind").value("DUPLICATE_EMAIL"));
    }

    @Test
    @DisplayName("Invalid registration lists the offending fields")
    void testRegistrationValidation() throws Exception {
        RegisterRequest invalid = RegisterRequestTestBuilder.user("Alice")
                .email("not-an-email")
                .password("123")
                .offers()
                .build();

        mockMvc.perform(post("/api/auth/register")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(invalid)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.kind").value("VALIDATION_ERROR"))
                .andExpect(jsonPath("$.data.email").exists())
                .andExpect(jsonPath("$.data.password").exists())
                .andExpect(jsonPath("$.data.skillsOffered").exists());
    }

    @Test
    @DisplayName("Email longer than the stored column is a validation error, not a server error")
    void testOverlongEmail() throws Exception {
        // Syntactically valid address of 130 characters
        String email = "a".repeat(50) + "@" + "b".repeat(30) + "." + "c".repeat(30) + "." + "d".repeat(13) + ".com";
        assertThat(email).hasSize(130);

        mockMvc.perform(post("/api/auth/register")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(
                                RegisterRequestTestBuilder.user("Alice").email(email).build())))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.kind").value("VALIDATION_ERROR"))
                .andExpect(jsonPath("$.data.email").exists());
    }

    @Test
    @DisplayName("Overlong email on profile update is a validation error")
    void testOverlongEmailOnUpdate() throws Exception {
        Session alice = register(RegisterRequestTestBuilder.user("Alice").build());
        String email = "a".repeat(64) + "@" + "b".repeat(60) + ".com";

        mockMvc.perform(put("/api/auth/profile")
                        .header(HttpHeaders.AUTHORIZATION, alice.bearer())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of("email", email))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.kind").value("VALIDATION_ERROR"));
    }

    @Test
    @DisplayName("Body sent as text/plain is rejected as unsupported media type")
    void testWrongContentType() throws Exception {
        mockMvc.perform(post("/api/auth/register")
                        .contentType(MediaType.TEXT_PLAIN)
                        .content("name=Alice"))
                .andExpect(status().isUnsupportedMediaType())
                .andExpect(jsonPath("$.kind").value("UNSUPPORTED_MEDIA_TYPE"));
    }

    @Test
    @DisplayName("Unsupported HTTP method carries an error kind")
    void testMethodNotAllowed() throws Exception {
        mockMvc.perform(delete("/api/users"))
                .andExpect(status().isMethodNotAllowed())
                .andExpect(jsonPath("$.kind").value("METHOD_NOT_ALLOWED"));
    }

    @Test
    @DisplayName("Wrong password is unauthorized")
    void testBadLogin() throws Exception {
        register(RegisterRequestTestBuilder.user("Alice").email("alice@example.com").build());

        mockMvc.perform(post("/api/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"email\":\"alice@example.com\",\"password\":\"wrong-password\"}"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.kind").value("INVALID_CREDENTIALS"));
    }

    @Test
    @DisplayName("Protected endpoints require a valid bearer token")
    void testAuthenticationRequired() throws Exception {
        mockMvc.perform(get("/api/users"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.kind").value("INVALID_CREDENTIALS"));

        mockMvc.perform(get("/api/swap-requests/my-requests")
                        .header(HttpHeaders.AUTHORIZATION, "Bearer not-a-real-token"))
                .andExpect(status().isUnauthorized());
    }

    @Test
    @DisplayName("Private profile is hidden from other users")
    void testPrivateProfile() throws Exception {
        Session alice = register(RegisterRequestTestBuilder.user("Alice").build());
        Session bob = register(RegisterRequestTestBuilder.user("Bob").build());

        mockMvc.perform(put("/api/auth/profile")
                        .header(HttpHeaders.AUTHORIZATION, alice.bearer())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"isPublic\":false}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.isPublic").value(false));

        mockMvc.perform(get("/api/users/{id}", alice.userId()).header(HttpHeaders.AUTHORIZATION, bob.bearer()))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.kind").value("FORBIDDEN"));

        mockMvc.perform(get("/api/users").header(HttpHeaders.AUTHORIZATION, bob.bearer()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data[*].userId").value(not(hasItem((int) alice.userId()))))
                .andExpect(jsonPath("$.data[*].userId").value(hasItem((int) bob.userId())));

        mockMvc.perform(get("/api/users/{id}", alice.userId()).header(HttpHeaders.AUTHORIZATION, alice.bearer()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.email").exists());
    }

    @Test
    @DisplayName("Other users' profiles do not expose email")
    void testEmailHiddenFromOthers() throws Exception {
        Session alice = register(RegisterRequestTestBuilder.user("Alice").build());
        Session bob = register(RegisterRequestTestBuilder.user("Bob").build());

        mockMvc.perform(get("/api/users/{id}", alice.userId()).header(HttpHeaders.AUTHORIZATION, bob.bearer()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.name").value("Alice"))
                .andExpect(jsonPath("$.data.email").doesNotExist());
    }

    @Test
    @DisplayName("Swap lifecycle over HTTP: accept, then cancel is a conflict")
    void testSwapLifecycle() throws Exception {
        Session alice = register(RegisterRequestTestBuilder.user("Alice").offers("guitar").wants("python").build());
        Session bob = register(RegisterRequestTestBuilder.user("Bob").offers("python").wants("guitar").build());
        long requestId = createRequest(alice, bob);

        mockMvc.perform(get("/api/swap-requests/received").header(HttpHeaders.AUTHORIZATION, bob.bearer()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data[0].requestId").value(requestId))
                .andExpect(jsonPath("$.data[0].requesterName").value("Alice"));

        mockMvc.perform(put("/api/swap-requests/{id}", requestId)
                        .header(HttpHeaders.AUTHORIZATION, bob.bearer())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"status\":\"accepted\",\"responseMessage\":\"Deal\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.status").value("ACCEPTED"))
                .andExpect(jsonPath("$.data.responseMessage").value("Deal"));

        mockMvc.perform(put("/api/swap-requests/{id}", requestId)
                        .header(HttpHeaders.AUTHORIZATION, alice.bearer())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"status\":\"CANCELLED\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.kind").value("INVALID_TRANSITION"));

        mockMvc.perform(get("/api/swap-requests/my-requests")
                        .param("status", "accepted")
                        .header(HttpHeaders.AUTHORIZATION, alice.bearer()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data[0].status").value("ACCEPTED"));
    }

    @Test
    @DisplayName("Third party is forbidden from viewing or deciding a request")
    void testThirdPartyForbidden() throws Exception {
        Session alice = register(RegisterRequestTestBuilder.user("Alice").build());
        Session bob = register(RegisterRequestTestBuilder.user("Bob").build());
        Session carol = register(RegisterRequestTestBuilder.user("Carol").build());
        long requestId = createRequest(alice, bob);

        mockMvc.perform(get("/api/swap-requests/{id}", requestId).header(HttpHeaders.AUTHORIZATION, carol.bearer()))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.kind").value("FORBIDDEN"));

        mockMvc.perform(put("/api/swap-requests/{id}", requestId)
                        .header(HttpHeaders.AUTHORIZATION, carol.bearer())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"status\":\"ACCEPTED\"}"))
                .andExpect(status().isForbidden());

        mockMvc.perform(delete("/api/swap-requests/{id}", requestId).header(HttpHeaders.AUTHORIZATION, carol.bearer()))
                .andExpect(status().isForbidden());
    }

    @Test
    @DisplayName("Malformed status values are validation errors")
    void testBadStatusValues() throws Exception {
        Session alice = register(RegisterRequestTestBuilder.user("Alice").build());
        Session bob = register(RegisterRequestTestBuilder.user("Bob").build());
        long requestId = createRequest(alice, bob);

        mockMvc.perform(put("/api/swap-requests/{id}", requestId)
                        .header(HttpHeaders.AUTHORIZATION, bob.bearer())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"status\":\"MAYBE\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.kind").value("VALIDATION_ERROR"));

        mockMvc.perform(put("/api/swap-requests/{id}", requestId)
                        .header(HttpHeaders.AUTHORIZATION, bob.bearer())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"status\":\"PENDING\"}"))
                .andExpect(status().isBadRequest());

        mockMvc.perform(get("/api/swap-requests/received")
                        .param("status", "MAYBE")
                        .header(HttpHeaders.AUTHORIZATION, bob.bearer()))
                .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("Requester deletes a pending request; it is then gone")
    void testDeleteRequest() throws Exception {
        Session alice = register(RegisterRequestTestBuilder.user("Alice").build());
        Session bob = register(RegisterRequestTestBuilder.user("Bob").build());
        long requestId = createRequest(alice, bob);

        mockMvc.perform(delete("/api/swap-requests/{id}", requestId).header(HttpHeaders.AUTHORIZATION, alice.bearer()))
                .andExpect(status().isOk());

        mockMvc.perform(get("/api/swap-requests/{id}", requestId).header(HttpHeaders.AUTHORIZATION, alice.bearer()))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.kind").value("NOT_FOUND"));
    }

    @Test
    @DisplayName("Skill catalogue and logout")
    void testSkillsAndLogout() throws Exception {
        Session alice = register(RegisterRequestTestBuilder.user("Alice").offers("guitar").wants("python").build());

        mockMvc.perform(get("/api/users/skills").header(HttpHeaders.AUTHORIZATION, alice.bearer()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data").value(hasItem("guitar")));

        MvcResult logout = mockMvc.perform(post("/api/auth/logout").header(HttpHeaders.AUTHORIZATION, alice.bearer()))
                .andExpect(status().isOk())
                .andReturn();
        assertThat(logout.getResponse().getContentAsString()).contains("Logout successful");
    }
}
