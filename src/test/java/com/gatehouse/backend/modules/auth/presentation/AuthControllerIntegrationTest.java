package com.gatehouse.backend.modules.auth.presentation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.util.List;
import java.util.UUID;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gatehouse.backend.modules.user.application.NewUser;
import com.gatehouse.backend.modules.user.application.UserService;
import com.gatehouse.backend.support.AbstractPostgresIntegrationTest;

import jakarta.servlet.http.Cookie;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.ResultActions;

@SpringBootTest
@AutoConfigureMockMvc
class AuthControllerIntegrationTest extends AbstractPostgresIntegrationTest {

    private static final String PASSWORD = "S3cret!pass";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private UserService userService;

    private String email;

    @BeforeEach
    void setUp() {
        email = "user-" + UUID.randomUUID() + "@example.com";
        userService.create(new NewUser(email, null, PASSWORD, List.of("member"), true, true, true));
    }

    @Test
    void sessionLifecycle() throws Exception {
        MvcResult signIn = signIn(PASSWORD)
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.expiresIn").value(3600))
                .andExpect(header().string(HttpHeaders.SET_COOKIE, containsString("HttpOnly")))
                .andReturn();
        String accessToken = readAccessToken(signIn);

        mockMvc.perform(get("/auth/account").header(HttpHeaders.AUTHORIZATION, "Bearer " + accessToken))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.email").value(email))
                .andExpect(jsonPath("$.roles[0]").value("member"));

        mockMvc.perform(get("/auth/account").cookie(new Cookie("access_token", accessToken)))
                .andExpect(status().isOk());

        mockMvc.perform(post("/auth/sign-out").header(HttpHeaders.AUTHORIZATION, "Bearer " + accessToken))
                .andExpect(status().isNoContent());

        mockMvc.perform(get("/auth/account").header(HttpHeaders.AUTHORIZATION, "Bearer " + accessToken))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("SESSION_NOT_FOUND"));
    }

    @Test
    void newSignInReplacesPreviousSession() throws Exception {
        String first = readAccessToken(signIn(PASSWORD).andReturn());
        String second = readAccessToken(signIn(PASSWORD).andReturn());

        assertThat(second).isNotEqualTo(first);
        mockMvc.perform(get("/auth/account").header(HttpHeaders.AUTHORIZATION, "Bearer " + first))
                .andExpect(status().isUnauthorized());
        mockMvc.perform(get("/auth/account").header(HttpHeaders.AUTHORIZATION, "Bearer " + second))
                .andExpect(status().isOk());
    }

    @Test
    void wrongPasswordIsUnauthorized() throws Exception {
        signIn("wrong-password")
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("INVALID_CREDENTIALS"));
    }

    @Test
    void anonymousAccountRequestIsUnauthorized() throws Exception {
        mockMvc.perform(get("/auth/account"))
                .andExpect(status().isUnauthorized());
    }

    @Test
    void signOutWithoutSessionSucceeds() throws Exception {
        mockMvc.perform(post("/auth/sign-out"))
                .andExpect(status().isNoContent());
    }

    @Test
    void signUpCreatesAccountThatCanSignIn() throws Exception {
        String newcomer = "newcomer-" + UUID.randomUUID() + "@example.com";

        signUp(newcomer, true)
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.email").value(newcomer))
                .andExpect(jsonPath("$.roles[0]").value("member"))
                .andExpect(jsonPath("$.emailValidated").value(false))
                .andExpect(jsonPath("$.acceptedTerms").value(true));

        email = newcomer;
        signIn(PASSWORD).andExpect(status().isOk());
    }

    @Test
    void signUpWithoutPrivacyPolicyIsRejected() throws Exception {
        String newcomer = "newcomer-" + UUID.randomUUID() + "@example.com";

        signUp(newcomer, false)
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("TERMS_NOT_ACCEPTED"));

        assertThat(userService.exists(newcomer)).isFalse();
    }

    private ResultActions signIn(String password) throws Exception {
        return mockMvc.perform(post("/auth/sign-in")
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                        {
                          "email": "%s",
                          "password": "%s"
                        }
                        """.formatted(email, password)));
    }

    private ResultActions signUp(String address, boolean acceptedPrivacyPolicy) throws Exception {
        return mockMvc.perform(post("/auth/sign-up")
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                        {
                          "email": "%s",
                          "password": "%s",
                          "acceptedTerms": true,
                          "acceptedPrivacyPolicy": %s
                        }
                        """.formatted(address, PASSWORD, acceptedPrivacyPolicy)));
    }

    private String readAccessToken(MvcResult result) throws Exception {
        JsonNode body = objectMapper.readTree(result.getResponse().getContentAsString());
        return body.path("accessToken").asText();
    }
}
