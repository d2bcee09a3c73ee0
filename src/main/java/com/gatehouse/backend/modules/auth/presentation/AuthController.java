package com.gatehouse.backend.modules.auth.presentation;

import com.gatehouse.backend.global.security.AuthenticatedUser;
import com.gatehouse.backend.modules.action.application.ActionFlowService;
import com.gatehouse.backend.modules.auth.application.AuthenticationService;
import com.gatehouse.backend.modules.auth.presentation.dto.AccountResponse;
import com.gatehouse.backend.modules.auth.presentation.dto.SessionTokenResponse;
import com.gatehouse.backend.modules.auth.presentation.dto.SignInRequest;
import com.gatehouse.backend.modules.auth.presentation.dto.SignUpRequest;
import com.gatehouse.backend.modules.user.application.UserService;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/auth")
@Tag(name = "Authentication")
public class AuthController {

    private final AuthenticationService authenticationService;
    private final ActionFlowService actionFlowService;
    private final UserService userService;

    public AuthController(
            AuthenticationService authenticationService,
            ActionFlowService actionFlowService,
            UserService userService
    ) {
        this.authenticationService = authenticationService;
        this.actionFlowService = actionFlowService;
        this.userService = userService;
    }

    @Operation(
            summary = "Register with email and password",
            responses = {
                    @ApiResponse(responseCode = "201", content = @Content(schema = @Schema(implementation = AccountResponse.class))),
                    @ApiResponse(responseCode = "400", description = "Agreements not accepted or user already exists")
            }
    )
    @PostMapping("/sign-up")
    public ResponseEntity<AccountResponse> signUp(@Valid @RequestBody SignUpRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(AccountResponse.from(actionFlowService.signUp(request.toRegistration())));
    }

    @Operation(
            summary = "Sign in with email and password",
            responses = {
                    @ApiResponse(responseCode = "200", content = @Content(schema = @Schema(implementation = SessionTokenResponse.class))),
                    @ApiResponse(responseCode = "401", description = "Invalid credentials"),
                    @ApiResponse(responseCode = "409", description = "Account disabled")
            }
    )
    @PostMapping("/sign-in")
    public ResponseEntity<SessionTokenResponse> signIn(
            @Valid @RequestBody SignInRequest request,
            HttpServletResponse response
    ) {
        return ResponseEntity.ok(SessionTokenResponse.from(
                authenticationService.signIn(request.email(), request.password(), response)));
    }

    @Operation(summary = "Sign out and clear the session cookie")
    @PostMapping("/sign-out")
    public ResponseEntity<Void> signOut(HttpServletRequest request, HttpServletResponse response) {
        authenticationService.logout(request, response);
        return ResponseEntity.noContent().build();
    }

    @Operation(summary = "Current account")
    @GetMapping("/account")
    public ResponseEntity<AccountResponse> account() {
        AuthenticatedUser principal = authenticationService.getAuthenticatedUser();
        return ResponseEntity.ok(AccountResponse.from(userService.getById(principal.userId())));
    }
}
