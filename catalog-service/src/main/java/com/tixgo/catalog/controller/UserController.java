package com.tixgo.catalog.controller;

import com.tixgo.catalog.service.UserAccountService;
import com.tixgo.common.dto.UserDto;
import com.tixgo.common.dto.UserRegistrationRequest;
import com.tixgo.common.identity.CallerRole;
import com.tixgo.common.identity.IdentityVerifier;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/users")
@RequiredArgsConstructor
@Tag(name = "User Controller", description = "Profiles and roles")
public class UserController {

    private final UserAccountService userAccountService;
    private final IdentityVerifier identityVerifier;

    @PostMapping
    @Operation(summary = "Register or refresh the caller's profile", description = "New accounts start with the USER role.")
    public ResponseEntity<UserDto> register(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @Valid @RequestBody UserRegistrationRequest request) {

        String caller = identityVerifier.verify(authorization);
        return ResponseEntity.ok(userAccountService.register(request, caller));
    }

    @GetMapping("/role")
    @Operation(summary = "The caller's role and suspension flag")
    public ResponseEntity<CallerRole> getRole(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization) {

        String caller = identityVerifier.verify(authorization);
        return ResponseEntity.ok(userAccountService.lookup(caller));
    }

    @GetMapping("/me")
    @Operation(summary = "The caller's profile")
    public ResponseEntity<UserDto> getProfile(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization) {

        String caller = identityVerifier.verify(authorization);
        return ResponseEntity.ok(userAccountService.getProfile(caller));
    }

    @GetMapping("/{email}")
    @Operation(summary = "A user's profile", description = "Readable by the user and by admins.")
    public ResponseEntity<UserDto> getUser(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @PathVariable String email) {

        String caller = identityVerifier.verify(authorization);
        return ResponseEntity.ok(userAccountService.getUser(email, caller));
    }
}
