package com.tixgo.catalog.controller;

import com.tixgo.catalog.service.VendorProfileService;
import com.tixgo.common.dto.VendorProfileDto;
import com.tixgo.common.dto.VendorProfileRequest;
import com.tixgo.common.dto.VendorProfileUpdateRequest;
import com.tixgo.common.identity.IdentityVerifier;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/vendors")
@RequiredArgsConstructor
@Tag(name = "Vendor Controller", description = "Vendor applications and business profiles")
public class VendorController {

    private final VendorProfileService vendorProfileService;
    private final IdentityVerifier identityVerifier;

    @PostMapping
    @Operation(summary = "Submit the caller's vendor application", description = "The profile stays unverified until an admin verifies it.")
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Application stored"),
        @ApiResponse(responseCode = "400", description = "Invalid profile"),
        @ApiResponse(responseCode = "403", description = "Email is not the caller's, or the account is suspended")
    })
    public ResponseEntity<VendorProfileDto> submitProfile(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @Valid @RequestBody VendorProfileRequest request) {

        String caller = identityVerifier.verify(authorization);
        return ResponseEntity.ok(vendorProfileService.submitProfile(request, caller));
    }

    @GetMapping
    @Operation(summary = "List vendor profiles", description = "Admin only, optionally filtered by verification.")
    public ResponseEntity<List<VendorProfileDto>> getProfiles(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @Parameter(description = "Filter by verification") @RequestParam(required = false) Boolean verified) {

        String caller = identityVerifier.verify(authorization);
        return ResponseEntity.ok(vendorProfileService.listProfiles(verified, caller));
    }

    @GetMapping("/{email}")
    @Operation(summary = "A vendor's profile")
    public ResponseEntity<VendorProfileDto> getProfile(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @Parameter(description = "Vendor email") @PathVariable String email) {

        identityVerifier.verify(authorization);
        return ResponseEntity.ok(vendorProfileService.getProfile(email));
    }

    @PutMapping("/{email}")
    @Operation(summary = "Edit the caller's vendor profile", description = "Owner only. Verification is unchanged.")
    public ResponseEntity<VendorProfileDto> updateProfile(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @Parameter(description = "Vendor email") @PathVariable String email,
            @Valid @RequestBody VendorProfileUpdateRequest request) {

        String caller = identityVerifier.verify(authorization);
        return ResponseEntity.ok(vendorProfileService.updateProfile(email, request, caller));
    }
}
