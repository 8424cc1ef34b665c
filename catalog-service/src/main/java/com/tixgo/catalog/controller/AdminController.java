package com.tixgo.catalog.controller;

import com.tixgo.catalog.service.ModerationService;
import com.tixgo.catalog.service.TicketService;
import com.tixgo.catalog.service.UserAccountService;
import com.tixgo.catalog.service.VendorProfileService;
import com.tixgo.common.dto.AdminStatsDto;
import com.tixgo.common.dto.AdvertiseRequest;
import com.tixgo.common.dto.TicketDto;
import com.tixgo.common.dto.UserDto;
import com.tixgo.common.dto.VendorProfileDto;
import com.tixgo.common.dto.VendorVerificationRequest;
import com.tixgo.common.enums.UserRole;
import com.tixgo.common.enums.VerificationStatus;
import com.tixgo.common.identity.IdentityVerifier;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/admin")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Admin Controller", description = "Ticket moderation, advertisement slots, vendor verification and user administration")
public class AdminController {

    private final ModerationService moderationService;
    private final TicketService ticketService;
    private final UserAccountService userAccountService;
    private final VendorProfileService vendorProfileService;
    private final IdentityVerifier identityVerifier;

    @GetMapping("/tickets")
    @Operation(summary = "Moderation queue", description = "All tickets including hidden ones, optionally filtered by status.")
    public ResponseEntity<Page<TicketDto>> getTickets(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @Parameter(description = "Filter by verification status") @RequestParam(required = false) VerificationStatus status,
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "20") int size) {

        String caller = identityVerifier.verify(authorization);
        userAccountService.requireAdmin(caller);

        if (page < 0 || size < 1 || size > 100) {
            return ResponseEntity.badRequest().build();
        }
        return ResponseEntity.ok(ticketService.getAllTickets(status, page, size));
    }

    @PatchMapping("/tickets/{id}/approve")
    @Operation(summary = "Approve a ticket")
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Ticket approved"),
        @ApiResponse(responseCode = "403", description = "Caller is not an admin"),
        @ApiResponse(responseCode = "404", description = "Ticket not found"),
        @ApiResponse(responseCode = "409", description = "Ticket was rejected")
    })
    public ResponseEntity<TicketDto> approveTicket(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @Parameter(description = "Ticket ID") @PathVariable Long id) {

        String caller = identityVerifier.verify(authorization);
        return ResponseEntity.ok(moderationService.approveTicket(id, caller));
    }

    @PatchMapping("/tickets/{id}/reject")
    @Operation(summary = "Reject a ticket", description = "Terminal. Also removes the ticket from the advertised slots.")
    public ResponseEntity<TicketDto> rejectTicket(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @Parameter(description = "Ticket ID") @PathVariable Long id) {

        String caller = identityVerifier.verify(authorization);
        return ResponseEntity.ok(moderationService.rejectTicket(id, caller));
    }

    @PatchMapping("/tickets/{id}/advertise")
    @Operation(
        summary = "Toggle advertisement",
        description = "Only approved, visible tickets can be advertised, and only while a slot is free."
    )
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Advertised flag updated"),
        @ApiResponse(responseCode = "400", description = "Body is not {\"advertised\": boolean}"),
        @ApiResponse(responseCode = "409", description = "Ticket not approved or all slots taken"),
        @ApiResponse(responseCode = "503", description = "Slot lock unavailable")
    })
    public ResponseEntity<TicketDto> setAdvertised(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @Parameter(description = "Ticket ID") @PathVariable Long id,
            @Valid @RequestBody AdvertiseRequest request) {

        String caller = identityVerifier.verify(authorization);
        log.info("Advertise request: ticket={} advertised={} by {}", id, request.getAdvertised(), caller);
        return ResponseEntity.ok(moderationService.setAdvertised(id, request.getAdvertised(), caller));
    }

    @GetMapping("/users")
    @Operation(summary = "List users", description = "Optionally filtered by role.")
    public ResponseEntity<List<UserDto>> getUsers(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @Parameter(description = "Filter by role") @RequestParam(required = false) UserRole role) {

        String caller = identityVerifier.verify(authorization);
        return ResponseEntity.ok(userAccountService.listUsers(role, caller));
    }

    @PatchMapping("/users/{id}/mark-fraud")
    @Operation(summary = "Suspend a vendor", description = "Flags the vendor and hides all of their tickets.")
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Vendor suspended"),
        @ApiResponse(responseCode = "400", description = "User is not a vendor"),
        @ApiResponse(responseCode = "404", description = "User not found")
    })
    public ResponseEntity<UserDto> markFraud(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @Parameter(description = "User ID") @PathVariable Long id) {

        String caller = identityVerifier.verify(authorization);
        return ResponseEntity.ok(moderationService.markFraud(id, caller));
    }

    @PatchMapping("/users/{id}/make-vendor")
    @Operation(summary = "Grant vendor role", description = "Also lifts a fraud suspension.")
    public ResponseEntity<UserDto> makeVendor(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @Parameter(description = "User ID") @PathVariable Long id) {

        String caller = identityVerifier.verify(authorization);
        return ResponseEntity.ok(moderationService.makeVendor(id, caller));
    }

    @PatchMapping("/users/{id}/make-admin")
    @Operation(summary = "Grant admin role")
    public ResponseEntity<UserDto> makeAdmin(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @Parameter(description = "User ID") @PathVariable Long id) {

        String caller = identityVerifier.verify(authorization);
        return ResponseEntity.ok(moderationService.makeAdmin(id, caller));
    }

    @GetMapping("/stats")
    @Operation(summary = "Marketplace statistics", description = "User, vendor, ticket and booking counts plus revenue.")
    public ResponseEntity<AdminStatsDto> getStats(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization) {

        String caller = identityVerifier.verify(authorization);
        return ResponseEntity.ok(userAccountService.getStats(caller));
    }

    @GetMapping("/profile")
    @Operation(summary = "The calling admin's profile")
    public ResponseEntity<UserDto> getProfile(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization) {

        String caller = identityVerifier.verify(authorization);
        return ResponseEntity.ok(userAccountService.getAdminProfile(caller));
    }

    @GetMapping("/vendors/pending")
    @Operation(summary = "Vendor applications awaiting verification")
    public ResponseEntity<List<VendorProfileDto>> getPendingVendors(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization) {

        String caller = identityVerifier.verify(authorization);
        return ResponseEntity.ok(vendorProfileService.getPendingProfiles(caller));
    }

    @PatchMapping("/vendors/{email}/verify")
    @Operation(summary = "Verify or unverify a vendor profile")
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Verification updated"),
        @ApiResponse(responseCode = "400", description = "Body is not {\"verify\": boolean}"),
        @ApiResponse(responseCode = "403", description = "Caller is not an admin"),
        @ApiResponse(responseCode = "404", description = "Vendor profile not found")
    })
    public ResponseEntity<VendorProfileDto> verifyVendor(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @Parameter(description = "Vendor email") @PathVariable String email,
            @Valid @RequestBody VendorVerificationRequest request) {

        String caller = identityVerifier.verify(authorization);
        return ResponseEntity.ok(vendorProfileService.verifyVendor(email, request.getVerify(), caller));
    }
}
