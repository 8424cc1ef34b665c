package com.tixgo.catalog.controller;

import com.tixgo.catalog.service.TicketService;
import com.tixgo.common.dto.TicketDto;
import com.tixgo.common.dto.TicketRequest;
import com.tixgo.common.dto.TicketUpdateRequest;
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
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/tickets")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Ticket Controller", description = "Ticket discovery and vendor listings")
public class TicketController {

    private final TicketService ticketService;
    private final IdentityVerifier identityVerifier;

    @GetMapping
    @Operation(
        summary = "Browse tickets",
        description = "Approved tickets that are not hidden, newest first. Optionally filtered by vendor or advertised flag."
    )
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Tickets found"),
        @ApiResponse(responseCode = "400", description = "Invalid paging parameters")
    })
    public ResponseEntity<Page<TicketDto>> getTickets(
            @Parameter(description = "Filter by vendor email")
            @RequestParam(required = false) String vendorEmail,

            @Parameter(description = "Filter by advertised flag")
            @RequestParam(required = false) Boolean advertised,

            @Parameter(description = "Page number (0-based)")
            @RequestParam(defaultValue = "0") int page,

            @Parameter(description = "Page size")
            @RequestParam(defaultValue = "20") int size) {

        if (page < 0 || size < 1 || size > 100) {
            return ResponseEntity.badRequest().build();
        }

        Page<TicketDto> tickets = ticketService.getPublicTickets(vendorEmail, advertised, page, size);
        log.debug("Returning {} tickets (page {} of {})",
                 tickets.getNumberOfElements(), tickets.getNumber(), tickets.getTotalPages());

        return ResponseEntity.ok(tickets);
    }

    @GetMapping("/advertised")
    @Operation(summary = "Homepage advertisements", description = "Approved, advertised and visible tickets.")
    public ResponseEntity<List<TicketDto>> getAdvertisedTickets(
            @Parameter(description = "Maximum number of tickets")
            @RequestParam(defaultValue = "6") int limit) {

        if (limit < 1 || limit > 100) {
            return ResponseEntity.badRequest().build();
        }
        return ResponseEntity.ok(ticketService.getAdvertisedTickets(limit));
    }

    @GetMapping("/vendor/{email}")
    @Operation(summary = "List a vendor's own tickets", description = "Only the vendor themselves may list them.")
    public ResponseEntity<List<TicketDto>> getVendorTickets(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @Parameter(description = "Vendor email") @PathVariable String email) {

        String caller = identityVerifier.verify(authorization);
        return ResponseEntity.ok(ticketService.getVendorTickets(email, caller));
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get ticket details")
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Ticket found"),
        @ApiResponse(responseCode = "404", description = "Ticket not found or hidden")
    })
    public ResponseEntity<TicketDto> getTicket(@Parameter(description = "Ticket ID") @PathVariable Long id) {
        return ResponseEntity.ok(ticketService.getTicket(id));
    }

    @PostMapping
    @Operation(
        summary = "Create a ticket",
        description = "Vendor lists a ticket. It starts PENDING and is invisible until an admin approves it. " +
                     "Moderation fields in the body are rejected."
    )
    @ApiResponses({
        @ApiResponse(responseCode = "201", description = "Ticket created"),
        @ApiResponse(responseCode = "400", description = "Invalid or disallowed fields"),
        @ApiResponse(responseCode = "401", description = "Missing or invalid bearer token"),
        @ApiResponse(responseCode = "403", description = "Caller is not a vendor or is suspended")
    })
    public ResponseEntity<TicketDto> createTicket(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @Valid @RequestBody TicketRequest request) {

        String caller = identityVerifier.verify(authorization);
        log.info("Ticket creation request: title={} vendor={}", request.getTitle(), caller);

        return ResponseEntity.status(HttpStatus.CREATED).body(ticketService.createTicket(request, caller));
    }

    @PatchMapping("/{id}")
    @Operation(summary = "Update a ticket", description = "Owner only. Rejected tickets cannot be changed.")
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Ticket updated"),
        @ApiResponse(responseCode = "403", description = "Not the owner, or ticket rejected"),
        @ApiResponse(responseCode = "404", description = "Ticket not found"),
        @ApiResponse(responseCode = "409", description = "Concurrent modification")
    })
    public ResponseEntity<TicketDto> updateTicket(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @Parameter(description = "Ticket ID") @PathVariable Long id,
            @Valid @RequestBody TicketUpdateRequest request) {

        String caller = identityVerifier.verify(authorization);
        return ResponseEntity.ok(ticketService.updateTicket(id, request, caller));
    }

    @DeleteMapping("/{id}")
    @Operation(summary = "Delete a ticket", description = "Owner only. Not allowed while bookings are open.")
    @ApiResponses({
        @ApiResponse(responseCode = "204", description = "Ticket deleted"),
        @ApiResponse(responseCode = "403", description = "Not the owner, or ticket rejected"),
        @ApiResponse(responseCode = "404", description = "Ticket not found"),
        @ApiResponse(responseCode = "409", description = "Ticket has open bookings")
    })
    public ResponseEntity<Void> deleteTicket(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @Parameter(description = "Ticket ID") @PathVariable Long id) {

        String caller = identityVerifier.verify(authorization);
        ticketService.deleteTicket(id, caller);
        return ResponseEntity.noContent().build();
    }
}
