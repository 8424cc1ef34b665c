package com.tixgo.booking.controller;

import com.tixgo.booking.service.BookingService;
import com.tixgo.common.dto.BookingDto;
import com.tixgo.common.dto.BookingRequest;
import com.tixgo.common.exception.MarketplaceException;
import com.tixgo.common.identity.IdentityVerifier;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/bookings")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Booking Controller", description = "Ticket reservation and booking lifecycle")
public class BookingController {

    private final BookingService bookingService;
    private final IdentityVerifier identityVerifier;

    @PostMapping
    @Operation(
        summary = "Create a booking",
        description = "Reserve stock on an approved ticket. The booking starts PENDING and snapshots " +
                     "the ticket's title, price and vendor. Stock is decremented with a single " +
                     "conditional write, so concurrent requests can never oversell."
    )
    @ApiResponses({
        @ApiResponse(responseCode = "201", description = "Booking created, stock reserved"),
        @ApiResponse(responseCode = "400", description = "Invalid request"),
        @ApiResponse(responseCode = "401", description = "Missing or invalid bearer token"),
        @ApiResponse(responseCode = "403", description = "Booking on behalf of another customer"),
        @ApiResponse(responseCode = "404", description = "Ticket not found"),
        @ApiResponse(responseCode = "409", description = "Ticket not approved or not enough stock")
    })
    public ResponseEntity<BookingDto> createBooking(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @Valid @RequestBody BookingRequest request) {

        String caller = identityVerifier.verify(authorization);
        log.info("Booking request received: ticket={} quantity={} caller={}",
                request.getTicketId(), request.getQuantity(), caller);

        try {
            BookingDto booking = bookingService.createBooking(request, caller);
            return ResponseEntity.status(HttpStatus.CREATED).body(booking);

        } catch (MarketplaceException e) {
            log.warn("Booking failed for ticket: {} - {}", request.getTicketId(), e.getMessage());
            throw e; // Will be handled by global exception handler
        }
    }

    @GetMapping
    @Operation(summary = "List the caller's bookings", description = "Newest first. Only the caller's own email is allowed.")
    public ResponseEntity<List<BookingDto>> getCustomerBookings(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @Parameter(description = "Customer email") @RequestParam String email) {

        String caller = identityVerifier.verify(authorization);
        return ResponseEntity.ok(bookingService.getCustomerBookings(email, caller));
    }

    @GetMapping("/vendor/{email}")
    @Operation(summary = "List booking requests for a vendor", description = "Only the vendor themselves may list them.")
    public ResponseEntity<List<BookingDto>> getVendorBookings(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @Parameter(description = "Vendor email") @PathVariable String email) {

        String caller = identityVerifier.verify(authorization);
        return ResponseEntity.ok(bookingService.getVendorBookings(email, caller));
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get a booking", description = "Visible to the booking's customer and vendor.")
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Booking found"),
        @ApiResponse(responseCode = "403", description = "Caller is neither customer nor vendor"),
        @ApiResponse(responseCode = "404", description = "Booking not found")
    })
    public ResponseEntity<BookingDto> getBooking(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @Parameter(description = "Booking ID") @PathVariable Long id) {

        String caller = identityVerifier.verify(authorization);
        return ResponseEntity.ok(bookingService.getBooking(id, caller));
    }

    @PatchMapping("/{id}/accept")
    @Operation(
        summary = "Accept a pending booking",
        description = "Vendor confirms the request. Only legal from PENDING; the customer can then check out."
    )
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Booking accepted"),
        @ApiResponse(responseCode = "403", description = "Caller is not the ticket's vendor"),
        @ApiResponse(responseCode = "404", description = "Booking not found"),
        @ApiResponse(responseCode = "409", description = "Booking is not pending")
    })
    public ResponseEntity<BookingDto> acceptBooking(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @Parameter(description = "Booking ID") @PathVariable Long id) {

        String caller = identityVerifier.verify(authorization);
        log.info("Accept request for booking: {} by {}", id, caller);

        try {
            return ResponseEntity.ok(bookingService.acceptBooking(id, caller));
        } catch (MarketplaceException e) {
            log.warn("Accept failed for booking: {} - {}", id, e.getMessage());
            throw e;
        }
    }

    @PatchMapping("/{id}/reject")
    @Operation(
        summary = "Reject a pending booking",
        description = "Vendor declines the request. Only legal from PENDING; reserved stock is returned to the ticket."
    )
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Booking rejected, stock released"),
        @ApiResponse(responseCode = "403", description = "Caller is not the ticket's vendor"),
        @ApiResponse(responseCode = "404", description = "Booking not found"),
        @ApiResponse(responseCode = "409", description = "Booking is not pending")
    })
    public ResponseEntity<BookingDto> rejectBooking(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @Parameter(description = "Booking ID") @PathVariable Long id) {

        String caller = identityVerifier.verify(authorization);
        log.info("Reject request for booking: {} by {}", id, caller);

        try {
            return ResponseEntity.ok(bookingService.rejectBooking(id, caller));
        } catch (MarketplaceException e) {
            log.warn("Reject failed for booking: {} - {}", id, e.getMessage());
            throw e;
        }
    }
}
