package com.tixgo.common.entity;

import com.tixgo.common.entity.Booking.BookingStatus;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

class BookingStatusTest {

    @Test
    void pending_MovesOnlyToAcceptedOrRejected() {
        assertTrue(BookingStatus.PENDING.canTransitionTo(BookingStatus.ACCEPTED));
        assertTrue(BookingStatus.PENDING.canTransitionTo(BookingStatus.REJECTED));
        assertFalse(BookingStatus.PENDING.canTransitionTo(BookingStatus.PAID));
        assertFalse(BookingStatus.PENDING.canTransitionTo(BookingStatus.CANCELLED));
    }

    @Test
    void accepted_MovesOnlyToPaidOrCancelled() {
        assertTrue(BookingStatus.ACCEPTED.canTransitionTo(BookingStatus.PAID));
        assertTrue(BookingStatus.ACCEPTED.canTransitionTo(BookingStatus.CANCELLED));
        assertFalse(BookingStatus.ACCEPTED.canTransitionTo(BookingStatus.REJECTED));
        assertFalse(BookingStatus.ACCEPTED.canTransitionTo(BookingStatus.PENDING));
    }

    @Test
    void terminalStates_HaveNoExits() {
        for (BookingStatus terminal : new BookingStatus[]{BookingStatus.REJECTED, BookingStatus.PAID, BookingStatus.CANCELLED}) {
            assertTrue(terminal.isTerminal());
            for (BookingStatus target : BookingStatus.values()) {
                assertFalse(terminal.canTransitionTo(target), terminal + " -> " + target);
            }
        }
        assertFalse(BookingStatus.PENDING.isTerminal());
        assertFalse(BookingStatus.ACCEPTED.isTerminal());
    }

    @Test
    void totalAmount_IsSnapshotPriceTimesQuantity() {
        Booking booking = Booking.builder().price(new BigDecimal("12.50")).quantity(4).build();

        assertEquals(0, new BigDecimal("50.00").compareTo(booking.getTotalAmount()));
    }

    @Test
    void ownership_IgnoresEmailCase() {
        Booking booking = Booking.builder().customerEmail("alice@example.com").vendorEmail("vendor@example.com").build();

        assertTrue(booking.isOwnedByCustomer("Alice@Example.com"));
        assertTrue(booking.isOwnedByVendor("VENDOR@example.com"));
        assertFalse(booking.isOwnedByCustomer("vendor@example.com"));
        assertFalse(booking.isOwnedByVendor(null));
    }
}
