package com.tixgo.common.entity;

import jakarta.persistence.*;
import jakarta.validation.constraints.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.Set;

@Entity
@Table(name = "bookings", indexes = {
    @Index(name = "idx_booking_customer", columnList = "customer_email"),
    @Index(name = "idx_booking_vendor", columnList = "vendor_email"),
    @Index(name = "idx_booking_ticket", columnList = "ticket_id"),
    @Index(name = "idx_booking_status", columnList = "status, created_at")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Booking {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @NotNull
    @Column(name = "ticket_id", nullable = false)
    private Long ticketId;

    @NotBlank
    @Column(name = "customer_email", nullable = false)
    private String customerEmail;

    // Snapshots taken from the ticket at creation, never updated afterwards
    @NotBlank
    @Column(name = "vendor_email", nullable = false, updatable = false)
    private String vendorEmail;

    @NotBlank
    @Column(nullable = false, updatable = false)
    private String title;

    @NotNull
    @Column(nullable = false, updatable = false, precision = 10, scale = 2)
    private BigDecimal price;

    @NotNull
    @Positive
    @Column(nullable = false, updatable = false)
    private Integer quantity;

    @NotNull
    @Column(nullable = false)
    @Enumerated(EnumType.STRING)
    private BookingStatus status;

    @Size(max = 255)
    @Column(name = "checkout_session_id")
    private String checkoutSessionId;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "accepted_at")
    private LocalDateTime acceptedAt;

    @Column(name = "rejected_at")
    private LocalDateTime rejectedAt;

    @Column(name = "paid_at")
    private LocalDateTime paidAt;

    @Column(name = "cancelled_at")
    private LocalDateTime cancelledAt;

    public enum BookingStatus {
        PENDING, ACCEPTED, REJECTED, PAID, CANCELLED;

        private static final Set<BookingStatus> TERMINAL = EnumSet.of(REJECTED, PAID, CANCELLED);

        public boolean isTerminal() {
            return TERMINAL.contains(this);
        }

        public boolean canTransitionTo(BookingStatus target) {
            switch (this) {
                case PENDING:
                    return target == ACCEPTED || target == REJECTED;
                case ACCEPTED:
                    return target == PAID || target == CANCELLED;
                default:
                    return false;
            }
        }
    }

    // Helper methods
    public BigDecimal getTotalAmount() {
        return price.multiply(BigDecimal.valueOf(quantity));
    }

    public boolean isOwnedByCustomer(String email) {
        return customerEmail != null && customerEmail.equalsIgnoreCase(email);
    }

    public boolean isOwnedByVendor(String email) {
        return vendorEmail != null && vendorEmail.equalsIgnoreCase(email);
    }
}
