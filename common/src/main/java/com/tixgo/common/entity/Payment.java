package com.tixgo.common.entity;

import jakarta.persistence.*;
import jakarta.validation.constraints.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Entity
@Table(name = "payments",
    uniqueConstraints = @UniqueConstraint(name = "uk_payment_transaction", columnNames = "transaction_id"),
    indexes = {
        @Index(name = "idx_payment_customer", columnList = "customer_email, paid_at"),
        @Index(name = "idx_payment_booking", columnList = "booking_id")
    })
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Payment {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @NotNull
    @Column(name = "booking_id", nullable = false)
    private Long bookingId;

    @NotNull
    @Column(name = "ticket_id", nullable = false)
    private Long ticketId;

    @NotBlank
    @Column(name = "customer_email", nullable = false)
    private String customerEmail;

    @NotNull
    @DecimalMin("0.00")
    @Column(nullable = false, precision = 12, scale = 2)
    private BigDecimal amount;

    @NotBlank
    @Size(max = 3)
    @Column(nullable = false, length = 3)
    private String currency;

    @NotNull
    @Positive
    @Column(nullable = false)
    private Integer quantity;

    // Idempotency key for finalization, unique at the storage layer
    @NotBlank
    @Column(name = "transaction_id", nullable = false, updatable = false)
    private String transactionId;

    @Column(name = "checkout_session_id")
    private String checkoutSessionId;

    @NotNull
    @Column(name = "paid_at", nullable = false)
    private LocalDateTime paidAt;
}
