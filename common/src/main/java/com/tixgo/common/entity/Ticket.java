package com.tixgo.common.entity;

import com.tixgo.common.enums.VerificationStatus;
import jakarta.persistence.*;
import jakarta.validation.constraints.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

@Entity
@Table(name = "tickets", indexes = {
    @Index(name = "idx_ticket_vendor", columnList = "vendor_email"),
    @Index(name = "idx_ticket_status", columnList = "verification_status"),
    @Index(name = "idx_ticket_advertised", columnList = "advertised, verification_status")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Ticket {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @NotBlank
    @Size(max = 200)
    @Column(name = "vendor_email", nullable = false)
    private String vendorEmail;

    @Size(max = 200)
    @Column(name = "vendor_name")
    private String vendorName;

    @NotBlank
    @Size(max = 200)
    @Column(nullable = false)
    private String title;

    @NotBlank
    @Size(max = 100)
    @Column(name = "from_location", nullable = false)
    private String fromLocation;

    @NotBlank
    @Size(max = 100)
    @Column(name = "to_location", nullable = false)
    private String toLocation;

    @NotNull
    @Column(nullable = false)
    private LocalDateTime departure;

    @Size(max = 50)
    @Column(name = "transport_type")
    private String transportType;

    @NotNull
    @DecimalMin("0.00")
    @Column(nullable = false, precision = 10, scale = 2)
    private BigDecimal price;

    @NotNull
    @PositiveOrZero
    @Column(nullable = false)
    private Integer quantity; // Available stock, decremented on reservation

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "ticket_perks", joinColumns = @JoinColumn(name = "ticket_id"))
    @Column(name = "perk")
    @Builder.Default
    private List<String> perks = new ArrayList<>();

    @Size(max = 500)
    @Column(name = "image_url", length = 500)
    private String imageUrl;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(name = "verification_status", nullable = false)
    @Builder.Default
    private VerificationStatus verificationStatus = VerificationStatus.PENDING;

    @Column(nullable = false)
    @Builder.Default
    private boolean advertised = false;

    @Column(nullable = false)
    @Builder.Default
    private boolean hidden = false;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    @Version
    private Long version; // Bumped by inventory writes as well

    // Helper methods
    public boolean isBookable() {
        return verificationStatus == VerificationStatus.APPROVED && !hidden;
    }

    public boolean isRejected() {
        return verificationStatus == VerificationStatus.REJECTED;
    }

    public boolean isOwnedBy(String email) {
        return vendorEmail != null && vendorEmail.equalsIgnoreCase(email);
    }
}
