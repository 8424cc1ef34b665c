package com.tixgo.common.entity;

import jakarta.persistence.*;
import jakarta.validation.constraints.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDateTime;

/**
 * A user's application to sell on the marketplace. Verification is an admin decision and is
 * separate from the VENDOR role.
 */
@Entity
@Table(name = "vendor_profiles",
    uniqueConstraints = @UniqueConstraint(name = "uk_vendor_profile_email", columnNames = "user_email"),
    indexes = @Index(name = "idx_vendor_profile_verified", columnList = "verified, created_at"))
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class VendorProfile {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @NotBlank
    @Email
    @Column(name = "user_email", nullable = false)
    private String userEmail;

    @NotBlank
    @Size(max = 200)
    @Column(name = "business_name", nullable = false)
    private String businessName;

    @Size(max = 30)
    private String phone;

    @Size(max = 300)
    private String address;

    @Size(max = 1000)
    @Column(length = 1000)
    private String description;

    @Size(max = 500)
    @Column(name = "logo_url", length = 500)
    private String logoUrl;

    @Column(nullable = false)
    @Builder.Default
    private boolean verified = false;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    public boolean isOwnedBy(String email) {
        return userEmail != null && userEmail.equalsIgnoreCase(email);
    }
}
