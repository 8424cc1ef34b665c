package com.tixgo.catalog.service;

import com.tixgo.catalog.repository.VendorProfileRepository;
import com.tixgo.common.dto.VendorProfileDto;
import com.tixgo.common.dto.VendorProfileRequest;
import com.tixgo.common.dto.VendorProfileUpdateRequest;
import com.tixgo.common.entity.VendorProfile;
import com.tixgo.common.exception.ErrorKind;
import com.tixgo.common.exception.MarketplaceException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Vendor applications. A submitted profile waits unverified until an admin verifies it.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class VendorProfileService {

    private final VendorProfileRepository vendorRepository;
    private final UserAccountService userAccountService;

    /**
     * Create or resubmit the caller's application. Resubmitting sends it back to the
     * pending queue.
     */
    @Transactional
    public VendorProfileDto submitProfile(VendorProfileRequest request, String callerEmail) {
        if (!request.getUserEmail().equalsIgnoreCase(callerEmail)) {
            throw MarketplaceException.forbidden("Vendor profiles can only be submitted for the caller's own email");
        }
        if (userAccountService.lookup(callerEmail).isFraud()) {
            throw new MarketplaceException(ErrorKind.VENDOR_SUSPENDED, "Vendor account " + callerEmail + " is suspended");
        }

        VendorProfile profile = vendorRepository.findByUserEmailIgnoreCase(callerEmail)
            .orElseGet(() -> VendorProfile.builder()
                .userEmail(callerEmail.toLowerCase())
                .build());

        boolean created = profile.getId() == null;
        profile.setBusinessName(request.getBusinessName());
        profile.setPhone(request.getPhone());
        profile.setAddress(request.getAddress());
        profile.setDescription(request.getDescription());
        profile.setLogoUrl(request.getLogoUrl());
        profile.setVerified(false);

        VendorProfile saved = vendorRepository.save(profile);
        log.info("Vendor profile {}: {}", created ? "submitted" : "resubmitted", saved.getUserEmail());
        return convertToDto(saved);
    }

    @Transactional(readOnly = true)
    public VendorProfileDto getProfile(String email) {
        return convertToDto(loadProfile(email));
    }

    /**
     * Owner edit. Keeps the current verification.
     */
    @Transactional
    public VendorProfileDto updateProfile(String email, VendorProfileUpdateRequest request, String callerEmail) {
        if (!email.equalsIgnoreCase(callerEmail)) {
            throw MarketplaceException.forbidden("Only the owner can edit vendor profile " + email);
        }
        if (request.isEmpty()) {
            throw MarketplaceException.validation("Update must change at least one field");
        }

        VendorProfile profile = loadProfile(email);

        if (request.getBusinessName() != null) {
            profile.setBusinessName(request.getBusinessName());
        }
        if (request.getPhone() != null) {
            profile.setPhone(request.getPhone());
        }
        if (request.getAddress() != null) {
            profile.setAddress(request.getAddress());
        }
        if (request.getDescription() != null) {
            profile.setDescription(request.getDescription());
        }
        if (request.getLogoUrl() != null) {
            profile.setLogoUrl(request.getLogoUrl());
        }

        VendorProfile saved = vendorRepository.save(profile);
        log.info("Vendor profile updated: {}", saved.getUserEmail());
        return convertToDto(saved);
    }

    @Transactional(readOnly = true)
    public List<VendorProfileDto> listProfiles(Boolean verified, String callerEmail) {
        userAccountService.requireAdmin(callerEmail);

        List<VendorProfile> profiles = verified == null
            ? vendorRepository.findAllByOrderByCreatedAtDesc()
            : vendorRepository.findByVerifiedOrderByCreatedAtDesc(verified);

        return profiles.stream()
            .map(this::convertToDto)
            .toList();
    }

    @Transactional(readOnly = true)
    public List<VendorProfileDto> getPendingProfiles(String callerEmail) {
        return listProfiles(Boolean.FALSE, callerEmail);
    }

    @Transactional
    public VendorProfileDto verifyVendor(String email, boolean verify, String callerEmail) {
        userAccountService.requireAdmin(callerEmail);

        int updated = vendorRepository.setVerified(email, verify);
        if (updated == 0) {
            throw MarketplaceException.notFound("Vendor profile", email);
        }

        log.info("Vendor profile {} {} by {}", email, verify ? "verified" : "unverified", callerEmail);
        return convertToDto(loadProfile(email));
    }

    private VendorProfile loadProfile(String email) {
        return vendorRepository.findByUserEmailIgnoreCase(email)
            .orElseThrow(() -> MarketplaceException.notFound("Vendor profile", email));
    }

    VendorProfileDto convertToDto(VendorProfile profile) {
        return VendorProfileDto.builder()
            .id(profile.getId())
            .userEmail(profile.getUserEmail())
            .businessName(profile.getBusinessName())
            .phone(profile.getPhone())
            .address(profile.getAddress())
            .description(profile.getDescription())
            .logoUrl(profile.getLogoUrl())
            .verified(profile.isVerified())
            .createdAt(profile.getCreatedAt())
            .updatedAt(profile.getUpdatedAt())
            .build();
    }
}
