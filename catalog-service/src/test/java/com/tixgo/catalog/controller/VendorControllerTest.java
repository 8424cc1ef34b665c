package com.tixgo.catalog.controller;

import com.tixgo.catalog.service.VendorProfileService;
import com.tixgo.common.dto.VendorProfileDto;
import com.tixgo.common.dto.VendorProfileRequest;
import com.tixgo.common.dto.VendorProfileUpdateRequest;
import com.tixgo.common.exception.ErrorKind;
import com.tixgo.common.exception.MarketplaceException;
import com.tixgo.common.identity.IdentityVerifier;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class VendorControllerTest {

    private static final String TOKEN = "Bearer token-vendor";
    private static final String VENDOR = "hanif@example.com";

    @Mock
    private VendorProfileService vendorProfileService;

    @Mock
    private IdentityVerifier identityVerifier;

    @InjectMocks
    private VendorController vendorController;

    @Test
    void submitProfile_UsesVerifiedCaller() {
        VendorProfileRequest request = VendorProfileRequest.builder().userEmail(VENDOR).businessName("Hanif").build();
        when(identityVerifier.verify(TOKEN)).thenReturn(VENDOR);
        when(vendorProfileService.submitProfile(request, VENDOR))
            .thenReturn(VendorProfileDto.builder().userEmail(VENDOR).verified(false).build());

        ResponseEntity<VendorProfileDto> response = vendorController.submitProfile(TOKEN, request);

        assertEquals(HttpStatus.OK, response.getStatusCode());
        assertFalse(response.getBody().isVerified());
    }

    @Test
    void getProfiles_PassesFilter() {
        when(identityVerifier.verify(TOKEN)).thenReturn("admin@example.com");
        when(vendorProfileService.listProfiles(Boolean.TRUE, "admin@example.com"))
            .thenReturn(List.of(VendorProfileDto.builder().userEmail(VENDOR).verified(true).build()));

        ResponseEntity<List<VendorProfileDto>> response = vendorController.getProfiles(TOKEN, Boolean.TRUE);

        assertEquals(1, response.getBody().size());
    }

    @Test
    void getProfile_RequiresAuthentication() {
        when(identityVerifier.verify(null)).thenThrow(
            new MarketplaceException(ErrorKind.UNAUTHENTICATED, "Missing bearer token"));

        MarketplaceException e = assertThrows(MarketplaceException.class,
            () -> vendorController.getProfile(null, VENDOR));

        assertEquals(ErrorKind.UNAUTHENTICATED, e.getKind());
        verifyNoInteractions(vendorProfileService);
    }

    @Test
    void updateProfile_Delegates() {
        VendorProfileUpdateRequest request = VendorProfileUpdateRequest.builder().phone("+8801800000000").build();
        when(identityVerifier.verify(TOKEN)).thenReturn(VENDOR);
        when(vendorProfileService.updateProfile(VENDOR, request, VENDOR))
            .thenReturn(VendorProfileDto.builder().userEmail(VENDOR).phone("+8801800000000").build());

        ResponseEntity<VendorProfileDto> response = vendorController.updateProfile(TOKEN, VENDOR, request);

        assertEquals("+8801800000000", response.getBody().getPhone());
    }
}
