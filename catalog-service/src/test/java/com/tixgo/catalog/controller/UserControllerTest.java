package com.tixgo.catalog.controller;

import com.tixgo.catalog.service.UserAccountService;
import com.tixgo.common.dto.UserDto;
import com.tixgo.common.dto.UserRegistrationRequest;
import com.tixgo.common.enums.UserRole;
import com.tixgo.common.exception.ErrorKind;
import com.tixgo.common.exception.MarketplaceException;
import com.tixgo.common.identity.CallerRole;
import com.tixgo.common.identity.IdentityVerifier;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class UserControllerTest {

    private static final String TOKEN = "Bearer token-alice";
    private static final String ALICE = "alice@example.com";

    @Mock
    private UserAccountService userAccountService;

    @Mock
    private IdentityVerifier identityVerifier;

    @InjectMocks
    private UserController userController;

    @Test
    void register_Delegates() {
        UserRegistrationRequest request = UserRegistrationRequest.builder().email(ALICE).name("Alice").build();
        when(identityVerifier.verify(TOKEN)).thenReturn(ALICE);
        when(userAccountService.register(request, ALICE)).thenReturn(UserDto.builder().email(ALICE).role("USER").build());

        ResponseEntity<UserDto> response = userController.register(TOKEN, request);

        assertEquals(HttpStatus.OK, response.getStatusCode());
        assertEquals("USER", response.getBody().getRole());
    }

    @Test
    void getRole_ReturnsLookup() {
        when(identityVerifier.verify(TOKEN)).thenReturn(ALICE);
        when(userAccountService.lookup(ALICE)).thenReturn(new CallerRole(ALICE, UserRole.VENDOR, true));

        ResponseEntity<CallerRole> response = userController.getRole(TOKEN);

        assertEquals(UserRole.VENDOR, response.getBody().getRole());
        assertTrue(response.getBody().isFraud());
    }

    @Test
    void getUser_Delegates() {
        when(identityVerifier.verify(TOKEN)).thenReturn(ALICE);
        when(userAccountService.getUser(ALICE, ALICE)).thenReturn(UserDto.builder().email(ALICE).role("USER").build());

        ResponseEntity<UserDto> response = userController.getUser(TOKEN, ALICE);

        assertEquals(ALICE, response.getBody().getEmail());
    }

    @Test
    void getUser_OtherUser_Forbidden() {
        when(identityVerifier.verify(TOKEN)).thenReturn(ALICE);
        when(userAccountService.getUser("bob@example.com", ALICE))
            .thenThrow(MarketplaceException.forbidden("Admin role required"));

        MarketplaceException e = assertThrows(MarketplaceException.class,
            () -> userController.getUser(TOKEN, "bob@example.com"));

        assertEquals(ErrorKind.FORBIDDEN, e.getKind());
    }
}
