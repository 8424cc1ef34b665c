package com.tixgo.catalog.service;

import com.tixgo.catalog.repository.BookingLedgerRepository;
import com.tixgo.catalog.repository.PaymentLedgerRepository;
import com.tixgo.catalog.repository.TicketRepository;
import com.tixgo.catalog.repository.UserAccountRepository;
import com.tixgo.common.dto.AdminStatsDto;
import com.tixgo.common.dto.UserDto;
import com.tixgo.common.dto.UserRegistrationRequest;
import com.tixgo.common.entity.UserAccount;
import com.tixgo.common.enums.UserRole;
import com.tixgo.common.exception.MarketplaceException;
import com.tixgo.common.identity.CallerRole;
import com.tixgo.common.identity.RoleLookup;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.List;

/**
 * User profiles and roles. Also the role lookup used by the ticket and moderation services.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class UserAccountService implements RoleLookup {

    private final UserAccountRepository userRepository;
    private final TicketRepository ticketRepository;
    private final BookingLedgerRepository bookingRepository;
    private final PaymentLedgerRepository paymentRepository;

    @Override
    @Transactional(readOnly = true)
    public CallerRole lookup(String email) {
        return userRepository.findByEmailIgnoreCase(email)
            .map(user -> new CallerRole(user.getEmail(), user.getRole(), user.isFraud()))
            .orElseGet(() -> CallerRole.defaultUser(email));
    }

    /**
     * Create the caller's profile on first login, refresh name and photo afterwards.
     * Role and fraud flag are never touched here.
     */
    @Transactional
    public UserDto register(UserRegistrationRequest request, String callerEmail) {
        if (!request.getEmail().equalsIgnoreCase(callerEmail)) {
            throw MarketplaceException.forbidden("Profiles can only be registered for the caller's own email");
        }

        UserAccount user = userRepository.findByEmailIgnoreCase(callerEmail)
            .orElseGet(() -> UserAccount.builder()
                .email(callerEmail.toLowerCase())
                .role(UserRole.USER)
                .build());

        boolean created = user.getId() == null;
        if (request.getName() != null) {
            user.setName(request.getName());
        }
        if (request.getPhotoUrl() != null) {
            user.setPhotoUrl(request.getPhotoUrl());
        }

        UserAccount saved = userRepository.save(user);
        log.info("User {}: {}", created ? "registered" : "updated", saved.getEmail());
        return convertToDto(saved);
    }

    @Transactional(readOnly = true)
    public UserDto getProfile(String callerEmail) {
        return userRepository.findByEmailIgnoreCase(callerEmail)
            .map(this::convertToDto)
            .orElseThrow(() -> MarketplaceException.notFound("User", callerEmail));
    }

    /**
     * Read one user's profile. Allowed for the user themselves and for admins.
     */
    @Transactional(readOnly = true)
    public UserDto getUser(String email, String callerEmail) {
        if (!email.equalsIgnoreCase(callerEmail)) {
            requireAdmin(callerEmail);
        }
        return getProfile(email);
    }

    @Transactional(readOnly = true)
    public UserDto getAdminProfile(String callerEmail) {
        requireAdmin(callerEmail);
        return getProfile(callerEmail);
    }

    /**
     * @throws MarketplaceException FORBIDDEN unless the caller is an admin
     */
    public CallerRole requireAdmin(String callerEmail) {
        CallerRole caller = lookup(callerEmail);
        if (!caller.isAdmin()) {
            log.warn("Admin operation refused for {}", callerEmail);
            throw MarketplaceException.forbidden("Admin role required");
        }
        return caller;
    }

    @Transactional(readOnly = true)
    public List<UserDto> listUsers(UserRole role, String callerEmail) {
        requireAdmin(callerEmail);

        List<UserAccount> users = role == null
            ? userRepository.findAllByOrderByCreatedAtDesc()
            : userRepository.findByRoleOrderByCreatedAtDesc(role);

        return users.stream()
            .map(this::convertToDto)
            .toList();
    }

    @Transactional(readOnly = true)
    public AdminStatsDto getStats(String callerEmail) {
        requireAdmin(callerEmail);

        BigDecimal revenue = paymentRepository.sumAmount();
        Long sold = paymentRepository.sumQuantity();

        return AdminStatsDto.builder()
            .usersCount(userRepository.count())
            .vendorsCount(userRepository.countByRole(UserRole.VENDOR))
            .ticketsCount(ticketRepository.count())
            .bookingsCount(bookingRepository.count())
            .totalRevenue(revenue != null ? revenue : BigDecimal.ZERO)
            .ticketsSold(sold != null ? sold : 0L)
            .build();
    }

    UserDto convertToDto(UserAccount user) {
        return UserDto.builder()
            .id(user.getId())
            .email(user.getEmail())
            .name(user.getName())
            .photoUrl(user.getPhotoUrl())
            .role(user.getRole().name())
            .fraud(user.isFraud())
            .createdAt(user.getCreatedAt())
            .build();
    }
}
