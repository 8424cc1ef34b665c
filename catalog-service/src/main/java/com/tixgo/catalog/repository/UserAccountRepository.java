package com.tixgo.catalog.repository;

import com.tixgo.common.entity.UserAccount;
import com.tixgo.common.enums.UserRole;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface UserAccountRepository extends JpaRepository<UserAccount, Long> {

    Optional<UserAccount> findByEmailIgnoreCase(String email);

    List<UserAccount> findAllByOrderByCreatedAtDesc();

    List<UserAccount> findByRoleOrderByCreatedAtDesc(UserRole role);

    long countByRole(UserRole role);
}
