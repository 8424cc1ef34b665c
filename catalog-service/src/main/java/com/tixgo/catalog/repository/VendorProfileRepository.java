package com.tixgo.catalog.repository;

import com.tixgo.common.entity.VendorProfile;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface VendorProfileRepository extends JpaRepository<VendorProfile, Long> {

    Optional<VendorProfile> findByUserEmailIgnoreCase(String userEmail);

    List<VendorProfile> findAllByOrderByCreatedAtDesc();

    List<VendorProfile> findByVerifiedOrderByCreatedAtDesc(boolean verified);

    /**
     * @return 1 if the profile exists, 0 otherwise
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE VendorProfile v SET v.verified = :verified, v.updatedAt = CURRENT_TIMESTAMP " +
           "WHERE LOWER(v.userEmail) = LOWER(:email)")
    int setVerified(@Param("email") String email, @Param("verified") boolean verified);
}
