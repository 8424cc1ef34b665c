package com.tixgo.catalog.repository;

import com.tixgo.common.entity.Payment;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;

@Repository
public interface PaymentLedgerRepository extends JpaRepository<Payment, Long> {

    // Both sums are null when no payment exists
    @Query("SELECT SUM(p.amount) FROM Payment p")
    BigDecimal sumAmount();

    @Query("SELECT SUM(p.quantity) FROM Payment p")
    Long sumQuantity();
}
