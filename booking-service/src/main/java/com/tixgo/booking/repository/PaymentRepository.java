package com.tixgo.booking.repository;

import com.tixgo.common.entity.Payment;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface PaymentRepository extends JpaRepository<Payment, Long> {

    Optional<Payment> findByTransactionId(String transactionId);

    List<Payment> findByCustomerEmailIgnoreCaseOrderByPaidAtDesc(String customerEmail);

    long countByBookingId(Long bookingId);
}
