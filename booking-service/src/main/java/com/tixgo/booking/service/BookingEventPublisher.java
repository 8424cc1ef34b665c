package com.tixgo.booking.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tixgo.common.dto.BookingDto;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

@Service
@Slf4j
@RequiredArgsConstructor
public class BookingEventPublisher {

    public enum EventType {
        BOOKING_CREATED,
        BOOKING_ACCEPTED,
        BOOKING_REJECTED,
        BOOKING_EXPIRED,
        BOOKING_CANCELLED,
        BOOKING_PAID
    }

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;

    @Value("${kafka.topics.booking-events:booking-events}")
    private String bookingEventsTopic;

    /**
     * Publish once the surrounding transaction commits. Rolled back transactions publish nothing.
     * Outside a transaction the event is sent immediately.
     */
    public void publishAfterCommit(EventType eventType, BookingDto booking) {
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            publish(eventType, booking);
            return;
        }

        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCompletion(int status) {
                if (status == STATUS_COMMITTED) {
                    publish(eventType, booking);
                } else {
                    log.debug("Transaction rolled back, dropping {} for booking {}", eventType, booking.getId());
                }
            }
        });
    }

    public void publish(EventType eventType, BookingDto booking) {
        try {
            String eventJson = objectMapper.writeValueAsString(createBookingEvent(eventType, booking));
            String key = String.valueOf(booking.getId());

            CompletableFuture<SendResult<String, String>> future =
                kafkaTemplate.send(bookingEventsTopic, key, eventJson);

            future.whenComplete((result, throwable) -> {
                if (throwable != null) {
                    log.error("Failed to publish {} for booking: {}", eventType, booking.getId(), throwable);
                } else {
                    log.debug("Published {} for booking: {} to partition: {}",
                             eventType, booking.getId(), result.getRecordMetadata().partition());
                }
            });

        } catch (Exception e) {
            log.error("Error creating {} event for booking: {}", eventType, booking.getId(), e);
        }
    }

    private Map<String, Object> createBookingEvent(EventType eventType, BookingDto booking) {
        Map<String, Object> event = new HashMap<>();
        event.put("eventType", eventType.name());
        event.put("timestamp", LocalDateTime.now().toString());
        event.put("source", "booking-service");
        event.put("bookingId", booking.getId());
        event.put("ticketId", booking.getTicketId());
        event.put("customerEmail", booking.getCustomerEmail());
        event.put("vendorEmail", booking.getVendorEmail());
        event.put("quantity", booking.getQuantity());
        event.put("status", booking.getStatus());
        event.put("amount", booking.getTotalAmount());
        return event;
    }
}
