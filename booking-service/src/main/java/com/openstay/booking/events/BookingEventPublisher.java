package com.openstay.booking.events;

import com.openstay.booking.port.BookingEventType;
import com.openstay.booking.port.BookingNotification;
import com.openstay.booking.port.NotificationPort;
import com.openstay.common.util.Constants;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;

/**
 * Publishes booking lifecycle events to Kafka, keyed by booking id so the events of one
 * booking stay ordered within a partition.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BookingEventPublisher implements NotificationPort {

    private final KafkaTemplate<String, Object> kafkaTemplate;

    @Override
    public void notify(BookingEventType eventType, BookingNotification notification) {
        BookingLifecycleEvent event = BookingLifecycleEvent.builder()
                .eventType(eventType.name())
                .bookingId(notification.bookingId())
                .hotelId(notification.hotelId())
                .customerId(notification.customerId())
                .status(notification.status().name())
                .checkInDate(notification.checkInDate())
                .checkOutDate(notification.checkOutDate())
                .totalPrice(notification.totalPrice())
                .refundAmount(notification.refundAmount())
                .timestamp(notification.occurredAt())
                .build();

        publishEvent(Constants.TOPIC_BOOKING_EVENTS, String.valueOf(notification.bookingId()), event);
    }

    private void publishEvent(String topic, String key, BookingLifecycleEvent event) {
        log.info("Publishing {} for booking {} to topic {}", event.getEventType(), key, topic);

        CompletableFuture<SendResult<String, Object>> future = kafkaTemplate.send(topic, key, event);

        future.whenComplete((result, ex) -> {
            if (ex == null) {
                log.info("Event published successfully to topic {}: offset={}",
                        topic, result.getRecordMetadata().offset());
            } else {
                log.error("Failed to publish {} for booking {} to topic {}", event.getEventType(), key, topic, ex);
            }
        });
    }
}
