package com.hkcraft.booking.infrastructure.messaging;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hkcraft.booking.infrastructure.messaging.events.Notification;
import com.hkcraft.booking.infrastructure.metrics.BookingMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Service;

import java.util.concurrent.CompletableFuture;

/**
 * Publishes notifications to Kafka for the delivery service to fan out.
 *
 * Topic partitioning strategy:
 * - Key: recipient user id, so one user's notifications stay in order
 *
 * @author Craft Booking Team
 */
@Service
public class KafkaNotifier implements Notifier {

    private static final Logger logger = LoggerFactory.getLogger(KafkaNotifier.class);

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;
    private final BookingMetricsService metricsService;
    private final String topic;

    public KafkaNotifier(
            KafkaTemplate<String, String> kafkaTemplate,
            ObjectMapper objectMapper,
            BookingMetricsService metricsService,
            @Value("${craft.notifications.topic:craft-notifications}") String topic
    ) {
        this.kafkaTemplate = kafkaTemplate;
        this.objectMapper = objectMapper;
        this.metricsService = metricsService;
        this.topic = topic;
    }

    @Override
    public void notify(String userId, Notification notification) {
        notification.setRecipientId(userId);
        try {
            String payload = objectMapper.writeValueAsString(notification);
            CompletableFuture<SendResult<String, String>> future = kafkaTemplate.send(topic, userId, payload);

            future.whenComplete((result, ex) -> {
                if (ex == null) {
                    logger.debug("Published {} notification for user {}, partition: {}",
                            notification.getType(), userId, result.getRecordMetadata().partition());
                } else {
                    logger.error("Failed to publish {} notification for user {}",
                            notification.getType(), userId, ex);
                    metricsService.recordNotificationFailure(notification.getType().name());
                }
            });
        } catch (JsonProcessingException e) {
            logger.error("Error serializing {} notification for user {}", notification.getType(), userId, e);
            metricsService.recordNotificationFailure(notification.getType().name());
        } catch (RuntimeException e) {
            // send() can fail synchronously, e.g. when metadata for the topic cannot be fetched
            logger.error("Error handing {} notification for user {} to Kafka", notification.getType(), userId, e);
            metricsService.recordNotificationFailure(notification.getType().name());
        }
    }
}
