package com.flagship.restaurant_ledger.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.kafka.DefaultKafkaProducerFactoryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

import java.util.Map;

/**
 * Kafka wiring for the outbox relay. Only loaded while the relay is enabled.
 */
@Configuration
@ConditionalOnProperty(name = "outbox.publisher.enabled", havingValue = "true", matchIfMissing = true)
public class KafkaConfig {

    /**
     * Back-office events topic, keyed by aggregate id.
     */
    @Bean
    public NewTopic backofficeTopic(@Value("${kafka.topic.backoffice:backoffice-events}") String name,
                                    @Value("${kafka.topic.partitions:3}") int partitions,
                                    @Value("${kafka.topic.replicas:1}") int replicas) {
        return TopicBuilder.name(name)
                .partitions(partitions)
                .replicas(replicas)
                .build();
    }

    /**
     * A relay retry must not duplicate or reorder records within a partition.
     */
    @Bean
    public DefaultKafkaProducerFactoryCustomizer idempotentProducer() {
        return factory -> factory.updateConfigs(Map.of(
                ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, true,
                ProducerConfig.MAX_IN_FLIGHT_REQUESTS_PER_CONNECTION, 5));
    }
}
