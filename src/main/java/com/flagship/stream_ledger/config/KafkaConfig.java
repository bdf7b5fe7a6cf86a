package com.flagship.stream_ledger.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Kafka topic for stream lifecycle and revenue events.
 *
 * Events are keyed by stream id, so all events of one stream land on the
 * same partition and keep their order.
 */
@Configuration
public class KafkaConfig {

    @Value("${kafka.topic.streams:streams}")
    private String streamsTopic;

    @Bean
    @ConditionalOnProperty(name = "kafka.topic.auto-create", havingValue = "true", matchIfMissing = true)
    public NewTopic streamsTopic() {
        return TopicBuilder.name(streamsTopic)
                .partitions(3)
                .replicas(1)
                .build();
    }
}
