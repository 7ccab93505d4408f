package com.flagship.pawn_ledger.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.apache.kafka.common.config.TopicConfig;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Topic that receives ledger events relayed from the outbox.
 */
@Configuration
public class KafkaConfig {

    @Value("${kafka.topic.ledger-events:ledger-events}")
    private String ledgerEventsTopic;

    @Value("${kafka.topic.partitions:3}")
    private int partitions;

    /**
     * Keyed by aggregate id, so events of one voucher, pledge or payment stay in
     * order on their partition. Ledger events form an audit trail and are
     * retained indefinitely.
     */
    @Bean
    public NewTopic ledgerEventsTopic() {
        return TopicBuilder.name(ledgerEventsTopic)
                .partitions(partitions)
                .replicas(1)
                .config(TopicConfig.RETENTION_MS_CONFIG, "-1")
                .config(TopicConfig.CLEANUP_POLICY_CONFIG, TopicConfig.CLEANUP_POLICY_DELETE)
                .build();
    }
}
