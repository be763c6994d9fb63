package com.flagship.savings_loan.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Topics the outbox publisher writes to. Events are keyed by aggregate id, so
 * events for one loan or one member stay ordered within a partition.
 */
@Configuration
public class KafkaConfig {

    @Value("${kafka.topic.loans:loan-events}")
    private String loansTopic;

    @Value("${kafka.topic.members:member-events}")
    private String membersTopic;

    @Bean
    public NewTopic loansTopic() {
        return TopicBuilder.name(loansTopic)
                .partitions(3)
                .replicas(1)
                .build();
    }

    @Bean
    public NewTopic membersTopic() {
        return TopicBuilder.name(membersTopic)
                .partitions(3)
                .replicas(1)
                .build();
    }
}
