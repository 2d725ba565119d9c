package com.flagship.savings_circle.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Topics fed by the outbox publisher. Events are keyed by pool id, so all
 * events of one pool land on the same partition in order.
 */
@Configuration
public class KafkaConfig {

    @Value("${kafka.topic.activity:pool-activity}")
    private String activityTopic;

    @Value("${kafka.topic.notifications:pool-notifications}")
    private String notificationsTopic;

    @Value("${kafka.topic.partitions:3}")
    private int partitions;

    @Bean
    public NewTopic poolActivityTopic() {
        return TopicBuilder.name(activityTopic)
                .partitions(partitions)
                .replicas(1)
                .build();
    }

    @Bean
    public NewTopic poolNotificationsTopic() {
        return TopicBuilder.name(notificationsTopic)
                .partitions(partitions)
                .replicas(1)
                .build();
    }
}
