package com.usermanagement.notification.config;

import com.usermanagement.notification.event.EventType;
import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;
import org.springframework.kafka.core.KafkaAdmin;

import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;

@Configuration
public class KafkaTopicConfig {

    private final NotificationProperties properties;

    public KafkaTopicConfig(NotificationProperties properties) {
        this.properties = properties;
    }

    @Bean
    public KafkaAdmin.NewTopics eventTopics() {
        NewTopic[] topics = Arrays.stream(EventType.values())
            .map(type -> TopicBuilder
                .name(type.getTopicName())
                .partitions(properties.getKafka().getPartitions())
                .replicas(1)
                .build())
            .toArray(NewTopic[]::new);
        return new KafkaAdmin.NewTopics(topics);
    }

    @Bean
    public NewTopic notificationDlqTopic() {
        return TopicBuilder
            .name(properties.getKafka().getDlqTopic())
            .partitions(1)
            .replicas(1)
            .build();
    }

    @Bean
    public NewTopic taskEventsTopic() {
        Map<String, String> configs = new HashMap<>();
        configs.put("retention.ms", "2592000000"); // 30 days retention

        return TopicBuilder
            .name(properties.getKafka().getTaskEventsTopic())
            .partitions(properties.getKafka().getPartitions())
            .replicas(1)
            .configs(configs)
            .build();
    }
}
