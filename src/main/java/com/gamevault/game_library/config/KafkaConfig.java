package com.gamevault.game_library.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Kafka topic for library transition events.
 */
@Configuration
public class KafkaConfig {

    @Value("${kafka.topic.library:library-transitions}")
    private String libraryTopic;

    @Value("${kafka.topic.library-partitions:3}")
    private int partitions;

    /**
     * Records are keyed by {@code userId:gameId}, so partitions only
     * affect parallelism across pairs, never ordering within one.
     */
    @Bean
    public NewTopic libraryTopic() {
        return TopicBuilder.name(libraryTopic)
                .partitions(partitions)
                .replicas(1)
                .build();
    }
}
