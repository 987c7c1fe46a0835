package com.example.tscribe_backend.config;

import com.example.tscribe_backend.repository.QueueEntryRepository;
import com.example.tscribe_backend.service.DatabaseWorkQueue;
import com.example.tscribe_backend.service.InMemoryWorkQueue;
import com.example.tscribe_backend.service.Interfaces.WorkQueue;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/** {@code queue.backend=database} (default, shared by every worker) or {@code memory} (one process). */
@Configuration
public class QueueConfig {

    @Bean
    @ConditionalOnProperty(name = "queue.backend", havingValue = "database", matchIfMissing = true)
    public WorkQueue databaseWorkQueue(QueueEntryRepository repository, Clock clock) {
        return new DatabaseWorkQueue(repository, clock);
    }

    @Bean
    @ConditionalOnProperty(name = "queue.backend", havingValue = "memory")
    public WorkQueue inMemoryWorkQueue(Clock clock) {
        return new InMemoryWorkQueue(clock);
    }
}
