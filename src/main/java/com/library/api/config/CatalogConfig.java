package com.library.api.config;

import com.library.api.entity.Book;
import com.library.api.mapper.BookMapper;
import com.library.api.service.ActivityLogger;
import com.library.api.service.BookService;
import com.library.api.service.ConsoleActivityLogger;
import com.library.api.service.InMemoryBookService;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.List;

/**
 * Binds the catalog and activity-log contracts to their implementations.
 *
 * <p>Both beans are singletons, so the catalog lives exactly as long as the
 * application context. Tests replace either one by declaring a {@code @Primary} bean
 * of the same contract type.
 */
@Configuration
public class CatalogConfig {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public BookService bookService(LibraryProperties properties) {
        List<Book> seed = properties.catalog().seed().stream()
            .map(BookMapper::toEntity)
            .toList();
        return new InMemoryBookService(seed);
    }

    @Bean
    public ActivityLogger activityLogger(LibraryProperties properties, Clock clock) {
        LibraryProperties.ActivityLog settings = properties.activityLog();
        return new ConsoleActivityLogger(System.out, clock, settings.tag(), settings.timestampPattern());
    }
}
