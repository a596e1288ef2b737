package com.library.api;

import com.library.api.config.LibraryProperties;
import com.library.api.integration.AbstractIntegrationTest;
import com.library.api.service.ActivityLogger;
import com.library.api.service.BookService;
import com.library.api.service.ConsoleActivityLogger;
import com.library.api.service.InMemoryBookService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import static org.assertj.core.api.Assertions.assertThat;

class LibraryApiApplicationTests extends AbstractIntegrationTest {

    @Autowired
    private BookService bookService;

    @Autowired
    private ActivityLogger activityLogger;

    @Autowired
    private LibraryProperties properties;

    @Test
    void contextLoads() {
        assertThat(bookService).isInstanceOf(InMemoryBookService.class);
        assertThat(activityLogger).isInstanceOf(ConsoleActivityLogger.class);
    }

    @Test
    void propertiesBindFromApplicationYml() {
        assertThat(properties.catalog().seed()).extracting(LibraryProperties.SeedBook::title)
            .containsExactly("1984", "To Kill a Mockingbird");
        assertThat(properties.activityLog().tag()).isEqualTo("ActivityLogger");
        assertThat(properties.activityLog().timestampPattern()).isEqualTo("yyyy-MM-dd HH:mm:ss");
    }
}
