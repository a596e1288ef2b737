package com.library.api.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.util.List;

/**
 * Settings bound from the {@code library.*} namespace.
 *
 * <p>The seed list carries no constraints: the catalog accepts any book, so the seed
 * does too.
 */
@Validated
@ConfigurationProperties(prefix = "library")
public record LibraryProperties(

    @Valid
    @DefaultValue
    Catalog catalog,

    @Valid
    @DefaultValue
    ActivityLog activityLog
) {

    public record Catalog(
        @DefaultValue
        List<SeedBook> seed
    ) {}

    public record SeedBook(int id, String title, String author) {}

    public record ActivityLog(

        @NotBlank(message = "Activity log tag must not be blank")
        @DefaultValue("ActivityLogger")
        String tag,

        @NotBlank(message = "Activity log timestamp pattern must not be blank")
        @DefaultValue("yyyy-MM-dd HH:mm:ss")
        String timestampPattern
    ) {}
}
