package com.library.api.mapper;

import com.library.api.config.LibraryProperties;
import com.library.api.dto.request.CreateBookRequest;
import com.library.api.dto.response.BookResponse;
import com.library.api.entity.Book;

import java.util.List;

public final class BookMapper {

    private BookMapper() {}

    public static Book toEntity(CreateBookRequest request) {
        return new Book(request.id(), request.title(), request.author());
    }

    public static Book toEntity(LibraryProperties.SeedBook seed) {
        return new Book(seed.id(), seed.title(), seed.author());
    }

    public static BookResponse toResponse(Book book) {
        return new BookResponse(book.getId(), book.getTitle(), book.getAuthor());
    }

    public static List<BookResponse> toResponses(List<Book> books) {
        return books.stream()
            .map(BookMapper::toResponse)
            .toList();
    }
}
