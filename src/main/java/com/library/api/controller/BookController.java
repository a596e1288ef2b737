package com.library.api.controller;

import com.library.api.dto.request.CreateBookRequest;
import com.library.api.dto.response.BookResponse;
import com.library.api.entity.Book;
import com.library.api.mapper.BookMapper;
import com.library.api.service.ActivityLogger;
import com.library.api.service.BookService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.List;

@RestController
@RequestMapping("/api/books")
@RequiredArgsConstructor
@Tag(name = "Books", description = "Book catalog operations")
public class BookController {

    private final BookService bookService;
    private final ActivityLogger activityLogger;

    @GetMapping
    @Operation(summary = "List all books", description = "Returns every book in insertion order.")
    public ResponseEntity<List<BookResponse>> findAll() {
        activityLogger.log("GET all books");
        return ResponseEntity.ok(BookMapper.toResponses(bookService.findAll()));
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get book by ID", description = "Resolves to the first book added with this ID.")
    @ApiResponse(responseCode = "200", description = "Book found")
    @ApiResponse(responseCode = "404", description = "Book not found")
    public ResponseEntity<BookResponse> findById(@PathVariable int id) {
        activityLogger.log("GET book with id " + id);
        return bookService.findById(id)
            .map(BookMapper::toResponse)
            .map(ResponseEntity::ok)
            .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @PostMapping
    @Operation(summary = "Add a book", description = "Appends the book as given. IDs are assigned by the caller and not checked for uniqueness.")
    @ApiResponse(responseCode = "201", description = "Book added")
    public ResponseEntity<BookResponse> create(@RequestBody CreateBookRequest request,
                                               UriComponentsBuilder uriBuilder) {
        Book book = BookMapper.toEntity(request);
        bookService.add(book);
        activityLogger.log("POST book with id " + book.getId() + ", title '" + book.getTitle() + "'");

        URI location = uriBuilder.path("/api/books/{id}").buildAndExpand(book.getId()).toUri();
        return ResponseEntity.created(location).body(BookMapper.toResponse(book));
    }

    @DeleteMapping("/{id}")
    @Operation(summary = "Delete a book", description = "Removes the first book with this ID. Deleting an unknown ID is a no-op.")
    @ApiResponse(responseCode = "204", description = "Book deleted, or no such book")
    public ResponseEntity<Void> delete(@PathVariable int id) {
        bookService.delete(id);
        activityLogger.log("DELETE book with id " + id);
        return ResponseEntity.noContent().build();
    }
}
