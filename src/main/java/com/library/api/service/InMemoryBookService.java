package com.library.api.service;

import com.library.api.entity.Book;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link BookService} backed by a list held in memory for the lifetime of the
 * application context.
 *
 * <p><strong>Locking</strong>: requests arrive on several servlet threads, so every
 * operation holds the monitor of {@link #books} for its whole duration. That single
 * coarse lock is the only guarantee offered; there is no ordering between concurrent
 * callers.
 *
 * <p>{@link #findAll()} copies the sequence under the lock, so callers can iterate it
 * without holding the monitor, while the elements stay the catalog's own instances.
 */
public class InMemoryBookService implements BookService {

    private static final Logger log = LoggerFactory.getLogger(InMemoryBookService.class);

    private final List<Book> books;

    public InMemoryBookService(List<Book> seed) {
        this.books = new ArrayList<>(seed);
        log.info("Book catalog initialized with {} seed book(s)", books.size());
    }

    @Override
    public List<Book> findAll() {
        synchronized (books) {
            return List.copyOf(books);
        }
    }

    @Override
    public Optional<Book> findById(int id) {
        synchronized (books) {
            return Optional.ofNullable(firstMatch(id));
        }
    }

    @Override
    public void add(Book book) {
        Objects.requireNonNull(book, "book");
        synchronized (books) {
            books.add(book);
        }
        log.debug("Added book {}", book);
    }

    @Override
    public void delete(int id) {
        Book removed;
        synchronized (books) {
            removed = firstMatch(id);
            if (removed != null) {
                removeInstance(removed);
            }
        }
        if (removed != null) {
            log.debug("Deleted book {}", removed);
        }
    }

    private Book firstMatch(int id) {
        for (Book book : books) {
            if (book.getId() == id) {
                return book;
            }
        }
        return null;
    }

    // List.remove(Object) would go through equals(); entries are compared by identity.
    private void removeInstance(Book book) {
        for (int i = 0; i < books.size(); i++) {
            if (books.get(i) == book) {
                books.remove(i);
                return;
            }
        }
    }
}
