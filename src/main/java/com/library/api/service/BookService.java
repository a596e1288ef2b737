package com.library.api.service;

import com.library.api.entity.Book;

import java.util.List;
import java.util.Optional;

/**
 * The book catalog.
 *
 * <p>Every operation is total: an unknown id is a normal outcome, reported as an empty
 * {@link Optional} by {@link #findById(int)} and ignored by {@link #delete(int)}.
 * Ids are not required to be unique; lookups resolve to the first entry in insertion
 * order.
 */
public interface BookService {

    /**
     * Returns every entry in insertion order. The elements are the live catalog
     * entries, not copies.
     */
    List<Book> findAll();

    /** Returns the first entry with the given id, if any. */
    Optional<Book> findById(int id);

    /**
     * Appends the book to the end of the catalog without any uniqueness check.
     *
     * @throws NullPointerException if {@code book} is null
     */
    void add(Book book);

    /** Removes the entry {@link #findById(int)} would return; does nothing when absent. */
    void delete(int id);
}
