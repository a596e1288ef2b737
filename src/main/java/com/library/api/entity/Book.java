package com.library.api.entity;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

/**
 * A catalog entry.
 *
 * <p>The {@code id} is assigned by the caller and is unique only by convention: the
 * catalog accepts duplicates, empty titles and negative ids alike.
 *
 * <p><strong>Identity</strong>: no {@code equals}/{@code hashCode} override. Two entries
 * sharing an id are still distinct entries, and the catalog removes an entry by
 * reference, so object identity is the correct equality here.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@ToString
public class Book {

    private int id;

    private String title;

    private String author;
}
