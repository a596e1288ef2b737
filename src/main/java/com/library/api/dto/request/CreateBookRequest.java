package com.library.api.dto.request;

public record CreateBookRequest(
    int id,
    String title,
    String author
) {}
