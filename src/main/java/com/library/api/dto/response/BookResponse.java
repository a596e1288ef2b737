package com.library.api.dto.response;

public record BookResponse(
    int id,
    String title,
    String author
) {}
