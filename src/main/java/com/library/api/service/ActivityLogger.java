package com.library.api.service;

/**
 * Records a human-readable line for each catalog access.
 */
public interface ActivityLogger {

    void log(String message);
}
