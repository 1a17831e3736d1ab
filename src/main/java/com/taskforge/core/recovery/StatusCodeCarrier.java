package com.taskforge.core.recovery;

/**
 * Implemented by capability exceptions that know the upstream status code.
 */
public interface StatusCodeCarrier {

    int statusCode();
}
