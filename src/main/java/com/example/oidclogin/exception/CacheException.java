package com.example.oidclogin.exception;

/**
 * Token cache I/O failure. Non-fatal: callers log it and continue without caching.
 */
public class CacheException extends RuntimeException {
  public CacheException(String message) {
    super(message);
  }

  public CacheException(String message, Throwable cause) {
    super(message, cause);
  }
}
