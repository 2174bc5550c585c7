package com.example.oidclogin.store;

import com.example.oidclogin.domain.entity.CacheEntry;

import java.util.List;
import java.util.Optional;

/**
 * Keyed persistence for token material. Backends (filesystem now, a secret manager later)
 * own the stored bytes; callers never touch them directly.
 *
 * <p>Implementations throw {@link com.example.oidclogin.exception.CacheException} on I/O failure.
 * Expiry is not enforced here.
 */
public interface CredentialStore {

  Optional<CacheEntry> read(String key);

  void write(CacheEntry entry);

  /**
   * @return {@code true} if an entry existed
   */
  boolean delete(String key);

  List<CacheEntry> list();

  void clear();
}
