package com.example.oidclogin.store;

import com.example.oidclogin.domain.entity.CacheEntry;
import com.example.oidclogin.exception.CacheException;
import com.example.oidclogin.store.dto.CacheFileRecord;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.FileAttribute;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Filesystem backend: one JSON file per key, named by the SHA-256 of the key.
 *
 * <p>Writes go to a temporary file that is renamed over the target while an advisory lock on
 * {@code .lock} is held, so concurrent processes never observe a half-written entry.
 * The directory is owner-only (0700) and so is every entry file (0600) on POSIX filesystems.
 */
@Slf4j
public class FileCredentialStore implements CredentialStore {

  private static final String ENTRY_SUFFIX = ".json";
  private static final String LOCK_FILE = ".lock";
  private static final Set<PosixFilePermission> OWNER_ONLY_FILE = PosixFilePermissions.fromString("rw-------");
  private static final Set<PosixFilePermission> OWNER_ONLY_DIR = PosixFilePermissions.fromString("rwx------");

  private final Path directory;
  private final ObjectMapper objectMapper;
  // FileLock is held per JVM, so threads of this process are serialized separately.
  private final ReentrantLock processLock = new ReentrantLock();

  public FileCredentialStore(Path directory, ObjectMapper objectMapper) {
    this.directory = directory;
    this.objectMapper = objectMapper;
  }

  public Path directory() {
    return directory;
  }

  @Override
  public Optional<CacheEntry> read(String key) {
    Path file = fileFor(key);
    try {
      byte[] content = Files.readAllBytes(file);
      CacheFileRecord record = objectMapper.readValue(content, CacheFileRecord.class);
      if (record == null) {
        throw new CacheException("Cache entry file is empty: " + file.getFileName());
      }
      return Optional.of(record.toEntry());
    } catch (NoSuchFileException e) {
      return Optional.empty();
    } catch (IOException | IllegalArgumentException | DateTimeParseException e) {
      throw new CacheException("Failed to read cache entry " + file.getFileName(), e);
    }
  }

  @Override
  public void write(CacheEntry entry) {
    Path target = fileFor(entry.key());
    withLock(() -> {
      Path temp = Files.createTempFile(directory, ".entry-", ".tmp", ownerOnlyFile());
      try {
        Files.write(temp, objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(CacheFileRecord.from(entry)));
        moveIntoPlace(temp, target);
      } finally {
        Files.deleteIfExists(temp);
      }
      return null;
    }, "write cache entry " + target.getFileName());
  }

  @Override
  public boolean delete(String key) {
    Path target = fileFor(key);
    return withLock(() -> Files.deleteIfExists(target), "delete cache entry " + target.getFileName());
  }

  @Override
  public List<CacheEntry> list() {
    List<CacheEntry> entries = new ArrayList<>();
    if (!Files.isDirectory(directory)) {
      return entries;
    }
    try (DirectoryStream<Path> files = Files.newDirectoryStream(directory, "*" + ENTRY_SUFFIX)) {
      for (Path file : files) {
        try {
          CacheFileRecord record = objectMapper.readValue(file.toFile(), CacheFileRecord.class);
          if (record != null) {
            entries.add(record.toEntry());
          }
        } catch (IOException | RuntimeException e) {
          log.warn("Skipping unreadable cache entry {}: {}", file.getFileName(), e.getMessage());
        }
      }
    } catch (IOException e) {
      throw new CacheException("Failed to list cache directory " + directory, e);
    }
    return entries;
  }

  @Override
  public void clear() {
    withLock(() -> {
      if (!Files.isDirectory(directory)) {
        return null;
      }
      try (DirectoryStream<Path> files = Files.newDirectoryStream(directory, "*" + ENTRY_SUFFIX)) {
        for (Path file : files) {
          Files.deleteIfExists(file);
        }
      }
      return null;
    }, "clear cache directory " + directory);
  }

  Path fileFor(String key) {
    return directory.resolve(hashKey(key) + ENTRY_SUFFIX);
  }

  static String hashKey(String key) {
    try {
      MessageDigest digest = MessageDigest.getInstance("SHA-256");
      return HexFormat.of().formatHex(digest.digest(key.getBytes(StandardCharsets.UTF_8)));
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 algorithm not available", e);
    }
  }

  private <T> T withLock(IoAction<T> action, String description) {
    processLock.lock();
    try {
      ensureDirectory();
      try (FileChannel channel = FileChannel.open(directory.resolve(LOCK_FILE),
                                                  StandardOpenOption.CREATE, StandardOpenOption.WRITE);
           FileLock ignored = channel.lock()) {
        return action.run();
      }
    } catch (IOException e) {
      throw new CacheException("Failed to " + description, e);
    } finally {
      processLock.unlock();
    }
  }

  private void ensureDirectory() throws IOException {
    if (Files.isDirectory(directory)) {
      return;
    }
    try {
      if (supportsPosix()) {
        Files.createDirectories(directory, PosixFilePermissions.asFileAttribute(OWNER_ONLY_DIR));
      } else {
        Files.createDirectories(directory);
      }
    } catch (FileAlreadyExistsException e) {
      if (!Files.isDirectory(directory)) {
        throw e;
      }
    }
  }

  private void moveIntoPlace(Path temp, Path target) throws IOException {
    try {
      Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    } catch (AtomicMoveNotSupportedException e) {
      Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
    }
  }

  private FileAttribute<?>[] ownerOnlyFile() {
    return supportsPosix()
        ? new FileAttribute<?>[] {PosixFilePermissions.asFileAttribute(OWNER_ONLY_FILE)}
        : new FileAttribute<?>[0];
  }

  private boolean supportsPosix() {
    return directory.getFileSystem().supportedFileAttributeViews().contains("posix");
  }

  @FunctionalInterface
  private interface IoAction<T> {
    T run() throws IOException;
  }
}
