package com.example.oidclogin.store;

import com.example.oidclogin.domain.entity.CacheEntry;
import com.example.oidclogin.domain.entity.TokenSet;
import com.example.oidclogin.exception.CacheException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class FileCredentialStoreTest {

  private static final Instant EXPIRES = Instant.parse("2024-05-01T11:00:00Z");
  private static final Instant CACHED = Instant.parse("2024-05-01T10:00:00Z");

  @TempDir
  Path tempDir;

  private Path directory;
  private FileCredentialStore store;

  @BeforeEach
  void setUp() {
    directory = tempDir.resolve("cache");
    store = new FileCredentialStore(directory, new ObjectMapper());
  }

  @Test
  void writesAndReadsEntry() {
    CacheEntry entry = entry("itl-cli@https://idp/realms/test", "access-1");

    store.write(entry);

    assertThat(store.read(entry.key())).contains(entry);
  }

  @Test
  void missingKeyReadsAsEmpty() {
    assertThat(store.read("nobody")).isEmpty();
  }

  @Test
  void fileIsNamedByKeyHashAndHoldsNoPlainKeyInTheName() {
    CacheEntry entry = entry("itl-cli@https://idp/realms/test", "access-1");

    store.write(entry);

    Path file = store.fileFor(entry.key());
    assertThat(file).exists();
    assertThat(file.getFileName().toString()).matches("[0-9a-f]{64}\\.json");
  }

  @Test
  void entryFilesAndDirectoryAreOwnerOnly() throws Exception {
    assumeTrue(directory.getFileSystem().supportedFileAttributeViews().contains("posix"));
    CacheEntry entry = entry("key", "access-1");

    store.write(entry);

    assertThat(PosixFilePermissions.toString(Files.getPosixFilePermissions(store.fileFor("key"))))
        .isEqualTo("rw-------");
    assertThat(PosixFilePermissions.toString(Files.getPosixFilePermissions(directory)))
        .isEqualTo("rwx------");
  }

  @Test
  void overwriteReplacesEntryAndLeavesNoTemporaryFiles() throws Exception {
    store.write(entry("key", "access-1"));
    store.write(entry("key", "access-2"));

    assertThat(store.read("key")).hasValueSatisfying(e -> assertThat(e.tokens().accessToken()).isEqualTo("access-2"));
    try (var files = Files.list(directory)) {
      assertThat(files.map(p -> p.getFileName().toString()))
          .noneMatch(name -> name.endsWith(".tmp"));
    }
  }

  @Test
  void cacheFileUsesSnakeCaseFields() throws Exception {
    store.write(entry("key", "access-1"));

    String json = Files.readString(store.fileFor("key"));

    assertThat(json)
        .contains("\"access_token\"")
        .contains("\"refresh_token\"")
        .contains("\"expires_at\" : \"2024-05-01T11:00:00Z\"")
        .contains("\"cached_at\" : \"2024-05-01T10:00:00Z\"");
  }

  @Test
  void deleteListAndClear() {
    store.write(entry("a", "access-a"));
    store.write(entry("b", "access-b"));

    assertThat(store.list()).extracting(CacheEntry::key).containsExactlyInAnyOrder("a", "b");
    assertThat(store.delete("a")).isTrue();
    assertThat(store.delete("a")).isFalse();

    store.clear();

    assertThat(store.list()).isEmpty();
  }

  @Test
  void corruptFileIsACacheErrorOnReadAndSkippedOnList() throws Exception {
    store.write(entry("good", "access-1"));
    Files.writeString(store.fileFor("bad"), "{ not json");

    assertThatThrownBy(() -> store.read("bad")).isInstanceOf(CacheException.class);
    assertThat(store.list()).extracting(CacheEntry::key).containsExactly("good");
  }

  @Test
  void listOfMissingDirectoryIsEmpty() {
    assertThat(store.list()).isEmpty();
  }

  private static CacheEntry entry(String key, String accessToken) {
    TokenSet tokens = new TokenSet(accessToken, "refresh", "id", "Bearer", EXPIRES, "openid");
    return new CacheEntry(key, "test", "https://idp/realms/test", "itl-cli", tokens, CACHED);
  }
}
