package com.example.oidclogin.cli;

import com.example.oidclogin.domain.entity.CacheEntryView;
import com.example.oidclogin.service.TokenCacheService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CacheCommandTest {

  @Mock
  private TokenCacheService tokenCacheService;

  private final StringWriter out = new StringWriter();
  private CommandLine commandLine;

  @BeforeEach
  void setUp() {
    commandLine = new CommandLine(new CacheCommand(tokenCacheService))
        .setExecutionExceptionHandler(new CliExceptionHandler())
        .setOut(new PrintWriter(out))
        .setErr(new PrintWriter(new StringWriter()));
  }

  @Test
  void listPrintsOneRowPerEntry() {
    Instant expires = Instant.parse("2024-05-01T11:00:00Z");
    when(tokenCacheService.list()).thenReturn(List.of(new CacheEntryView(
        "itl-cli@https://idp/realms/test", "test", "https://idp/realms/test", "itl-cli", "Bearer", "openid",
        expires, Instant.parse("2024-05-01T10:00:00Z"), true, false, true)));

    assertThat(commandLine.execute("list")).isZero();

    assertThat(out.toString())
        .contains("KEY")
        .contains("itl-cli@https://idp/realms/test")
        .contains("near-expiry");
  }

  @Test
  void clearWithKeyDeletesOneEntry() {
    when(tokenCacheService.delete("some-key")).thenReturn(true);

    assertThat(commandLine.execute("clear", "--key", "some-key")).isZero();

    assertThat(out.toString()).contains("Removed cache entry 'some-key'");
  }

  @Test
  void clearWithoutKeyClearsEverything() {
    assertThat(commandLine.execute("clear")).isZero();

    verify(tokenCacheService).clear();
  }

  @Test
  void missingSubcommandIsAUsageError() {
    assertThat(commandLine.execute()).isEqualTo(CliExitCodes.USAGE);
  }
}
