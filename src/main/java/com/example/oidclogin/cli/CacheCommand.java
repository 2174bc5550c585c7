package com.example.oidclogin.cli;

import com.example.oidclogin.domain.entity.CacheEntryView;
import com.example.oidclogin.service.TokenCacheService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.List;

/**
 * Inspects and clears the token cache. Listings never include token values.
 */
@Component
@RequiredArgsConstructor
@Command(name = "cache", mixinStandardHelpOptions = true, description = "Inspect or clear the token cache.")
public class CacheCommand implements Runnable {

  private static final String ROW_FORMAT = "%-50s %-22s %-22s %-12s %s%n";

  private final TokenCacheService tokenCacheService;

  @Spec
  CommandSpec spec;

  @Override
  public void run() {
    throw new CommandLine.ParameterException(spec.commandLine(), "Missing required subcommand: list or clear");
  }

  @Command(name = "list", description = "List cached identities and their expiry.")
  int list() {
    List<CacheEntryView> entries = tokenCacheService.list();
    PrintWriter out = spec.commandLine().getOut();
    if (entries.isEmpty()) {
      out.println("Token cache is empty.");
      out.flush();
      return CliExitCodes.OK;
    }

    out.printf(ROW_FORMAT, "KEY", "EXPIRES", "CACHED", "STATUS", "REFRESH");
    for (CacheEntryView entry : entries) {
      out.printf(ROW_FORMAT, entry.key(), entry.expiresAt(), entry.cachedAt(), status(entry),
          entry.hasRefreshToken() ? "yes" : "no");
    }
    out.flush();
    return CliExitCodes.OK;
  }

  @Command(name = "clear", description = "Delete one cached entry, or all of them.")
  int clear(@Option(names = {"-k", "--key"}, description = "Only delete this key.") String key) {
    PrintWriter out = spec.commandLine().getOut();
    if (key != null) {
      boolean deleted = tokenCacheService.delete(key);
      out.println(deleted ? "Removed cache entry '" + key + "'." : "No cache entry '" + key + "'.");
    } else {
      tokenCacheService.clear();
      out.println("Token cache cleared.");
    }
    out.flush();
    return CliExitCodes.OK;
  }

  private static String status(CacheEntryView entry) {
    if (entry.expired()) {
      return "expired";
    }
    return entry.nearExpiry() ? "near-expiry" : "valid";
  }
}
