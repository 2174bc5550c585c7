package com.example.oidclogin.config;

import com.example.oidclogin.properties.ApplicationProperties;
import com.example.oidclogin.service.ContextService;
import com.example.oidclogin.service.TokenCacheService;
import com.example.oidclogin.store.FileCredentialStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wires the two file-backed credential stores: the per-identity token cache and the
 * single current login context.
 */
@Configuration
public class StoreConfig {

  @Bean
  public TokenCacheService tokenCacheService(ApplicationProperties properties,
                                             ObjectMapper objectMapper,
                                             Clock clock) {
    ApplicationProperties.CacheProperties cache = properties.cache();
    return new TokenCacheService(
        new FileCredentialStore(cache.directory(), objectMapper),
        cache.refreshWindow(),
        clock);
  }

  @Bean
  public ContextService contextService(ApplicationProperties properties,
                                       ObjectMapper objectMapper,
                                       Clock clock) {
    return new ContextService(
        new FileCredentialStore(properties.cache().contextDirectory(), objectMapper),
        clock);
  }
}
