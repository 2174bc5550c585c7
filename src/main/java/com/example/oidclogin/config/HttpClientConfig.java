package com.example.oidclogin.config;

import com.example.oidclogin.properties.ApplicationProperties;
import okhttp3.OkHttpClient;
import okhttp3.Protocol;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Arrays;

/**
 * OkHttp client used for discovery and token endpoint calls.
 *
 * Short fixed timeouts and no automatic retries: a failed exchange surfaces
 * immediately and the user restarts the whole flow.
 */
@Configuration
public class HttpClientConfig {

  @Bean
  public OkHttpClient identityProviderHttpClient(ApplicationProperties properties) {
    ApplicationProperties.OkHttpProperties http = properties.http();
    return new OkHttpClient.Builder()
        .protocols(Arrays.asList(Protocol.HTTP_2, Protocol.HTTP_1_1))
        .connectTimeout(http.connectTimeout())
        .readTimeout(http.readTimeout())
        .writeTimeout(http.writeTimeout())
        .retryOnConnectionFailure(false)
        .followRedirects(false)
        .followSslRedirects(false)
        .build();
  }
}
