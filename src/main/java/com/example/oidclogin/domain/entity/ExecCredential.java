package com.example.oidclogin.domain.entity;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Kubernetes {@code ExecCredential} document written to standard output by the exec plugin.
 */
@JsonPropertyOrder({"apiVersion", "kind", "status"})
public record ExecCredential(
    String apiVersion,
    String kind,
    Status status
) {

  public static final String KIND = "ExecCredential";

  public static ExecCredential of(String apiVersion, String token, String expirationTimestamp) {
    return new ExecCredential(apiVersion, KIND, new Status(token, expirationTimestamp));
  }

  @JsonPropertyOrder({"token", "expirationTimestamp"})
  public record Status(String token, String expirationTimestamp) {

    @Override
    public String toString() {
      return "Status[expirationTimestamp=" + expirationTimestamp + "]";
    }
  }
}
