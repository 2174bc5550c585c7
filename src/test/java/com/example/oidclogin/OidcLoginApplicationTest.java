package com.example.oidclogin;

import com.example.oidclogin.cli.CliExitCodes;
import com.example.oidclogin.service.ExecCredentialService;
import com.example.oidclogin.service.TokenCacheService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(args = "--version")
class OidcLoginApplicationTest {

  @Autowired
  private OidcLoginApplication application;
  @Autowired
  private TokenCacheService tokenCacheService;
  @Autowired
  private ExecCredentialService execCredentialService;

  @Test
  void contextLoadsAndRunsTheCommandLine() {
    assertThat(tokenCacheService).isNotNull();
    assertThat(execCredentialService).isNotNull();
    assertThat(application.getExitCode()).isEqualTo(CliExitCodes.OK);
  }
}
