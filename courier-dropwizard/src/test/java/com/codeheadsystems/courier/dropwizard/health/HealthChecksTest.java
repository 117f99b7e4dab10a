package com.codeheadsystems.courier.dropwizard.health;

import static org.assertj.core.api.Assertions.assertThat;

import com.codahale.metrics.health.HealthCheck;
import com.codeheadsystems.courier.server.auth.SigningSecret;
import com.codeheadsystems.courier.server.auth.TokenService;
import com.codeheadsystems.courier.server.model.User;
import com.codeheadsystems.courier.server.model.UserUpdate;
import com.codeheadsystems.courier.server.store.InMemoryUserStore;
import com.codeheadsystems.courier.server.store.UserStore;
import com.codeheadsystems.courier.server.store.UserStoreException;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class HealthChecksTest {

  @Test
  void tokenService_healthy() {
    TokenService tokenService = new TokenService(SigningSecret.random(new SecureRandom()));

    HealthCheck.Result result = new TokenServiceHealthCheck(tokenService).execute();

    assertThat(result.isHealthy()).isTrue();
    assertThat(result.getMessage()).contains("PT24H");
  }

  @Test
  void tokenService_unhealthyWhenTokensExpireBeforeValidation() {
    // Each reading is two days after the previous one.
    Clock jumping = new Clock() {
      private int calls;

      @Override
      public ZoneOffset getZone() {
        return ZoneOffset.UTC;
      }

      @Override
      public Clock withZone(ZoneId zone) {
        return this;
      }

      @Override
      public Instant instant() {
        return Instant.parse("2026-01-01T00:00:00Z").plus(Duration.ofDays(2L * calls++));
      }
    };
    TokenService tokenService = new TokenService(SigningSecret.random(new SecureRandom()),
        Duration.ofHours(1), jumping);

    HealthCheck.Result result = new TokenServiceHealthCheck(tokenService).execute();

    assertThat(result.isHealthy()).isFalse();
  }

  @Test
  void userStore_healthy() {
    HealthCheck.Result result = new UserStoreHealthCheck(new InMemoryUserStore()).execute();

    assertThat(result.isHealthy()).isTrue();
    assertThat(result.getMessage()).contains("InMemoryUserStore");
  }

  @Test
  void userStore_unhealthyWhenStoreThrows() {
    UserStore broken = new UserStore() {
      @Override
      public Optional<User> find(String email) {
        throw new UserStoreException("db down", null);
      }

      @Override
      public void insert(User user) {
        throw new UserStoreException("db down", null);
      }

      @Override
      public Optional<User> update(String email, String expectedPasswordHash, UserUpdate update) {
        throw new UserStoreException("db down", null);
      }

      @Override
      public boolean delete(String email, String expectedPasswordHash) {
        throw new UserStoreException("db down", null);
      }

      @Override
      public List<String> listEmails() {
        throw new UserStoreException("db down", null);
      }
    };

    HealthCheck.Result result = new UserStoreHealthCheck(broken).execute();

    assertThat(result.isHealthy()).isFalse();
    assertThat(result.getError()).isInstanceOf(UserStoreException.class);
  }
}
