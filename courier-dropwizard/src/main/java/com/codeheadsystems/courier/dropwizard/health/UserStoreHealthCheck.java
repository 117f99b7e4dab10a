package com.codeheadsystems.courier.dropwizard.health;

import com.codahale.metrics.health.HealthCheck;
import com.codeheadsystems.courier.server.store.UserStore;

/**
 * Health check that performs a lookup against the user store.
 */
public class UserStoreHealthCheck extends HealthCheck {

  private final UserStore userStore;

  /**
   * Instantiates a new User store health check.
   *
   * @param userStore the user store
   */
  public UserStoreHealthCheck(UserStore userStore) {
    this.userStore = userStore;
  }

  @Override
  protected Result check() {
    userStore.find(TokenServiceHealthCheck.PROBE_EMAIL);
    return Result.healthy("%s reachable", userStore.getClass().getSimpleName());
  }
}
