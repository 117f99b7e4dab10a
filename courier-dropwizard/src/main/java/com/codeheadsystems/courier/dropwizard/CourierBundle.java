package com.codeheadsystems.courier.dropwizard;

import com.codeheadsystems.courier.dropwizard.health.TokenServiceHealthCheck;
import com.codeheadsystems.courier.dropwizard.health.UserStoreHealthCheck;
import com.codeheadsystems.courier.server.auth.AuthGate;
import com.codeheadsystems.courier.server.auth.PasswordVault;
import com.codeheadsystems.courier.server.auth.SigningSecret;
import com.codeheadsystems.courier.server.auth.TokenService;
import com.codeheadsystems.courier.server.manager.AccountManager;
import com.codeheadsystems.courier.server.resource.AccountResource;
import com.codeheadsystems.courier.server.store.HibernateUserStore;
import com.codeheadsystems.courier.server.store.InMemoryUserStore;
import com.codeheadsystems.courier.server.store.UserEntity;
import com.codeheadsystems.courier.server.store.UserStore;
import io.dropwizard.core.ConfiguredBundle;
import io.dropwizard.core.setup.Bootstrap;
import io.dropwizard.core.setup.Environment;
import io.dropwizard.db.PooledDataSourceFactory;
import io.dropwizard.hibernate.HibernateBundle;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Dropwizard bundle that wires the courier account service into an existing Dropwizard
 * application.
 * <p>
 * Registers the account JAX-RS resource and the {@code token-service} and {@code user-store}
 * health checks. Requires a {@link CourierConfiguration} block in the application's YAML config.
 * <p>
 * Embed in your application and let the configuration pick the store:
 * <pre>{@code
 *   bootstrap.addBundle(new CourierBundle<>());
 * }</pre>
 * With a {@code database} block the bundle runs a {@link HibernateBundle} for {@link UserEntity}
 * (which also registers the {@code courier-db} health check) and backs accounts with a
 * {@link HibernateUserStore}; without one it falls back to an {@link InMemoryUserStore}.
 * Set {@code hibernate.hbm2ddl.auto} under {@code database.properties} to let Hibernate create
 * the table.
 * <p>
 * Or supply your own store:
 * <pre>{@code
 *   bootstrap.addBundle(new CourierBundle<>(myUserStore));
 * }</pre>
 */
@Singleton
public class CourierBundle<C extends CourierConfiguration> implements ConfiguredBundle<C> {

  static final String DATABASE_NAME = "courier-db";

  private static final Logger log = LoggerFactory.getLogger(CourierBundle.class);

  private final UserStore suppliedStore;
  private final SecureRandom secureRandom = new SecureRandom();
  private final HibernateBundle<C> hibernateBundle = new HibernateBundle<>(UserEntity.class) {
    @Override
    public PooledDataSourceFactory getDataSourceFactory(C configuration) {
      return configuration.getDatabase();
    }

    @Override
    protected String name() {
      return DATABASE_NAME;
    }
  };

  private UserStore userStore;
  private TokenService tokenService;

  /**
   * Creates a bundle whose user store is chosen from the configuration.
   */
  public CourierBundle() {
    this.suppliedStore = null;
  }

  /**
   * Creates a bundle backed by the supplied store. The {@code database} block, if any, is ignored.
   *
   * @param userStore the user store
   */
  @Inject
  public CourierBundle(UserStore userStore) {
    this.suppliedStore = userStore;
  }

  @Override
  public void initialize(Bootstrap<?> bootstrap) {
    hibernateBundle.initialize(bootstrap);
  }

  @Override
  public void run(C configuration, Environment environment) throws Exception {
    userStore = buildUserStore(configuration, environment);
    tokenService = new TokenService(buildSigningSecret(configuration),
        Duration.ofHours(configuration.getTokenTtlHours()), Clock.systemUTC());
    PasswordVault passwordVault = new PasswordVault(secureRandom, configuration.getBcryptCost());
    AccountManager accountManager =
        new AccountManager(passwordVault, tokenService, new AuthGate(tokenService), userStore);

    environment.jersey().register(new AccountResource(accountManager));
    environment.healthChecks().register("token-service", new TokenServiceHealthCheck(tokenService));
    environment.healthChecks().register("user-store", new UserStoreHealthCheck(userStore));
    log.info("Courier account service ready (bcrypt cost {}, token ttl {}h, store {})",
        passwordVault.cost(), configuration.getTokenTtlHours(), userStore.getClass().getSimpleName());
  }

  /**
   * The store in use, available after {@link #run}.
   *
   * @return the user store
   */
  public UserStore getUserStore() {
    return userStore;
  }

  /**
   * The token service in use, available after {@link #run}.
   *
   * @return the token service
   */
  public TokenService getTokenService() {
    return tokenService;
  }

  private UserStore buildUserStore(C configuration, Environment environment) throws Exception {
    if (suppliedStore != null) {
      return suppliedStore;
    }
    if (configuration.getDatabase() == null) {
      return new InMemoryUserStore();
    }
    hibernateBundle.run(configuration, environment);
    return new HibernateUserStore(hibernateBundle.getSessionFactory());
  }

  private SigningSecret buildSigningSecret(C configuration) {
    String secretHex = configuration.getTokenSecretHex();
    if (secretHex == null || secretHex.isEmpty()) {
      log.warn("No token secret configured, generating randomly. "
          + "Tokens will be invalidated on restart. Do not use in production.");
      return SigningSecret.random(secureRandom);
    }
    try {
      return SigningSecret.fromHex(secretHex);
    } catch (IllegalArgumentException e) {
      throw new IllegalStateException("tokenSecretHex must be at least "
          + SigningSecret.MIN_LENGTH_BYTES + " hex-encoded bytes", e);
    }
  }
}
