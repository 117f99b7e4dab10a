package com.codeheadsystems.courier.app;

import com.codeheadsystems.courier.dropwizard.CourierBundle;
import com.codeheadsystems.courier.dropwizard.CourierConfiguration;
import io.dropwizard.configuration.EnvironmentVariableSubstitutor;
import io.dropwizard.configuration.SubstitutingSourceProvider;
import io.dropwizard.core.Application;
import io.dropwizard.core.setup.Bootstrap;
import io.dropwizard.core.setup.Environment;

/**
 * Runnable courier account service.
 * <p>
 * Start with {@code java -jar courier-app.jar server config/config.yml}. The store, signing
 * secret, token lifetime and bcrypt cost all come from the YAML file, which is read once at
 * start-up.
 */
public class CourierServerApplication extends Application<CourierConfiguration> {

  /**
   * The entry point of application.
   *
   * @param args the input arguments
   * @throws Exception the exception
   */
  public static void main(String[] args) throws Exception {
    new CourierServerApplication().run(args);
  }

  @Override
  public String getName() {
    return "courier";
  }

  @Override
  public void initialize(Bootstrap<CourierConfiguration> bootstrap) {
    // Allow ${ENV_VAR:-default} substitution so deployments can override single keys,
    // e.g. COURIER_TOKEN_SECRET_HEX, without replacing the whole file.
    bootstrap.setConfigurationSourceProvider(
        new SubstitutingSourceProvider(
            bootstrap.getConfigurationSourceProvider(),
            new EnvironmentVariableSubstitutor(false)
        )
    );
    bootstrap.addBundle(new CourierBundle<>());
  }

  @Override
  public void run(CourierConfiguration configuration, Environment environment) {
    // Everything is registered by CourierBundle
  }
}
