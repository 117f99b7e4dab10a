package com.codeheadsystems.courier.dropwizard;

import io.dropwizard.core.Application;
import io.dropwizard.core.setup.Bootstrap;
import io.dropwizard.core.setup.Environment;

/**
 * Minimal Dropwizard application used only in integration tests.
 */
public class CourierApplication extends Application<CourierConfiguration> {

  private final CourierBundle<CourierConfiguration> bundle = new CourierBundle<>();

  @Override
  public String getName() {
    return "courier-test";
  }

  @Override
  public void initialize(Bootstrap<CourierConfiguration> bootstrap) {
    bootstrap.addBundle(bundle);
  }

  @Override
  public void run(CourierConfiguration configuration, Environment environment) {
    // Everything is registered by the bundle
  }

  public CourierBundle<CourierConfiguration> getBundle() {
    return bundle;
  }
}
