package com.codeheadsystems.courier.dropwizard;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.dropwizard.core.Configuration;
import io.dropwizard.db.DataSourceFactory;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;

/**
 * Dropwizard configuration for the courier account service.
 * <p>
 * For production, supply {@code tokenSecretHex} (at least 32 random bytes, hex-encoded) so that
 * session tokens survive restarts and are accepted by every instance, and a {@code database}
 * block so that accounts are persisted. Omitting either falls back to a development default
 * and logs a warning.
 * <p>
 * Generate a secret with: {@code openssl rand -hex 32}
 */
public class CourierConfiguration extends Configuration {

  /**
   * Hex-encoded HMAC-SHA256 signing secret for session tokens.
   * Leave empty for random generation (dev only, tokens become invalid on restart).
   */
  private String tokenSecretHex = "";

  /**
   * Session token lifetime in hours.
   */
  @Min(1)
  private long tokenTtlHours = 24;

  /**
   * bcrypt cost factor; each increment doubles the hashing time.
   */
  @Min(4)
  @Max(31)
  private int bcryptCost = 12;

  /**
   * Database connection settings for the Hibernate-backed store. When absent, accounts are kept
   * in memory.
   */
  @Valid
  private DataSourceFactory database;

  /**
   * Gets token secret hex.
   *
   * @return the token secret hex
   */
  @JsonProperty
  public String getTokenSecretHex() {
    return tokenSecretHex;
  }

  /**
   * Sets token secret hex.
   *
   * @param tokenSecretHex the token secret hex
   */
  @JsonProperty
  public void setTokenSecretHex(String tokenSecretHex) {
    this.tokenSecretHex = tokenSecretHex;
  }

  /**
   * Gets token ttl hours.
   *
   * @return the token ttl hours
   */
  @JsonProperty
  public long getTokenTtlHours() {
    return tokenTtlHours;
  }

  /**
   * Sets token ttl hours.
   *
   * @param tokenTtlHours the token ttl hours
   */
  @JsonProperty
  public void setTokenTtlHours(long tokenTtlHours) {
    this.tokenTtlHours = tokenTtlHours;
  }

  @JsonProperty
  public int getBcryptCost() {
    return bcryptCost;
  }

  @JsonProperty
  public void setBcryptCost(int bcryptCost) {
    this.bcryptCost = bcryptCost;
  }

  /**
   * Gets the database settings.
   *
   * @return the data source factory, or null when no database is configured
   */
  @JsonProperty
  public DataSourceFactory getDatabase() {
    return database;
  }

  @JsonProperty
  public void setDatabase(DataSourceFactory database) {
    this.database = database;
  }
}
