package com.codeheadsystems.courier.server.store;

import com.codeheadsystems.courier.server.model.User;
import com.codeheadsystems.courier.server.model.UserUpdate;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-persistent in-memory {@link UserStore} backed by a {@link ConcurrentHashMap}.
 * <p>
 * All accounts are lost on server restart. Suitable for development and
 * integration testing only; use {@link HibernateUserStore} for production.
 */
public class InMemoryUserStore implements UserStore {

  private static final Logger log = LoggerFactory.getLogger(InMemoryUserStore.class);

  private final ConcurrentHashMap<String, User> users = new ConcurrentHashMap<>();

  public InMemoryUserStore() {
    log.warn("Using InMemoryUserStore: accounts will NOT survive restarts. "
        + "Configure a database for production.");
  }

  @Override
  public Optional<User> find(String email) {
    return Optional.ofNullable(users.get(email));
  }

  @Override
  public void insert(User user) {
    if (users.putIfAbsent(user.email(), user) != null) {
      throw new DuplicateUserException(user.email(), null);
    }
    log.debug("Stored user {}", user.email());
  }

  @Override
  public Optional<User> update(String email, String expectedPasswordHash, UserUpdate update) {
    AtomicReference<User> updated = new AtomicReference<>();
    users.computeIfPresent(email, (k, existing) -> {
      if (!existing.passwordHash().equals(expectedPasswordHash)) {
        return existing;
      }
      User merged = existing.merge(update);
      updated.set(merged);
      return merged;
    });
    return Optional.ofNullable(updated.get());
  }

  @Override
  public boolean delete(String email, String expectedPasswordHash) {
    AtomicBoolean removed = new AtomicBoolean();
    users.computeIfPresent(email, (k, existing) -> {
      if (!existing.passwordHash().equals(expectedPasswordHash)) {
        return existing;
      }
      removed.set(true);
      return null;
    });
    return removed.get();
  }

  @Override
  public List<String> listEmails() {
    return users.keySet().stream().sorted().toList();
  }
}
