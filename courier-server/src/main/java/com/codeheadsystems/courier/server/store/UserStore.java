package com.codeheadsystems.courier.server.store;

import com.codeheadsystems.courier.server.model.User;
import com.codeheadsystems.courier.server.model.UserUpdate;
import java.util.List;
import java.util.Optional;

/**
 * Storage abstraction for user accounts.
 * <p>
 * Implementations must be thread-safe, and each mutating call must be atomic on its own.
 * Typical production implementations back this with a relational database.
 */
public interface UserStore {

  /**
   * Looks up a user by email.
   *
   * @param email the email
   * @return the user, or empty if no user has this email
   */
  Optional<User> find(String email);

  /**
   * Inserts a new user.
   *
   * @param user the user
   * @throws DuplicateUserException if a user with the same email already exists
   */
  void insert(User user);

  /**
   * Applies the non-null fields of {@code update} to the user with the given email, provided
   * its stored password hash still equals {@code expectedPasswordHash}. The check and the write
   * are one atomic step, so a password change that lands first makes this call a no-op.
   *
   * @param email                the email
   * @param expectedPasswordHash the hash the caller authorized against
   * @param update               the fields to change
   * @return the updated user, or empty if no user has this email or its hash has changed
   */
  Optional<User> update(String email, String expectedPasswordHash, UserUpdate update);

  /**
   * Removes the user with the given email, provided its stored password hash still equals
   * {@code expectedPasswordHash}.
   *
   * @param email                the email
   * @param expectedPasswordHash the hash the caller authorized against
   * @return true if a user was removed
   */
  boolean delete(String email, String expectedPasswordHash);

  /**
   * Lists the email of every user, in ascending order.
   *
   * @return the emails
   */
  List<String> listEmails();
}
