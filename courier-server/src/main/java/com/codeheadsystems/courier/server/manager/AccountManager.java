package com.codeheadsystems.courier.server.manager;

import com.codeheadsystems.courier.model.ApiResponse;
import com.codeheadsystems.courier.model.CreateUserRequest;
import com.codeheadsystems.courier.model.LoginRequest;
import com.codeheadsystems.courier.model.UpdateUserRequest;
import com.codeheadsystems.courier.model.UserResponse;
import com.codeheadsystems.courier.server.auth.AuthDecision;
import com.codeheadsystems.courier.server.auth.AuthDecision.DenialReason;
import com.codeheadsystems.courier.server.auth.AuthGate;
import com.codeheadsystems.courier.server.auth.PasswordVault;
import com.codeheadsystems.courier.server.auth.TokenService;
import com.codeheadsystems.courier.server.model.Credential;
import com.codeheadsystems.courier.server.model.User;
import com.codeheadsystems.courier.server.model.UserUpdate;
import com.codeheadsystems.courier.server.store.DuplicateUserException;
import com.codeheadsystems.courier.server.store.UserStore;
import java.nio.charset.StandardCharsets;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Framework-agnostic service implementing the account operations.
 * <p>
 * Composes {@link PasswordVault}, {@link TokenService} and {@link AuthGate} with a
 * {@link UserStore} so that framework adapters ({@code AccountResource} for JAX-RS) stay thin.
 * Every outcome is returned as an {@link ApiResponse} envelope:
 * <ul>
 *   <li>{@code Failure} for expected negatives: unknown user, wrong password;</li>
 *   <li>{@code Error} for misuse: rejected token, duplicate email.</li>
 * </ul>
 * <p>
 * <strong>Exception contract</strong> (callers should map these to HTTP responses):
 * <ul>
 *   <li>{@link IllegalArgumentException} for missing or invalid request data, HTTP 400</li>
 *   <li>{@link com.codeheadsystems.courier.server.store.UserStoreException} when the store
 *       fails, HTTP 500</li>
 * </ul>
 */
public class AccountManager {

  static final String NO_SUCH_USER = "No user with email: %s";
  static final String WRONG_PASSWORD = "Password is incorrect";
  static final String BAD_TOKEN = "Failed to validate token";
  static final String INVALID_TOKEN = "Invalid token: %s";
  static final String DELETED = "Successfully deleted %s";

  private static final Logger log = LoggerFactory.getLogger(AccountManager.class);

  private final PasswordVault passwordVault;
  private final TokenService tokenService;
  private final AuthGate authGate;
  private final UserStore userStore;

  /**
   * Instantiates a new Account manager.
   *
   * @param passwordVault the password vault
   * @param tokenService  the token service
   * @param authGate      the auth gate
   * @param userStore     the user store
   */
  public AccountManager(PasswordVault passwordVault, TokenService tokenService, AuthGate authGate,
                        UserStore userStore) {
    this.passwordVault = passwordVault;
    this.tokenService = tokenService;
    this.authGate = authGate;
    this.userStore = userStore;
  }

  /**
   * Registers a new user. The password is hashed before it reaches the store.
   *
   * @param req the registration payload
   * @return the created user without its password hash, or an Error if the email is taken
   * @throws IllegalArgumentException if a required field is missing or the password is too long
   */
  public ApiResponse<?> createUser(CreateUserRequest req) {
    if (req == null) {
      throw new IllegalArgumentException("Missing request body");
    }
    String email = require(req.email(), "email");
    String password = require(req.password(), "password");
    String handle = require(req.handle(), "handle");
    String publicKey = require(req.publicKey(), "public_key");
    log.debug("createUser({})", email);

    User user = new User(email, passwordVault.hash(password), handle,
        publicKey.getBytes(StandardCharsets.UTF_8), null);
    try {
      userStore.insert(user);
    } catch (DuplicateUserException e) {
      log.warn("Rejected registration for existing email {}", email);
      return ApiResponse.error(e.getMessage());
    }
    return ApiResponse.success(toResponse(user));
  }

  /**
   * Verifies a password and issues a session token.
   *
   * @param email the account email
   * @param req   the login payload
   * @return the token string, or a Failure for an unknown user or wrong password
   * @throws IllegalArgumentException if the password is missing
   */
  public ApiResponse<?> login(String email, LoginRequest req) {
    Credential credential = new Credential(
        require(email, "email"),
        require(req == null ? null : req.password(), "password"));
    log.debug("login({})", credential.email());

    Optional<User> user = userStore.find(credential.email());
    if (user.isEmpty()) {
      return noSuchUser(credential.email());
    }
    if (!passwordVault.verify(credential.password(), user.get().passwordHash())) {
      log.debug("Wrong password for {}", credential.email());
      return ApiResponse.failure(WRONG_PASSWORD);
    }
    return ApiResponse.success(tokenService.issue(user.get().email(), user.get().passwordHash()));
  }

  /**
   * Deletes a user. Requires a token issued to that user against the current password.
   *
   * @param email the account email
   * @param token the session token
   * @return a confirmation message, a Failure for an unknown user, or an Error for a refused token
   */
  public ApiResponse<?> deleteUser(String email, String token) {
    log.debug("deleteUser({})", email);
    Optional<User> user = userStore.find(require(email, "email"));
    if (user.isEmpty()) {
      return noSuchUser(email);
    }
    String authorizedHash = user.get().passwordHash();
    AuthDecision decision = authGate.authorize(email, token, authorizedHash);
    if (!decision.authorized()) {
      return refused(email, "delete", decision.reason());
    }
    if (!userStore.delete(email, authorizedHash)) {
      return lostRace(email, "delete");
    }
    log.info("Deleted user {}", email);
    return ApiResponse.success(String.format(DELETED, email));
  }

  /**
   * Updates a user. Requires a token issued to that user against the current password.
   * A new password is hashed before it reaches the store, and from then on every token issued
   * against the old password is refused.
   *
   * @param email the account email
   * @param token the session token
   * @param req   the fields to change
   * @return the updated user, a Failure for an unknown user, or an Error for a refused token
   * @throws IllegalArgumentException if the body is missing or the new password is too long
   */
  public ApiResponse<?> updateUser(String email, String token, UpdateUserRequest req) {
    log.debug("updateUser({})", email);
    if (req == null) {
      throw new IllegalArgumentException("Missing request body");
    }
    Optional<User> user = userStore.find(require(email, "email"));
    if (user.isEmpty()) {
      return noSuchUser(email);
    }
    String authorizedHash = user.get().passwordHash();
    AuthDecision decision = authGate.authorize(email, token, authorizedHash);
    if (!decision.authorized()) {
      return refused(email, "update", decision.reason());
    }
    UserUpdate update = new UserUpdate(
        req.password() == null ? null : passwordVault.hash(require(req.password(), "password")),
        req.handle(),
        req.publicKey() == null ? null : req.publicKey().getBytes(StandardCharsets.UTF_8),
        req.bio());
    return userStore.update(email, authorizedHash, update)
        .<ApiResponse<?>>map(updated -> ApiResponse.success(toResponse(updated)))
        .orElseGet(() -> lostRace(email, "update"));
  }

  /**
   * Looks up a user. Public.
   *
   * @param email the account email
   * @return the user without its password hash, or a Failure
   */
  public ApiResponse<?> getUser(String email) {
    log.debug("getUser({})", email);
    return userStore.find(require(email, "email"))
        .<ApiResponse<?>>map(user -> ApiResponse.success(toResponse(user)))
        .orElseGet(() -> noSuchUser(email));
  }

  /**
   * Lists every registered email. Public.
   *
   * @return the emails in ascending order
   */
  public ApiResponse<?> listUsers() {
    log.debug("listUsers()");
    return ApiResponse.success(userStore.listEmails());
  }

  private static ApiResponse<String> noSuchUser(String email) {
    log.debug("No user with email {}", email);
    return ApiResponse.failure(String.format(NO_SUCH_USER, email));
  }

  // The user was removed or its password changed after the token was checked.
  private ApiResponse<String> lostRace(String email, String operation) {
    if (userStore.find(email).isEmpty()) {
      return noSuchUser(email);
    }
    return refused(email, operation, DenialReason.STALE_CREDENTIAL);
  }

  private static ApiResponse<String> refused(String email, String operation, DenialReason reason) {
    log.warn("Refused {} for {}: {}", operation, email, reason.description());
    if (reason == DenialReason.BAD_TOKEN) {
      return ApiResponse.error(BAD_TOKEN);
    }
    return ApiResponse.error(String.format(INVALID_TOKEN, reason.description()));
  }

  private static UserResponse toResponse(User user) {
    return new UserResponse(
        user.email(),
        user.handle(),
        user.publicKey() == null ? null : new String(user.publicKey(), StandardCharsets.UTF_8),
        user.bio());
  }

  private static String require(String value, String fieldName) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("Missing required field: " + fieldName);
    }
    return value;
  }
}
