package com.codeheadsystems.courier.client.accessor;

import com.codeheadsystems.courier.client.exceptions.AccountAccessorException;
import com.codeheadsystems.courier.client.model.AccountResult;
import com.codeheadsystems.courier.client.model.ServerConnectionInfo;
import com.codeheadsystems.courier.model.CreateUserRequest;
import com.codeheadsystems.courier.model.LoginRequest;
import com.codeheadsystems.courier.model.Status;
import com.codeheadsystems.courier.model.UpdateUserRequest;
import com.codeheadsystems.courier.model.UserResponse;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.List;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP client for the account endpoints exposed by {@code courier-server}.
 * <p>
 * The {@code endpoint} in {@link ServerConnectionInfo} is the base URL of the server
 * (e.g. {@code http://host:8080}); path segments are appended per endpoint, with the email and
 * token path parameters URL-encoded.
 * <p>
 * Every call returns an {@link AccountResult}: {@code Failure} and {@code Error} envelopes are
 * ordinary results, not exceptions. I/O errors, interruptions, HTTP status codes of 400 and
 * above, and bodies that are not envelopes are wrapped in {@link AccountAccessorException}.
 */
@Singleton
public class AccountAccessor {

  private static final Logger log = LoggerFactory.getLogger(AccountAccessor.class);

  private final HttpClient httpClient;
  private final ObjectMapper objectMapper;
  private final ServerConnectionInfo serverConnectionInfo;
  private final JavaType userType;
  private final JavaType stringType;
  private final JavaType emailListType;

  /**
   * Instantiates a new Account accessor.
   *
   * @param httpClient           the http client
   * @param objectMapper         the object mapper
   * @param serverConnectionInfo where the server lives
   */
  @Inject
  public AccountAccessor(final HttpClient httpClient,
                         final ObjectMapper objectMapper,
                         final ServerConnectionInfo serverConnectionInfo) {
    log.info("AccountAccessor({})", serverConnectionInfo.endpoint());
    this.httpClient = httpClient;
    this.objectMapper = objectMapper;
    this.serverConnectionInfo = serverConnectionInfo;
    this.userType = objectMapper.constructType(UserResponse.class);
    this.stringType = objectMapper.constructType(String.class);
    this.emailListType = objectMapper.getTypeFactory().constructCollectionType(List.class, String.class);
  }

  /**
   * Registers a new user.
   *
   * @param request the registration payload
   * @return the created user, or an Error if the email is taken
   */
  public AccountResult<UserResponse> createUser(final CreateUserRequest request) {
    log.debug("createUser({})", request.email());
    return send("POST", "/create/user", request, userType);
  }

  /**
   * Logs in and returns a session token.
   *
   * @param email    the account email
   * @param password the plaintext password
   * @return the token, or a Failure for an unknown user or a wrong password
   */
  public AccountResult<String> login(final String email, final String password) {
    log.debug("login({})", email);
    return send("POST", "/login/" + encode(email), new LoginRequest(password), stringType);
  }

  /**
   * Deletes the user.
   *
   * @param email the account email
   * @param token a session token issued to that account
   * @return the server's confirmation message, or a Failure/Error
   */
  public AccountResult<String> deleteUser(final String email, final String token) {
    log.debug("deleteUser({})", email);
    return send("DELETE", "/user/delete/" + encode(email) + "/" + encode(token), null, stringType);
  }

  /**
   * Updates the user. Null fields of the request are left unchanged on the server.
   *
   * @param email   the account email
   * @param token   a session token issued to that account
   * @param request the fields to change
   * @return the updated user, or a Failure/Error
   */
  public AccountResult<UserResponse> updateUser(final String email, final String token,
                                                final UpdateUserRequest request) {
    log.debug("updateUser({})", email);
    return send("PUT", "/update/user/" + encode(email) + "/" + encode(token), request, userType);
  }

  /**
   * Looks up a user.
   *
   * @param email the account email
   * @return the user, or a Failure if no such user exists
   */
  public AccountResult<UserResponse> getUser(final String email) {
    log.debug("getUser({})", email);
    return send("GET", "/user/" + encode(email), null, userType);
  }

  /**
   * Lists every registered email.
   *
   * @return the emails in ascending order
   */
  public AccountResult<List<String>> listUsers() {
    log.debug("listUsers()");
    return send("GET", "/list/users", null, emailListType);
  }

  private <T> AccountResult<T> send(String method, String path, Object body, JavaType dataType) {
    URI uri = resolve(path);
    try {
      HttpRequest.Builder builder = HttpRequest.newBuilder()
          .uri(uri)
          .header("Accept", "application/json");
      if (body == null) {
        builder.method(method, HttpRequest.BodyPublishers.noBody());
      } else {
        builder.header("Content-Type", "application/json")
            .method(method, HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(body)));
      }
      HttpResponse<String> response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
      checkStatus(method, uri, response.statusCode());
      return readEnvelope(response.body(), dataType);
    } catch (IOException e) {
      throw new AccountAccessorException("HTTP request failed: " + method + " " + uri, e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new AccountAccessorException("HTTP request interrupted: " + method + " " + uri, e);
    }
  }

  // The data field is typed by status: the payload on success, a message string otherwise.
  private <T> AccountResult<T> readEnvelope(String body, JavaType dataType) throws IOException {
    JsonNode envelope = objectMapper.readTree(body);
    JsonNode statusNode = envelope == null ? null : envelope.get("status");
    if (statusNode == null || !statusNode.isTextual()) {
      throw new AccountAccessorException("Response is not an envelope: " + body, null);
    }
    Status status = objectMapper.treeToValue(statusNode, Status.class);
    JsonNode data = envelope.get("data");
    if (status != Status.SUCCESS) {
      return AccountResult.rejected(status, data == null || data.isNull() ? null : data.asText());
    }
    if (data == null || data.isNull()) {
      return AccountResult.success(null);
    }
    T value = objectMapper.readerFor(dataType).readValue(data);
    return AccountResult.success(value);
  }

  private URI resolve(String path) {
    URI base = serverConnectionInfo.endpoint();
    String basePath = base.getPath() == null ? "" : base.getPath();
    if (basePath.endsWith("/")) {
      basePath = basePath.substring(0, basePath.length() - 1);
    }
    return base.resolve(basePath + path);
  }

  private void checkStatus(String method, URI uri, int statusCode) {
    if (statusCode >= 400) {
      throw new AccountAccessorException(
          "Server returned HTTP " + statusCode + " for " + method + " " + uri, null, statusCode);
    }
  }

  private static String encode(String pathSegment) {
    return URLEncoder.encode(pathSegment, StandardCharsets.UTF_8).replace("+", "%20");
  }
}
