package com.codeheadsystems.courier.server.resource;

import com.codeheadsystems.courier.model.ApiResponse;
import com.codeheadsystems.courier.model.CreateUserRequest;
import com.codeheadsystems.courier.model.LoginRequest;
import com.codeheadsystems.courier.model.UpdateUserRequest;
import com.codeheadsystems.courier.server.manager.AccountManager;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.PUT;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * JAX-RS resource exposing the account operations.
 * <p>
 * Endpoints:
 * <ul>
 *   <li>{@code POST   /create/user}                   public</li>
 *   <li>{@code POST   /login/{email}}                 public</li>
 *   <li>{@code DELETE /user/delete/{email}/{token}}   token-gated</li>
 *   <li>{@code PUT    /update/user/{email}/{token}}   token-gated</li>
 *   <li>{@code GET    /user/{email}}                  public</li>
 *   <li>{@code GET    /list/users}                    public</li>
 * </ul>
 * Every endpoint answers HTTP 200 with an {@link ApiResponse} envelope whose status is
 * {@code Success}, {@code Failure} or {@code Error}. Malformed requests get HTTP 400.
 */
@Path("/")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class AccountResource {

  private static final Logger log = LoggerFactory.getLogger(AccountResource.class);

  private final AccountManager accountManager;

  public AccountResource(AccountManager accountManager) {
    this.accountManager = accountManager;
  }

  @POST
  @Path("create/user")
  public ApiResponse<?> createUser(CreateUserRequest req) {
    return handle(() -> accountManager.createUser(req));
  }

  @POST
  @Path("login/{email}")
  public ApiResponse<?> login(@PathParam("email") String email, LoginRequest req) {
    return handle(() -> accountManager.login(email, req));
  }

  @DELETE
  @Path("user/delete/{email}/{token}")
  public ApiResponse<?> deleteUser(@PathParam("email") String email,
                                   @PathParam("token") String token) {
    return handle(() -> accountManager.deleteUser(email, token));
  }

  @PUT
  @Path("update/user/{email}/{token}")
  public ApiResponse<?> updateUser(@PathParam("email") String email,
                                   @PathParam("token") String token,
                                   UpdateUserRequest req) {
    return handle(() -> accountManager.updateUser(email, token, req));
  }

  @GET
  @Path("user/{email}")
  public ApiResponse<?> getUser(@PathParam("email") String email) {
    return handle(() -> accountManager.getUser(email));
  }

  @GET
  @Path("list/users")
  public ApiResponse<?> listUsers() {
    return handle(accountManager::listUsers);
  }

  /**
   * Maps {@link IllegalArgumentException} to HTTP 400 instead of leaking a stack trace.
   */
  private static ApiResponse<?> handle(Supplier<ApiResponse<?>> call) {
    try {
      return call.get();
    } catch (IllegalArgumentException e) {
      log.debug("Bad request: {}", e.getMessage());
      throw new WebApplicationException(e.getMessage(), Response.Status.BAD_REQUEST);
    }
  }
}
