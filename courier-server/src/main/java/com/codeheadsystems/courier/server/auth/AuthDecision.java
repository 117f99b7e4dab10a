package com.codeheadsystems.courier.server.auth;

/**
 * Outcome of {@link AuthGate#authorize}.
 *
 * @param authorized true when the token authorizes the request
 * @param reason     why the request was denied, null when authorized
 */
public record AuthDecision(boolean authorized, DenialReason reason) {

  private static final AuthDecision ALLOWED = new AuthDecision(true, null);

  public static AuthDecision allow() {
    return ALLOWED;
  }

  public static AuthDecision denied(DenialReason reason) {
    return new AuthDecision(false, reason);
  }

  /**
   * Why a token was refused.
   */
  public enum DenialReason {
    BAD_TOKEN("bad token"),
    IDENTITY_MISMATCH("identity mismatch"),
    STALE_CREDENTIAL("stale credential");

    private final String description;

    DenialReason(String description) {
      this.description = description;
    }

    public String description() {
      return description;
    }
  }
}
