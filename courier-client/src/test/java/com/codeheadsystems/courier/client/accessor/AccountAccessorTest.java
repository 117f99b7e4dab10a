package com.codeheadsystems.courier.client.accessor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.codeheadsystems.courier.client.exceptions.AccountAccessorException;
import com.codeheadsystems.courier.client.model.AccountResult;
import com.codeheadsystems.courier.client.model.ServerConnectionInfo;
import com.codeheadsystems.courier.model.CreateUserRequest;
import com.codeheadsystems.courier.model.Status;
import com.codeheadsystems.courier.model.UpdateUserRequest;
import com.codeheadsystems.courier.model.UserResponse;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class AccountAccessorTest {

  private static final URI BASE_URI = URI.create("http://localhost:8080");

  @Mock private HttpClient httpClient;
  @Mock private HttpResponse<String> httpResponse;

  private AccountAccessor accessor;

  @BeforeEach
  void setUp() {
    accessor = new AccountAccessor(httpClient, new ObjectMapper(), new ServerConnectionInfo(BASE_URI));
  }

  @Test
  void createUser_success_returnsUser() throws Exception {
    respond(200, "{\"status\":\"Success\",\"data\":{\"email\":\"a@x.com\",\"handle\":\"alice\","
        + "\"public_key\":\"pk\",\"bio\":null}}");

    AccountResult<UserResponse> result = accessor.createUser(
        new CreateUserRequest("a@x.com", "pw1", "alice", "pk"));

    assertThat(result.isSuccess()).isTrue();
    assertThat(result.value()).isEqualTo(new UserResponse("a@x.com", "alice", "pk", null));
    HttpRequest sent = captureRequest();
    assertThat(sent.method()).isEqualTo("POST");
    assertThat(sent.uri()).isEqualTo(URI.create("http://localhost:8080/create/user"));
    assertThat(sent.headers().firstValue("Content-Type")).contains("application/json");
  }

  @Test
  void createUser_duplicate_returnsError() throws Exception {
    respond(200, "{\"status\":\"Error\",\"data\":\"User already exists with email: a@x.com\"}");

    AccountResult<UserResponse> result = accessor.createUser(
        new CreateUserRequest("a@x.com", "pw1", "alice", "pk"));

    assertThat(result.status()).isEqualTo(Status.ERROR);
    assertThat(result.value()).isNull();
    assertThat(result.message()).isEqualTo("User already exists with email: a@x.com");
    assertThatThrownBy(result::orElseThrow)
        .isInstanceOf(AccountAccessorException.class)
        .hasMessageContaining("User already exists");
  }

  @Test
  void login_success_returnsTokenAndEncodesEmail() throws Exception {
    respond(200, "{\"status\":\"Success\",\"data\":\"h.p.s\"}");

    AccountResult<String> result = accessor.login("a+b@x.com", "pw1");

    assertThat(result.orElseThrow()).isEqualTo("h.p.s");
    assertThat(captureRequest().uri().getRawPath()).isEqualTo("/login/a%2Bb%40x.com");
  }

  @Test
  void login_wrongPassword_returnsFailure() throws Exception {
    respond(200, "{\"status\":\"Failure\",\"data\":\"Password is incorrect\"}");

    AccountResult<String> result = accessor.login("a@x.com", "nope");

    assertThat(result.status()).isEqualTo(Status.FAILURE);
    assertThat(result.message()).isEqualTo("Password is incorrect");
  }

  @Test
  void deleteUser_sendsTokenInPath() throws Exception {
    respond(200, "{\"status\":\"Success\",\"data\":\"Successfully deleted a@x.com\"}");

    AccountResult<String> result = accessor.deleteUser("a@x.com", "h.p-s_t");

    assertThat(result.value()).isEqualTo("Successfully deleted a@x.com");
    HttpRequest sent = captureRequest();
    assertThat(sent.method()).isEqualTo("DELETE");
    assertThat(sent.uri().getRawPath()).isEqualTo("/user/delete/a%40x.com/h.p-s_t");
  }

  @Test
  void updateUser_usesPut() throws Exception {
    respond(200, "{\"status\":\"Success\",\"data\":{\"email\":\"a@x.com\",\"handle\":\"alice\","
        + "\"public_key\":\"pk\",\"bio\":\"hi\"}}");

    AccountResult<UserResponse> result = accessor.updateUser("a@x.com", "t",
        new UpdateUserRequest(null, null, null, "hi"));

    assertThat(result.value().bio()).isEqualTo("hi");
    assertThat(captureRequest().method()).isEqualTo("PUT");
  }

  @Test
  void getUser_unknown_returnsFailure() throws Exception {
    respond(200, "{\"status\":\"Failure\",\"data\":\"No user with email: nobody@x.com\"}");

    AccountResult<UserResponse> result = accessor.getUser("nobody@x.com");

    assertThat(result.isSuccess()).isFalse();
    assertThat(result.message()).isEqualTo("No user with email: nobody@x.com");
  }

  @Test
  void listUsers_returnsEmails() throws Exception {
    respond(200, "{\"status\":\"Success\",\"data\":[\"a@x.com\",\"b@x.com\"]}");

    AccountResult<List<String>> result = accessor.listUsers();

    assertThat(result.value()).containsExactly("a@x.com", "b@x.com");
    HttpRequest sent = captureRequest();
    assertThat(sent.method()).isEqualTo("GET");
    assertThat(sent.uri()).isEqualTo(URI.create("http://localhost:8080/list/users"));
  }

  @Test
  void baseUriWithPath_isPreserved() throws Exception {
    accessor = new AccountAccessor(httpClient, new ObjectMapper(),
        new ServerConnectionInfo(URI.create("http://localhost:8080/api/")));
    respond(200, "{\"status\":\"Success\",\"data\":[]}");

    accessor.listUsers();

    assertThat(captureRequest().uri()).isEqualTo(URI.create("http://localhost:8080/api/list/users"));
  }

  @Test
  void httpError_throwsWithStatus() throws Exception {
    doReturn(httpResponse).when(httpClient).send(any(), any());
    when(httpResponse.statusCode()).thenReturn(400);

    assertThatThrownBy(() -> accessor.login("a@x.com", ""))
        .isInstanceOf(AccountAccessorException.class)
        .satisfies(e -> assertThat(((AccountAccessorException) e).getStatusCode()).isEqualTo(400));
  }

  @Test
  void nonEnvelopeBody_throws() throws Exception {
    respond(200, "{\"unexpected\":true}");

    assertThatThrownBy(() -> accessor.listUsers()).isInstanceOf(AccountAccessorException.class);
  }

  @Test
  void ioException_throwsAccessorException() throws Exception {
    doThrow(new IOException("connection refused")).when(httpClient).send(any(), any());

    assertThatThrownBy(() -> accessor.getUser("a@x.com"))
        .isInstanceOf(AccountAccessorException.class)
        .hasCauseInstanceOf(IOException.class);
  }

  @Test
  void interrupted_restoresInterruptFlag() throws Exception {
    doThrow(new InterruptedException("interrupted")).when(httpClient).send(any(), any());

    try {
      assertThatThrownBy(() -> accessor.getUser("a@x.com"))
          .isInstanceOf(AccountAccessorException.class)
          .hasCauseInstanceOf(InterruptedException.class);
      assertThat(Thread.currentThread().isInterrupted()).isTrue();
    } finally {
      Thread.interrupted();
    }
  }

  private void respond(int status, String body) throws Exception {
    doReturn(httpResponse).when(httpClient).send(any(), any());
    when(httpResponse.statusCode()).thenReturn(status);
    when(httpResponse.body()).thenReturn(body);
  }

  @SuppressWarnings("unchecked")
  private HttpRequest captureRequest() throws Exception {
    ArgumentCaptor<HttpRequest> captor = ArgumentCaptor.forClass(HttpRequest.class);
    verify(httpClient).send(captor.capture(), any(HttpResponse.BodyHandler.class));
    return captor.getValue();
  }
}
