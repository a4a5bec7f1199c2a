package io.github.wphillipmoore.httpauth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import io.github.wphillipmoore.httpauth.auth.AllowAllChecker;
import io.github.wphillipmoore.httpauth.auth.BasicCredentials;
import io.github.wphillipmoore.httpauth.auth.CredentialChecker;
import io.github.wphillipmoore.httpauth.auth.StaticCredentialStore;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class AuthenticatingHandlerTest {

  private static final CredentialChecker DENY = (username, password) -> false;
  private static final CredentialChecker ALLOW = (username, password) -> true;

  private final AtomicBoolean downstreamCalled = new AtomicBoolean();

  private void writeOk(HttpExchange exchange) throws IOException {
    downstreamCalled.set(true);
    byte[] body = "OK".getBytes(StandardCharsets.UTF_8);
    exchange.sendResponseHeaders(200, body.length);
    exchange.getResponseBody().write(body);
    exchange.close();
  }

  private final HttpHandler okHandler = this::writeOk;
  private final ExchangeFunction okFunction = this::writeOk;

  private static void assertUnauthorized(RecordingExchange exchange) {
    assertThat(exchange.getResponseCode()).isEqualTo(401);
    assertThat(exchange.getResponseHeaders().getFirst("WWW-Authenticate")).isEqualTo("Basic");
    assertThat(exchange.responseBodyText()).isEqualTo("Unauthorized");
    assertThat(exchange.isClosed()).isTrue();
  }

  @Nested
  class Rejection {

    @Test
    void rejectingCheckerAnswers401WithChallenge() throws IOException {
      AuthenticatingHandler handler = new AuthenticatingHandler(DENY, okHandler);
      RecordingExchange exchange = RecordingExchange.get("/");

      handler.handle(exchange);

      assertUnauthorized(exchange);
      assertThat(exchange.responseLength()).isEqualTo("Unauthorized".length());
      assertThat(downstreamCalled).isFalse();
    }

    @Test
    void challengeHasNoRealm() throws IOException {
      AuthenticatingHandler handler = new AuthenticatingHandler(DENY, okHandler);
      RecordingExchange exchange = RecordingExchange.get("/");

      handler.handle(exchange);

      assertThat(exchange.getResponseHeaders().get("WWW-Authenticate")).containsExactly("Basic");
    }

    @Test
    void rejectionIsPlainText() throws IOException {
      AuthenticatingHandler handler = new AuthenticatingHandler(DENY, okHandler);
      RecordingExchange exchange = RecordingExchange.get("/");

      handler.handle(exchange);

      assertThat(exchange.getResponseHeaders().getFirst("Content-Type"))
          .isEqualTo("text/plain; charset=utf-8");
    }

    @Test
    void headRequestIsRejectedWithoutBody() throws IOException {
      AuthenticatingHandler handler = new AuthenticatingHandler(DENY, okHandler);
      RecordingExchange exchange = new RecordingExchange("HEAD", "/");

      handler.handle(exchange);

      assertThat(exchange.getResponseCode()).isEqualTo(401);
      assertThat(exchange.getResponseHeaders().getFirst("WWW-Authenticate")).isEqualTo("Basic");
      assertThat(exchange.responseLength()).isEqualTo(-1);
      assertThat(exchange.responseBodyText()).isEmpty();
      assertThat(downstreamCalled).isFalse();
    }
  }

  @Nested
  class Acceptance {

    @Test
    void acceptingCheckerDelegatesToDownstream() throws IOException {
      AuthenticatingHandler handler = new AuthenticatingHandler(ALLOW, okHandler);
      RecordingExchange exchange = RecordingExchange.get("/");

      handler.handle(exchange);

      assertThat(downstreamCalled).isTrue();
      assertThat(exchange.getResponseCode()).isEqualTo(200);
      assertThat(exchange.responseBodyText()).isEqualTo("OK");
      assertThat(exchange.getResponseHeaders().containsKey("WWW-Authenticate")).isFalse();
    }

    @Test
    void downstreamReceivesTheSameExchange() throws IOException {
      List<HttpExchange> seen = new ArrayList<>();
      AuthenticatingHandler handler = new AuthenticatingHandler(ALLOW, seen::add);
      RecordingExchange exchange = RecordingExchange.get("/reports?year=2024");

      handler.handle(exchange);

      assertThat(seen).containsExactly(exchange);
      assertThat(exchange.getResponseCode()).isEqualTo(-1);
      assertThat(exchange.getResponseHeaders()).isEmpty();
    }

    @Test
    void downstreamFailurePropagates() {
      HttpHandler failing =
          exchange -> {
            throw new IOException("broken pipe");
          };
      AuthenticatingHandler handler = new AuthenticatingHandler(ALLOW, failing);

      assertThatThrownBy(() -> handler.handle(RecordingExchange.get("/")))
          .isInstanceOf(IOException.class)
          .hasMessage("broken pipe");
    }
  }

  @Nested
  class CredentialExtraction {

    private final List<String> presented = new ArrayList<>();

    private AuthenticatingHandler recordingHandler() {
      return new AuthenticatingHandler(
          (username, password) -> {
            presented.add(username);
            presented.add(password);
            return false;
          },
          okHandler);
    }

    @Test
    void decodedCredentialsReachTheChecker() throws IOException {
      RecordingExchange exchange =
          RecordingExchange.get("/")
              .withHeader(
                  "Authorization", new BasicCredentials("alice", "shhhh").toAuthorizationHeader());

      recordingHandler().handle(exchange);

      assertThat(presented).containsExactly("alice", "shhhh");
    }

    @Test
    void missingHeaderPresentsEmptyCredentials() throws IOException {
      recordingHandler().handle(RecordingExchange.get("/"));

      assertThat(presented).containsExactly("", "");
    }

    @Test
    void otherSchemePresentsEmptyCredentials() throws IOException {
      RecordingExchange exchange =
          RecordingExchange.get("/").withHeader("Authorization", "Bearer abc.def.ghi");

      recordingHandler().handle(exchange);

      assertThat(presented).containsExactly("", "");
      assertUnauthorized(exchange);
    }

    @Test
    void undecodableHeaderPresentsEmptyCredentials() throws IOException {
      RecordingExchange exchange =
          RecordingExchange.get("/").withHeader("Authorization", "Basic !!not-base64!!");

      recordingHandler().handle(exchange);

      assertThat(presented).containsExactly("", "");
      assertUnauthorized(exchange);
    }

    @Test
    void onlyFirstAuthorizationHeaderIsUsed() throws IOException {
      RecordingExchange exchange =
          RecordingExchange.get("/")
              .withHeader("Authorization", new BasicCredentials("a", "1").toAuthorizationHeader())
              .withHeader("Authorization", new BasicCredentials("b", "2").toAuthorizationHeader());

      recordingHandler().handle(exchange);

      assertThat(presented).containsExactly("a", "1");
    }
  }

  @Nested
  class WithStores {

    private final CredentialChecker store =
        new StaticCredentialStore(Map.of("alice", "shhhh", "bob", ""));

    @Test
    void validCredentialsPass() throws IOException {
      AuthenticatingHandler handler = new AuthenticatingHandler(store, okHandler);
      RecordingExchange exchange =
          RecordingExchange.get("/")
              .withHeader(
                  "Authorization", new BasicCredentials("alice", "shhhh").toAuthorizationHeader());

      handler.handle(exchange);

      assertThat(exchange.getResponseCode()).isEqualTo(200);
    }

    @Test
    void wrongPasswordIsRejected() throws IOException {
      AuthenticatingHandler handler = new AuthenticatingHandler(store, okHandler);
      RecordingExchange exchange =
          RecordingExchange.get("/")
              .withHeader(
                  "Authorization", new BasicCredentials("alice", "SHHHH").toAuthorizationHeader());

      handler.handle(exchange);

      assertUnauthorized(exchange);
      assertThat(downstreamCalled).isFalse();
    }

    @Test
    void missingHeaderDoesNotMatchUserWithEmptyPassword() throws IOException {
      AuthenticatingHandler handler = new AuthenticatingHandler(store, okHandler);
      RecordingExchange exchange = RecordingExchange.get("/");

      handler.handle(exchange);

      assertUnauthorized(exchange);
    }

    @Test
    void invalidUtf8DoesNotMatchReplacementCharacter() throws IOException {
      CredentialChecker replacement = new StaticCredentialStore(Map.of("u", "\uFFFD"));
      AuthenticatingHandler handler = new AuthenticatingHandler(replacement, okHandler);
      byte[] raw = {'u', ':', (byte) 0xFF};
      RecordingExchange exchange =
          RecordingExchange.get("/")
              .withHeader("Authorization", "Basic " + Base64.getEncoder().encodeToString(raw));

      handler.handle(exchange);

      assertUnauthorized(exchange);
      assertThat(downstreamCalled).isFalse();
    }

    @Test
    void allowAllLetsAnonymousRequestsThrough() throws IOException {
      AuthenticatingHandler handler =
          new AuthenticatingHandler(new AllowAllChecker(), okHandler);
      RecordingExchange exchange = RecordingExchange.get("/");

      handler.handle(exchange);

      assertThat(exchange.getResponseCode()).isEqualTo(200);
      assertThat(exchange.responseBodyText()).isEqualTo("OK");
    }
  }

  @Nested
  class FunctionForm {

    @Test
    void rejectsLikeTheHandlerForm() throws IOException {
      AuthenticatingHandler handler = AuthenticatingHandler.of(DENY, okFunction);
      RecordingExchange exchange = RecordingExchange.get("/");

      handler.handle(exchange);

      assertUnauthorized(exchange);
      assertThat(downstreamCalled).isFalse();
    }

    @Test
    void acceptsLikeTheHandlerForm() throws IOException {
      AuthenticatingHandler handler = AuthenticatingHandler.of(ALLOW, okFunction);
      RecordingExchange exchange = RecordingExchange.get("/");

      handler.handle(exchange);

      assertThat(exchange.getResponseCode()).isEqualTo(200);
      assertThat(exchange.responseBodyText()).isEqualTo("OK");
    }
  }

  @Nested
  class Construction {

    @Test
    void nullCheckerThrowsNullPointerException() {
      assertThatThrownBy(() -> new AuthenticatingHandler(null, exchange -> {}))
          .isInstanceOf(NullPointerException.class)
          .hasMessage("checker");
    }

    @Test
    void nullDownstreamThrowsNullPointerException() {
      assertThatThrownBy(() -> new AuthenticatingHandler(ALLOW, null))
          .isInstanceOf(NullPointerException.class)
          .hasMessage("downstream");
    }

    @Test
    void nullFunctionThrowsNullPointerException() {
      assertThatThrownBy(() -> AuthenticatingHandler.of(ALLOW, null))
          .isInstanceOf(NullPointerException.class)
          .hasMessage("function");
    }
  }
}
