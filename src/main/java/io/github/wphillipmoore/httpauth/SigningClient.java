package io.github.wphillipmoore.httpauth;

import io.github.wphillipmoore.httpauth.exception.HttpAuthTransportException;
import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.StringJoiner;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Wraps an {@link HttpClient} so that every request is signed before it is sent.
 *
 * <p>Signing happens first. If the {@link RequestSigner} throws, the exception reaches the caller
 * and nothing is sent. Otherwise the request goes out as built, plus whatever the signer added.
 * Invalid URLs fail with the {@link IllegalArgumentException} raised while building the request.
 * Network failures are wrapped in {@link HttpAuthTransportException}.
 *
 * <pre>{@code
 * SigningClient client = SigningClient.of(new BasicAuthSigner("admin", "secret"));
 * HttpResponse<String> response = client.get("https://host/status");
 * }</pre>
 */
public final class SigningClient {

  static final String FORM_CONTENT_TYPE = "application/x-www-form-urlencoded";

  private static final Logger LOG = LoggerFactory.getLogger(SigningClient.class);

  private final HttpClient client;
  private final RequestSigner signer;

  /**
   * Creates a client that signs with {@code signer} and sends with {@code client}.
   *
   * @param client the client used to send signed requests
   * @param signer the signer applied to every request
   */
  public SigningClient(HttpClient client, RequestSigner signer) {
    this.client = Objects.requireNonNull(client, "client");
    this.signer = Objects.requireNonNull(signer, "signer");
  }

  /**
   * Creates a client that sends with a default {@link HttpClient}.
   *
   * @param signer the signer applied to every request
   * @return the signing client
   */
  public static SigningClient of(RequestSigner signer) {
    return new SigningClient(HttpClient.newHttpClient(), signer);
  }

  /** Returns the signer applied to every request. */
  public RequestSigner getSigner() {
    return signer;
  }

  /**
   * Signs and sends a request.
   *
   * @param request the request to sign and send
   * @param bodyHandler the handler for the response body
   * @param <T> the response body type
   * @return the response
   * @throws io.github.wphillipmoore.httpauth.exception.SigningException if signing fails
   * @throws HttpAuthTransportException if the request fails or is interrupted
   */
  public <T> HttpResponse<T> send(
      HttpRequest.Builder request, HttpResponse.BodyHandler<T> bodyHandler) {
    signer.sign(request);
    HttpRequest signed = request.build();
    LOG.debug("Sending signed {} {}", signed.method(), signed.uri());
    try {
      return client.send(signed, bodyHandler);
    } catch (IOException e) {
      throw new HttpAuthTransportException("HTTP request failed", signed.uri(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new HttpAuthTransportException("HTTP request interrupted", signed.uri(), e);
    }
  }

  /**
   * Sends a signed GET request and reads the body as a string.
   *
   * @param url the URL to fetch
   * @return the response
   */
  public HttpResponse<String> get(String url) {
    return get(url, HttpResponse.BodyHandlers.ofString());
  }

  /**
   * Sends a signed GET request.
   *
   * @param url the URL to fetch
   * @param bodyHandler the handler for the response body
   * @param <T> the response body type
   * @return the response
   */
  public <T> HttpResponse<T> get(String url, HttpResponse.BodyHandler<T> bodyHandler) {
    return send(HttpRequest.newBuilder(URI.create(url)).GET(), bodyHandler);
  }

  /**
   * Sends a signed HEAD request.
   *
   * @param url the URL to query
   * @return the response, which has no body
   */
  public HttpResponse<Void> head(String url) {
    return send(
        HttpRequest.newBuilder(URI.create(url))
            .method("HEAD", HttpRequest.BodyPublishers.noBody()),
        HttpResponse.BodyHandlers.discarding());
  }

  /**
   * Sends a signed POST request and reads the body as a string.
   *
   * @param url the URL to post to
   * @param contentType the value of the {@code Content-Type} header
   * @param body the request body
   * @return the response
   */
  public HttpResponse<String> post(String url, String contentType, HttpRequest.BodyPublisher body) {
    return post(url, contentType, body, HttpResponse.BodyHandlers.ofString());
  }

  /**
   * Sends a signed POST request.
   *
   * @param url the URL to post to
   * @param contentType the value of the {@code Content-Type} header
   * @param body the request body
   * @param bodyHandler the handler for the response body
   * @param <T> the response body type
   * @return the response
   */
  public <T> HttpResponse<T> post(
      String url,
      String contentType,
      HttpRequest.BodyPublisher body,
      HttpResponse.BodyHandler<T> bodyHandler) {
    return send(
        HttpRequest.newBuilder(URI.create(url)).header("Content-Type", contentType).POST(body),
        bodyHandler);
  }

  /**
   * Sends a signed form POST request and reads the body as a string.
   *
   * @param url the URL to post to
   * @param form the form fields; each name may carry several values
   * @return the response
   */
  public HttpResponse<String> postForm(String url, Map<String, List<String>> form) {
    return post(url, FORM_CONTENT_TYPE, HttpRequest.BodyPublishers.ofString(encodeForm(form)));
  }

  /**
   * Encodes form fields as {@code application/x-www-form-urlencoded}, names in sorted order.
   *
   * @param form the form fields
   * @return the encoded form
   */
  static String encodeForm(Map<String, List<String>> form) {
    StringJoiner joiner = new StringJoiner("&");
    new TreeMap<>(form)
        .forEach(
            (name, values) -> {
              String encodedName = URLEncoder.encode(name, StandardCharsets.UTF_8);
              for (String value : values) {
                joiner.add(encodedName + "=" + URLEncoder.encode(value, StandardCharsets.UTF_8));
              }
            });
    return joiner.toString();
  }
}
