package com.onthegomap.geoscene.util;

import static com.google.common.net.HttpHeaders.ACCEPT;
import static com.google.common.net.HttpHeaders.USER_AGENT;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.onthegomap.geoscene.config.GeoSceneConfig;
import com.onthegomap.geoscene.reader.GeoJsonException;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.FileSystemNotFoundException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A {@link JsonFetcher} that reads {@code http(s)} URLs with {@link HttpClient} and {@code file:} URLs or plain paths
 * from disk.
 * <p>
 * Requests send the user-agent and use the timeout from {@link GeoSceneConfig}. Connection errors and {@code 5xx}
 * responses are retried up to {@link GeoSceneConfig#httpRetries()} times, waiting
 * {@link GeoSceneConfig#httpRetryWait()} between attempts.
 */
public class HttpJsonFetcher implements JsonFetcher {

  private static final Logger LOGGER = LoggerFactory.getLogger(HttpJsonFetcher.class);
  // two or more characters so that windows drive letters like C:\ are read as paths
  private static final Pattern SCHEME = Pattern.compile("^([A-Za-z][A-Za-z0-9+.-]+):");
  private final GeoSceneConfig config;
  private final ObjectMapper mapper = new ObjectMapper();
  private HttpClient client;

  public HttpJsonFetcher(GeoSceneConfig config) {
    this.config = config;
  }

  @Override
  public CompletableFuture<JsonNode> fetchJson(String url) {
    var scheme = SCHEME.matcher(url);
    try {
      if (!scheme.find()) {
        return readFile(Path.of(url));
      }
      return switch (scheme.group(1).toLowerCase(Locale.ROOT)) {
        case "http", "https" -> fetchWithRetries(URI.create(url), 0);
        case "file" -> readFile(Path.of(URI.create(url)));
        default -> CompletableFuture.failedFuture(new IllegalArgumentException("Unsupported URL scheme: " + url));
      };
    } catch (IllegalArgumentException | FileSystemNotFoundException e) {
      return CompletableFuture.failedFuture(e);
    }
  }

  /** Reads {@code path} on the calling thread; the result is already complete when returned. */
  private CompletableFuture<JsonNode> readFile(Path path) {
    try {
      return CompletableFuture.completedFuture(parse(Files.readAllBytes(path), path.toString()));
    } catch (IOException e) {
      return CompletableFuture.failedFuture(new UncheckedIOException(e));
    } catch (RuntimeException e) {
      return CompletableFuture.failedFuture(e);
    }
  }

  private CompletableFuture<JsonNode> fetchWithRetries(URI uri, int attempt) {
    CompletableFuture<Response> response;
    try {
      response = send(uri);
    } catch (RuntimeException e) {
      response = CompletableFuture.failedFuture(e);
    }
    return response
      .thenApply(result -> {
        if (result.status() >= 500) {
          throw new RetryableException("Bad response from " + uri + ": " + result.status());
        } else if (result.status() < 200 || result.status() >= 300) {
          throw new IllegalStateException("Bad response from " + uri + ": " + result.status());
        }
        return parse(result.body(), uri.toString());
      })
      .exceptionallyCompose(error -> {
        Throwable cause = Exceptions.unwrap(error);
        boolean retryable = cause instanceof IOException || cause instanceof RetryableException;
        if (retryable && attempt < config.httpRetries()) {
          LOGGER.warn("Failed to fetch {} ({}), retrying in {}", uri, cause.getMessage(), config.httpRetryWait());
          Executor delayed =
            CompletableFuture.delayedExecutor(config.httpRetryWait().toMillis(), TimeUnit.MILLISECONDS);
          return CompletableFuture.supplyAsync(() -> attempt + 1, delayed)
            .thenCompose(next -> fetchWithRetries(uri, next));
        }
        return CompletableFuture.failedFuture(cause);
      });
  }

  private JsonNode parse(byte[] body, String source) {
    try {
      return mapper.readTree(body);
    } catch (IOException e) {
      throw new GeoJsonException(GeoJsonException.Kind.INVALID_JSON, "Invalid json from " + source, e);
    }
  }

  /** Sends a {@code GET} request to {@code uri}. Overridden in tests. */
  CompletableFuture<Response> send(URI uri) {
    HttpRequest request = HttpRequest.newBuilder(uri)
      .timeout(config.httpTimeout())
      .header(USER_AGENT, config.httpUserAgent())
      .header(ACCEPT, "application/geo+json, application/json")
      .GET()
      .build();
    return client().sendAsync(request, HttpResponse.BodyHandlers.ofByteArray())
      .thenApply(response -> new Response(response.statusCode(), response.body()));
  }

  private synchronized HttpClient client() {
    if (client == null) {
      client = HttpClient.newBuilder()
        .followRedirects(HttpClient.Redirect.NORMAL)
        .connectTimeout(config.httpTimeout())
        .build();
    }
    return client;
  }

  record Response(int status, byte[] body) {}

  private static class RetryableException extends RuntimeException {
    RetryableException(String message) {
      super(message);
    }
  }
}
