package com.onthegomap.tileserve.builder;

import static com.onthegomap.tileserve.util.Exceptions.throwFatalException;

import com.onthegomap.tileserve.config.Configuration;
import com.onthegomap.tileserve.util.YAML;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads a JSON or YAML configuration file from a local path or an http(s) URL and builds it into a
 * {@link Configuration}.
 */
public class ConfigLoader {

  private static final Logger LOGGER = LoggerFactory.getLogger(ConfigLoader.class);
  private static final Duration TIMEOUT = Duration.ofSeconds(30);
  private static final String USER_AGENT = "User-Agent";
  private static final String USER_AGENT_VALUE = "tileserve";

  private ConfigLoader() {}

  /**
   * Returns the configuration stored at {@code location}.
   * <p>
   * Relative paths inside the configuration are resolved against the file's directory, or against the URL with its
   * last path segment removed.
   *
   * @param location local path, {@code file:} URL, or {@code http(s)} URL
   */
  public static Configuration load(String location) {
    URI uri = remoteUri(location);
    if (uri != null) {
      LOGGER.info("Loading configuration from {}", uri);
      Map<String, Object> spec = parse(fetch(uri), location);
      return ConfigurationBuilder.build(spec, uri.resolve(".").toString());
    }
    Path path = location.toLowerCase(Locale.ROOT).startsWith("file:") ? Path.of(URI.create(location)) :
      Path.of(location);
    return load(path);
  }

  /** Returns the configuration stored in the local file {@code path}. */
  public static Configuration load(Path path) {
    Path absolute = path.toAbsolutePath().normalize();
    LOGGER.info("Loading configuration from {}", absolute);
    Map<String, Object> spec = ConfigValues.asMap(YAML.load(absolute, Object.class), "Configuration " + path);
    Path parent = absolute.getParent();
    return ConfigurationBuilder.build(spec, parent == null ? "." : parent.toString());
  }

  private static Map<String, Object> parse(InputStream stream, String location) {
    return ConfigValues.asMap(YAML.load(stream, Object.class), "Configuration " + location);
  }

  private static URI remoteUri(String location) {
    String lower = location.toLowerCase(Locale.ROOT);
    return lower.startsWith("http://") || lower.startsWith("https://") ? URI.create(location) : null;
  }

  private static InputStream fetch(URI uri) {
    HttpClient client = HttpClient.newBuilder()
      .connectTimeout(TIMEOUT)
      .followRedirects(HttpClient.Redirect.NORMAL)
      .build();
    HttpRequest request = HttpRequest.newBuilder(uri)
      .timeout(TIMEOUT)
      .header(USER_AGENT, USER_AGENT_VALUE)
      .GET()
      .build();
    try {
      HttpResponse<InputStream> response = client.send(request, HttpResponse.BodyHandlers.ofInputStream());
      if (response.statusCode() != 200) {
        response.body().close();
        throw new UncheckedIOException(new IOException("Bad response fetching " + uri + ": " + response.statusCode()));
      }
      return response.body();
    } catch (IOException | InterruptedException e) {
      return throwFatalException(e);
    }
  }
}
