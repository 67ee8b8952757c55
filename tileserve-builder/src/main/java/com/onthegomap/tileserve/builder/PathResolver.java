package com.onthegomap.tileserve.builder;

import com.google.common.base.Strings;
import com.onthegomap.tileserve.config.ConfigurationException;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.file.Path;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Resolves paths from a configuration file that must point at the local filesystem, like the root of a disk cache.
 * <p>
 * A configuration may itself be loaded from a URL. In that case a plain path like {@code /tmp/tiles} is ambiguous, so
 * it must be written as {@code file:///tmp/tiles}.
 */
public class PathResolver {

  private static final Pattern SCHEME = Pattern.compile("^([a-zA-Z][a-zA-Z0-9+.-]*):(.*)$", Pattern.DOTALL);

  private PathResolver() {}

  /**
   * Returns the local path for {@code relPath} relative to the directory or URL {@code dirPath}.
   *
   * @param relPath path from the configuration: absolute, relative, or a {@code file://} URL
   * @param dirPath where the configuration came from: a local directory or a URL
   * @param context what the path is for, like {@code "Disk cache path"}, used to start error messages
   * @throws ConfigurationException if {@code relPath} is not local, or is a plain path and {@code dirPath} is remote
   */
  public static String enforcedLocalPath(String relPath, String dirPath, String context) {
    Url dir = Url.parse(dirPath);
    Url rel = Url.parse(relPath);

    if (!rel.isLocal()) {
      throw new ConfigurationException(
        "%s must be a local file path, absolute or \"file://\", not \"%s\".".formatted(context, relPath));
    }

    if (!dir.isLocal() && !rel.isFile()) {
      throw new ConfigurationException(
        "%s must start with \"file://\" in a remote configuration (\"%s\" relative to %s)"
          .formatted(context, relPath, dirPath));
    }

    if (rel.isFile()) {
      return rel.path();
    } else if (dir.isFile()) {
      return urlJoin(dir.path(), rel.path(), context);
    }
    return Path.of(dirPath).resolve(relPath).toString();
  }

  private static String urlJoin(String base, String relative, String context) {
    try {
      return new URI(null, null, base, null).resolve(new URI(null, null, relative, null)).getPath();
    } catch (URISyntaxException e) {
      throw new ConfigurationException(
        "%s \"%s\" can not be joined with \"%s\": %s".formatted(context, relative, base, e.getMessage()), e);
    }
  }

  /** The scheme and path components of a URL-like string, where plain paths have an empty scheme. */
  record Url(String scheme, String path) {

    static Url parse(String value) {
      String scheme = "";
      String rest = Strings.nullToEmpty(value);
      var matcher = SCHEME.matcher(rest);
      if (matcher.matches()) {
        scheme = matcher.group(1).toLowerCase(Locale.ROOT);
        rest = matcher.group(2);
      }
      if (rest.startsWith("//")) {
        int pathStart = indexOfAny(rest, "/?#", 2);
        rest = pathStart < 0 ? "" : rest.substring(pathStart);
      }
      int pathEnd = indexOfAny(rest, "?#", 0);
      return new Url(scheme, pathEnd < 0 ? rest : rest.substring(0, pathEnd));
    }

    private static int indexOfAny(String value, String chars, int from) {
      for (int i = from; i < value.length(); i++) {
        if (chars.indexOf(value.charAt(i)) >= 0) {
          return i;
        }
      }
      return -1;
    }

    boolean isFile() {
      return "file".equals(scheme);
    }

    boolean isLocal() {
      return scheme.isEmpty() || isFile();
    }
  }
}
