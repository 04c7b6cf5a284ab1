package mailqueue.smtp;

import java.net.URI;
import java.net.URISyntaxException;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;

/**
 * Parsed form of {@code smtp[s]://[user[:password]@]host[:port][?options]}.
 *
 * <p>{@code smtps} connects over implicit TLS (default port 465); {@code smtp} uses plain
 * SMTP with opportunistic STARTTLS (default port 587). Recognized options:
 * <ul>
 *   <li>{@code requireTLS=true} fails the connection when STARTTLS is not offered</li>
 *   <li>{@code ignoreTLS=true} never upgrades with STARTTLS</li>
 *   <li>{@code connectionTimeout}, {@code socketTimeout} in milliseconds</li>
 *   <li>{@code name} host name announced in EHLO</li>
 *   <li>{@code tls.rejectUnauthorized=false} trusts any server certificate</li>
 *   <li>any {@code mail.*} key, copied verbatim into the session properties</li>
 * </ul>
 * Other options are kept in {@link #options()} and otherwise ignored.
 */
public final class SmtpConnectionUri {
  static final String INVALID = "Invalid SMTP connection URI";

  private final boolean secure;
  private final String host;
  private final int port;
  private final String user;
  private final String password;
  private final Map<String, String> options;

  private SmtpConnectionUri(boolean secure, String host, int port, String user, String password,
      Map<String, String> options) {
    this.secure = secure;
    this.host = host;
    this.port = port;
    this.user = user;
    this.password = password;
    this.options = Collections.unmodifiableMap(options);
  }

  /**
   * Parses a connection URI.
   *
   * @throws IllegalArgumentException if the scheme is not {@code smtp}/{@code smtps}, the host
   *     is missing or the port is not a number. The message never contains the password.
   */
  public static SmtpConnectionUri parse(String uri) {
    Objects.requireNonNull(uri, "uri");
    URI parsed;
    try {
      parsed = new URI(uri.trim());
    } catch (URISyntaxException e) {
      throw new IllegalArgumentException(INVALID);
    }
    String scheme = parsed.getScheme() == null ? "" : parsed.getScheme().toLowerCase(Locale.ROOT);
    if (!scheme.equals("smtp") && !scheme.equals("smtps")) {
      throw new IllegalArgumentException(INVALID + ": unsupported scheme '" + scheme + "'");
    }
    if (parsed.getHost() == null || parsed.getHost().isEmpty()) {
      throw new IllegalArgumentException(INVALID + ": missing host");
    }
    boolean secure = scheme.equals("smtps");
    int port = parsed.getPort() > 0 ? parsed.getPort() : (secure ? 465 : 587);

    String user = null;
    String password = null;
    String userInfo = parsed.getRawUserInfo();
    if (userInfo != null && !userInfo.isEmpty()) {
      int colon = userInfo.indexOf(':');
      user = decode(colon < 0 ? userInfo : userInfo.substring(0, colon));
      password = colon < 0 ? null : decode(userInfo.substring(colon + 1));
    }

    Map<String, String> options = new LinkedHashMap<>();
    String query = parsed.getRawQuery();
    if (query != null && !query.isEmpty()) {
      for (String pair : query.split("&")) {
        if (pair.isEmpty()) {
          continue;
        }
        int eq = pair.indexOf('=');
        String key = decode(eq < 0 ? pair : pair.substring(0, eq));
        String value = eq < 0 ? "true" : decode(pair.substring(eq + 1));
        options.put(key, value);
      }
    }
    return new SmtpConnectionUri(secure, parsed.getHost(), port, user, password, options);
  }

  private static String decode(String value) {
    return URLDecoder.decode(value, StandardCharsets.UTF_8);
  }

  public boolean secure() {
    return secure;
  }

  /** Jakarta Mail protocol name: {@code smtp} or {@code smtps}. */
  public String protocol() {
    return secure ? "smtps" : "smtp";
  }

  public String host() {
    return host;
  }

  public int port() {
    return port;
  }

  /** User name, or {@code null} for an unauthenticated connection. */
  public String user() {
    return user;
  }

  public String password() {
    return password;
  }

  public Map<String, String> options() {
    return options;
  }

  /**
   * Builds Jakarta Mail session properties for this connection.
   */
  public Properties toSessionProperties() {
    String prefix = "mail." + protocol() + ".";
    Properties props = new Properties();
    props.setProperty("mail.transport.protocol", protocol());
    props.setProperty(prefix + "host", host);
    props.setProperty(prefix + "port", Integer.toString(port));
    props.setProperty(prefix + "auth", Boolean.toString(user != null));
    props.setProperty(prefix + "sendpartial", "true");
    props.setProperty(prefix + "connectiontimeout", options.getOrDefault("connectionTimeout", "10000"));
    props.setProperty(prefix + "timeout", options.getOrDefault("socketTimeout", "30000"));
    props.setProperty(prefix + "writetimeout", options.getOrDefault("socketTimeout", "30000"));
    if (!secure) {
      boolean ignoreTls = "true".equalsIgnoreCase(options.get("ignoreTLS"));
      props.setProperty(prefix + "starttls.enable", Boolean.toString(!ignoreTls));
      props.setProperty(prefix + "starttls.required", Boolean.toString("true".equalsIgnoreCase(options.get("requireTLS"))));
    }
    if (options.containsKey("name")) {
      props.setProperty(prefix + "localhost", options.get("name"));
    }
    if ("false".equalsIgnoreCase(options.get("tls.rejectUnauthorized"))) {
      props.setProperty(prefix + "ssl.trust", "*");
    }
    for (Map.Entry<String, String> option : options.entrySet()) {
      if (option.getKey().startsWith("mail.")) {
        props.setProperty(option.getKey(), option.getValue());
      }
    }
    return props;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder(protocol()).append("://");
    if (user != null) {
      sb.append(user);
      if (password != null) {
        sb.append(":****");
      }
      sb.append('@');
    }
    return sb.append(host).append(':').append(port).toString();
  }
}
