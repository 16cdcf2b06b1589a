package net.jodah.tether;

import java.io.UnsupportedEncodingException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.URLDecoder;
import java.security.KeyManagementException;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;

import javax.net.ssl.SSLContext;

import net.jodah.tether.internal.util.Assert;
import net.jodah.tether.util.Duration;

import com.rabbitmq.client.Address;
import com.rabbitmq.client.ConnectionFactory;

/**
 * Connection options. Changes will not effect connections that have already been created.
 *
 * <p>
 * Options can be set from an endpoint URL of the form
 * {@code amqp[s]://user:password@host:port/vhost?heartbeat=60&reconnect_interval=2.5&name=orders}.
 * When several URLs are given, each host is tried in turn when connecting.
 */
public class ConnectionOptions {
  private ConnectionFactory factory;
  private Address[] addresses;
  private String name;
  private ExecutorService executor;
  private Duration reconnectInterval;

  public ConnectionOptions() {
    factory = new ConnectionFactory();
  }

  /**
   * Creates a new Options object for the {@code connectionFactory}.
   *
   * @throws NullPointerException if {@code connectionFactory} is null
   */
  public ConnectionOptions(ConnectionFactory connectionFactory) {
    this.factory = Assert.notNull(connectionFactory, "connectionFactory");
  }

  private ConnectionOptions(ConnectionOptions options) {
    factory = options.factory.clone();
    addresses = options.addresses;
    name = options.name;
    executor = options.executor;
    reconnectInterval = options.reconnectInterval;
  }

  /**
   * Returns a new copy of the options.
   */
  public ConnectionOptions copy() {
    return new ConnectionOptions(this);
  }

  /**
   * Returns the addresses to attempt connections to, in round-robin order.
   */
  public Address[] getAddresses() {
    if (addresses != null)
      return addresses;
    return new Address[] { new Address(factory.getHost(), factory.getPort()) };
  }

  public ConnectionFactory getConnectionFactory() {
    return factory;
  }

  /**
   * Returns the consumer executor.
   *
   * @see #withConsumerExecutor(ExecutorService)
   */
  public ExecutorService getConsumerExecutor() {
    return executor;
  }

  public String getName() {
    return name;
  }

  /**
   * Returns the interval to wait between reconnect attempts, if one was set via a URL or
   * {@link #withReconnectInterval(Duration)}, else null.
   */
  public Duration getReconnectInterval() {
    return reconnectInterval;
  }

  /**
   * Sets the {@code addresses} to attempt connections to, in round-robin order.
   *
   * @throws NullPointerException if {@code addresses} is null
   */
  public ConnectionOptions withAddresses(Address... addresses) {
    this.addresses = Assert.notNull(addresses, "addresses");
    return this;
  }

  /**
   * Sets the client properties.
   *
   * @throws NullPointerException if {@code clientProperties} is null
   */
  public ConnectionOptions withClientProperties(Map<String, Object> clientProperties) {
    factory.setClientProperties(Assert.notNull(clientProperties, "clientProperties"));
    return this;
  }

  /**
   * Sets the {@code connectionFactory}.
   *
   * @throws NullPointerException if {@code connectionFactory} is null
   */
  public ConnectionOptions withConnectionFactory(ConnectionFactory connectionFactory) {
    this.factory = Assert.notNull(connectionFactory, "connectionFactory");
    return this;
  }

  /**
   * Set the connection timeout, zero for infinite, for an individual connection attempt.
   *
   * @throws NullPointerException if {@code connectionTimeout} is null
   */
  public ConnectionOptions withConnectionTimeout(Duration connectionTimeout) {
    factory.setConnectionTimeout((int) Assert.notNull(connectionTimeout, "connectionTimeout").toMillis());
    return this;
  }

  /**
   * Sets the executor used to handle consumer callbacks. The {@code executor} will not be shutdown
   * when a connection is closed.
   *
   * @throws NullPointerException if {@code executor} is null
   */
  public ConnectionOptions withConsumerExecutor(ExecutorService executor) {
    this.executor = Assert.notNull(executor, "executor");
    return this;
  }

  /**
   * Sets the {@code host}.
   *
   * @throws NullPointerException if {@code host} is null
   */
  public ConnectionOptions withHost(String host) {
    factory.setHost(Assert.notNull(host, "host"));
    addresses = null;
    return this;
  }

  /**
   * Sets the connection name. Used for logging, consumer thread naming and as the client provided
   * connection name shown by the broker.
   *
   * @throws NullPointerException if {@code name} is null
   */
  public ConnectionOptions withName(String name) {
    this.name = Assert.notNull(name, "name");
    return this;
  }

  public ConnectionOptions withPassword(String password) {
    factory.setPassword(password);
    return this;
  }

  public ConnectionOptions withPort(int port) {
    factory.setPort(port);
    return this;
  }

  /**
   * Sets the interval to wait between reconnect attempts. Takes precedence over the interval of
   * the configured recovery policy.
   *
   * @throws NullPointerException if {@code reconnectInterval} is null
   */
  public ConnectionOptions withReconnectInterval(Duration reconnectInterval) {
    this.reconnectInterval = Assert.notNull(reconnectInterval, "reconnectInterval");
    return this;
  }

  /**
   * Set the requested heartbeat, zero for none.
   *
   * @throws NullPointerException if {@code requestedHeartbeat} is null
   */
  public ConnectionOptions withRequestedHeartbeat(Duration requestedHeartbeat) {
    factory.setRequestedHeartbeat((int) Assert.notNull(requestedHeartbeat, "requestedHeartbeat").toSeconds());
    return this;
  }

  /**
   * Sets the initialized {@code sslContext} to use.
   *
   * @throws NullPointerException if {@code sslContext} is null
   */
  public ConnectionOptions withSslProtocol(SSLContext sslContext) {
    factory.useSslProtocol(Assert.notNull(sslContext, "sslContext"));
    return this;
  }

  /**
   * Sets the options from the endpoint {@code url}.
   *
   * @throws NullPointerException if {@code url} is null
   * @throws IllegalArgumentException if {@code url} is malformed or contains an invalid parameter
   */
  public ConnectionOptions withUrl(String url) {
    return withUrls(url);
  }

  /**
   * Sets the options from the endpoint {@code urls}. Credentials, virtual host and parameters are
   * taken from the first URL, while every URL contributes an address to attempt connections to.
   *
   * @throws NullPointerException if {@code urls} is null
   * @throws IllegalArgumentException if {@code urls} is empty, or any url is malformed or contains
   *           an invalid parameter
   */
  public ConnectionOptions withUrls(String... urls) {
    Assert.notNull(urls, "urls");
    Assert.isTrue(urls.length > 0, "At least one url is required");
    List<Address> parsed = new ArrayList<Address>(urls.length);
    for (int i = 0; i < urls.length; i++) {
      URI uri = parseUri(Assert.notNull(urls[i], "url"));
      boolean ssl = "amqps".equals(uri.getScheme());
      int port = uri.getPort() != -1 ? uri.getPort() : ssl ? ConnectionFactory.DEFAULT_AMQP_OVER_SSL_PORT
          : ConnectionFactory.DEFAULT_AMQP_PORT;
      parsed.add(new Address(uri.getHost(), port));
      if (i == 0)
        configure(uri);
    }

    addresses = parsed.toArray(new Address[parsed.size()]);
    return this;
  }

  /**
   * Sets the username.
   *
   * @throws NullPointerException if {@code username} is null
   */
  public ConnectionOptions withUsername(String username) {
    factory.setUsername(Assert.notNull(username, "username"));
    return this;
  }

  /**
   * Sets the virtual host.
   *
   * @throws NullPointerException if {@code virtualHost} is null
   */
  public ConnectionOptions withVirtualHost(String virtualHost) {
    factory.setVirtualHost(Assert.notNull(virtualHost, "virtualHost"));
    return this;
  }

  private static URI parseUri(String url) {
    try {
      URI uri = new URI(url);
      Assert.isTrue("amqp".equals(uri.getScheme()) || "amqps".equals(uri.getScheme()),
          "Unsupported url scheme: %s", uri.getScheme());
      Assert.isTrue(uri.getHost() != null, "Url has no host: %s", url);
      return uri;
    } catch (URISyntaxException e) {
      throw new IllegalArgumentException("Invalid url: " + url, e);
    }
  }

  private void configure(URI uri) {
    String base = uri.getRawQuery() == null ? uri.toString() : uri.toString().substring(0,
        uri.toString().indexOf('?'));
    try {
      factory.setUri(base);
    } catch (URISyntaxException e) {
      throw new IllegalArgumentException("Invalid url: " + uri, e);
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalArgumentException("Unable to configure TLS for " + uri, e);
    } catch (KeyManagementException e) {
      throw new IllegalArgumentException("Unable to configure TLS for " + uri, e);
    }

    if (uri.getRawQuery() == null)
      return;
    for (String param : uri.getRawQuery().split("&")) {
      if (param.isEmpty())
        continue;
      int eq = param.indexOf('=');
      String key = decode(eq == -1 ? param : param.substring(0, eq));
      String value = eq == -1 ? "" : decode(param.substring(eq + 1));
      if ("heartbeat".equals(key))
        factory.setRequestedHeartbeat(parseInt(key, value));
      else if ("connection_timeout".equals(key))
        factory.setConnectionTimeout(parseInt(key, value));
      else if ("reconnect_interval".equals(key))
        reconnectInterval = Duration.of(value);
      else if ("name".equals(key))
        name = value;
    }
  }

  private static int parseInt(String key, String value) {
    try {
      return Integer.parseInt(value);
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(String.format("Invalid %s: %s", key, value), e);
    }
  }

  private static String decode(String value) {
    try {
      return URLDecoder.decode(value, "UTF-8");
    } catch (UnsupportedEncodingException e) {
      throw new IllegalStateException(e);
    }
  }
}
