package net.jodah.tether;

import java.io.IOException;

import net.jodah.tether.config.Config;
import net.jodah.tether.internal.util.Assert;

/**
 * Creates connections to a broker.
 */
public final class Connections {
  private Connections() {
  }

  /**
   * Creates a plain connection to the broker at the {@code urls}, which are tried in turn.
   *
   * @throws NullPointerException if {@code urls} is null
   * @throws IllegalArgumentException if a url is malformed
   * @throws AmqpException.ConnectionException if the connection could not be established
   */
  public static Connection create(String... urls) throws IOException {
    return create(new ConnectionOptions().withUrls(urls), new Config());
  }

  /**
   * Creates a plain connection for the {@code options} and {@code config}. The connection is
   * established with a single attempt.
   *
   * @throws NullPointerException if {@code options} or {@code config} are null
   * @throws AmqpException.ConnectionException if the connection could not be established
   */
  public static Connection create(ConnectionOptions options, Config config) throws IOException {
    Assert.notNull(options, "options");
    Assert.notNull(config, "config");
    Connection connection = new Connection(options.copy(), new Config(config));
    connection.connect();
    return connection;
  }

  /**
   * Creates a robust connection to the broker at the {@code urls}, which are tried in turn.
   *
   * @throws NullPointerException if {@code urls} is null
   * @throws IllegalArgumentException if a url is malformed
   * @throws AmqpException.ConnectionException if the initial connection could not be established
   */
  public static RobustConnection createRobust(String... urls) throws IOException {
    return createRobust(new ConnectionOptions().withUrls(urls), new Config());
  }

  /**
   * Creates a robust connection for the {@code options} and {@code config}. The initial connection
   * is established with a single attempt, after which the connection reconnects according to the
   * config's recovery policy whenever its link is lost.
   *
   * @throws NullPointerException if {@code options} or {@code config} are null
   * @throws AmqpException.ConnectionException if the initial connection could not be established
   */
  public static RobustConnection createRobust(ConnectionOptions options, Config config)
      throws IOException {
    Assert.notNull(options, "options");
    Assert.notNull(config, "config");
    RobustConnection connection = new RobustConnection(options.copy(), new Config(config));
    connection.connect();
    return connection;
  }
}
