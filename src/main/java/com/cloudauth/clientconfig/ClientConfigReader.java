package com.cloudauth.clientconfig;

import java.io.IOException;
import java.util.Optional;

/**
 * Read access to the current client configuration.
 */
@FunctionalInterface
public interface ClientConfigReader {
  Optional<ClientConfig> read() throws IOException;
}
