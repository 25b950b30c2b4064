package com.codeheadsystems.seedtransfer.client.model;

import java.net.URI;

/**
 * Network connection details for the backup server.
 *
 * @param endpoint base URL of the server (e.g. http://host:8080). Paths are appended to it.
 */
public record ServerConnectionInfo(URI endpoint) {

  public ServerConnectionInfo {
    if (endpoint == null) {
      throw new IllegalArgumentException("endpoint is required");
    }
  }
}
