package com.codeheadsystems.seedtransfer.client.accessor;

import com.codeheadsystems.seedtransfer.client.exceptions.BackupAccessorException;
import com.codeheadsystems.seedtransfer.client.model.ServerConnectionInfo;
import com.codeheadsystems.seedtransfer.model.EncryptedBackup;
import com.codeheadsystems.seedtransfer.model.IdentityReference;
import com.codeheadsystems.seedtransfer.transport.BackupTransport;
import com.codeheadsystems.seedtransfer.wire.BackupDocument;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.Optional;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link BackupTransport} backed by the backup server's REST endpoint
 * {@code /identity/backup/{identity}}.
 * <p>
 * {@code PUT} stores a {@link BackupDocument}, {@code GET} returns it. A 404 on {@code GET}
 * means no backup exists. A 401 from either call is surfaced as a {@link SecurityException}.
 * Other error statuses, I/O errors, interruptions and unreadable documents are wrapped in
 * {@link BackupAccessorException}.
 */
@Singleton
public class HttpBackupTransport implements BackupTransport {

  private static final Logger log = LoggerFactory.getLogger(HttpBackupTransport.class);

  private final HttpClient httpClient;
  private final ObjectMapper objectMapper;
  private final ServerConnectionInfo serverConnectionInfo;

  /**
   * Instantiates a new Http backup transport.
   *
   * @param httpClient           the http client
   * @param objectMapper         the object mapper
   * @param serverConnectionInfo the backup server
   */
  @Inject
  public HttpBackupTransport(final HttpClient httpClient,
                             final ObjectMapper objectMapper,
                             final ServerConnectionInfo serverConnectionInfo) {
    log.info("HttpBackupTransport({})", serverConnectionInfo.endpoint());
    this.httpClient = httpClient;
    this.objectMapper = objectMapper;
    this.serverConnectionInfo = serverConnectionInfo;
  }

  @Override
  public void upload(final IdentityReference identity, final EncryptedBackup backup) {
    log.debug("upload(identity={})", identity);
    URI uri = backupUri(identity);
    try {
      String requestBody = objectMapper.writeValueAsString(new BackupDocument(backup));
      HttpRequest request = HttpRequest.newBuilder()
          .uri(uri)
          .header("Content-Type", "application/json")
          .PUT(HttpRequest.BodyPublishers.ofString(requestBody))
          .build();
      HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
      checkStatus(identity, response.statusCode());
    } catch (IOException e) {
      throw new BackupAccessorException("HTTP request failed for identity: " + identity, e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new BackupAccessorException("HTTP request interrupted for identity: " + identity, e);
    }
  }

  @Override
  public Optional<EncryptedBackup> download(final IdentityReference identity) {
    log.debug("download(identity={})", identity);
    URI uri = backupUri(identity);
    try {
      HttpRequest request = HttpRequest.newBuilder()
          .uri(uri)
          .header("Accept", "application/json")
          .GET()
          .build();
      HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
      if (response.statusCode() == 404) {
        log.debug("download: no backup for identity={}", identity);
        return Optional.empty();
      }
      checkStatus(identity, response.statusCode());
      BackupDocument document = objectMapper.readValue(response.body(), BackupDocument.class);
      if (document == null) {
        throw new BackupAccessorException("Empty backup document for identity: " + identity, null);
      }
      return Optional.of(document.encryptedBackup());
    } catch (IllegalArgumentException e) {
      throw new BackupAccessorException("Malformed backup document for identity: " + identity, e);
    } catch (IOException e) {
      throw new BackupAccessorException("HTTP request failed for identity: " + identity, e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new BackupAccessorException("HTTP request interrupted for identity: " + identity, e);
    }
  }

  // ── Helpers ───────────────────────────────────────────────────────────────

  URI backupUri(IdentityReference identity) {
    URI base = serverConnectionInfo.endpoint();
    String encoded = URLEncoder.encode(identity.value(), StandardCharsets.UTF_8).replace("+", "%20");
    String basePath = base.getPath() == null ? "" : base.getPath();
    if (basePath.endsWith("/")) {
      basePath = basePath.substring(0, basePath.length() - 1);
    }
    return base.resolve(basePath + "/identity/backup/" + encoded);
  }

  private void checkStatus(IdentityReference identity, int statusCode) {
    if (statusCode == 401) {
      throw new SecurityException("Server rejected request (401) for identity: " + identity);
    }
    if (statusCode >= 400) {
      throw new BackupAccessorException(
          "Server returned HTTP " + statusCode + " for identity: " + identity, null);
    }
  }
}
