package com.codeheadsystems.seedtransfer.client.accessor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.codeheadsystems.seedtransfer.client.exceptions.BackupAccessorException;
import com.codeheadsystems.seedtransfer.client.model.ServerConnectionInfo;
import com.codeheadsystems.seedtransfer.model.Argon2Params;
import com.codeheadsystems.seedtransfer.model.EncryptedBackup;
import com.codeheadsystems.seedtransfer.model.IdentityReference;
import com.codeheadsystems.seedtransfer.wire.BackupDocument;
import com.codeheadsystems.seedtransfer.wire.KdfParamsDocument;
import com.fasterxml.jackson.core.JsonParseException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

/**
 * The type Http backup transport test.
 */
@ExtendWith(MockitoExtension.class)
class HttpBackupTransportTest {

  private static final URI BASE_URI = URI.create("http://localhost:8080");
  private static final IdentityReference IDENTITY = new IdentityReference("alice@example.com");
  private static final EncryptedBackup BACKUP =
      new EncryptedBackup(new Argon2Params(new byte[16], 2, 65536, 1, 32, 12, 16), "AAAA");

  @Mock private HttpClient httpClient;
  @Mock private HttpResponse<String> httpResponse;
  @Mock private ObjectMapper objectMapper;

  private HttpBackupTransport transport;

  @BeforeEach
  void setUp() {
    transport = new HttpBackupTransport(httpClient, objectMapper, new ServerConnectionInfo(BASE_URI));
  }

  // ── Upload ────────────────────────────────────────────────────────────────

  @Test
  @SuppressWarnings("unchecked")
  void upload_success_putsDocumentToIdentityPath() throws Exception {
    when(objectMapper.writeValueAsString(any())).thenReturn("{}");
    doReturn(httpResponse).when(httpClient).send(any(), any());
    when(httpResponse.statusCode()).thenReturn(204);

    transport.upload(IDENTITY, BACKUP);

    ArgumentCaptor<HttpRequest> request = ArgumentCaptor.forClass(HttpRequest.class);
    verify(httpClient).send(request.capture(), any());
    assertThat(request.getValue().method()).isEqualTo("PUT");
    assertThat(request.getValue().uri().toString())
        .isEqualTo("http://localhost:8080/identity/backup/alice%40example.com");
    ArgumentCaptor<Object> body = ArgumentCaptor.forClass(Object.class);
    verify(objectMapper).writeValueAsString(body.capture());
    assertThat(body.getValue()).isEqualTo(new BackupDocument(BACKUP));
  }

  @Test
  @SuppressWarnings("unchecked")
  void upload_ioException_throwsBackupAccessorException() throws Exception {
    when(objectMapper.writeValueAsString(any())).thenReturn("{}");
    doThrow(new IOException("connection refused")).when(httpClient).send(any(), any());

    assertThatThrownBy(() -> transport.upload(IDENTITY, BACKUP))
        .isInstanceOf(BackupAccessorException.class)
        .hasMessageContaining("alice@example.com")
        .hasCauseInstanceOf(IOException.class);
  }

  @Test
  @SuppressWarnings("unchecked")
  void upload_401_throwsSecurityException() throws Exception {
    when(objectMapper.writeValueAsString(any())).thenReturn("{}");
    doReturn(httpResponse).when(httpClient).send(any(), any());
    when(httpResponse.statusCode()).thenReturn(401);

    assertThatThrownBy(() -> transport.upload(IDENTITY, BACKUP))
        .isInstanceOf(SecurityException.class)
        .hasMessageContaining("401");
  }

  @Test
  @SuppressWarnings("unchecked")
  void upload_500_throwsBackupAccessorException() throws Exception {
    when(objectMapper.writeValueAsString(any())).thenReturn("{}");
    doReturn(httpResponse).when(httpClient).send(any(), any());
    when(httpResponse.statusCode()).thenReturn(500);

    assertThatThrownBy(() -> transport.upload(IDENTITY, BACKUP))
        .isInstanceOf(BackupAccessorException.class)
        .hasMessageContaining("500");
  }

  @Test
  @SuppressWarnings("unchecked")
  void upload_interrupted_restoresInterruptFlag() throws Exception {
    when(objectMapper.writeValueAsString(any())).thenReturn("{}");
    doThrow(new InterruptedException("stop")).when(httpClient).send(any(), any());

    try {
      assertThatThrownBy(() -> transport.upload(IDENTITY, BACKUP))
          .isInstanceOf(BackupAccessorException.class)
          .hasMessageContaining("interrupted");
      assertThat(Thread.currentThread().isInterrupted()).isTrue();
    } finally {
      Thread.interrupted();
    }
  }

  // ── Download ──────────────────────────────────────────────────────────────

  @Test
  @SuppressWarnings("unchecked")
  void download_success_returnsBackup() throws Exception {
    String body = "{\"kdfParams\":{},\"encryptedSeed\":\"AAAA\"}";
    doReturn(httpResponse).when(httpClient).send(any(), any());
    when(httpResponse.statusCode()).thenReturn(200);
    when(httpResponse.body()).thenReturn(body);
    when(objectMapper.readValue(eq(body), eq(BackupDocument.class)))
        .thenReturn(new BackupDocument(BACKUP));

    Optional<EncryptedBackup> result = transport.download(IDENTITY);

    assertThat(result).contains(BACKUP);
    ArgumentCaptor<HttpRequest> request = ArgumentCaptor.forClass(HttpRequest.class);
    verify(httpClient).send(request.capture(), any());
    assertThat(request.getValue().method()).isEqualTo("GET");
  }

  @Test
  @SuppressWarnings("unchecked")
  void download_404_returnsEmpty() throws Exception {
    doReturn(httpResponse).when(httpClient).send(any(), any());
    when(httpResponse.statusCode()).thenReturn(404);

    assertThat(transport.download(IDENTITY)).isEmpty();
  }

  @Test
  @SuppressWarnings("unchecked")
  void download_401_throwsSecurityException() throws Exception {
    doReturn(httpResponse).when(httpClient).send(any(), any());
    when(httpResponse.statusCode()).thenReturn(401);

    assertThatThrownBy(() -> transport.download(IDENTITY))
        .isInstanceOf(SecurityException.class);
  }

  @Test
  @SuppressWarnings("unchecked")
  void download_unparseableBody_throwsBackupAccessorException() throws Exception {
    doReturn(httpResponse).when(httpClient).send(any(), any());
    when(httpResponse.statusCode()).thenReturn(200);
    when(httpResponse.body()).thenReturn("not json");
    when(objectMapper.readValue(eq("not json"), eq(BackupDocument.class)))
        .thenThrow(new JsonParseException(null, "bad"));

    assertThatThrownBy(() -> transport.download(IDENTITY))
        .isInstanceOf(BackupAccessorException.class);
  }

  @Test
  @SuppressWarnings("unchecked")
  void download_unsupportedKdf_throwsBackupAccessorException() throws Exception {
    doReturn(httpResponse).when(httpClient).send(any(), any());
    when(httpResponse.statusCode()).thenReturn(200);
    when(httpResponse.body()).thenReturn("{}");
    when(objectMapper.readValue(eq("{}"), eq(BackupDocument.class))).thenReturn(new BackupDocument(
        new KdfParamsDocument("pbkdf2", "AAAA", 1, 1, 1, 32, 12, 16), "AAAA"));

    assertThatThrownBy(() -> transport.download(IDENTITY))
        .isInstanceOf(BackupAccessorException.class)
        .hasMessageContaining("Malformed")
        .hasCauseInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void backupUri_keepsBasePathAndEncodesIdentity() {
    HttpBackupTransport prefixed = new HttpBackupTransport(httpClient, objectMapper,
        new ServerConnectionInfo(URI.create("https://backup.example.com/api/")));
    assertThat(prefixed.backupUri(new IdentityReference("bob smith")).toString())
        .isEqualTo("https://backup.example.com/api/identity/backup/bob%20smith");
  }
}
