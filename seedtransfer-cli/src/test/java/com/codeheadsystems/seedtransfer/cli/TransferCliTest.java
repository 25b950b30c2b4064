package com.codeheadsystems.seedtransfer.cli;

import static org.assertj.core.api.Assertions.assertThat;

import com.codeheadsystems.seedtransfer.transport.InMemoryBackupTransport;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class TransferCliTest {

  private static final String SEED_HEX = "7f".repeat(32);
  private static final String SEED_WORDS =
      "legal winner thank year wave sausage worth useful ".repeat(2)
          + "legal winner thank year wave sausage worth title";

  private final InMemoryBackupTransport transport = new InMemoryBackupTransport();

  private ByteArrayOutputStream out;
  private ByteArrayOutputStream err;
  private TransferCli cli;

  @BeforeEach
  void setUp() {
    out = new ByteArrayOutputStream();
    err = new ByteArrayOutputStream();
    cli = new TransferCli(new PrintStream(out, true, StandardCharsets.UTF_8),
        new PrintStream(err, true, StandardCharsets.UTF_8), info -> transport);
  }

  private String out() {
    return out.toString(StandardCharsets.UTF_8);
  }

  private String err() {
    return err.toString(StandardCharsets.UTF_8);
  }

  @Test
  void noArguments_printsUsage() {
    assertThat(cli.run(new String[0])).isEqualTo(TransferCli.EXIT_ERROR);
    assertThat(err()).contains("Usage: TransferCli");
  }

  @Test
  void unknownCommand_fails() {
    assertThat(cli.run(new String[]{"explode"})).isEqualTo(TransferCli.EXIT_ERROR);
    assertThat(err()).contains("Unknown command: explode");
  }

  @Test
  void generate_printsSeedAndWords() {
    assertThat(cli.run(new String[]{"generate"})).isEqualTo(TransferCli.EXIT_OK);
    assertThat(out()).containsPattern("seed  : [0-9a-f]{64}").contains("words : ");
  }

  @Test
  void mnemonic_printsWords() {
    assertThat(cli.run(new String[]{"mnemonic", SEED_HEX})).isEqualTo(TransferCli.EXIT_OK);
    assertThat(out().trim()).isEqualTo(SEED_WORDS);
  }

  @Test
  void recover_printsSeed() {
    String[] args = ("recover " + SEED_WORDS).split(" ");
    assertThat(cli.run(args)).isEqualTo(TransferCli.EXIT_OK);
    assertThat(out().trim()).isEqualTo(SEED_HEX);
  }

  @Test
  void recover_badWords_fails() {
    assertThat(cli.run(new String[]{"recover", "zoo", "zoo"})).isEqualTo(TransferCli.EXIT_ERROR);
    assertThat(err()).contains("Expected 24 words");
  }

  @Test
  void frames_thenAssembleReversed_recoversSeed() {
    assertThat(cli.run(new String[]{"frames", SEED_HEX})).isEqualTo(TransferCli.EXIT_OK);
    String[] frames = out().trim().split("\\R");
    assertThat(frames).hasSize(3);

    out.reset();
    assertThat(cli.run(new String[]{"assemble", frames[2], frames[1], frames[0]}))
        .isEqualTo(TransferCli.EXIT_OK);
    assertThat(out()).contains("SUCCEEDED").endsWith(SEED_HEX + System.lineSeparator());
  }

  @Test
  void assemble_corruptedChecksum_isRejected() {
    cli.run(new String[]{"frames", SEED_HEX});
    String[] frames = out().trim().split("\\R");
    String corrupted = frames[2].substring(0, frames[2].length() - 1) + "x";

    out.reset();
    assertThat(cli.run(new String[]{"assemble", frames[0], frames[1], corrupted}))
        .isEqualTo(TransferCli.EXIT_REJECTED);
    assertThat(out()).contains("REJECTED");
  }

  @Test
  void frames_badHex_fails() {
    assertThat(cli.run(new String[]{"frames", "nothex"})).isEqualTo(TransferCli.EXIT_ERROR);
  }

  @Test
  void backup_thenRestore_recoversSeed() {
    assertThat(cli.run(new String[]{"backup", "alice", SEED_HEX, "hunter2"}))
        .isEqualTo(TransferCli.EXIT_OK);
    assertThat(out()).contains("Backup stored.");

    out.reset();
    assertThat(cli.run(new String[]{"restore", "alice", "hunter2"})).isEqualTo(TransferCli.EXIT_OK);
    assertThat(out()).endsWith(SEED_HEX + System.lineSeparator());
  }

  @Test
  void restore_wrongPassphrase_exitsWithSecurityCode() {
    cli.run(new String[]{"backup", "alice", SEED_HEX, "hunter2"});

    assertThat(cli.run(new String[]{"restore", "alice", "hunter3"}))
        .isEqualTo(TransferCli.EXIT_SECURITY);
    assertThat(err()).contains("Wrong passphrase or corrupted backup");
  }

  @Test
  void restore_unknownIdentity_fails() {
    assertThat(cli.run(new String[]{"restore", "nobody", "pw"})).isEqualTo(TransferCli.EXIT_ERROR);
    assertThat(err()).contains("No backup found");
  }

  @Test
  void backup_costBelowFloor_fails() {
    assertThat(cli.run(new String[]{"backup", "alice", SEED_HEX, "pw", "--memory", "1024"}))
        .isEqualTo(TransferCli.EXIT_ERROR);
  }

  @Test
  void option_missingValue_fails() {
    assertThat(cli.run(new String[]{"generate", "--memory"})).isEqualTo(TransferCli.EXIT_ERROR);
  }
}
