package com.codeheadsystems.seedtransfer.cli;

import com.codeheadsystems.seedtransfer.backup.BackupConfig;
import com.codeheadsystems.seedtransfer.backup.PassphraseBackupCipher;
import com.codeheadsystems.seedtransfer.checksum.ChecksumCalculator;
import com.codeheadsystems.seedtransfer.client.accessor.HttpBackupTransport;
import com.codeheadsystems.seedtransfer.client.manager.IdentityTransferManager;
import com.codeheadsystems.seedtransfer.client.model.ServerConnectionInfo;
import com.codeheadsystems.seedtransfer.common.RandomProvider;
import com.codeheadsystems.seedtransfer.exceptions.DecryptionFailedException;
import com.codeheadsystems.seedtransfer.exceptions.SeedTransferException;
import com.codeheadsystems.seedtransfer.mnemonic.MnemonicCodec;
import com.codeheadsystems.seedtransfer.model.IdentityReference;
import com.codeheadsystems.seedtransfer.model.Mnemonic;
import com.codeheadsystems.seedtransfer.model.Seed;
import com.codeheadsystems.seedtransfer.qr.AssemblyEvent;
import com.codeheadsystems.seedtransfer.qr.AssemblyEvent.Outcome;
import com.codeheadsystems.seedtransfer.qr.FrameAssembler;
import com.codeheadsystems.seedtransfer.qr.QrFrameCodec;
import com.codeheadsystems.seedtransfer.store.IdentityStore;
import com.codeheadsystems.seedtransfer.store.InMemoryIdentityStore;
import com.codeheadsystems.seedtransfer.transport.BackupTransport;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.PrintStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.function.Function;

/**
 * Command-line tool for moving an identity seed between devices.
 *
 * <pre>
 * Usage:
 *   TransferCli &lt;command&gt; [arguments] [options]
 *
 * Commands:
 *   generate                                  Create a fresh seed, print hex and words.
 *   mnemonic &lt;seedHex&gt;                        Print the 24 recovery words.
 *   recover  &lt;word1&gt; ... &lt;word24&gt;              Print the seed for 24 recovery words.
 *   frames   &lt;seedHex&gt;                        Print the three QR frame texts.
 *   assemble &lt;frame&gt; &lt;frame&gt; &lt;frame&gt;          Reassemble frames (any order), print the seed.
 *   backup   &lt;identity&gt; &lt;seedHex&gt; &lt;passphrase&gt;  Encrypt and upload a backup.
 *   restore  &lt;identity&gt; &lt;passphrase&gt;           Download and decrypt a backup.
 *
 * Options:
 *   --server &lt;url&gt;       Backup server base URL   (default: http://localhost:8080)
 *   --memory &lt;kib&gt;       Argon2id memory in KiB   (default: 65536)
 *   --iterations &lt;n&gt;     Argon2id iterations      (default: 2)
 *   --parallelism &lt;n&gt;    Argon2id parallelism     (default: 1)
 * </pre>
 *
 * <p>The Argon2id options only affect new backups; restore always uses the parameters stored
 * with the backup.
 */
public class TransferCli {

  static final int EXIT_OK = 0;
  static final int EXIT_ERROR = 1;
  static final int EXIT_SECURITY = 2;
  static final int EXIT_REJECTED = 3;

  private static final String DEFAULT_SERVER = "http://localhost:8080";
  private static final int DEFAULT_MEMORY = BackupConfig.DEFAULT.memoryKib();
  private static final int DEFAULT_ITERATIONS = BackupConfig.DEFAULT.iterations();
  private static final int DEFAULT_PARALLELISM = BackupConfig.DEFAULT.parallelism();

  private final PrintStream out;
  private final PrintStream err;
  private final Function<ServerConnectionInfo, BackupTransport> transportFactory;
  private final MnemonicCodec mnemonicCodec = new MnemonicCodec();
  private final ChecksumCalculator checksumCalculator = new ChecksumCalculator();
  private final QrFrameCodec frameCodec = new QrFrameCodec(checksumCalculator);

  TransferCli(final PrintStream out, final PrintStream err,
              final Function<ServerConnectionInfo, BackupTransport> transportFactory) {
    this.out = out;
    this.err = err;
    this.transportFactory = transportFactory;
  }

  /**
   * Main entry point.
   *
   * @param args command-line arguments
   */
  public static void main(String[] args) {
    TransferCli cli = new TransferCli(System.out, System.err,
        info -> new HttpBackupTransport(HttpClient.newHttpClient(), new ObjectMapper(), info));
    System.exit(cli.run(args));
  }

  int run(String[] args) {
    String server = DEFAULT_SERVER;
    int memory = DEFAULT_MEMORY;
    int iterations = DEFAULT_ITERATIONS;
    int parallelism = DEFAULT_PARALLELISM;
    List<String> positional = new ArrayList<>();

    try {
      for (int i = 0; i < args.length; i++) {
        switch (args[i]) {
          case "--server"      -> server      = args[++i];
          case "--memory"      -> memory      = Integer.parseInt(args[++i]);
          case "--iterations"  -> iterations  = Integer.parseInt(args[++i]);
          case "--parallelism" -> parallelism = Integer.parseInt(args[++i]);
          default              -> positional.add(args[i]);
        }
      }
    } catch (ArrayIndexOutOfBoundsException | NumberFormatException e) {
      err.println("Invalid option: " + e.getMessage());
      printUsage();
      return EXIT_ERROR;
    }

    if (positional.isEmpty()) {
      printUsage();
      return EXIT_ERROR;
    }

    String command = positional.get(0);
    List<String> rest = positional.subList(1, positional.size());
    try {
      return switch (command) {
        case "generate" -> runGenerate();
        case "mnemonic" -> expect(rest, 1) ? runMnemonic(rest.get(0)) : EXIT_ERROR;
        case "recover"  -> runRecover(rest);
        case "frames"   -> expect(rest, 1) ? runFrames(rest.get(0)) : EXIT_ERROR;
        case "assemble" -> expect(rest, QrFrameCodec.TOTAL_FRAMES) ? runAssemble(rest) : EXIT_ERROR;
        case "backup"   -> expect(rest, 3)
            ? runBackup(server, BackupConfig.withArgon2id(memory, iterations, parallelism),
                rest.get(0), rest.get(1), rest.get(2))
            : EXIT_ERROR;
        case "restore"  -> expect(rest, 2) ? runRestore(server, rest.get(0), rest.get(1)) : EXIT_ERROR;
        default -> {
          err.println("Unknown command: " + command);
          printUsage();
          yield EXIT_ERROR;
        }
      };
    } catch (SecurityException e) {
      err.println("Security failure: " + e.getMessage());
      return EXIT_SECURITY;
    } catch (DecryptionFailedException e) {
      err.println(e.getMessage());
      return EXIT_SECURITY;
    } catch (SeedTransferException | IllegalArgumentException | IllegalStateException e) {
      err.println("Error: " + e.getMessage());
      return EXIT_ERROR;
    }
  }

  // ── Commands ──────────────────────────────────────────────────────────────

  private int runGenerate() {
    Seed seed = Seed.generate(new RandomProvider());
    try {
      out.println("seed  : " + seed.toHex());
      out.println("words : " + mnemonicCodec.encode(seed).phrase());
      return EXIT_OK;
    } finally {
      seed.destroy();
    }
  }

  private int runMnemonic(String seedHex) {
    Seed seed = Seed.fromHex(seedHex);
    try {
      out.println(mnemonicCodec.encode(seed).phrase());
      return EXIT_OK;
    } finally {
      seed.destroy();
    }
  }

  private int runRecover(List<String> words) {
    Seed seed = mnemonicCodec.decode(Mnemonic.parse(String.join(" ", words)));
    try {
      out.println(seed.toHex());
      return EXIT_OK;
    } finally {
      seed.destroy();
    }
  }

  private int runFrames(String seedHex) {
    Seed seed = Seed.fromHex(seedHex);
    try {
      frameCodec.encodeAll(mnemonicCodec.encode(seed), seed).forEach(out::println);
      return EXIT_OK;
    } finally {
      seed.destroy();
    }
  }

  private int runAssemble(List<String> frames) {
    IdentityStore store = new InMemoryIdentityStore();
    FrameAssembler assembler = new FrameAssembler(frameCodec, mnemonicCodec, checksumCalculator, store);
    for (String frame : frames) {
      AssemblyEvent event = assembler.offer(frame);
      out.println(event.outcome() + ": " + event.detail());
      if (event.outcome() == Outcome.REJECTED) {
        return EXIT_REJECTED;
      }
    }
    if (!assembler.state().isTerminal()) {
      err.println("Incomplete frame set: received " + assembler.state().received());
      return EXIT_REJECTED;
    }
    out.println(store.get().map(this::hexAndDestroy).orElseThrow());
    return EXIT_OK;
  }

  private int runBackup(String server, BackupConfig config, String identity, String seedHex,
                        String passphrase) {
    IdentityStore store = new InMemoryIdentityStore();
    Seed seed = Seed.fromHex(seedHex);
    try {
      store.set(seed);
    } finally {
      seed.destroy();
    }
    out.println("Server  : " + server);
    out.println("Argon2id: memory=" + config.memoryKib() + " KiB, iterations=" + config.iterations()
        + ", parallelism=" + config.parallelism());
    out.println("Encrypting and uploading backup...");
    join(manager(server, config, store).createBackup(new IdentityReference(identity),
        passphrase.toCharArray()));
    out.println("Backup stored.");
    return EXIT_OK;
  }

  private int runRestore(String server, String identity, String passphrase) {
    IdentityStore store = new InMemoryIdentityStore();
    out.println("Server  : " + server);
    out.println("Downloading and decrypting backup...");
    join(manager(server, BackupConfig.DEFAULT, store).restoreBackup(new IdentityReference(identity),
        passphrase.toCharArray()));
    out.println(store.get().map(this::hexAndDestroy).orElseThrow());
    return EXIT_OK;
  }

  // ── Helpers ───────────────────────────────────────────────────────────────

  private IdentityTransferManager manager(String server, BackupConfig config, IdentityStore store) {
    BackupTransport transport = transportFactory.apply(new ServerConnectionInfo(URI.create(server)));
    return new IdentityTransferManager(mnemonicCodec, checksumCalculator, frameCodec,
        new PassphraseBackupCipher(config), store, transport, Runnable::run);
  }

  private String hexAndDestroy(Seed seed) {
    try {
      return seed.toHex();
    } finally {
      seed.destroy();
    }
  }

  private boolean expect(List<String> arguments, int count) {
    if (arguments.size() != count) {
      err.println("Expected " + count + " argument(s), got " + arguments.size());
      printUsage();
      return false;
    }
    return true;
  }

  private static <T> T join(CompletableFuture<T> future) {
    try {
      return future.join();
    } catch (CompletionException e) {
      if (e.getCause() instanceof RuntimeException cause) {
        throw cause;
      }
      throw e;
    }
  }

  private void printUsage() {
    err.println("Usage: TransferCli <command> [arguments] [options]");
    err.println();
    err.println("Commands:");
    err.println("  generate                                  Create a fresh seed");
    err.println("  mnemonic <seedHex>                        Print the 24 recovery words");
    err.println("  recover  <word1> ... <word24>             Print the seed for 24 words");
    err.println("  frames   <seedHex>                        Print the three QR frame texts");
    err.println("  assemble <frame> <frame> <frame>          Reassemble frames, print the seed");
    err.println("  backup   <identity> <seedHex> <passphrase> Encrypt and upload a backup");
    err.println("  restore  <identity> <passphrase>          Download and decrypt a backup");
    err.println();
    err.println("Options:");
    err.println("  --server <url>       Backup server base URL (default: " + DEFAULT_SERVER + ")");
    err.println("  --memory <kib>       Argon2id memory KiB    (default: " + DEFAULT_MEMORY + ")");
    err.println("  --iterations <n>     Argon2id iterations    (default: " + DEFAULT_ITERATIONS + ")");
    err.println("  --parallelism <n>    Argon2id parallelism   (default: " + DEFAULT_PARALLELISM + ")");
  }
}
