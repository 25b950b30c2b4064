package com.codeheadsystems.seedtransfer.store;

import com.codeheadsystems.seedtransfer.common.ByteUtils;
import com.codeheadsystems.seedtransfer.model.Seed;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-persistent {@link IdentityStore}. The seed is lost when the process exits.
 * Suitable for tests and the command line tool only.
 */
public class InMemoryIdentityStore implements IdentityStore {

  private static final Logger log = LoggerFactory.getLogger(InMemoryIdentityStore.class);

  private byte[] seed;

  public InMemoryIdentityStore() {
    log.warn("Using InMemoryIdentityStore, the identity will NOT survive restarts.");
  }

  @Override
  public synchronized Optional<Seed> get() {
    return seed == null ? Optional.empty() : Optional.of(Seed.of(seed));
  }

  @Override
  public synchronized void set(Seed seed) {
    ByteUtils.zero(this.seed);
    this.seed = seed.bytes();
    log.debug("Stored identity seed");
  }
}
