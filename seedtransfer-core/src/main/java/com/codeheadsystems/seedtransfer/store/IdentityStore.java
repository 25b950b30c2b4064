package com.codeheadsystems.seedtransfer.store;

import com.codeheadsystems.seedtransfer.model.Seed;
import java.util.Optional;

/**
 * Secure at-rest storage of this device's seed (keychain, keystore, encrypted preferences).
 * <p>
 * Implementations must be thread-safe and must keep their own copy of the seed: callers
 * destroy the instance they passed to {@link #set(Seed)} as soon as it returns.
 */
public interface IdentityStore {

  /**
   * Loads the stored seed.
   *
   * @return a new seed instance owned by the caller, or empty if no identity exists yet
   */
  Optional<Seed> get();

  /**
   * Stores or replaces the seed.
   *
   * @param seed the seed to persist
   */
  void set(Seed seed);
}
