package com.codeheadsystems.seedtransfer.mnemonic;

import com.codeheadsystems.seedtransfer.common.ByteUtils;
import com.codeheadsystems.seedtransfer.exceptions.InvalidMnemonicException;
import com.codeheadsystems.seedtransfer.model.Mnemonic;
import com.codeheadsystems.seedtransfer.model.Seed;
import java.util.List;
import java.util.Objects;
import org.bitcoinj.crypto.MnemonicCode;
import org.bitcoinj.crypto.MnemonicException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts between a 32-byte seed and its 24-word BIP-39 mnemonic (English word list).
 * <p>
 * 256 bits of entropy plus an 8-bit SHA-256 checksum give 264 bits, i.e. 24 words of 11 bits.
 * Shorter BIP-39 phrases are valid in general but not here: only the 24-word form
 * round-trips a full seed, so anything else is rejected before the word list is consulted.
 */
public class MnemonicCodec {

  /**
   * Words in a seed mnemonic.
   */
  public static final int WORD_COUNT = 24;

  private static final Logger log = LoggerFactory.getLogger(MnemonicCodec.class);

  private final MnemonicCode mnemonicCode;

  /**
   * Uses bitcoinj's bundled English word list.
   */
  public MnemonicCodec() {
    this(MnemonicCode.INSTANCE);
  }

  /**
   * Instantiates a new mnemonic codec.
   *
   * @param mnemonicCode the BIP-39 implementation
   */
  public MnemonicCodec(final MnemonicCode mnemonicCode) {
    this.mnemonicCode = Objects.requireNonNull(mnemonicCode, "BIP-39 word list not loaded");
  }

  /**
   * Encodes a seed. Deterministic and total for every well-formed seed.
   *
   * @param seed the seed
   * @return the 24-word mnemonic
   */
  public Mnemonic encode(final Seed seed) {
    byte[] entropy = seed.bytes();
    try {
      return new Mnemonic(toWords(entropy));
    } finally {
      ByteUtils.zero(entropy);
    }
  }

  /**
   * Decodes a mnemonic back to its seed, checking word count, vocabulary and the embedded
   * checksum before anything is returned.
   *
   * @param mnemonic the mnemonic
   * @return the seed
   * @throws InvalidMnemonicException if any check fails
   */
  public Seed decode(final Mnemonic mnemonic) {
    if (mnemonic.size() != WORD_COUNT) {
      throw new InvalidMnemonicException(
          "Expected " + WORD_COUNT + " words but got " + mnemonic.size());
    }
    byte[] entropy;
    try {
      entropy = mnemonicCode.toEntropy(mnemonic.words());
    } catch (MnemonicException.MnemonicWordException e) {
      throw new InvalidMnemonicException("Mnemonic contains a word outside the word list", e);
    } catch (MnemonicException.MnemonicChecksumException e) {
      throw new InvalidMnemonicException("Mnemonic checksum does not match", e);
    } catch (MnemonicException e) {
      throw new InvalidMnemonicException("Mnemonic is malformed", e);
    }
    try {
      return Seed.of(entropy);
    } finally {
      ByteUtils.zero(entropy);
    }
  }

  /**
   * Parses and decodes typed-in words.
   *
   * @param phrase space separated words
   * @return the seed
   * @throws InvalidMnemonicException if the phrase is not a valid 24-word mnemonic
   */
  public Seed decode(final String phrase) {
    return decode(Mnemonic.parse(phrase));
  }

  /**
   * Non-throwing form of {@link #decode(Mnemonic)} for early input validation.
   *
   * @param mnemonic the mnemonic
   * @return true if the mnemonic would decode
   */
  public boolean validate(final Mnemonic mnemonic) {
    if (mnemonic.size() != WORD_COUNT) {
      return false;
    }
    try {
      mnemonicCode.check(mnemonic.words());
      return true;
    } catch (MnemonicException e) {
      log.debug("validate: rejected ({})", e.getClass().getSimpleName());
      return false;
    }
  }

  /**
   * @param word a candidate word
   * @return true if the word is in the word list
   */
  public boolean isWord(final String word) {
    return mnemonicCode.getWordList().contains(word);
  }

  /**
   * @return the 2048-word list, in index order
   */
  public List<String> wordList() {
    return mnemonicCode.getWordList();
  }

  private List<String> toWords(byte[] entropy) {
    try {
      return mnemonicCode.toMnemonic(entropy);
    } catch (Exception e) {
      // Some bitcoinj releases declare a checked length exception here; 32 bytes never trips it.
      throw new IllegalArgumentException("Unable to encode seed as mnemonic", e);
    }
  }
}
