package com.codeheadsystems.seedtransfer.qr;

/**
 * Why a scan session was thrown away.
 */
public enum RejectionReason {
  /**
   * A scanned text was not a frame of this protocol.
   */
  FORMAT_ERROR,
  /**
   * The reassembled words did not decode as a mnemonic.
   */
  DECODE_ERROR,
  /**
   * The words decoded, but the seed did not match the checksum frame.
   */
  CHECKSUM_MISMATCH
}
