package ca.gc.cra.rdt.domain.segment;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Integrity digest used by {@link Segment}: the first four bytes of MD5 over the header fields
 * (checksum excluded) followed by the payload.
 *
 * <p>Stateless; a fresh {@link MessageDigest} is obtained per call.</p>
 *
 * @since 0.1.0
 */
public final class Checksums {
  private static final String ALGORITHM = "MD5";

  private Checksums() {
    // Utility
  }

  /**
   * Computes the digest for the supplied wire fields.
   *
   * @param flags flag byte
   * @param seq 32-bit sequence number
   * @param ack 32-bit acknowledgment number
   * @param window 16-bit advertised window
   * @param payload payload bytes; must not be {@code null}
   * @return digest folded into a big-endian {@code int}
   */
  public static int compute(int flags, long seq, long ack, int window, byte[] payload) {
    MessageDigest digest = newDigest();
    digest.update((byte) flags);
    updateInt(digest, seq);
    updateInt(digest, ack);
    digest.update((byte) (window >>> 8));
    digest.update((byte) window);
    digest.update(payload);
    byte[] hash = digest.digest();
    return ((hash[0] & 0xFF) << 24)
        | ((hash[1] & 0xFF) << 16)
        | ((hash[2] & 0xFF) << 8)
        | (hash[3] & 0xFF);
  }

  private static void updateInt(MessageDigest digest, long value) {
    digest.update((byte) (value >>> 24));
    digest.update((byte) (value >>> 16));
    digest.update((byte) (value >>> 8));
    digest.update((byte) value);
  }

  private static MessageDigest newDigest() {
    try {
      return MessageDigest.getInstance(ALGORITHM);
    } catch (NoSuchAlgorithmException ex) {
      // Every Java SE platform ships MD5.
      throw new IllegalStateException("MD5 digest unavailable", ex);
    }
  }
}
