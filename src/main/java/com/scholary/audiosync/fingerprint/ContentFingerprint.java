package com.scholary.audiosync.fingerprint;

import com.fasterxml.jackson.annotation.JsonValue;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.regex.Pattern;

/**
 * SHA-256 digest of a file's full byte content.
 *
 * <p>This is the identity key for the whole system: two files with the same fingerprint are the
 * same content for sync purposes, whatever their name or location. Files are hashed in fixed-size
 * chunks so memory use does not depend on file size.
 */
public record ContentFingerprint(@JsonValue String hex) {

  private static final Pattern HEX_PATTERN = Pattern.compile("[0-9a-f]{64}");
  private static final int BUFFER_SIZE = 64 * 1024;

  public ContentFingerprint {
    if (hex == null || !HEX_PATTERN.matcher(hex).matches()) {
      throw new IllegalArgumentException("Fingerprint must be 64 lowercase hex characters");
    }
  }

  /**
   * Hash the content of a file.
   *
   * @param file the file to hash
   * @return the fingerprint of its content
   * @throws IOException if the file cannot be read
   */
  public static ContentFingerprint of(Path file) throws IOException {
    try (InputStream in = Files.newInputStream(file)) {
      return of(in);
    }
  }

  /** Hash everything remaining in a stream. The caller closes the stream. */
  public static ContentFingerprint of(InputStream in) throws IOException {
    MessageDigest digest = newDigest();
    byte[] buffer = new byte[BUFFER_SIZE];
    int read;
    while ((read = in.read(buffer)) != -1) {
      digest.update(buffer, 0, read);
    }
    return new ContentFingerprint(HexFormat.of().formatHex(digest.digest()));
  }

  /** Hash an in-memory byte array. */
  public static ContentFingerprint of(byte[] content) {
    return new ContentFingerprint(HexFormat.of().formatHex(newDigest().digest(content)));
  }

  /** Parse a stored fingerprint, returning null for null input. */
  public static ContentFingerprint fromHex(String hex) {
    return hex == null ? null : new ContentFingerprint(hex);
  }

  /** First 12 characters, for log lines. */
  public String shortForm() {
    return hex.substring(0, 12);
  }

  @Override
  public String toString() {
    return hex;
  }

  private static MessageDigest newDigest() {
    try {
      return MessageDigest.getInstance("SHA-256");
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }
}
