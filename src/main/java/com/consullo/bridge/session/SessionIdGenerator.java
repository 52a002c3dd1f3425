package com.consullo.bridge.session;

import java.security.SecureRandom;
import java.util.Random;
import java.util.function.Predicate;
import org.apache.commons.lang3.RandomStringUtils;
import org.apache.commons.lang3.Validate;

/**
 * Generates short, human-typeable session ids, re-rolled on collision.
 *
 * @since 1.0
 */
public final class SessionIdGenerator {

  public static final int DEFAULT_LENGTH = 6;
  public static final String DEFAULT_ALPHABET = "ABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789";

  static final int MAX_ATTEMPTS = 1000;

  private final char[] alphabet;
  private final int length;
  private final Random random;

  /**
   * Creates a generator of 6-character ids over {@code A-Z0-9}.
   */
  public SessionIdGenerator() {
    this(DEFAULT_ALPHABET, DEFAULT_LENGTH, new SecureRandom());
  }

  /**
   * Creates a generator.
   *
   * @param alphabet characters ids are drawn from
   * @param length id length
   * @param random randomness source
   */
  public SessionIdGenerator(final String alphabet, final int length, final Random random) {
    Validate.notEmpty(alphabet, "alphabet must not be empty");
    Validate.isTrue(length > 0, "length must be positive");
    Validate.notNull(random, "random must not be null");
    this.alphabet = alphabet.toCharArray();
    this.length = length;
    this.random = random;
  }

  /**
   * Returns an id for which {@code taken} is false.
   *
   * @param taken tells whether an id is already in use
   * @return fresh id
   * @throws IllegalStateException if no free id was found within the attempt bound
   */
  public String generate(final Predicate<String> taken) {
    Validate.notNull(taken, "taken must not be null");
    for (int attempt = 0; attempt < MAX_ATTEMPTS; attempt++) {
      final String id;
      synchronized (random) {
        id = RandomStringUtils.random(length, 0, alphabet.length, false, false, alphabet, random);
      }
      if (!taken.test(id)) {
        return id;
      }
    }
    throw new IllegalStateException("No free session id after " + MAX_ATTEMPTS + " attempts");
  }
}
