package com.example.ghostmysql.core.credentials;

import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Random;

/** Generates random passwords from a {@link PasswordPolicy} using {@link SecureRandom}. */
public final class PasswordGenerator {

  static final String LOWERCASE = "abcdefghijklmnopqrstuvwxyz";
  static final String UPPERCASE = "ABCDEFGHIJKLMNOPQRSTUVWXYZ";
  static final String NUMBERS = "0123456789";
  static final String SYMBOLS = "!@#$%^&*()+_-=}{[]|:;\"/?.><,`~";

  private final Random random;

  public PasswordGenerator() {
    this(new SecureRandom());
  }

  PasswordGenerator(final Random random) {
    this.random = random;
  }

  /**
   * Generates a password. With a strict policy one character of every enabled class is placed
   * first, the rest is drawn from the combined pool, and the result is shuffled.
   *
   * @param policy character-class constraints
   * @return a new password
   */
  public String generate(final PasswordPolicy policy) {
    final var classes = new ArrayList<String>(4);
    if (policy.lowercase()) classes.add(LOWERCASE);
    if (policy.uppercase()) classes.add(UPPERCASE);
    if (policy.numbers()) classes.add(NUMBERS);
    if (policy.symbols()) classes.add(SYMBOLS);
    final var pool = String.join("", classes);

    final var chars = new ArrayList<Character>(policy.length());
    if (policy.strict()) {
      for (final var cls : classes) chars.add(pick(cls));
    }
    while (chars.size() < policy.length()) chars.add(pick(pool));
    Collections.shuffle(chars, random);

    final var sb = new StringBuilder(policy.length());
    chars.forEach(sb::append);
    return sb.toString();
  }

  private char pick(final String source) {
    return source.charAt(random.nextInt(source.length()));
  }
}
