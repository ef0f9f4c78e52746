package com.example.ghostmysql.core.credentials;

/**
 * Character-class constraints for a generated password.
 *
 * @param length number of characters, must be positive
 * @param lowercase include lowercase letters
 * @param uppercase include uppercase letters
 * @param numbers include digits
 * @param symbols include symbols
 * @param strict require at least one character of every included class
 */
public record PasswordPolicy(
    int length,
    boolean lowercase,
    boolean uppercase,
    boolean numbers,
    boolean symbols,
    boolean strict) {

  public PasswordPolicy {
    if (length <= 0) throw new IllegalArgumentException("length must be positive");
    if (!lowercase && !uppercase && !numbers && !symbols)
      throw new IllegalArgumentException("at least one character class must be enabled");
    if (strict && length < classCount(lowercase, uppercase, numbers, symbols))
      throw new IllegalArgumentException("length is too short for a strict policy");
  }

  /**
   * Letters, digits and symbols, each guaranteed to appear at least once.
   *
   * @param length number of characters
   * @return strict policy
   */
  public static PasswordPolicy strict(final int length) {
    return new PasswordPolicy(length, true, true, true, true, true);
  }

  private static int classCount(final boolean... enabled) {
    var count = 0;
    for (final var e : enabled) if (e) count++;
    return count;
  }
}
