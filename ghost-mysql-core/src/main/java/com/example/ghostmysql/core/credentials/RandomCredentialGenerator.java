package com.example.ghostmysql.core.credentials;

import com.example.ghostmysql.core.ProvisionerSettings;
import java.security.SecureRandom;
import java.util.Random;

/**
 * Default {@link CredentialGenerator}: {@code <prefix><n>} usernames with {@code n} drawn from
 * {@code [0, range)} and strict passwords.
 *
 * <p>The username namespace is deliberately small, so collisions with accounts left over from
 * earlier installs are expected; the provisioner retries with a new name when one occurs.
 */
public final class RandomCredentialGenerator implements CredentialGenerator {

  private final String prefix;
  private final int range;
  private final PasswordPolicy policy;
  private final PasswordGenerator passwords;
  private final Random random;

  public RandomCredentialGenerator(final ProvisionerSettings settings) {
    this(settings, new SecureRandom());
  }

  RandomCredentialGenerator(final ProvisionerSettings settings, final Random random) {
    this.prefix = settings.usernamePrefix();
    this.range = settings.usernameRange();
    this.policy = PasswordPolicy.strict(settings.passwordLength());
    this.passwords = new PasswordGenerator(random);
    this.random = random;
  }

  @Override
  public String username() {
    return prefix + random.nextInt(range);
  }

  @Override
  public String password() {
    return passwords.generate(policy);
  }
}
