package com.example.ghostmysql.core;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.*;

class ProvisionerSettingsTest {

  @AfterEach
  void clearProperties() {
    System.clearProperty("ghost.mysql.root-user");
    System.clearProperty("ghost.mysql.user.max-attempts");
    System.clearProperty("ghost.mysql.password.length");
  }

  @Test
  @DisplayName("Defaults match a stock Ghost install")
  void defaults() {
    final var settings = ProvisionerSettings.defaults();
    assertEquals("root", settings.rootUser());
    assertEquals("ghost-", settings.usernamePrefix());
    assertEquals(1000, settings.usernameRange());
    assertEquals(10, settings.passwordLength());
    assertTrue(settings.collisionPolicy().isUnbounded());
  }

  @Test
  @DisplayName("System properties override defaults")
  void systemPropertiesOverrideDefaults() {
    System.setProperty("ghost.mysql.root-user", "admin");
    System.setProperty("ghost.mysql.user.max-attempts", " 25 ");
    System.setProperty("ghost.mysql.password.length", "16");

    final var settings = ProvisionerSettings.fromEnvironment();

    assertEquals("admin", settings.rootUser());
    assertEquals(16, settings.passwordLength());
    assertFalse(settings.collisionPolicy().isUnbounded());
    assertEquals(25, settings.collisionPolicy().maxAttempts());
  }

  @Test
  @DisplayName("Non-numeric values are rejected with the property name")
  void nonNumericValuesAreRejected() {
    System.setProperty("ghost.mysql.password.length", "long");

    final var thrown =
        assertThrows(IllegalArgumentException.class, ProvisionerSettings::fromEnvironment);
    assertTrue(thrown.getMessage().contains("ghost.mysql.password.length"));
  }

  @Test
  @DisplayName("Constructor validates ranges")
  void constructorValidates() {
    assertThrows(
        IllegalArgumentException.class, () -> new ProvisionerSettings(" ", "ghost-", 1000, 0, 10));
    assertThrows(
        IllegalArgumentException.class, () -> new ProvisionerSettings("root", "ghost-", 0, 0, 10));
    assertThrows(
        IllegalArgumentException.class,
        () -> new ProvisionerSettings("root", "ghost-", 1000, -1, 10));
    assertThrows(
        IllegalArgumentException.class,
        () -> new ProvisionerSettings("root", "ghost-", 1000, 0, 3));
  }
}
