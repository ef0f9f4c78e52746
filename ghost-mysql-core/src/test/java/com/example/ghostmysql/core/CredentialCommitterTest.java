package com.example.ghostmysql.core;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

import com.example.ghostmysql.core.TestDoubles.InMemoryConfigStore;
import com.example.ghostmysql.core.config.ConfigKeys;
import com.example.ghostmysql.core.config.ConfigStore;
import com.example.ghostmysql.core.credentials.ProvisionedCredential;
import org.junit.jupiter.api.*;

class CredentialCommitterTest {

  @Test
  @DisplayName("Writes user and password then saves once")
  void writesThenSaves() {
    final var store = InMemoryConfigStore.ghostProd("root");

    new CredentialCommitter(store).commit(new ProvisionedCredential("ghost-17", "pw"));

    assertEquals(1, store.saves().size());
    assertEquals("ghost-17", store.saves().get(0).get(ConfigKeys.USER));
    assertEquals("pw", store.saves().get(0).get(ConfigKeys.PASSWORD));
    assertEquals("db.local", store.saves().get(0).get(ConfigKeys.HOST));
  }

  @Test
  @DisplayName("Save happens after both values are set")
  void saveAfterSet() {
    final var store = mock(ConfigStore.class);
    when(store.set(anyString(), anyString())).thenReturn(store);

    new CredentialCommitter(store).commit(new ProvisionedCredential("ghost-1", "pw"));

    final var order = inOrder(store);
    order.verify(store).set(ConfigKeys.USER, "ghost-1");
    order.verify(store).set(ConfigKeys.PASSWORD, "pw");
    order.verify(store).save();
  }
}
