package io.b2mash.credstore.crypto;

import static org.assertj.core.api.Assertions.assertThat;

import io.b2mash.credstore.TestcontainersConfiguration;
import io.b2mash.credstore.exception.ConcurrentSecretModificationException;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@Import(TestcontainersConfiguration.class)
@ActiveProfiles("test")
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class KeyManagementServiceIntegrationTest {

  private static final int ROTATORS = 4;

  @Autowired private KeyManagementService keyManagementService;

  private ExecutorService executor;

  @BeforeAll
  void startExecutor() {
    executor = Executors.newFixedThreadPool(ROTATORS);
  }

  @AfterAll
  void stopExecutor() {
    executor.shutdownNow();
  }

  @Test
  void shouldKeepOneActiveKekWhenRotationsRace() throws Exception {
    String scope = UUID.randomUUID().toString();
    keyManagementService.rotate(scope);

    for (int round = 0; round < 10; round++) {
      rotateConcurrently(scope);

      assertThat(keyManagementService.list(scope))
          .filteredOn(kek -> kek.getStatus() == KekStatus.ACTIVE)
          .hasSize(1);
    }

    var keks = keyManagementService.list(scope);
    assertThat(keks.get(0).getStatus()).isEqualTo(KekStatus.ACTIVE);
    assertThat(keks).extracting(KekMetadata::getVersion).doesNotHaveDuplicates();
    assertThat(keks.subList(1, keks.size()))
        .extracting(KekMetadata::getStatus)
        .containsOnly(KekStatus.DEPRECATED);
  }

  @Test
  void shouldCreateOneInitialKekWhenFirstUsesRace() throws Exception {
    String scope = UUID.randomUUID().toString();
    var start = new CountDownLatch(1);
    List<Future<KekRef>> results = new ArrayList<>();
    for (int i = 0; i < ROTATORS; i++) {
      results.add(
          executor.submit(
              () -> {
                start.await();
                return keyManagementService.active(scope).ref();
              }));
    }
    start.countDown();

    for (var result : results) {
      assertThat(result.get(30, TimeUnit.SECONDS)).isEqualTo(new KekRef(scope, 1));
    }
    assertThat(keyManagementService.list(scope)).hasSize(1);
  }

  @Test
  void shouldDeprecateThePreviousKekOnRotation() {
    String scope = UUID.randomUUID().toString();
    var first = keyManagementService.active(scope).ref();

    var second = keyManagementService.rotate(scope);

    assertThat(second.version()).isEqualTo(first.version() + 1);
    assertThat(keyManagementService.find(first))
        .get()
        .extracting(KekMetadata::getStatus)
        .isEqualTo(KekStatus.DEPRECATED);
    assertThat(keyManagementService.resolve(first).status()).isEqualTo(KekStatus.DEPRECATED);
  }

  private void rotateConcurrently(String scope) throws InterruptedException, TimeoutException {
    var start = new CountDownLatch(1);
    List<Future<KekRef>> results = new ArrayList<>();
    for (int i = 0; i < ROTATORS; i++) {
      results.add(
          executor.submit(
              () -> {
                start.await();
                return keyManagementService.rotate(scope);
              }));
    }
    start.countDown();
    for (var result : results) {
      try {
        result.get(30, TimeUnit.SECONDS);
      } catch (ExecutionException e) {
        // a losing rotation must be rejected, never applied
        assertThat(e.getCause()).isInstanceOf(ConcurrentSecretModificationException.class);
      }
    }
  }
}
