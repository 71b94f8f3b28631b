package io.b2mash.credstore.secrettype;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Registers configured secret types on startup. Idempotent: types already in the database are left
 * as they are.
 */
@Component
@Order(50)
@EnableConfigurationProperties(SecretTypeProperties.class)
public class SecretTypeBootstrapRunner implements ApplicationRunner {

  private static final Logger log = LoggerFactory.getLogger(SecretTypeBootstrapRunner.class);

  private final SecretTypeService secretTypeService;
  private final SecretTypeProperties properties;

  public SecretTypeBootstrapRunner(
      SecretTypeService secretTypeService, SecretTypeProperties properties) {
    this.secretTypeService = secretTypeService;
    this.properties = properties;
  }

  @Override
  public void run(ApplicationArguments args) {
    int registered = 0;
    for (var definition : properties.secretTypes()) {
      if (secretTypeService.registerIfAbsent(definition)) {
        registered++;
      }
    }
    log.info(
        "Secret type bootstrap: {} configured, {} newly registered",
        properties.secretTypes().size(),
        registered);
  }
}
