package io.b2mash.credstore.secrettype;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.b2mash.credstore.exception.InvalidSecretTypeException;
import io.b2mash.credstore.exception.ValidationFailedException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class SecretTypeService {

  private static final Logger log = LoggerFactory.getLogger(SecretTypeService.class);

  private final SecretTypeRepository repository;

  // Types change only through update(), which evicts; the expiry covers other nodes.
  private final Cache<String, SecretType> cache =
      Caffeine.newBuilder().expireAfterWrite(Duration.ofSeconds(60)).maximumSize(1_000).build();

  public SecretTypeService(SecretTypeRepository repository) {
    this.repository = repository;
  }

  @Transactional
  public SecretType register(SecretTypeDefinition definition) {
    if (repository.existsById(definition.id())) {
      throw new ValidationFailedException(
          "Secret type " + definition.id() + " is already registered");
    }
    var saved = repository.save(new SecretType(definition));
    log.info("Registered secret type {}", saved.getId());
    return saved;
  }

  /** Administrative update of schema and version policy. The type id never changes. */
  @Transactional
  public SecretType update(String id, SecretTypeDefinition definition) {
    if (!id.equals(definition.id())) {
      throw new ValidationFailedException("Secret type id cannot change: " + id);
    }
    var type =
        repository
            .findById(id)
            .orElseThrow(() -> new InvalidSecretTypeException("Unknown secret type " + id));
    type.apply(definition);
    var saved = repository.save(type);
    cache.invalidate(id);
    log.info("Updated secret type {}", id);
    return saved;
  }

  /** Registers the type unless it exists; existing types keep any administrative changes. */
  @Transactional
  public boolean registerIfAbsent(SecretTypeDefinition definition) {
    if (repository.existsById(definition.id())) {
      return false;
    }
    register(definition);
    return true;
  }

  /**
   * @throws InvalidSecretTypeException when the type is not registered
   */
  public SecretType require(String id) {
    if (id == null || id.isBlank()) {
      throw new InvalidSecretTypeException("Secret type is required");
    }
    var cached = cache.getIfPresent(id);
    if (cached != null) {
      return cached;
    }
    var type =
        repository
            .findById(id)
            .orElseThrow(() -> new InvalidSecretTypeException("Unknown secret type " + id));
    cache.put(id, type);
    return type;
  }

  /** Validates parameters against the type's schema. */
  public void validateParameters(SecretType type, Map<String, Object> parameters) {
    type.getSchema().validate(parameters);
  }

  public List<SecretType> findAll() {
    return repository.findAllByOrderByIdAsc();
  }
}
