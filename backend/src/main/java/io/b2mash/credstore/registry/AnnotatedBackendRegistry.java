package io.b2mash.credstore.registry;

import io.b2mash.credstore.backend.SecretBackend;
import io.b2mash.credstore.backend.SecretBackendPlugin;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ApplicationContext;
import org.springframework.core.annotation.AnnotationUtils;
import org.springframework.stereotype.Component;

/** Registry built at startup from every bean annotated with {@link SecretBackendPlugin}. */
@Component
@EnableConfigurationProperties(RegistryProperties.class)
public class AnnotatedBackendRegistry implements BackendRegistry {

  private static final Logger log = LoggerFactory.getLogger(AnnotatedBackendRegistry.class);

  private final List<BackendInstance> instances;

  @Autowired
  public AnnotatedBackendRegistry(
      ApplicationContext applicationContext, RegistryProperties properties) {
    this(applicationContext.getBeansWithAnnotation(SecretBackendPlugin.class), properties);
  }

  AnnotatedBackendRegistry(Map<String, Object> annotatedBeans, RegistryProperties properties) {
    // Fail fast if two beans register the same instance id.
    var byId = new HashMap<String, BackendInstance>();
    annotatedBeans.forEach(
        (name, bean) -> {
          var annotation =
              AnnotationUtils.findAnnotation(bean.getClass(), SecretBackendPlugin.class);
          if (!(bean instanceof SecretBackend backend)) {
            throw new IllegalStateException(
                "@SecretBackendPlugin bean "
                    + name
                    + " does not implement "
                    + SecretBackend.class.getSimpleName());
          }
          int priority =
              properties
                  .priorityOverrides()
                  .getOrDefault(annotation.instanceId(), annotation.priority());
          var instance =
              new BackendInstance(
                  annotation.instanceId(),
                  priority,
                  annotation.vendor(),
                  annotation.encrypting(),
                  backend);
          var existing = byId.putIfAbsent(annotation.instanceId(), instance);
          if (existing != null) {
            throw new IllegalStateException(
                "Duplicate @SecretBackendPlugin: instanceId="
                    + annotation.instanceId()
                    + " registered by both "
                    + existing.backend().getClass().getName()
                    + " and "
                    + bean.getClass().getName());
          }
        });

    var ranked = new ArrayList<>(byId.values());
    ranked.sort(
        Comparator.comparingInt(BackendInstance::priority)
            .thenComparing(BackendInstance::instanceId));
    this.instances = List.copyOf(ranked);
    instances.forEach(
        i ->
            log.info(
                "Registered secret backend {} (vendor={}, priority={}, encrypting={})",
                i.instanceId(),
                i.vendor(),
                i.priority(),
                i.encrypting()));
  }

  @Override
  public List<BackendInstance> instances() {
    return instances;
  }
}
