package io.b2mash.credstore.registry;

import java.util.List;

/** Source of the registered backend instances. Discovery is the implementation's concern. */
public interface BackendRegistry {

  /** All instances, ordered by priority ascending then instance id. */
  List<BackendInstance> instances();
}
