package io.b2mash.credstore.registry;

import io.b2mash.credstore.backend.SecretBackend;

/**
 * A registered backend handle with its ranking metadata.
 *
 * @param priority effective priority after configuration overrides; lower wins
 */
public record BackendInstance(
    String instanceId, int priority, String vendor, boolean encrypting, SecretBackend backend) {}
