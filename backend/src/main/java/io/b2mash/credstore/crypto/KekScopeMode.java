package io.b2mash.credstore.crypto;

import java.util.UUID;

/** Whether all tenants share one KEK chain or each tenant gets its own. */
public enum KekScopeMode {
  GLOBAL,
  TENANT;

  public static final String GLOBAL_SCOPE = "global";

  public String scopeFor(UUID tenantId) {
    return switch (this) {
      case GLOBAL -> GLOBAL_SCOPE;
      case TENANT -> tenantId.toString();
    };
  }
}
