package io.hmis.backend.provisioning;

public record ProvisioningResult(String schemaName, boolean alreadyProvisioned) {

  public static ProvisioningResult success(String schemaName) {
    return new ProvisioningResult(schemaName, false);
  }

  public static ProvisioningResult alreadyProvisioned(String schemaName) {
    return new ProvisioningResult(schemaName, true);
  }
}
