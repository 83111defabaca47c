package io.hmis.backend.provisioning;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.net.URI;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/internal/tenants")
public class ProvisioningController {

  private static final Logger log = LoggerFactory.getLogger(ProvisioningController.class);

  private final TenantProvisioningService provisioningService;

  public ProvisioningController(TenantProvisioningService provisioningService) {
    this.provisioningService = provisioningService;
  }

  @PostMapping
  public ResponseEntity<ProvisioningResponse> provisionTenant(
      @Valid @RequestBody ProvisioningRequest request) {
    log.info("Received provisioning request for tenant {}", request.tenantId());

    var result = provisioningService.provisionTenant(request.tenantId(), request.name());

    if (result.alreadyProvisioned()) {
      return ResponseEntity.status(409)
          .body(new ProvisioningResponse(result.schemaName(), "Tenant already provisioned"));
    }
    String tenantId = SchemaNameGenerator.normalizeTenantId(request.tenantId());
    return ResponseEntity.created(URI.create("/internal/tenants/" + tenantId))
        .body(new ProvisioningResponse(result.schemaName(), "Tenant provisioned successfully"));
  }

  @PostMapping("/{tenantId}/deactivate")
  public ResponseEntity<Void> deactivateTenant(@PathVariable String tenantId) {
    provisioningService.deactivateTenant(tenantId);
    return ResponseEntity.noContent().build();
  }

  public record ProvisioningRequest(
      @NotBlank(message = "tenantId is required") @Size(max = 56) String tenantId,
      @NotBlank(message = "name is required") @Size(max = 255) String name) {}

  public record ProvisioningResponse(String schemaName, String message) {}
}
