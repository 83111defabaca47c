package io.hmis.backend.pharmacy;

import io.hmis.backend.multitenancy.TenantContext;
import jakarta.validation.Valid;
import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/pharmacy")
public class PharmacyController {

  private final PharmacyCommandHandler commandHandler;

  public PharmacyController(PharmacyCommandHandler commandHandler) {
    this.commandHandler = commandHandler;
  }

  @PostMapping("/prescriptions/{id}/dispense")
  public ResponseEntity<DispensationRecord> dispense(
      TenantContext tenant,
      @PathVariable UUID id,
      @RequestHeader(value = "X-User-ID", required = false) UUID userId,
      @Valid @RequestBody DispenseMedicationCommand command) {
    return ResponseEntity.status(HttpStatus.CREATED)
        .body(commandHandler.dispenseMedication(tenant, id, command, userId));
  }
}
