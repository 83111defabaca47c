package io.hmis.backend.clinical;

import io.hmis.backend.multitenancy.TenantContext;
import jakarta.validation.Valid;
import java.net.URI;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/encounters")
public class EncounterController {

  private final EncounterCommandHandler commandHandler;

  public EncounterController(EncounterCommandHandler commandHandler) {
    this.commandHandler = commandHandler;
  }

  @PostMapping
  public ResponseEntity<Encounter> createEncounter(
      TenantContext tenant,
      @RequestHeader(value = "X-User-ID", required = false) UUID userId,
      @Valid @RequestBody CreateEncounterCommand command) {
    var encounter = commandHandler.createEncounter(tenant, command, userId);
    return ResponseEntity.created(URI.create("/api/encounters/" + encounter.id()))
        .body(encounter);
  }

  @PostMapping("/{id}/diagnoses")
  public ResponseEntity<Diagnosis> addDiagnosis(
      TenantContext tenant,
      @PathVariable UUID id,
      @RequestHeader(value = "X-User-ID", required = false) UUID userId,
      @Valid @RequestBody AddDiagnosisCommand command) {
    var diagnosis = commandHandler.addDiagnosis(tenant, id, command, userId);
    return ResponseEntity.created(
            URI.create("/api/encounters/" + id + "/diagnoses/" + diagnosis.id()))
        .body(diagnosis);
  }
}
