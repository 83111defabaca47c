package io.hmis.backend.billing;

import io.hmis.backend.multitenancy.TenantContext;
import jakarta.validation.Valid;
import java.net.URI;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/billing")
public class BillingController {

  static final String USER_HEADER = "X-User-ID";

  private final InvoiceCommandHandler commandHandler;

  public BillingController(InvoiceCommandHandler commandHandler) {
    this.commandHandler = commandHandler;
  }

  @PostMapping("/invoices")
  public ResponseEntity<Invoice> createInvoice(
      TenantContext tenant,
      @RequestHeader(value = USER_HEADER, required = false) UUID userId,
      @Valid @RequestBody CreateInvoiceCommand command) {
    var invoice = commandHandler.createInvoice(tenant, command, userId);
    return ResponseEntity.created(URI.create("/api/billing/invoices/" + invoice.id()))
        .body(invoice);
  }

  @GetMapping("/invoices/{id}")
  public ResponseEntity<InvoiceDetails> getInvoice(TenantContext tenant, @PathVariable UUID id) {
    return ResponseEntity.ok(commandHandler.getInvoice(tenant, id));
  }

  @PostMapping("/invoices/{id}/payments")
  public ResponseEntity<Payment> recordPayment(
      TenantContext tenant,
      @PathVariable UUID id,
      @RequestHeader(value = USER_HEADER, required = false) UUID userId,
      @Valid @RequestBody RecordPaymentCommand command) {
    var payment = commandHandler.recordPayment(tenant, id, command, userId);
    return ResponseEntity.created(
            URI.create("/api/billing/invoices/" + id + "/payments/" + payment.id()))
        .body(payment);
  }
}
