package io.hmis.backend.billing;

import java.util.List;

public record InvoiceDetails(Invoice invoice, List<ChargeItem> chargeItems) {}
