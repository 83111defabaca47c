package io.hmis.backend.projection;

import java.math.BigDecimal;

public record RankedMember(String member, BigDecimal score) {}
