package io.b2mash.crm.crmcore.deal;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Map;
import java.util.UUID;

public record Deal(
    UUID id,
    String title,
    UUID companyId,
    UUID contactId,
    BigDecimal value,
    String currency,
    String stage,
    int probability,
    LocalDate closeDate,
    Map<String, Object> customFields,
    Instant createdAt,
    Instant updatedAt,
    String createdBy,
    String updatedBy) {}
