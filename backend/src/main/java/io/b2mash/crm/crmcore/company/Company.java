package io.b2mash.crm.crmcore.company;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

public record Company(
    UUID id,
    String name,
    Address address,
    Map<String, Object> customFields,
    Instant createdAt,
    Instant updatedAt,
    String createdBy,
    String updatedBy) {}
