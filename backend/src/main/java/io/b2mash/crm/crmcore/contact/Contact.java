package io.b2mash.crm.crmcore.contact;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

public record Contact(
    UUID id,
    String firstName,
    String lastName,
    List<String> emails,
    List<String> phones,
    UUID companyId,
    Map<String, Object> customFields,
    Instant createdAt,
    Instant updatedAt,
    String createdBy,
    String updatedBy) {}
