package io.b2mash.crm.crmcore.note.dto;

import io.b2mash.crm.crmcore.attachment.EntityReference;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record CreateNoteRequest(
    @NotBlank String content, @NotNull @Valid EntityReference attachedTo) {}
