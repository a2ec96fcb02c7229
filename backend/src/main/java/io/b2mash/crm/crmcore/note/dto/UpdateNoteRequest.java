package io.b2mash.crm.crmcore.note.dto;

import io.b2mash.crm.crmcore.attachment.EntityReference;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.openapitools.jackson.nullable.JsonNullable;

public class UpdateNoteRequest {

  @NotBlank private JsonNullable<String> content = JsonNullable.undefined();

  @NotNull @Valid private JsonNullable<EntityReference> attachedTo = JsonNullable.undefined();

  public JsonNullable<String> getContent() {
    return content;
  }

  public UpdateNoteRequest content(String content) {
    this.content = JsonNullable.of(content);
    return this;
  }

  public JsonNullable<EntityReference> getAttachedTo() {
    return attachedTo;
  }

  public UpdateNoteRequest attachedTo(EntityReference attachedTo) {
    this.attachedTo = JsonNullable.of(attachedTo);
    return this;
  }
}
