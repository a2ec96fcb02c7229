package io.b2mash.crm.crmcore.note;

import io.b2mash.crm.crmcore.attachment.EntityReference;

/**
 * @param attachedTo owning entity, or {@code null} for every note
 */
public record NoteFilter(EntityReference attachedTo) {

  public static NoteFilter none() {
    return new NoteFilter(null);
  }
}
