package io.b2mash.crm.crmcore.note;

import io.b2mash.crm.crmcore.attachment.EntityReference;
import io.b2mash.crm.crmcore.audit.AuditService;
import io.b2mash.crm.crmcore.exception.ResourceNotFoundException;
import io.b2mash.crm.crmcore.note.dto.CreateNoteRequest;
import io.b2mash.crm.crmcore.note.dto.UpdateNoteRequest;
import io.b2mash.crm.crmcore.repository.Pagination;
import io.b2mash.crm.crmcore.validation.InputValidator;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class NoteService {

  static final String AUDIT_ENTITY_TYPE = "note";

  private static final Logger log = LoggerFactory.getLogger(NoteService.class);

  private final NoteRepository noteRepository;
  private final InputValidator inputValidator;
  private final AuditService auditService;

  public NoteService(
      NoteRepository noteRepository, InputValidator inputValidator, AuditService auditService) {
    this.noteRepository = noteRepository;
    this.inputValidator = inputValidator;
    this.auditService = auditService;
  }

  public Note createNote(CreateNoteRequest request, String actingUser) {
    inputValidator.validate(request);

    var note = noteRepository.create(request, actingUser);
    auditService.logCreate(AUDIT_ENTITY_TYPE, note.id(), actingUser, note);

    log.info(
        "Created note: id={}, attachedTo={}, user={}", note.id(), note.attachedTo(), actingUser);
    return note;
  }

  public Note getNote(UUID id) {
    return noteRepository.findById(id).orElseThrow(() -> new ResourceNotFoundException("Note", id));
  }

  public List<Note> listNotes(NoteFilter filter, Pagination pagination) {
    return noteRepository.findAll(filter, pagination);
  }

  public List<Note> getNotesByEntity(EntityReference entity) {
    return noteRepository.findByEntity(entity);
  }

  public Note updateNote(UUID id, UpdateNoteRequest request, String actingUser) {
    inputValidator.validate(request);
    var existing = getNote(id);

    var updated = noteRepository.update(id, request, actingUser);
    auditService.logUpdate(AUDIT_ENTITY_TYPE, id, actingUser, existing, updated);

    log.info("Updated note: id={}, user={}", id, actingUser);
    return updated;
  }

  public void deleteNote(UUID id, String actingUser) {
    var existing = getNote(id);

    noteRepository.delete(id, actingUser);
    auditService.logDelete(AUDIT_ENTITY_TYPE, id, actingUser, existing);

    log.info("Deleted note: id={}, user={}", id, actingUser);
  }
}
