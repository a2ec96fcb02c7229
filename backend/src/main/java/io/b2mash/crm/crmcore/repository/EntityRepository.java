package io.b2mash.crm.crmcore.repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Storage contract shared by the entity repositories. Every store failure is translated by
 * {@link DatabaseErrorTranslator} before it leaves an implementation.
 *
 * @param <T> stored entity
 * @param <C> creation input
 * @param <U> partial update input
 * @param <F> list filter
 */
public interface EntityRepository<T, C, U, F> {

  /** Inserts the provided fields and returns the stored row. */
  T create(C input, String actingUser);

  Optional<T> findById(UUID id);

  /**
   * Returns matching rows newest first.
   *
   * @param pagination window to apply, or {@code null} for every row
   */
  List<T> findAll(F filter, Pagination pagination);

  /**
   * Applies the fields present in {@code update}. An update carrying no fields returns the current
   * row without touching its modification timestamp.
   *
   * @throws io.b2mash.crm.crmcore.exception.ResourceNotFoundException if no row has this id
   */
  T update(UUID id, U update, String actingUser);

  /**
   * @throws io.b2mash.crm.crmcore.exception.ResourceNotFoundException if no row was removed
   */
  void delete(UUID id, String actingUser);
}
