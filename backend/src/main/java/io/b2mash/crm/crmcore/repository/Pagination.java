package io.b2mash.crm.crmcore.repository;

import io.b2mash.crm.crmcore.exception.ValidationFailedException;

/**
 * Page window for list queries. A {@code null} pagination argument means "return every matching
 * row".
 */
public record Pagination(int limit, int offset) {

  public static final int DEFAULT_LIMIT = 50;
  public static final int MAX_LIMIT = 1000;

  public Pagination {
    if (limit < 1 || limit > MAX_LIMIT) {
      throw ValidationFailedException.forField(
          "limit", "Limit must be between 1 and " + MAX_LIMIT);
    }
    if (offset < 0) {
      throw ValidationFailedException.forField("offset", "Offset must not be negative");
    }
  }

  public static Pagination firstPage() {
    return new Pagination(DEFAULT_LIMIT, 0);
  }

  public static Pagination of(int limit, int offset) {
    return new Pagination(limit, offset);
  }
}
