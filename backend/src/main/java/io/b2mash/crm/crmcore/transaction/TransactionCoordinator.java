package io.b2mash.crm.crmcore.transaction;

import io.b2mash.crm.crmcore.exception.DatabaseOperationException;
import io.b2mash.crm.crmcore.repository.DatabaseErrorTranslator;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;
import org.springframework.web.ErrorResponseException;

/**
 * Runs a multi-step unit of work on one pooled connection. Every repository call made inside the
 * callback uses the connection bound to the current thread by the transaction manager; the
 * transaction commits when the callback returns and rolls back when it throws. The connection goes
 * back to the pool exactly once either way.
 *
 * <p>Nested calls join the outer transaction.
 */
@Component
public class TransactionCoordinator {

  private static final Logger log = LoggerFactory.getLogger(TransactionCoordinator.class);

  private final TransactionTemplate txTemplate;

  public TransactionCoordinator(PlatformTransactionManager txManager) {
    this.txTemplate = new TransactionTemplate(txManager);
  }

  /**
   * Executes {@code unitOfWork} atomically and returns its result.
   *
   * @throws ErrorResponseException subtypes raised by the unit of work, unchanged
   * @throws DatabaseOperationException for any other failure, including commit failure
   */
  public <T> T execute(Supplier<T> unitOfWork) {
    try {
      return txTemplate.execute(status -> unitOfWork.get());
    } catch (ErrorResponseException e) {
      log.debug("Transaction rolled back: {}", e.getBody().getDetail());
      throw e;
    } catch (DataAccessException e) {
      throw DatabaseErrorTranslator.translate(e);
    } catch (RuntimeException e) {
      log.warn("Transaction failed: {}", e.getMessage());
      throw new DatabaseOperationException("Transaction failed", e);
    }
  }

  public void executeWithoutResult(Runnable unitOfWork) {
    execute(
        () -> {
          unitOfWork.run();
          return null;
        });
  }
}
