package com.openstay.booking.domain.service;

import com.openstay.booking.config.BookingRulesProperties;
import com.openstay.common.exception.BusinessException;
import com.openstay.common.exception.TransactionConflictException;
import jakarta.persistence.LockTimeoutException;
import jakarta.persistence.OptimisticLockException;
import jakarta.persistence.PessimisticLockException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionTimedOutException;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.function.Supplier;

/**
 * Runs one state transition as a single READ COMMITTED transaction bounded by
 * {@code booking.rules.transaction-timeout-seconds}.
 *
 * Lock contention, serialization failures and timeouts surface as
 * {@link TransactionConflictException}; business failures pass through unchanged.
 * Either way nothing was committed.
 */
@Slf4j
@Component
public class BookingTransactions {

    private final TransactionTemplate transactionTemplate;

    public BookingTransactions(PlatformTransactionManager transactionManager, BookingRulesProperties rules) {
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.transactionTemplate.setIsolationLevel(TransactionDefinition.ISOLATION_READ_COMMITTED);
        this.transactionTemplate.setTimeout(rules.getTransactionTimeoutSeconds());
    }

    public <T> T execute(String operation, Supplier<T> work) {
        try {
            return transactionTemplate.execute(status -> work.get());
        } catch (BusinessException e) {
            throw e;
        } catch (RuntimeException e) {
            if (isConflict(e)) {
                log.warn("{} rolled back on a transaction conflict: {}", operation, e.getMessage());
                throw new TransactionConflictException(operation + " could not complete due to a concurrent update", e);
            }
            throw e;
        }
    }

    static boolean isConflict(Throwable failure) {
        for (Throwable t = failure; t != null; t = t.getCause() == t ? null : t.getCause()) {
            if (t instanceof TransientDataAccessException
                    || t instanceof TransactionTimedOutException
                    || t instanceof OptimisticLockException
                    || t instanceof PessimisticLockException
                    || t instanceof LockTimeoutException) {
                return true;
            }
        }
        return false;
    }
}
