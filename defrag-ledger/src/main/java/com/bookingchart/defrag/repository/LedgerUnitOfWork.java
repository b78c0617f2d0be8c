package com.bookingchart.defrag.repository;

import com.bookingchart.defrag.config.DefragProperties;
import com.bookingchart.defrag.exception.PersistenceException;
import com.bookingchart.defrag.exception.StateConflictException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.function.Function;

/**
 * Runs ledger operations as single transactions with a bounded timeout.
 *
 * The connection is acquired when the unit starts and released when it ends, whatever the
 * outcome. Any exception rolls the whole unit back. Store failures are translated on the
 * way out: lock/serialization conflicts become {@link StateConflictException}, everything
 * else {@link PersistenceException}. Domain exceptions pass through unchanged.
 */
@Component
@Slf4j
public class LedgerUnitOfWork {

    private final TransactionTemplate writeTemplate;
    private final TransactionTemplate readTemplate;
    private final PropertyRepository properties;
    private final MoveBatchRepository batches;
    private final DefragMoveRepository moves;

    public LedgerUnitOfWork(PlatformTransactionManager transactionManager,
                            DefragProperties defragProperties,
                            PropertyRepository properties,
                            MoveBatchRepository batches,
                            DefragMoveRepository moves) {
        int timeoutSeconds = (int) Math.max(1, defragProperties.getLedger().getUnitTimeout().toSeconds());

        this.writeTemplate = new TransactionTemplate(transactionManager);
        this.writeTemplate.setIsolationLevel(TransactionDefinition.ISOLATION_READ_COMMITTED);
        this.writeTemplate.setTimeout(timeoutSeconds);

        this.readTemplate = new TransactionTemplate(transactionManager);
        this.readTemplate.setReadOnly(true);
        this.readTemplate.setTimeout(timeoutSeconds);

        this.properties = properties;
        this.batches = batches;
        this.moves = moves;
    }

    /**
     * Run {@code work} as one atomic unit. Either everything it wrote is committed or nothing is.
     *
     * @param operation short label used in logs and error messages
     */
    public <T> T execute(String operation, Function<LedgerContext, T> work) {
        return run(writeTemplate, operation, work);
    }

    /** Same as {@link #execute} on a read-only transaction. */
    public <T> T read(String operation, Function<LedgerContext, T> work) {
        return run(readTemplate, operation, work);
    }

    private <T> T run(TransactionTemplate template, String operation, Function<LedgerContext, T> work) {
        try {
            return template.execute(status -> {
                try (LedgerContext context = new LedgerContext(properties, batches, moves)) {
                    return work.apply(context);
                }
            });
        } catch (ConcurrencyFailureException e) {
            log.warn("{} lost a concurrent update and was rolled back: {}", operation, e.getMessage());
            throw new StateConflictException(operation + " conflicted with a concurrent update", e);
        } catch (DataAccessException | TransactionException e) {
            log.error("{} failed and was rolled back: {}", operation, e.getMessage(), e);
            throw new PersistenceException(operation + " failed and was rolled back", e);
        }
    }
}
