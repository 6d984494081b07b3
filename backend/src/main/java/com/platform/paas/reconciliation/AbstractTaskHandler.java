package com.platform.paas.reconciliation;

import com.platform.paas.connectors.kubernetes.ClusterOperationException;
import com.platform.paas.worker.HandlerFatalException;
import com.platform.paas.worker.HandlerTransientException;
import com.platform.paas.worker.TaskHandler;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.NonTransientDataAccessException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;

import java.util.function.Supplier;

/**
 * Translates collaborator failures into the handler error taxonomy.
 */
public abstract class AbstractTaskHandler implements TaskHandler {
    
    protected void cluster(Runnable call) {
        cluster(() -> {
            call.run();
            return null;
        });
    }
    
    protected <T> T cluster(Supplier<T> call) {
        try {
            return call.get();
        } catch (ClusterOperationException e) {
            if (e.isRetryable()) {
                throw new HandlerTransientException(e.getMessage(), e);
            }
            throw new HandlerFatalException(e.getMessage(), e);
        }
    }
    
    /**
     * Store outages and timeouts are retried. Other non-transient failures (constraint
     * violations, bad SQL) are fatal. {@link DataAccessResourceFailureException} extends
     * the non-transient branch of the hierarchy but means the store could not be reached.
     */
    protected <T> T store(Supplier<T> call) {
        try {
            return call.get();
        } catch (TransientDataAccessException | RecoverableDataAccessException
                 | DataAccessResourceFailureException e) {
            throw new HandlerTransientException("State store unavailable: " + e.getMessage(), e);
        } catch (NonTransientDataAccessException e) {
            throw new HandlerFatalException("State store rejected the operation: " + e.getMessage(), e);
        } catch (DataAccessException e) {
            throw new HandlerTransientException("State store unavailable: " + e.getMessage(), e);
        }
    }
}
