package com.pixperfect.assets.service;

import com.pixperfect.assets.common.exception.AssetException;
import com.pixperfect.assets.common.exception.StorageUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs a storage call with a bounded wait. Anything that is not already an
 * {@link AssetException} comes out as {@link StorageUnavailableException}.
 */
@Slf4j
@Component
public class StorageCallGuard {

    private final AsyncTaskExecutor storageExecutor;
    private final Duration callTimeout;

    public StorageCallGuard(@Qualifier("storageExecutor") AsyncTaskExecutor storageExecutor,
                            @Value("${assets.storage.call-timeout:10s}") Duration callTimeout) {
        this.storageExecutor = storageExecutor;
        this.callTimeout = callTimeout;
    }

    public <T> T call(String operation, Callable<T> action) {
        Future<T> future;
        try {
            future = storageExecutor.submit(action);
        } catch (TaskRejectedException e) {
            throw new StorageUnavailableException(operation + " rejected, storage pool saturated", e);
        }

        try {
            return future.get(callTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.error("{} did not complete within {}", operation, callTimeout);
            throw new StorageUnavailableException(operation + " timed out after " + callTimeout, e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new StorageUnavailableException(operation + " interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof AssetException) {
                throw (AssetException) cause;
            }
            throw new StorageUnavailableException(operation + " failed", cause);
        }
    }
}
