package com.crowd.service.impl;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Blocking access to store futures for the request-scoped handlers
 */
final class StoreCalls {
    
    private StoreCalls() {
    }
    
    /**
     * Wait for the store call and rethrow its failure unwrapped
     */
    static <T> T await(CompletableFuture<T> call) {
        try {
            return call.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw e;
        }
    }
}
