package com.hazardhawk.server.ai.dispatch;

import com.hazardhawk.server.ai.SafetyAnalysis;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;

/**
 * Single-flight gate: concurrent callers with the same fingerprint share the first caller's
 * cascade. If the leader is interrupted, waiting followers start over and one becomes the new
 * leader.
 */
public class InFlightRequests {

    private static final Logger logger = LoggerFactory.getLogger(InFlightRequests.class);

    public interface Cascade {
        SafetyAnalysis run() throws AllStrategiesExhaustedException, InterruptedException;
    }

    private final ConcurrentHashMap<String, CompletableFuture<SafetyAnalysis>> flights = new ConcurrentHashMap<>();

    public SafetyAnalysis execute(String fingerprint, Cascade cascade)
            throws AllStrategiesExhaustedException, InterruptedException {
        while (true) {
            CompletableFuture<SafetyAnalysis> created = new CompletableFuture<>();
            CompletableFuture<SafetyAnalysis> existing = flights.putIfAbsent(fingerprint, created);

            if (existing == null) {
                try {
                    SafetyAnalysis result = cascade.run();
                    created.complete(result);
                    return result;
                } catch (InterruptedException e) {
                    created.cancel(false);
                    throw e;
                } catch (AllStrategiesExhaustedException | RuntimeException | Error e) {
                    created.completeExceptionally(e);
                    throw e;
                } finally {
                    flights.remove(fingerprint, created);
                }
            }

            logger.debug("Joining in-flight analysis for {}", fingerprint);
            try {
                return existing.get();
            } catch (CancellationException e) {
                logger.debug("Leader for {} was interrupted, retrying", fingerprint);
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                if (cause instanceof AllStrategiesExhaustedException) {
                    throw (AllStrategiesExhaustedException) cause;
                }
                if (cause instanceof RuntimeException) {
                    throw (RuntimeException) cause;
                }
                if (cause instanceof Error) {
                    throw (Error) cause;
                }
                throw new IllegalStateException("Unexpected in-flight failure", cause);
            }
        }
    }

    public int size() {
        return flights.size();
    }
}
