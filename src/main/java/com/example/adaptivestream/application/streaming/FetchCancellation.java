package com.example.adaptivestream.application.streaming;

import java.util.ArrayList;
import java.util.List;

/**
 * Cancellation token handed to the transport so an in-flight request can be aborted.
 */
public class FetchCancellation {

    private final List<Runnable> callbacks = new ArrayList<>();
    private boolean cancelled;

    /**
     * Registers an abort hook. Runs immediately if the fetch was already cancelled.
     */
    public void onCancel(Runnable callback) {
        synchronized (this) {
            if (!cancelled) {
                callbacks.add(callback);
                return;
            }
        }
        callback.run();
    }

    public void cancel() {
        List<Runnable> toRun;
        synchronized (this) {
            if (cancelled) {
                return;
            }
            cancelled = true;
            toRun = new ArrayList<>(callbacks);
            callbacks.clear();
        }
        for (Runnable callback : toRun) {
            callback.run();
        }
    }

    public synchronized boolean isCancelled() {
        return cancelled;
    }
}
