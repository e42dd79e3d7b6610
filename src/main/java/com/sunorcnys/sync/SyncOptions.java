package com.sunorcnys.sync;

import java.util.function.BooleanSupplier;

/**
 * @param skipDuplicates look up each source song once (by match key) and add each destination track at most once
 * @param cancellation   polled before every song and every add chunk; true stops the run
 */
public record SyncOptions(boolean skipDuplicates, BooleanSupplier cancellation) {

    public SyncOptions {
        if (cancellation == null) {
            cancellation = () -> false;
        }
    }

    public static SyncOptions defaults() {
        return new SyncOptions(false, null);
    }

    public SyncOptions withSkipDuplicates(boolean skip) {
        return new SyncOptions(skip, cancellation);
    }

    public SyncOptions withCancellation(BooleanSupplier supplier) {
        return new SyncOptions(skipDuplicates, supplier);
    }

    boolean isCancelled() {
        return cancellation.getAsBoolean();
    }
}
