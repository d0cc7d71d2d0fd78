package com.elssolution.hydromonitor.service;

import java.util.concurrent.atomic.AtomicLong;

/** Ids for readings that never reached the durable store: prefix_epochMs-seq. */
final class SyntheticIds {
    static final String EXTERNAL = "external";
    static final String MEMORY = "memory";
    static final String SAMPLE = "sample";

    private static final AtomicLong SEQ = new AtomicLong();

    private SyntheticIds() {}

    static String next(String prefix, long epochMs) {
        return prefix + "_" + epochMs + "-" + SEQ.incrementAndGet();
    }
}
