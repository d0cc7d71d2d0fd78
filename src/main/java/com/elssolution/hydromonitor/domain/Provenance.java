package com.elssolution.hydromonitor.domain;

/** Where the readings handed to a caller came from. */
public enum Provenance {
    /** Remote fetch succeeded during this request. */
    FRESH,
    /** Served inside the cache window, no remote call made. */
    STALE_CACHE,
    /** Remote fetch failed; rows come from durable storage. */
    STALE_STORAGE,
    /** In-memory fallback buffer or generated sample data. */
    SYNTHETIC
}
