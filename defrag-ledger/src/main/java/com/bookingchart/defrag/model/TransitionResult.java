package com.bookingchart.defrag.model;

/** Move and batch as they stand right after a committed transition. */
public record TransitionResult(DefragMove move, MoveBatch batch) {}
