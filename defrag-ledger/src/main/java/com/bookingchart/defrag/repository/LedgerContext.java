package com.bookingchart.defrag.repository;

/**
 * Handle on the store for exactly one unit of work. Every call made through it runs on the
 * unit's transaction; once the unit ends the context is closed and refuses further use.
 */
public final class LedgerContext implements AutoCloseable {

    private final PropertyRepository properties;
    private final MoveBatchRepository batches;
    private final DefragMoveRepository moves;
    private boolean closed;

    LedgerContext(PropertyRepository properties, MoveBatchRepository batches, DefragMoveRepository moves) {
        this.properties = properties;
        this.batches = batches;
        this.moves = moves;
    }

    public PropertyRepository properties() {
        ensureOpen();
        return properties;
    }

    public MoveBatchRepository batches() {
        ensureOpen();
        return batches;
    }

    public DefragMoveRepository moves() {
        ensureOpen();
        return moves;
    }

    @Override
    public void close() {
        closed = true;
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Ledger context used outside its unit of work");
        }
    }
}
