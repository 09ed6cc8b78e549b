package lab.reconciler.adapter;

import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Lazy, restartable walk over a block range that pulls transfers one window at a time.
 */
public final class BlockRangeScan implements Iterable<ChainAdapter.IncomingTransfer> {

    @FunctionalInterface
    public interface WindowFetcher {
        List<ChainAdapter.IncomingTransfer> fetch(long fromHeight, long toHeight);
    }

    private final long fromHeight;
    private final long toHeight;
    private final int windowSize;
    private final WindowFetcher fetcher;

    public BlockRangeScan(long fromHeight, long toHeight, int windowSize, WindowFetcher fetcher) {
        if (windowSize < 1) {
            throw new IllegalArgumentException("windowSize must be positive: " + windowSize);
        }
        this.fromHeight = fromHeight;
        this.toHeight = toHeight;
        this.windowSize = windowSize;
        this.fetcher = fetcher;
    }

    @Override
    public Iterator<ChainAdapter.IncomingTransfer> iterator() {
        return new Iterator<>() {
            private long nextWindowStart = fromHeight;
            private Iterator<ChainAdapter.IncomingTransfer> current = Collections.emptyIterator();

            @Override
            public boolean hasNext() {
                while (!current.hasNext() && nextWindowStart <= toHeight) {
                    long windowEnd = Math.min(toHeight, nextWindowStart + windowSize - 1);
                    current = fetcher.fetch(nextWindowStart, windowEnd).iterator();
                    nextWindowStart = windowEnd + 1;
                }
                return current.hasNext();
            }

            @Override
            public ChainAdapter.IncomingTransfer next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                return current.next();
            }
        };
    }
}
