package lab.reconciler.scanner;

/**
 * Outcome of one scanner tick. {@code fromHeight}/{@code toHeight} are zero when no block
 * range was scanned.
 */
public record ScanResult(
        String chain,
        Outcome outcome,
        long chainHeight,
        long fromHeight,
        long toHeight,
        long cursorHeight,
        int transfersSeen,
        int depositsReorged
) {

    public enum Outcome {
        SCANNED,
        /** Nothing new below the safety lag; confirmations were still refreshed. */
        CAUGHT_UP,
        /** No new block since the last tick. */
        IDLE,
        RPC_UNAVAILABLE
    }

    static ScanResult unavailable(String chain, long cursorHeight) {
        return new ScanResult(chain, Outcome.RPC_UNAVAILABLE, 0, 0, 0, cursorHeight, 0, 0);
    }

    static ScanResult idle(String chain, long chainHeight, long cursorHeight) {
        return new ScanResult(chain, Outcome.IDLE, chainHeight, 0, 0, cursorHeight, 0, 0);
    }
}
