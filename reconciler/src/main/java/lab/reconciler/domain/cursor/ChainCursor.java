package lab.reconciler.domain.cursor;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Entity
@Table(name = "chain_cursors")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Builder
public class ChainCursor {

    @Id
    @Column(length = 16)
    private String chain;

    @Column(nullable = false)
    private long lastScannedHeight;

    private Instant lastScanAt;

    /** Distance between the chain tip and the cursor after the last completed tick. */
    private long scanLag;

    @Version
    private long version;

    public static ChainCursor startingAt(String chain, long height) {
        return ChainCursor.builder()
                .chain(chain)
                .lastScannedHeight(height)
                .build();
    }

    public void advanceTo(long height, long tip, Instant now) {
        if (height < lastScannedHeight) {
            throw new IllegalStateException("cursor cannot move backwards: " + chain + " " + lastScannedHeight + " -> " + height);
        }
        this.lastScannedHeight = height;
        this.scanLag = Math.max(0, tip - height);
        this.lastScanAt = now;
    }

    public void markIdle(long tip, Instant now) {
        this.scanLag = Math.max(0, tip - lastScannedHeight);
        this.lastScanAt = now;
    }

    /** Explicit reorg recovery; the only way the cursor ever moves backwards. */
    public boolean rollbackTo(long height) {
        if (height >= lastScannedHeight) {
            return false;
        }
        this.lastScannedHeight = Math.max(0, height);
        return true;
    }
}
