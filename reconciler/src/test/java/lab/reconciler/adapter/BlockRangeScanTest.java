package lab.reconciler.adapter;

import lab.reconciler.adapter.ChainAdapter.IncomingTransfer;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.stream.LongStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BlockRangeScanTest {

    @Test
    void walksTheRangeInWindowsAndOnlyOnDemand() {
        List<long[]> windows = new ArrayList<>();
        BlockRangeScan scan = new BlockRangeScan(10, 34, 10, (from, to) -> {
            windows.add(new long[] {from, to});
            return LongStream.rangeClosed(from, to).filter(h -> h % 5 == 0).mapToObj(BlockRangeScanTest::transferAt).toList();
        });

        Iterator<IncomingTransfer> iterator = scan.iterator();
        assertThat(windows).isEmpty();
        assertThat(iterator.next().blockHeight()).isEqualTo(10);
        assertThat(windows).hasSize(1);

        List<Long> heights = new ArrayList<>();
        iterator.forEachRemaining(t -> heights.add(t.blockHeight()));

        assertThat(heights).containsExactly(15L, 20L, 25L, 30L);
        assertThat(windows).extracting(w -> w[0] + "-" + w[1]).containsExactly("10-19", "20-29", "30-34");
    }

    @Test
    void everyIterationStartsOver() {
        BlockRangeScan scan = new BlockRangeScan(1, 3, 2,
                (from, to) -> LongStream.rangeClosed(from, to).mapToObj(BlockRangeScanTest::transferAt).toList());

        List<Long> first = new ArrayList<>();
        scan.forEach(t -> first.add(t.blockHeight()));
        List<Long> second = new ArrayList<>();
        scan.forEach(t -> second.add(t.blockHeight()));

        assertThat(first).containsExactly(1L, 2L, 3L).isEqualTo(second);
    }

    @Test
    void emptyWindowsAreSkipped() {
        BlockRangeScan scan = new BlockRangeScan(0, 99, 10,
                (from, to) -> from == 90 ? List.of(transferAt(95)) : List.of());

        assertThat(scan).extracting(IncomingTransfer::blockHeight).containsExactly(95L);
    }

    @Test
    void invertedRange_isEmptyAndWindowMustBePositive() {
        assertThat(new BlockRangeScan(5, 4, 10, (from, to) -> List.of(transferAt(from)))).isEmpty();
        assertThatThrownBy(() -> new BlockRangeScan(0, 10, 0, (from, to) -> List.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static IncomingTransfer transferAt(long height) {
        return new IncomingTransfer("0xtx" + height, "0xfrom", "0xto", BigDecimal.ONE, height, 0, 1);
    }
}
