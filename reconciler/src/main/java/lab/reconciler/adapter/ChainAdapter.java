package lab.reconciler.adapter;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Uniform view over one blockchain. Implementations translate their RPC surface into these
 * calls and report transient network trouble as {@link RpcUnavailableException}.
 */
public interface ChainAdapter extends AutoCloseable {

    String chainCode();

    int requiredConfirmations();

    long currentHeight();

    /**
     * Transfers of {@code token} into {@code address} in blocks {@code [fromHeight, toHeight]},
     * ordered by block height then in-block index. The sequence is fetched lazily in chunks
     * and every call to {@code iterator()} starts over, so a failed scan can simply be
     * repeated.
     */
    Iterable<IncomingTransfer> scanAddress(String address, String token, long fromHeight, long toHeight);

    BigDecimal balance(String address, String token);

    SignedTransfer sign(TransferCommand command, byte[] privateKey);

    /**
     * Submits a signed transfer. A {@link BroadcastRejectedException} means the node refused
     * it; callers still reconcile through later scans since a refusal after relay is possible.
     */
    String broadcast(SignedTransfer transfer);

    /** Network fee, in the native coin, of one transfer of {@code token}. */
    BigDecimal estimateFee(String token);

    Optional<TxObservation> lookupTransaction(String txHash);

    boolean isValidAddress(String address);

    GeneratedAddress generateAddress();

    @Override
    default void close() {
    }

    record IncomingTransfer(
            String txHash,
            String fromAddress,
            String toAddress,
            BigDecimal amount,
            long blockHeight,
            long indexInBlock,
            long confirmations
    ) {}

    record TransferCommand(
            String fromAddress,
            String toAddress,
            String token,
            BigDecimal amount
    ) {}

    record SignedTransfer(
            String txHash,
            String payload
    ) {}

    /** {@code fee} is the native coin actually paid, or null when the node does not report it. */
    record TxObservation(
            String txHash,
            long blockHeight,
            long confirmations,
            boolean success,
            BigDecimal fee
    ) {}

    /** Fresh key pair; the caller encrypts the key and wipes the array. */
    record GeneratedAddress(
            String address,
            byte[] privateKey
    ) {}
}
