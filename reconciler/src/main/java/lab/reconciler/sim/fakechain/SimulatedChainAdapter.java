package lab.reconciler.sim.fakechain;

import lab.reconciler.adapter.BlockRangeScan;
import lab.reconciler.adapter.ChainAdapter;
import lab.reconciler.config.ReconcilerProperties;
import org.web3j.crypto.ECKeyPair;
import org.web3j.crypto.Hash;
import org.web3j.crypto.Keys;
import org.web3j.utils.Numeric;

import java.math.BigDecimal;
import java.security.GeneralSecurityException;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * {@link ChainAdapter} over a {@link FakeChain}. Keys and addresses are real secp256k1 pairs,
 * so signing still proves the caller holds the key of the paying address.
 */
public class SimulatedChainAdapter implements ChainAdapter {

    private static final Pattern ADDRESS_PATTERN = Pattern.compile("^0x[a-fA-F0-9]{40}$");

    private final FakeChain fakeChain;
    private final ReconcilerProperties.ChainEntry config;

    public SimulatedChainAdapter(FakeChain fakeChain, ReconcilerProperties.ChainEntry config) {
        this.fakeChain = fakeChain;
        this.config = config;
    }

    public FakeChain fakeChain() {
        return fakeChain;
    }

    @Override
    public String chainCode() {
        return fakeChain.chain();
    }

    @Override
    public int requiredConfirmations() {
        return config.getRequiredConfirmations();
    }

    @Override
    public long currentHeight() {
        return fakeChain.height();
    }

    @Override
    public Iterable<IncomingTransfer> scanAddress(String address, String token, long fromHeight, long toHeight) {
        return new BlockRangeScan(fromHeight, toHeight, config.getBatchBlockSize(), (from, to) -> {
            long head = fakeChain.height();
            return fakeChain.transfersTo(address, token, from, to).stream()
                    .map(t -> new IncomingTransfer(t.txHash(), t.fromAddress(), t.toAddress(), t.amount(),
                            t.blockHeight(), t.indexInBlock(), head - t.blockHeight() + 1))
                    .toList();
        });
    }

    @Override
    public BigDecimal balance(String address, String token) {
        return fakeChain.balanceOf(address, token);
    }

    @Override
    public SignedTransfer sign(TransferCommand command, byte[] privateKey) {
        if (!isValidAddress(command.toAddress())) {
            throw new IllegalArgumentException("Invalid address: " + command.toAddress());
        }
        String signer = "0x" + Keys.getAddress(ECKeyPair.create(privateKey));
        if (!signer.equalsIgnoreCase(command.fromAddress())) {
            throw new IllegalStateException("key does not belong to sender " + command.fromAddress());
        }
        String payload = String.join("|",
                command.fromAddress(),
                command.toAddress(),
                command.token(),
                command.amount().toPlainString(),
                fakeChain.newTxHash());
        return new SignedTransfer(Hash.sha3String(payload), payload);
    }

    @Override
    public String broadcast(SignedTransfer transfer) {
        String[] parts = transfer.payload().split("\\|");
        return fakeChain.submit(transfer.txHash(), parts[0], parts[1], parts[2], new BigDecimal(parts[3]));
    }

    @Override
    public BigDecimal estimateFee(String token) {
        return fakeChain.transferFee();
    }

    @Override
    public Optional<TxObservation> lookupTransaction(String txHash) {
        long head = fakeChain.height();
        return fakeChain.findMined(txHash)
                .map(t -> new TxObservation(t.txHash(), t.blockHeight(), head - t.blockHeight() + 1, t.success(),
                        fakeChain.transferFee()));
    }

    @Override
    public boolean isValidAddress(String address) {
        return address != null && ADDRESS_PATTERN.matcher(address).matches();
    }

    @Override
    public GeneratedAddress generateAddress() {
        try {
            ECKeyPair keyPair = Keys.createEcKeyPair();
            return new GeneratedAddress("0x" + Keys.getAddress(keyPair), Numeric.toBytesPadded(keyPair.getPrivateKey(), 32));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("failed to generate key pair for " + chainCode(), e);
        }
    }
}
