package lab.reconciler.adapter;

import lab.reconciler.config.ReconcilerProperties;
import lombok.extern.slf4j.Slf4j;
import org.web3j.abi.FunctionEncoder;
import org.web3j.abi.FunctionReturnDecoder;
import org.web3j.abi.TypeReference;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.Type;
import org.web3j.abi.datatypes.generated.Uint256;
import org.web3j.crypto.ECKeyPair;
import org.web3j.crypto.Keys;
import org.web3j.crypto.RawTransaction;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.DefaultBlockParameter;
import org.web3j.protocol.core.DefaultBlockParameterName;
import org.web3j.protocol.core.Response;
import org.web3j.protocol.core.methods.request.EthFilter;
import org.web3j.protocol.core.methods.request.Transaction;
import org.web3j.protocol.core.methods.response.EthBlock;
import org.web3j.protocol.core.methods.response.EthCall;
import org.web3j.protocol.core.methods.response.EthLog;
import org.web3j.protocol.core.methods.response.EthSendTransaction;
import org.web3j.protocol.core.methods.response.Log;
import org.web3j.protocol.core.methods.response.TransactionReceipt;
import org.web3j.protocol.exceptions.ClientConnectionException;
import org.web3j.utils.Numeric;

import java.io.IOException;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.security.GeneralSecurityException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * EVM chain over JSON-RPC. Token deposits are found through ERC-20 {@code Transfer} logs,
 * native deposits by walking block bodies.
 */
@Slf4j
public class EvmRpcAdapter implements ChainAdapter {

    static final String TRANSFER_TOPIC = "0xddf252ad1be2c89b69c2b068fc378daa952ba7f163c4a11628f55a4df523b3ef";

    private static final Pattern EVM_ADDRESS_PATTERN = Pattern.compile("^0x[a-fA-F0-9]{40}$");
    private static final BigInteger NATIVE_GAS_LIMIT = BigInteger.valueOf(21_000);
    private static final BigInteger TOKEN_GAS_LIMIT = BigInteger.valueOf(65_000);

    private final String chain;
    private final ReconcilerProperties.ChainEntry config;
    private final Web3j web3j;
    private volatile boolean chainIdVerified;

    public EvmRpcAdapter(String chain, ReconcilerProperties.ChainEntry config, Web3j web3j) {
        this.chain = chain;
        this.config = config;
        this.web3j = web3j;
    }

    @Override
    public String chainCode() {
        return chain;
    }

    @Override
    public int requiredConfirmations() {
        return config.getRequiredConfirmations();
    }

    @Override
    public long currentHeight() {
        return call("eth_blockNumber", () -> web3j.ethBlockNumber().send()).getBlockNumber().longValueExact();
    }

    @Override
    public Iterable<IncomingTransfer> scanAddress(String address, String token, long fromHeight, long toHeight) {
        if (config.isNative(token)) {
            return new BlockRangeScan(fromHeight, toHeight, 1, (from, to) -> nativeTransfersInBlock(address, from));
        }
        ReconcilerProperties.TokenEntry tokenEntry = config.token(token);
        return new BlockRangeScan(fromHeight, toHeight, config.getBatchBlockSize(),
                (from, to) -> tokenTransfers(address, tokenEntry, from, to));
    }

    // One eth_getLogs per window, filtered on Transfer(_, address, _) for the token contract.
    private List<IncomingTransfer> tokenTransfers(String address, ReconcilerProperties.TokenEntry token, long from, long to) {
        EthFilter filter = new EthFilter(
                DefaultBlockParameter.valueOf(BigInteger.valueOf(from)),
                DefaultBlockParameter.valueOf(BigInteger.valueOf(to)),
                token.getContract()
        );
        filter.addSingleTopic(TRANSFER_TOPIC);
        filter.addNullTopic();
        filter.addSingleTopic(Numeric.toHexStringWithPrefixZeroPadded(Numeric.toBigInt(address), 64));

        EthLog response = call("eth_getLogs", () -> web3j.ethGetLogs(filter).send());
        long head = currentHeight();
        List<IncomingTransfer> transfers = new ArrayList<>();
        for (EthLog.LogResult<?> result : response.getLogs()) {
            if (!(result.get() instanceof Log entry) || entry.isRemoved()) {
                continue;
            }
            long block = entry.getBlockNumber().longValueExact();
            BigInteger raw = Numeric.toBigInt(entry.getData());
            transfers.add(new IncomingTransfer(
                    entry.getTransactionHash(),
                    topicAddress(entry.getTopics().get(1)),
                    address,
                    new BigDecimal(raw).movePointLeft(token.getDecimals()),
                    block,
                    entry.getLogIndex().longValueExact(),
                    head - block + 1
            ));
        }
        transfers.sort(Comparator.comparingLong(IncomingTransfer::blockHeight).thenComparingLong(IncomingTransfer::indexInBlock));
        return transfers;
    }

    private List<IncomingTransfer> nativeTransfersInBlock(String address, long height) {
        EthBlock response = call("eth_getBlockByNumber",
                () -> web3j.ethGetBlockByNumber(DefaultBlockParameter.valueOf(BigInteger.valueOf(height)), true).send());
        EthBlock.Block block = response.getBlock();
        if (block == null) {
            throw new RpcUnavailableException(chain, "block " + height + " not served yet");
        }
        long head = currentHeight();
        List<IncomingTransfer> transfers = new ArrayList<>();
        for (EthBlock.TransactionResult<?> result : block.getTransactions()) {
            if (result.get() instanceof EthBlock.TransactionObject tx
                    && tx.getTo() != null
                    && tx.getTo().equalsIgnoreCase(address)
                    && tx.getValue().signum() > 0) {
                transfers.add(new IncomingTransfer(
                        tx.getHash(),
                        tx.getFrom(),
                        address,
                        new BigDecimal(tx.getValue()).movePointLeft(config.getNativeDecimals()),
                        height,
                        tx.getTransactionIndex().longValueExact(),
                        head - height + 1
                ));
            }
        }
        return transfers;
    }

    @Override
    public BigDecimal balance(String address, String token) {
        if (config.isNative(token)) {
            BigInteger wei = call("eth_getBalance",
                    () -> web3j.ethGetBalance(address, DefaultBlockParameterName.LATEST).send()).getBalance();
            return new BigDecimal(wei).movePointLeft(config.getNativeDecimals());
        }
        ReconcilerProperties.TokenEntry tokenEntry = config.token(token);
        Function balanceOf = new Function(
                "balanceOf",
                List.of(new Address(address)),
                List.of(new TypeReference<Uint256>() {})
        );
        EthCall response = call("eth_call", () -> web3j.ethCall(
                Transaction.createEthCallTransaction(address, tokenEntry.getContract(), FunctionEncoder.encode(balanceOf)),
                DefaultBlockParameterName.LATEST
        ).send());
        List<Type> decoded = FunctionReturnDecoder.decode(response.getValue(), balanceOf.getOutputParameters());
        if (decoded.isEmpty()) {
            return BigDecimal.ZERO;
        }
        BigInteger raw = ((Uint256) decoded.get(0)).getValue();
        return new BigDecimal(raw).movePointLeft(tokenEntry.getDecimals());
    }

    @Override
    public SignedTransfer sign(TransferCommand command, byte[] privateKey) {
        if (!isValidAddress(command.toAddress())) {
            throw new IllegalArgumentException("Invalid EVM to-address: " + command.toAddress());
        }
        ensureConnectedChainIdMatchesConfigured();

        BigInteger nonce = call("eth_getTransactionCount", () -> web3j.ethGetTransactionCount(
                command.fromAddress(), DefaultBlockParameterName.PENDING).send()).getTransactionCount();
        BigInteger gasPrice = call("eth_gasPrice", () -> web3j.ethGasPrice().send()).getGasPrice();

        RawTransaction raw;
        if (config.isNative(command.token())) {
            raw = RawTransaction.createEtherTransaction(
                    nonce, gasPrice, NATIVE_GAS_LIMIT, command.toAddress(),
                    toBaseUnits(command.amount(), config.getNativeDecimals()));
        } else {
            ReconcilerProperties.TokenEntry token = config.token(command.token());
            Function transfer = new Function(
                    "transfer",
                    List.of(new Address(command.toAddress()), new Uint256(toBaseUnits(command.amount(), token.getDecimals()))),
                    List.of()
            );
            raw = RawTransaction.createTransaction(
                    nonce, gasPrice, TOKEN_GAS_LIMIT, token.getContract(), FunctionEncoder.encode(transfer));
        }
        return EvmSigner.sign(raw, config.getChainId(), command.fromAddress(), privateKey);
    }

    @Override
    public String broadcast(SignedTransfer transfer) {
        EthSendTransaction sent = send("eth_sendRawTransaction", () -> web3j.ethSendRawTransaction(transfer.payload()).send());
        if (sent.hasError()) {
            String detail = sent.getError().getMessage();
            if (detail != null && detail.toLowerCase(Locale.ROOT).contains("already known")) {
                log.info("event=adapter.broadcast.already_known chain={} txHash={}", chain, transfer.txHash());
                return transfer.txHash();
            }
            throw new BroadcastRejectedException(chain, detail);
        }
        String txHash = sent.getTransactionHash();
        if (txHash == null || txHash.isBlank()) {
            throw new RpcUnavailableException(chain, "RPC returned an empty tx hash");
        }
        return txHash;
    }

    @Override
    public BigDecimal estimateFee(String token) {
        BigInteger gasPrice = call("eth_gasPrice", () -> web3j.ethGasPrice().send()).getGasPrice();
        BigInteger gasLimit = config.isNative(token) ? NATIVE_GAS_LIMIT : TOKEN_GAS_LIMIT;
        return new BigDecimal(gasPrice.multiply(gasLimit)).movePointLeft(config.getNativeDecimals());
    }

    @Override
    public Optional<TxObservation> lookupTransaction(String txHash) {
        Optional<TransactionReceipt> receipt = call("eth_getTransactionReceipt",
                () -> web3j.ethGetTransactionReceipt(txHash).send()).getTransactionReceipt();
        if (receipt.isEmpty() || receipt.get().getBlockNumberRaw() == null) {
            return Optional.empty();
        }
        long block = receipt.get().getBlockNumber().longValueExact();
        long head = currentHeight();
        return Optional.of(new TxObservation(txHash, block, head - block + 1, receipt.get().isStatusOK(), paidFee(receipt.get())));
    }

    private BigDecimal paidFee(TransactionReceipt receipt) {
        String gasUsed = receipt.getGasUsedRaw();
        String effectiveGasPrice = receipt.getEffectiveGasPrice();
        if (gasUsed == null || effectiveGasPrice == null || effectiveGasPrice.isBlank()) {
            return null;
        }
        BigInteger wei = Numeric.decodeQuantity(gasUsed).multiply(Numeric.decodeQuantity(effectiveGasPrice));
        return new BigDecimal(wei).movePointLeft(config.getNativeDecimals());
    }

    @Override
    public boolean isValidAddress(String address) {
        return address != null && EVM_ADDRESS_PATTERN.matcher(address).matches();
    }

    @Override
    public GeneratedAddress generateAddress() {
        try {
            ECKeyPair keyPair = Keys.createEcKeyPair();
            String address = Keys.toChecksumAddress(Keys.getAddress(keyPair));
            return new GeneratedAddress(address, Numeric.toBytesPadded(keyPair.getPrivateKey(), 32));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("failed to generate key pair for " + chain, e);
        }
    }

    @Override
    public void close() {
        web3j.shutdown();
    }

    // Safety check to avoid signing for the wrong chain when config and RPC endpoint disagree.
    private void ensureConnectedChainIdMatchesConfigured() {
        if (chainIdVerified) {
            return;
        }
        long remoteChainId = call("eth_chainId", () -> web3j.ethChainId().send()).getChainId().longValueExact();
        if (remoteChainId != config.getChainId()) {
            throw new IllegalStateException("Connected RPC chain id mismatch. chain=" + chain
                    + " expected=" + config.getChainId() + ", actual=" + remoteChainId);
        }
        chainIdVerified = true;
    }

    private static BigInteger toBaseUnits(BigDecimal amount, int decimals) {
        try {
            return amount.movePointRight(decimals).toBigIntegerExact();
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("amount " + amount.toPlainString() + " has more than " + decimals + " decimals", e);
        }
    }

    private static String topicAddress(String topic) {
        return "0x" + Numeric.cleanHexPrefix(topic).substring(24);
    }

    @FunctionalInterface
    private interface RpcCall<T extends Response<?>> {
        T execute() throws IOException;
    }

    // Read-only calls: a node-side error is as transient as a dropped connection.
    private <T extends Response<?>> T call(String method, RpcCall<T> rpc) {
        T response = send(method, rpc);
        if (response.hasError()) {
            throw new RpcUnavailableException(chain, method + " failed: " + response.getError().getMessage());
        }
        return response;
    }

    private <T extends Response<?>> T send(String method, RpcCall<T> rpc) {
        try {
            return rpc.execute();
        } catch (IOException | ClientConnectionException e) {
            throw new RpcUnavailableException(chain, method + " unavailable", e);
        }
    }
}
