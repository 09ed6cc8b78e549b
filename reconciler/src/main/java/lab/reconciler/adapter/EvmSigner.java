package lab.reconciler.adapter;

import org.web3j.crypto.Credentials;
import org.web3j.crypto.ECKeyPair;
import org.web3j.crypto.Hash;
import org.web3j.crypto.RawTransaction;
import org.web3j.crypto.TransactionEncoder;
import org.web3j.utils.Numeric;

/**
 * Signs EVM transactions with a key that only lives for the duration of the call.
 */
final class EvmSigner {

    private EvmSigner() {
    }

    static ChainAdapter.SignedTransfer sign(RawTransaction tx, long chainId, String expectedSender, byte[] privateKey) {
        Credentials credentials = Credentials.create(ECKeyPair.create(privateKey));
        if (expectedSender != null && !credentials.getAddress().equalsIgnoreCase(expectedSender)) {
            throw new IllegalStateException("key does not belong to sender " + expectedSender);
        }
        byte[] signed = TransactionEncoder.signMessage(tx, chainId, credentials);
        String payload = Numeric.toHexString(signed);
        return new ChainAdapter.SignedTransfer(Hash.sha3(payload), payload);
    }
}
