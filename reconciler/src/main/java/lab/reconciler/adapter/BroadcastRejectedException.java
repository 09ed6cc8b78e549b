package lab.reconciler.adapter;

public class BroadcastRejectedException extends RuntimeException {

    private final String chainDetail;

    public BroadcastRejectedException(String chain, String chainDetail) {
        super(chain + " rejected transaction: " + chainDetail);
        this.chainDetail = chainDetail;
    }

    public String getChainDetail() {
        return chainDetail;
    }
}
