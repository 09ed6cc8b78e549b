package lab.reconciler.orchestration;

public class AddressPoolExhaustedException extends RuntimeException {
    public AddressPoolExhaustedException(String message) {
        super(message);
    }
}
