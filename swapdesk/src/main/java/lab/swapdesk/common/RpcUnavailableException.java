package lab.swapdesk.common;

import java.util.List;

public class RpcUnavailableException extends SwapException {

    private final List<String> triedEndpoints;

    public RpcUnavailableException(String message, List<String> triedEndpoints, Throwable cause) {
        super(SwapErrorKind.RPC_UNAVAILABLE, message, cause);
        this.triedEndpoints = triedEndpoints == null ? List.of() : List.copyOf(triedEndpoints);
    }

    public RpcUnavailableException(String message) {
        this(message, List.of(), null);
    }

    public List<String> getTriedEndpoints() {
        return triedEndpoints;
    }
}
