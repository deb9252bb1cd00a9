package lab.swapdesk.adapter.rpc;

import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.ResourceAccessException;

import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.net.http.HttpConnectTimeoutException;
import java.net.http.HttpTimeoutException;

/**
 * Classifies RestClient failures by whether the request could have reached the remote side.
 */
public final class HttpFailures {

    private HttpFailures() {
    }

    /** The connection was never established, so the request body was never delivered. */
    public static boolean neverSent(Throwable failure) {
        for (Throwable t = failure; t != null; t = t.getCause()) {
            if (t instanceof HttpConnectTimeoutException
                    || t instanceof ConnectException
                    || t instanceof UnknownHostException
                    || t instanceof NoRouteToHostException) {
                return true;
            }
        }
        return false;
    }

    public static boolean timedOut(Throwable failure) {
        for (Throwable t = failure; t != null; t = t.getCause()) {
            if (t instanceof HttpTimeoutException || t instanceof SocketTimeoutException) {
                return true;
            }
        }
        return false;
    }

    /** Failures where asking again (same or another endpoint) can help a read-only call. */
    public static boolean transientFailure(Throwable failure) {
        if (failure instanceof ResourceAccessException || failure instanceof HttpServerErrorException) {
            return true;
        }
        return failure instanceof HttpClientErrorException.TooManyRequests;
    }
}
