package lab.swapdesk.adapter.rpc;

import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.net.http.HttpClient;
import java.time.Duration;

public final class RestClients {

    private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(3);

    private RestClients() {
    }

    // Every outbound call gets an explicit connect and read bound.
    public static RestClient withTimeout(RestClient.Builder builder, Duration readTimeout) {
        HttpClient httpClient = HttpClient.newBuilder()
                .connectTimeout(CONNECT_TIMEOUT)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
        JdkClientHttpRequestFactory requestFactory = new JdkClientHttpRequestFactory(httpClient);
        requestFactory.setReadTimeout(readTimeout);
        return builder.clone().requestFactory(requestFactory).build();
    }
}
