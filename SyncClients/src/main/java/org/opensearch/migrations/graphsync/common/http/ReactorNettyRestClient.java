package org.opensearch.migrations.graphsync.common.http;

import java.time.Duration;
import javax.net.ssl.SSLException;
import javax.net.ssl.SSLParameters;

import io.netty.handler.ssl.SslContextBuilder;
import io.netty.handler.ssl.util.InsecureTrustManagerFactory;
import lombok.extern.slf4j.Slf4j;
import reactor.netty.http.client.HttpClient;
import reactor.netty.resources.ConnectionProvider;
import reactor.netty.tcp.SslProvider;

/**
 * REST client for one OpenSearch cluster on top of Reactor Netty. TLS is used only for https endpoints;
 * an insecure context skips both certificate and hostname verification.
 */
@Slf4j
public class ReactorNettyRestClient extends AbstractRestClient {
    /** Bulk requests of large pages can take a while on a busy cluster. */
    public static final Duration DEFAULT_RESPONSE_TIMEOUT = Duration.ofMinutes(2);

    public ReactorNettyRestClient(ConnectionContext connectionContext) {
        this(connectionContext, 0, DEFAULT_RESPONSE_TIMEOUT);
    }

    /**
     * @param maxConnections If &gt; 0, the size of a dedicated connection pool; otherwise Reactor's shared pool
     */
    public ReactorNettyRestClient(ConnectionContext connectionContext, int maxConnections, Duration responseTimeout) {
        super(connectionContext, new ReactorNettyAdapter(
            createHttpClient(connectionContext, maxConnections, responseTimeout)));
    }

    static HttpClient createHttpClient(ConnectionContext connectionContext, int maxConnections,
                                       Duration responseTimeout) {
        var httpClient = maxConnections > 0
            ? HttpClient.create(ConnectionProvider.create("GraphSyncRestClient", maxConnections))
            : HttpClient.create();

        if (ConnectionContext.Protocol.HTTPS.equals(connectionContext.getProtocol())) {
            if (connectionContext.isInsecure()) {
                log.warn("Certificates of {} will not be verified", connectionContext.getUri());
                httpClient = httpClient.secure(trustAllCertificates());
            } else {
                httpClient = httpClient.secure(SslProvider.defaultClientProvider());
            }
        }

        return httpClient
            .baseUrl(connectionContext.getUri().toString())
            .responseTimeout(responseTimeout)
            .disableRetry(false) // Enable one retry on connection reset with no delay
            .keepAlive(true);
    }

    private static SslProvider trustAllCertificates() {
        try {
            var sslContext = SslContextBuilder.forClient()
                .trustManager(InsecureTrustManagerFactory.INSTANCE)
                .build();
            return SslProvider.builder()
                .sslContext(sslContext)
                .handlerConfigurator(sslHandler -> {
                    var engine = sslHandler.engine();
                    SSLParameters sslParameters = engine.getSSLParameters();
                    sslParameters.setEndpointIdentificationAlgorithm(null);
                    engine.setSSLParameters(sslParameters);
                })
                .build();
        } catch (SSLException e) {
            throw new IllegalStateException("Unable to construct SslProvider", e);
        }
    }
}
