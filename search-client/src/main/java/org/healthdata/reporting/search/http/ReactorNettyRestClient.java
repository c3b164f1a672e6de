package org.healthdata.reporting.search.http;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

import javax.net.ssl.SSLEngine;
import javax.net.ssl.SSLException;
import javax.net.ssl.SSLParameters;

import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import io.netty.handler.ssl.util.InsecureTrustManagerFactory;
import reactor.netty.http.client.HttpClient;
import reactor.netty.resources.ConnectionProvider;
import reactor.netty.tcp.SslProvider;

/**
 * REST client backed by reactor-netty with a bounded connection pool. A configured CA certificate takes
 * precedence over the insecure flag.
 */
public class ReactorNettyRestClient extends AbstractRestClient {

    public ReactorNettyRestClient(ConnectionContext connectionContext) {
        this(connectionContext, 0);
    }

    /**
     * @param maxConnections pool size; 0 or less uses the reactor-netty default pool
     */
    public ReactorNettyRestClient(ConnectionContext connectionContext, int maxConnections) {
        super(connectionContext, createAdapter(connectionContext, maxConnections));
    }

    private static ReactorNettyAdapter createAdapter(ConnectionContext connectionContext, int maxConnections) {
        HttpClient httpClient = maxConnections <= 0
            ? HttpClient.create()
            : HttpClient.create(ConnectionProvider.create("SearchClient", maxConnections));

        if (connectionContext.getProtocol() == ConnectionContext.Protocol.HTTPS) {
            SslProvider sslProvider;
            if (connectionContext.getCaCert() != null) {
                sslProvider = getSslProvider(connectionContext.getCaCert());
            } else if (connectionContext.isInsecure()) {
                sslProvider = getInsecureSslProvider();
            } else {
                sslProvider = SslProvider.defaultClientProvider();
            }
            httpClient = httpClient.secure(sslProvider);
        }

        httpClient = httpClient
            .baseUrl(connectionContext.getUri().toString())
            .responseTimeout(connectionContext.getRequestTimeout())
            .disableRetry(false) // one retry on connection reset
            .keepAlive(true);

        return new ReactorNettyAdapter(httpClient);
    }

    private static SslProvider getSslProvider(Path caCert) {
        try (InputStream caCertStream = Files.newInputStream(caCert)) {
            SslContext sslContext = SslContextBuilder.forClient()
                .trustManager(caCertStream)
                .build();
            return SslProvider.builder()
                .sslContext(sslContext)
                .build();
        } catch (IOException e) {
            throw new IllegalStateException("Unable to construct SslProvider from " + caCert, e);
        }
    }

    private static SslProvider getInsecureSslProvider() {
        try {
            SslContext sslContext = SslContextBuilder.forClient()
                .trustManager(InsecureTrustManagerFactory.INSTANCE)
                .build();

            return SslProvider.builder()
                .sslContext(sslContext)
                .handlerConfigurator(sslHandler -> {
                    SSLEngine engine = sslHandler.engine();
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
