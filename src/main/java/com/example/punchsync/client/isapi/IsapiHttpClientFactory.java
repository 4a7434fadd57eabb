package com.example.punchsync.client.isapi;

import com.example.punchsync.model.DeviceConfig;
import org.apache.hc.client5.http.auth.AuthScope;
import org.apache.hc.client5.http.auth.UsernamePasswordCredentials;
import org.apache.hc.client5.http.config.ConnectionConfig;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.auth.BasicCredentialsProvider;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManagerBuilder;
import org.apache.hc.client5.http.ssl.NoopHostnameVerifier;
import org.apache.hc.client5.http.ssl.SSLConnectionSocketFactory;
import org.apache.hc.core5.ssl.SSLContexts;
import org.apache.hc.core5.ssl.TrustStrategy;
import org.apache.hc.core5.util.Timeout;

import javax.net.ssl.SSLContext;
import java.security.GeneralSecurityException;
import java.security.cert.X509Certificate;
import java.time.Duration;

/**
 * Builds the per-terminal {@link CloseableHttpClient}. Terminals usually ship self-signed
 * certificates, so HTTPS can optionally trust every certificate.
 */
public final class IsapiHttpClientFactory {
    private static final long DEFAULT_TIMEOUT_MILLIS = 5_000L;

    private IsapiHttpClientFactory() {
    }

    public static CloseableHttpClient create(DeviceConfig device, Duration connectTimeout, Duration responseTimeout) {
        Timeout connect = toTimeout(connectTimeout);
        Timeout response = toTimeout(responseTimeout);
        PoolingHttpClientConnectionManagerBuilder connectionManager = PoolingHttpClientConnectionManagerBuilder.create()
            .setDefaultConnectionConfig(ConnectionConfig.custom()
                .setConnectTimeout(connect)
                .setSocketTimeout(response)
                .build())
            .setMaxConnTotal(2)
            .setMaxConnPerRoute(2);
        if (device.isHttps() && device.isInsecureTls()) {
            connectionManager.setSSLSocketFactory(new SSLConnectionSocketFactory(trustAll(), NoopHostnameVerifier.INSTANCE));
        }
        RequestConfig requestConfig = RequestConfig.custom()
            .setConnectionRequestTimeout(connect)
            .setResponseTimeout(response)
            .build();
        BasicCredentialsProvider credentials = new BasicCredentialsProvider();
        if (device.getUsername() != null && device.getPassword() != null) {
            credentials.setCredentials(new AuthScope(device.getAddress(), device.getPort()),
                new UsernamePasswordCredentials(device.getUsername(), device.getPassword().toCharArray()));
        }
        return HttpClients.custom()
            .setConnectionManager(connectionManager.build())
            .setDefaultRequestConfig(requestConfig)
            .setDefaultCredentialsProvider(credentials)
            .disableAutomaticRetries()
            .build();
    }

    private static SSLContext trustAll() {
        try {
            return SSLContexts.custom()
                .loadTrustMaterial(null, (TrustStrategy) (X509Certificate[] chain, String authType) -> true)
                .build();
        } catch (GeneralSecurityException ex) {
            throw new IllegalStateException("Unable to create insecure TLS context", ex);
        }
    }

    private static Timeout toTimeout(Duration duration) {
        long millis = duration == null ? 0L : duration.toMillis();
        if (millis <= 0L) {
            millis = DEFAULT_TIMEOUT_MILLIS;
        }
        return Timeout.ofMilliseconds(millis);
    }
}
