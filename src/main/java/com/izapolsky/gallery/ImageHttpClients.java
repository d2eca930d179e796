package com.izapolsky.gallery;

import org.apache.http.client.config.RequestConfig;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.impl.client.HttpClients;
import org.apache.http.impl.conn.PoolingHttpClientConnectionManager;

/**
 * Builds the single pooled http client shared by all fetch workers
 */
public final class ImageHttpClients {

    public static final int MAX_CONNECTIONS = 50;

    private ImageHttpClients() {
    }

    public static CloseableHttpClient create(RetrySettings settings) {
        return create(settings, new TransportRetryPolicy(settings));
    }

    public static CloseableHttpClient create(RetrySettings settings, TransportRetryPolicy retryPolicy) {
        PoolingHttpClientConnectionManager connectionManager = new PoolingHttpClientConnectionManager();
        connectionManager.setMaxTotal(MAX_CONNECTIONS);
        connectionManager.setDefaultMaxPerRoute(MAX_CONNECTIONS);

        RequestConfig requestConfig = RequestConfig.custom()
                .setConnectTimeout(settings.getRequestTimeoutMillis())
                .setSocketTimeout(settings.getRequestTimeoutMillis())
                .setConnectionRequestTimeout(settings.getRequestTimeoutMillis())
                .build();

        return HttpClients.custom()
                .setConnectionManager(connectionManager)
                .setDefaultRequestConfig(requestConfig)
                .setRetryHandler(retryPolicy)
                .setServiceUnavailableRetryStrategy(retryPolicy)
                .build();
    }
}
