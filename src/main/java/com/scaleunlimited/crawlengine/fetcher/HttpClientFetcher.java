package com.scaleunlimited.crawlengine.fetcher;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.net.SocketTimeoutException;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import org.apache.commons.io.IOUtils;
import org.apache.http.Header;
import org.apache.http.HttpEntity;
import org.apache.http.HttpHost;
import org.apache.http.client.config.RequestConfig;
import org.apache.http.client.methods.CloseableHttpResponse;
import org.apache.http.client.methods.HttpRequestBase;
import org.apache.http.client.methods.HttpUriRequest;
import org.apache.http.client.methods.RequestBuilder;
import org.apache.http.conn.ConnectTimeoutException;
import org.apache.http.entity.ByteArrayEntity;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.impl.client.HttpClients;
import org.apache.http.impl.conn.PoolingHttpClientConnectionManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.scaleunlimited.crawlengine.pojos.CrawlRequest;
import com.scaleunlimited.crawlengine.pojos.FetchContext;
import com.scaleunlimited.crawlengine.pojos.FetchedResponse;
import com.scaleunlimited.crawlengine.utils.HttpUtils;

/**
 * {@link BaseHttpFetcher} on top of Apache HttpClient, with a pooled
 * connection manager sized from the fetcher's thread count.
 */
public class HttpClientFetcher extends BaseHttpFetcher {
    static final Logger LOGGER = LoggerFactory.getLogger(HttpClientFetcher.class);

    private static final int BUFFER_SIZE = 8 * 1024;

    private CloseableHttpClient _httpClient;
    private Set<HttpRequestBase> _activeRequests;

    public HttpClientFetcher(int maxThreads) {
        super(maxThreads);

        _activeRequests = Collections.newSetFromMap(new ConcurrentHashMap<HttpRequestBase, Boolean>());
    }

    @Override
    public FetchedResponse get(FetchContext context) throws BaseFetchException {
        CrawlRequest request = context.getRequest();
        String url = request.getUrl();

        URI uri;
        try {
            uri = new URI(url);
        } catch (URISyntaxException e) {
            throw new UrlFetchException(url, e.getMessage());
        }

        RequestConfig.Builder configBuilder = RequestConfig.custom()
                .setConnectTimeout(_timeoutMs)
                .setConnectionRequestTimeout(_timeoutMs)
                .setSocketTimeout(_timeoutMs)
                .setRedirectsEnabled(false);

        if (context.getProxy() != null) {
            configBuilder.setProxy(HttpHost.create(context.getProxy()));
        }

        RequestBuilder requestBuilder = RequestBuilder.create(request.getMethod())
                .setUri(uri)
                .setConfig(configBuilder.build());
        for (Map.Entry<String, String> header : context.getHeaders().entrySet()) {
            requestBuilder.setHeader(header.getKey(), header.getValue());
        }

        if (request.hasBody()) {
            requestBuilder.setEntity(new ByteArrayEntity(request.getBody()));
        }

        HttpUriRequest httpRequest = requestBuilder.build();
        HttpRequestBase abortable = (httpRequest instanceof HttpRequestBase) ? (HttpRequestBase) httpRequest : null;
        if (abortable != null) {
            _activeRequests.add(abortable);
        }

        long startTime = System.currentTimeMillis();
        try (CloseableHttpResponse response = getClient().execute(httpRequest)) {
            Map<String, String> headers = new HashMap<>();
            for (Header header : response.getAllHeaders()) {
                headers.putIfAbsent(header.getName(), header.getValue());
            }

            String contentType = "";
            byte[] content = new byte[0];
            HttpEntity entity = response.getEntity();
            if (entity != null) {
                if (entity.getContentType() != null) {
                    contentType = entity.getContentType().getValue();
                }

                String mimeType = HttpUtils.getMimeTypeFromContentType(contentType);
                if (!mimeType.isEmpty() && !isValidMimeType(mimeType)) {
                    throw new AbortedFetchException(url, "Invalid mime-type: " + mimeType,
                            AbortedFetchReason.INVALID_MIMETYPE);
                }

                try (InputStream in = entity.getContent()) {
                    content = readContent(url, in);
                }
            }

            long latency = System.currentTimeMillis() - startTime;
            return new FetchedResponse(request, response.getStatusLine().getStatusCode(), headers,
                    content, contentType, latency, startTime);
        } catch (SocketTimeoutException | ConnectTimeoutException e) {
            throw new TimeoutFetchException(url, e);
        } catch (InterruptedIOException e) {
            throw new AbortedFetchException(url, "Fetch interrupted", AbortedFetchReason.INTERRUPTED);
        } catch (IOException e) {
            if ((abortable != null) && abortable.isAborted()) {
                throw new AbortedFetchException(url, "Fetch aborted", AbortedFetchReason.INTERRUPTED);
            }

            throw new IOFetchException(url, e);
        } finally {
            if (abortable != null) {
                _activeRequests.remove(abortable);
            }
        }
    }

    /**
     * Read up to our max content size. Anything past that is dropped (the
     * content is truncated, not rejected).
     */
    private byte[] readContent(String url, InputStream in) throws IOException {
        ByteArrayOutputStream result = new ByteArrayOutputStream();
        byte[] buffer = new byte[BUFFER_SIZE];
        int remaining = _maxContentSize;
        while (remaining > 0) {
            int bytesRead = IOUtils.read(in, buffer, 0, Math.min(buffer.length, remaining));
            if (bytesRead == 0) {
                break;
            }

            result.write(buffer, 0, bytesRead);
            remaining -= bytesRead;
        }

        if (remaining == 0) {
            LOGGER.debug("Truncated content for '{}' at {} bytes", url, _maxContentSize);
        }

        return result.toByteArray();
    }

    @Override
    public void abort() {
        for (HttpRequestBase request : _activeRequests) {
            request.abort();
        }
    }

    @Override
    public synchronized void close() {
        if (_httpClient != null) {
            try {
                _httpClient.close();
            } catch (IOException e) {
                LOGGER.warn("Error closing HTTP client: " + e.getMessage(), e);
            }

            _httpClient = null;
        }
    }

    private synchronized CloseableHttpClient getClient() {
        if (_httpClient == null) {
            PoolingHttpClientConnectionManager connectionManager = new PoolingHttpClientConnectionManager();
            connectionManager.setMaxTotal(_maxThreads);
            connectionManager.setDefaultMaxPerRoute(_maxConnectionsPerHost);

            _httpClient = HttpClients.custom()
                    .setConnectionManager(connectionManager)
                    .disableRedirectHandling()
                    .disableAutomaticRetries()
                    .build();
        }

        return _httpClient;
    }
}
