package io.httpreq.client.http.jdk;

import static io.httpreq.util.Assert.checkNotNullParam;

import java.time.Duration;
import java.util.concurrent.Executor;

import io.httpreq.client.http.HttpClient;
import io.httpreq.client.http.HttpClientBuilder;
import org.jspecify.annotations.Nullable;

/**
 * Creates {@link HttpClient} instances backed by the JDK HTTP client.
 *
 * <p>Defaults: one-minute request timeout, HTTP/1.1, redirects followed except from
 * HTTPS to HTTP, no connect timeout beyond the request timeout.
 */
public class JdkHttpClientBuilder implements HttpClientBuilder {

    private Duration timeout = HttpClient.DEFAULT_TIMEOUT;
    private @Nullable Duration connectTimeout;
    private java.net.http.HttpClient.Version version = java.net.http.HttpClient.Version.HTTP_1_1;
    private java.net.http.HttpClient.Redirect redirect = java.net.http.HttpClient.Redirect.NORMAL;
    private @Nullable Executor executor;
    private java.net.http.HttpClient.@Nullable Builder delegate;

    @Override
    public JdkHttpClientBuilder timeout(Duration timeout) {
        this.timeout = positive("timeout", timeout);
        return this;
    }

    public JdkHttpClientBuilder connectTimeout(Duration connectTimeout) {
        this.connectTimeout = positive("connectTimeout", connectTimeout);
        return this;
    }

    public JdkHttpClientBuilder version(java.net.http.HttpClient.Version version) {
        this.version = checkNotNullParam("version", version);
        return this;
    }

    public JdkHttpClientBuilder followRedirects(java.net.http.HttpClient.Redirect redirect) {
        this.redirect = checkNotNullParam("redirect", redirect);
        return this;
    }

    public JdkHttpClientBuilder executor(Executor executor) {
        this.executor = checkNotNullParam("executor", executor);
        return this;
    }

    /**
     * Uses a caller-configured JDK builder (proxy, SSL context, authenticator...). The
     * version, redirect, connect timeout and executor settings of this builder are not
     * applied to it.
     *
     * @param builder the JDK client builder
     * @return this builder
     */
    public JdkHttpClientBuilder httpClientBuilder(java.net.http.HttpClient.Builder builder) {
        this.delegate = checkNotNullParam("builder", builder);
        return this;
    }

    @Override
    public HttpClient create() {
        return new JdkHttpClient(buildJdkClient(), timeout);
    }

    private java.net.http.HttpClient buildJdkClient() {
        if (delegate != null) {
            return delegate.build();
        }
        java.net.http.HttpClient.Builder builder = java.net.http.HttpClient.newBuilder()
                .version(version)
                .followRedirects(redirect);
        if (connectTimeout != null) {
            builder.connectTimeout(connectTimeout);
        }
        if (executor != null) {
            builder.executor(executor);
        }
        return builder.build();
    }

    private static Duration positive(String name, Duration value) {
        checkNotNullParam(name, value);
        if (value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException("Parameter '" + name + "' must be positive");
        }
        return value;
    }
}
