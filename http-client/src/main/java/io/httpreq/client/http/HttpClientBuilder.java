package io.httpreq.client.http;

import java.time.Duration;

import io.httpreq.client.http.jdk.JdkHttpClientBuilder;

public interface HttpClientBuilder {

    static HttpClientBuilder newBuilder() {
        return new JdkHttpClientBuilder();
    }

    HttpClientBuilder timeout(Duration timeout);

    HttpClient create();
}
