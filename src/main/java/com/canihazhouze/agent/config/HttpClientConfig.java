package com.canihazhouze.agent.config;

import com.canihazhouze.agent.llm.ChatModelProperties;
import lombok.extern.slf4j.Slf4j;
import org.apache.hc.client5.http.config.ConnectionConfig;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManagerBuilder;
import org.apache.hc.core5.util.Timeout;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.HttpComponentsClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.time.Duration;

/**
 * Pooled Apache HttpClient 5 instances behind Spring's RestClient.
 *
 * The chat model and the platform service tools get separate pools with their
 * own timeouts: a slow CRUD service must not eat connections the model needs.
 */
@Configuration
@Slf4j
public class HttpClientConfig {

    @Bean("chatModelRestClientBuilder")
    public RestClient.Builder chatModelRestClientBuilder(ChatModelProperties props) {
        log.info("Chat model HTTP pool: maxConnections={} connectTimeout={} readTimeout={}",
                props.getMaxConnections(), props.getConnectTimeout(), props.getReadTimeout());
        return RestClient.builder().requestFactory(requestFactory(
                props.getConnectTimeout(), props.getReadTimeout(), props.getMaxConnections()));
    }

    @Bean("toolRestClientBuilder")
    public RestClient.Builder toolRestClientBuilder(ToolProperties props) {
        ToolProperties.Http http = props.getHttp();
        return RestClient.builder().requestFactory(requestFactory(
                Duration.ofMillis(http.getConnectTimeoutMs()),
                Duration.ofMillis(http.getReadTimeoutMs()),
                20));
    }

    private HttpComponentsClientHttpRequestFactory requestFactory(Duration connectTimeout,
                                                                  Duration readTimeout,
                                                                  int maxConnections) {
        ConnectionConfig connectionConfig = ConnectionConfig.custom()
                .setConnectTimeout(Timeout.of(connectTimeout))
                .setSocketTimeout(Timeout.of(readTimeout))
                .build();

        CloseableHttpClient httpClient = HttpClients.custom()
                .setConnectionManager(
                        PoolingHttpClientConnectionManagerBuilder.create()
                                .setDefaultConnectionConfig(connectionConfig)
                                .setMaxConnTotal(maxConnections)
                                .setMaxConnPerRoute(maxConnections)
                                .build())
                .setDefaultRequestConfig(RequestConfig.custom()
                        .setResponseTimeout(Timeout.of(readTimeout))
                        .build())
                .build();

        return new HttpComponentsClientHttpRequestFactory(httpClient);
    }
}
