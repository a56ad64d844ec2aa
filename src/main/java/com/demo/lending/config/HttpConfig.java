package com.demo.lending.config;

import org.apache.hc.client5.http.config.ConnectionConfig;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManagerBuilder;
import org.apache.hc.core5.util.Timeout;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.HttpComponentsClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

@Configuration
public class HttpConfig {

    /** Used for Risk Service calls; a timeout surfaces as an unavailable verdict. */
    @Bean
    public RestTemplate restTemplate(LendingProperties props) {
        return new RestTemplate(new HttpComponentsClientHttpRequestFactory(httpClient(props.getRisk())));
    }

    static CloseableHttpClient httpClient(LendingProperties.Risk risk) {
        Timeout connect = Timeout.ofMilliseconds(risk.getConnectTimeoutMs());
        Timeout read = Timeout.ofMilliseconds(risk.getReadTimeoutMs());
        ConnectionConfig connectionConfig = ConnectionConfig.custom()
                .setConnectTimeout(connect)
                .setSocketTimeout(read)
                .build();
        return HttpClients.custom()
                .setConnectionManager(PoolingHttpClientConnectionManagerBuilder.create()
                        .setDefaultConnectionConfig(connectionConfig)
                        .build())
                .setDefaultRequestConfig(RequestConfig.custom().setResponseTimeout(read).build())
                .build();
    }
}
