package com.tenacy.rootpulse.config;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.json.jackson.JacksonJsonpMapper;
import co.elastic.clients.transport.ElasticsearchTransport;
import co.elastic.clients.transport.rest_client.RestClientTransport;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.tenacy.rootpulse.credential.CredentialProvider;
import org.apache.http.HttpHeaders;
import org.apache.http.HttpHost;
import org.apache.http.HttpRequestInterceptor;
import org.apache.http.client.config.RequestConfig;
import org.elasticsearch.client.RestClient;
import org.elasticsearch.client.RestClientBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.URI;
import java.net.URISyntaxException;

@Configuration
public class ElasticsearchConfig {

    private final LogStoreProperties logStoreProperties;
    private final CredentialProvider credentialProvider;

    public ElasticsearchConfig(LogStoreProperties logStoreProperties, CredentialProvider credentialProvider) {
        this.logStoreProperties = logStoreProperties;
        this.credentialProvider = credentialProvider;
    }

    @Bean(destroyMethod = "close")
    public RestClient restClient() {
        String elasticsearchUri = logStoreProperties.getUris();
        try {
            // URI를 적절히 파싱
            URI uri = new URI(elasticsearchUri);
            String host = uri.getHost();
            int port = uri.getPort() > 0 ? uri.getPort() : 9200;
            String scheme = uri.getScheme() != null ? uri.getScheme() : "http";

            RestClientBuilder builder = RestClient.builder(
                    new HttpHost(host, port, scheme)
            );

            // 타임아웃 설정
            builder.setRequestConfigCallback(
                    (RequestConfig.Builder requestConfigBuilder) -> requestConfigBuilder
                            .setSocketTimeout(logStoreProperties.getSocketTimeout())
                            .setConnectTimeout(logStoreProperties.getConnectionTimeout())
            );

            // 요청마다 캐시된 자격 증명을 헤더로 첨부 (만료 시 provider 가 갱신)
            builder.setHttpClientConfigCallback(httpClientBuilder ->
                    httpClientBuilder.setMaxConnTotal(20)
                            .setMaxConnPerRoute(10)
                            .addInterceptorLast((HttpRequestInterceptor) (request, context) ->
                                    credentialProvider.getValidCredentials()
                                            .toAuthorizationHeader()
                                            .ifPresent(value -> request.setHeader(HttpHeaders.AUTHORIZATION, value))));

            return builder.build();
        } catch (URISyntaxException e) {
            throw new IllegalStateException("Invalid log store URI: " + elasticsearchUri, e);
        }
    }

    @Bean
    public ElasticsearchTransport elasticsearchTransport(RestClient restClient) {
        ObjectMapper objectMapper = new ObjectMapper().registerModule(new JavaTimeModule());
        return new RestClientTransport(restClient, new JacksonJsonpMapper(objectMapper));
    }

    @Bean
    public ElasticsearchClient elasticsearchClient(ElasticsearchTransport elasticsearchTransport) {
        return new ElasticsearchClient(elasticsearchTransport);
    }
}
