package org.gc.contentscheduler.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.elasticsearch.client.ClientConfiguration;
import org.springframework.data.elasticsearch.client.elc.ElasticsearchClients;
import org.springframework.data.elasticsearch.client.elc.ElasticsearchConfiguration;
import org.springframework.data.elasticsearch.repository.config.EnableElasticsearchRepositories;

import javax.net.ssl.SSLContext;
import javax.net.ssl.TrustManagerFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.KeyStore;
import java.security.cert.Certificate;
import java.security.cert.CertificateFactory;
import java.time.Duration;

/**
 * Client settings for the schedule store. TLS and basic auth are only applied
 * when their properties are set, so a plain local node works without them.
 */
@Configuration
@EnableElasticsearchRepositories(basePackages = "org.gc.contentscheduler.repository")
public class ElasticsearchClientConfig extends ElasticsearchConfiguration {

    @Value("${es.cluster-nodes:localhost:9200}")
    private String clusterNodes;

    @Value("${es.trust-store:}")
    private String trustStore;

    @Value("${es.username:}")
    private String username;

    @Value("${es.password:}")
    private String password;

    @Value("${es.socket-timeout-seconds:30}")
    private long socketTimeoutSeconds;

    @Override
    public ClientConfiguration clientConfiguration() {
        var builder = ClientConfiguration.builder().connectedTo(clusterNodes);

        if (hasText(trustStore)) {
            builder.usingSsl(sslContextFor(Path.of(trustStore)));
        }
        if (hasText(username) && hasText(password)) {
            builder.withBasicAuth(username, password);
        }

        return builder
                .withSocketTimeout(Duration.ofSeconds(socketTimeoutSeconds))
                .withClientConfigurer(ElasticsearchClients.ElasticsearchHttpClientConfigurationCallback.from(
                        httpAsyncClientBuilder -> httpAsyncClientBuilder
                                .setKeepAliveStrategy((response, context) -> Duration.ofMinutes(5).toMillis())))
                .build();
    }

    private static SSLContext sslContextFor(Path certificatePath) {
        try (InputStream in = Files.newInputStream(certificatePath)) {
            Certificate ca = CertificateFactory.getInstance("X.509").generateCertificate(in);

            KeyStore keyStore = KeyStore.getInstance(KeyStore.getDefaultType());
            keyStore.load(null, null);
            keyStore.setCertificateEntry("ca", ca);

            TrustManagerFactory tmf = TrustManagerFactory.getInstance(TrustManagerFactory.getDefaultAlgorithm());
            tmf.init(keyStore);

            SSLContext context = SSLContext.getInstance("TLS");
            context.init(null, tmf.getTrustManagers(), null);
            return context;
        } catch (IOException | GeneralSecurityException e) {
            throw new IllegalStateException("Unable to load Elasticsearch trust store " + certificatePath, e);
        }
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
