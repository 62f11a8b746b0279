package com.tiendapago.bi.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.secretsmanager.SecretsManagerClient;
import software.amazon.awssdk.services.secretsmanager.SecretsManagerClientBuilder;

import java.net.URI;

/**
 * Cliente de AWS Secrets Manager, usado solo cuando las credenciales de Drive viven en un secreto.
 */
@Configuration
@ConditionalOnProperty(prefix = "google.drive", name = "credentials-secret-name")
public class AwsConfig {

    private static final Logger log = LoggerFactory.getLogger(AwsConfig.class);

    @Value("${app.aws.region:us-east-1}")
    private String region;

    @Value("${app.aws.localstack.enabled:false}")
    private boolean localstackEnabled;

    @Value("${app.aws.localstack.endpoint:http://localhost:4566}")
    private String localstackEndpoint;

    @Bean
    public SecretsManagerClient secretsManagerClient() {
        SecretsManagerClientBuilder builder = SecretsManagerClient.builder().region(Region.of(region));
        if (localstackEnabled) {
            log.info("Configurando Secrets Manager para LocalStack en: {}", localstackEndpoint);
            builder.endpointOverride(URI.create(localstackEndpoint));
        } else {
            log.info("Configurando Secrets Manager para AWS en la región: {}", region);
        }
        return builder.build();
    }
}
