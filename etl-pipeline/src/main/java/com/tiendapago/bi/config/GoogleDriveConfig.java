package com.tiendapago.bi.config;

import com.google.api.client.googleapis.auth.oauth2.GoogleCredential;
import com.google.api.client.googleapis.javanet.GoogleNetHttpTransport;
import com.google.api.client.json.JsonFactory;
import com.google.api.client.json.gson.GsonFactory;
import com.google.api.services.drive.Drive;
import com.google.api.services.drive.DriveScopes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.services.secretsmanager.SecretsManagerClient;
import software.amazon.awssdk.services.secretsmanager.model.GetSecretValueRequest;
import software.amazon.awssdk.services.secretsmanager.model.GetSecretValueResponse;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.util.Collections;

/**
 * Cliente de Google Drive autenticado con cuenta de servicio. Solo se crea cuando hay una carpeta
 * configurada. Las credenciales se buscan en este orden: variable de entorno, AWS Secrets Manager,
 * archivo local.
 */
@Configuration
@ConditionalOnExpression("!'${google.drive.folder-id:}'.isBlank()")
public class GoogleDriveConfig {

    private static final Logger log = LoggerFactory.getLogger(GoogleDriveConfig.class);
    private static final JsonFactory JSON_FACTORY = GsonFactory.getDefaultInstance();

    private final GoogleDriveProperties googleDriveProperties;
    private final ObjectProvider<SecretsManagerClient> secretsManagerClient;

    public GoogleDriveConfig(GoogleDriveProperties googleDriveProperties,
                             ObjectProvider<SecretsManagerClient> secretsManagerClient) {
        this.googleDriveProperties = googleDriveProperties;
        this.secretsManagerClient = secretsManagerClient;
    }

    @Bean
    public Drive googleDriveService() throws GeneralSecurityException, IOException {
        byte[] serviceAccountKey = resolveServiceAccountKey();

        GoogleCredential credential;
        try (InputStream privateKeyStream = new ByteArrayInputStream(serviceAccountKey)) {
            credential = GoogleCredential.fromStream(privateKeyStream)
                    .createScoped(Collections.singleton(DriveScopes.DRIVE));
        }

        return new Drive.Builder(GoogleNetHttpTransport.newTrustedTransport(), JSON_FACTORY, credential)
                .setApplicationName(googleDriveProperties.getApplicationName())
                .build();
    }

    private byte[] resolveServiceAccountKey() throws IOException {
        String envCredentials = googleDriveProperties.getServiceAccountJson();
        if (envCredentials != null && !envCredentials.isBlank()) {
            log.info("Autenticando en Google Drive vía variable de entorno (Cloud/CI).");
            return envCredentials.getBytes(StandardCharsets.UTF_8);
        }

        String secretName = googleDriveProperties.getCredentialsSecretName();
        if (secretName != null && !secretName.isBlank()) {
            log.info("Autenticando en Google Drive con el secreto '{}' de AWS Secrets Manager.", secretName);
            return getCredentialsFromSecretsManager(secretName).getBytes(StandardCharsets.UTF_8);
        }

        Path localFile = Path.of(googleDriveProperties.getCredentialsFile());
        if (Files.exists(localFile)) {
            log.info("Autenticando en Google Drive vía archivo local: {}", localFile);
            return Files.readAllBytes(localFile);
        }

        throw new IllegalStateException(
                "No se encontraron credenciales válidas de Google Drive (ni variable de entorno, ni secreto, ni archivo local).");
    }

    private String getCredentialsFromSecretsManager(String secretName) {
        SecretsManagerClient client = secretsManagerClient.getIfAvailable();
        if (client == null) {
            throw new IllegalStateException("No hay cliente de AWS Secrets Manager configurado para leer " + secretName);
        }

        GetSecretValueResponse response = client.getSecretValue(GetSecretValueRequest.builder()
                .secretId(secretName)
                .build());

        if (response.secretString() != null) {
            return response.secretString();
        } else if (response.secretBinary() != null) {
            return response.secretBinary().asUtf8String();
        }
        throw new IllegalStateException("El secreto de Google Drive '" + secretName + "' está vacío en Secrets Manager.");
    }
}
