package com.tiendapago.bi.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.NotBlank;

/**
 * Acceso a la carpeta de Google Drive con las fuentes. Sin {@code folderId} solo se usan archivos locales.
 */
@Data
@Component
@Validated
@ConfigurationProperties(prefix = "google.drive")
public class GoogleDriveProperties {

    /** ID de la carpeta de Drive que contiene el Excel y el JSON. */
    private String folderId;

    /** Contenido JSON de la cuenta de servicio (variable GCP_SA_KEY en CI). */
    private String serviceAccountJson;

    /** Nombre del secreto en AWS Secrets Manager con la cuenta de servicio. */
    private String credentialsSecretName;

    /** Archivo local con la cuenta de servicio (entorno de desarrollo). */
    @NotBlank(message = "La ruta del archivo de credenciales de Google no puede estar en blanco.")
    private String credentialsFile = "google_credentials.json";

    @NotBlank(message = "El nombre de la aplicación de Google Drive no puede estar en blanco.")
    private String applicationName = "Tienda Pago BI Pipeline";
}
