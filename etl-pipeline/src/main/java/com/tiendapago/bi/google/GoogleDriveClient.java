package com.tiendapago.bi.google;

import com.google.api.services.drive.Drive;
import com.google.api.services.drive.model.File;
import com.google.api.services.drive.model.FileList;
import com.tiendapago.bi.config.GoogleDriveProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Optional;

@Service
@ConditionalOnExpression("!'${google.drive.folder-id:}'.isBlank()")
public class GoogleDriveClient {

    private static final Logger log = LoggerFactory.getLogger(GoogleDriveClient.class);

    private final Drive googleDriveService;
    private final String targetFolderId;

    public GoogleDriveClient(Drive googleDriveService, GoogleDriveProperties googleDriveProperties) {
        this.googleDriveService = googleDriveService;
        this.targetFolderId = googleDriveProperties.getFolderId();
        log.info("GoogleDriveClient inicializado para la carpeta ID: {}", targetFolderId);
    }

    /**
     * Busca un archivo por nombre exacto en la carpeta configurada, ignorando la papelera.
     *
     * @param fileName Nombre del archivo.
     * @return La primera coincidencia, si existe.
     * @throws IOException Si falla la consulta a la API de Drive.
     */
    public Optional<File> findFileInFolder(String fileName) throws IOException {
        String query = String.format("name = '%s' and '%s' in parents and trashed = false",
                fileName.replace("'", "\\'"), targetFolderId);

        FileList result = googleDriveService.files().list()
                .setQ(query)
                .setFields("files(id, name)")
                .execute();

        List<File> files = result.getFiles();
        if (files == null || files.isEmpty()) {
            log.warn("Archivo '{}' no encontrado en la carpeta {}", fileName, targetFolderId);
            return Optional.empty();
        }
        return Optional.of(files.get(0));
    }

    /**
     * Descarga el contenido de un archivo de Drive a una ruta local, creando los directorios necesarios.
     * Se escribe primero en un archivo temporal del mismo directorio, así una descarga interrumpida
     * nunca deja un archivo truncado en el destino.
     */
    public void downloadTo(String fileId, Path target) throws IOException {
        log.info("Descargando el archivo con ID {} en {}", fileId, target);
        Path destination = target.toAbsolutePath();
        Path parent = destination.getParent();
        Files.createDirectories(parent);

        Path partial = Files.createTempFile(parent, destination.getFileName().toString(), ".part");
        try {
            try (OutputStream outputStream = Files.newOutputStream(partial)) {
                googleDriveService.files().get(fileId).executeMediaAndDownloadTo(outputStream);
            }
            moveIntoPlace(partial, destination);
        } finally {
            Files.deleteIfExists(partial);
        }
        log.info("Archivo descargado exitosamente en: {}", target);
    }

    private void moveIntoPlace(Path partial, Path destination) throws IOException {
        try {
            Files.move(partial, destination, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("El sistema de archivos no soporta movimientos atómicos, se reemplaza {} directamente", destination);
            Files.move(partial, destination, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
