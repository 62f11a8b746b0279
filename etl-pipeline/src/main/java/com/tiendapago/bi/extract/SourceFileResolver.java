package com.tiendapago.bi.extract;

import com.google.api.services.drive.model.File;
import com.tiendapago.bi.google.GoogleDriveClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Ubica un archivo fuente: usa la copia local si existe y, si no, lo descarga desde Google Drive
 * cuando hay una carpeta configurada.
 */
@Component
public class SourceFileResolver {

    private static final Logger log = LoggerFactory.getLogger(SourceFileResolver.class);

    private final Optional<GoogleDriveClient> googleDriveClient;

    public SourceFileResolver(Optional<GoogleDriveClient> googleDriveClient) {
        this.googleDriveClient = googleDriveClient;
        if (googleDriveClient.isEmpty()) {
            log.warn("No se configuró google.drive.folder-id. El pipeline dependerá de archivos locales.");
        }
    }

    public Path resolve(Path localPath) throws SourceExtractionException {
        if (Files.exists(localPath)) {
            return localPath;
        }
        if (googleDriveClient.isEmpty()) {
            throw new SourceExtractionException("El archivo fuente no está disponible: " + localPath);
        }

        String fileName = localPath.getFileName().toString();
        log.info("Archivo local no encontrado. Intentando recuperar '{}' desde Drive.", fileName);
        try {
            GoogleDriveClient client = googleDriveClient.get();
            Optional<File> remote = client.findFileInFolder(fileName);
            if (remote.isEmpty()) {
                throw new SourceExtractionException("Archivo '" + fileName + "' no encontrado en la carpeta remota.");
            }
            client.downloadTo(remote.get().getId(), localPath);
            return localPath;
        } catch (IOException e) {
            throw new SourceExtractionException("Excepción durante la descarga desde Drive de " + fileName, e);
        }
    }
}
