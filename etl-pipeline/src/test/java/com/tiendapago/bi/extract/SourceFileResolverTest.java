package com.tiendapago.bi.extract;

import com.google.api.services.drive.model.File;
import com.tiendapago.bi.google.GoogleDriveClient;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SourceFileResolverTest {

    @TempDir
    Path tempDir;

    @Mock
    private GoogleDriveClient googleDriveClient;

    @Test
    void resolve_existingLocalFile_doesNotTouchDrive() throws Exception {
        Path local = Files.writeString(tempDir.resolve("ClientesMarca.xlsx"), "x");

        Path resolved = new SourceFileResolver(Optional.of(googleDriveClient)).resolve(local);

        assertEquals(local, resolved);
        verifyNoInteractions(googleDriveClient);
    }

    @Test
    void resolve_missingLocalFile_downloadsFromDrive() throws Exception {
        Path local = tempDir.resolve("RecomendadosMarca.json");
        File remote = new File().setId("drive-123").setName("RecomendadosMarca.json");
        when(googleDriveClient.findFileInFolder("RecomendadosMarca.json")).thenReturn(Optional.of(remote));

        Path resolved = new SourceFileResolver(Optional.of(googleDriveClient)).resolve(local);

        assertEquals(local, resolved);
        verify(googleDriveClient).downloadTo("drive-123", local);
    }

    @Test
    void resolve_notFoundInDrive_fails() throws Exception {
        when(googleDriveClient.findFileInFolder(anyString())).thenReturn(Optional.empty());

        SourceFileResolver resolver = new SourceFileResolver(Optional.of(googleDriveClient));

        assertThrows(SourceExtractionException.class, () -> resolver.resolve(tempDir.resolve("ClientesMarca.xlsx")));
        verify(googleDriveClient, never()).downloadTo(anyString(), any());
    }

    @Test
    void resolve_driveError_isWrapped() throws Exception {
        when(googleDriveClient.findFileInFolder(anyString())).thenThrow(new IOException("timeout"));

        SourceFileResolver resolver = new SourceFileResolver(Optional.of(googleDriveClient));

        SourceExtractionException e = assertThrows(SourceExtractionException.class,
                () -> resolver.resolve(tempDir.resolve("ClientesMarca.xlsx")));
        assertInstanceOf(IOException.class, e.getCause());
    }

    @Test
    void resolve_withoutDriveAndWithoutLocalFile_fails() {
        SourceFileResolver resolver = new SourceFileResolver(Optional.empty());

        assertThrows(SourceExtractionException.class, () -> resolver.resolve(tempDir.resolve("ClientesMarca.xlsx")));
    }
}
