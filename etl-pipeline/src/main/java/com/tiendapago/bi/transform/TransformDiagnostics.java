package com.tiendapago.bi.transform;

import org.slf4j.Logger;
import org.slf4j.helpers.MessageFormatter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

/**
 * Contexto de diagnóstico de una corrida de transformación.
 * Se crea uno por corrida y se pasa explícitamente a cada componente, que registra aquí
 * las advertencias de calidad de datos además de emitirlas por su propio logger.
 */
public class TransformDiagnostics {

    private final String runId;
    private final List<String> warnings = new ArrayList<>();

    public TransformDiagnostics() {
        this(UUID.randomUUID().toString());
    }

    public TransformDiagnostics(String runId) {
        this.runId = runId;
    }

    public String getRunId() {
        return runId;
    }

    /**
     * Registra una advertencia y la emite como WARN en el logger del componente.
     *
     * @param log     Logger del componente que detectó el problema.
     * @param message Mensaje con marcadores {} al estilo SLF4J.
     * @param args    Argumentos del mensaje.
     */
    public void warn(Logger log, String message, Object... args) {
        String formatted = MessageFormatter.arrayFormat(message, args).getMessage();
        warnings.add(formatted);
        log.warn("[run {}] {}", runId, formatted);
    }

    public List<String> getWarnings() {
        return Collections.unmodifiableList(warnings);
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }
}
