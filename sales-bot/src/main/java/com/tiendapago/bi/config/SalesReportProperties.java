package com.tiendapago.bi.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.NotBlank;
import java.time.LocalDate;

@Data
@Component
@Validated
@ConfigurationProperties(prefix = "app.report")
public class SalesReportProperties {

    /** Fecha de corte del reporte. Si no se configura se usa la fecha actual. */
    private LocalDate fechaCorte;

    @NotBlank
    private String dashboardUrl = "https://lookerstudio.google.com/reporting/1b952e87-75af-4570-b81f-a7d0191a095b";

    public LocalDate resolveFechaCorte() {
        return fechaCorte != null ? fechaCorte : LocalDate.now();
    }
}
