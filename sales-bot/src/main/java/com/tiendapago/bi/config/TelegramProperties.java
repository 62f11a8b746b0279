package com.tiendapago.bi.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.NotBlank;

@Data
@Component
@Validated
@ConfigurationProperties(prefix = "app.telegram")
public class TelegramProperties {

    @NotBlank
    private String token;

    @NotBlank
    private String chatId;

    @NotBlank
    private String baseUrl = "https://api.telegram.org";
}
