package com.tiendapago.bi.telegram;

import com.tiendapago.bi.config.TelegramProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.Map;

/**
 * Envía mensajes a un chat de Telegram mediante la Bot API.
 */
@Component
public class TelegramClient {

    private static final Logger log = LoggerFactory.getLogger(TelegramClient.class);

    private final RestTemplate restTemplate;
    private final TelegramProperties telegramProperties;

    public TelegramClient(RestTemplate restTemplate, TelegramProperties telegramProperties) {
        this.restTemplate = restTemplate;
        this.telegramProperties = telegramProperties;
    }

    /**
     * @return true si Telegram aceptó el mensaje.
     */
    public boolean sendMessage(String text) {
        String url = telegramProperties.getBaseUrl() + "/bot" + telegramProperties.getToken() + "/sendMessage";
        Map<String, Object> payload = Map.of(
                "chat_id", telegramProperties.getChatId(),
                "text", text,
                "parse_mode", "Markdown");
        try {
            restTemplate.postForEntity(url, payload, String.class);
            log.info("Reporte enviado exitosamente al chat {}.", telegramProperties.getChatId());
            return true;
        } catch (RestClientException e) {
            log.error("Error enviando a Telegram: {}", e.getMessage(), e);
            return false;
        }
    }
}
