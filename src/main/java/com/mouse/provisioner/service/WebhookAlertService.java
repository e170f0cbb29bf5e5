package com.mouse.provisioner.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.mouse.provisioner.entity.Account;
import com.mouse.provisioner.enums.FailureReason;
import com.mouse.provisioner.interfaces.ProvisioningListener;
import com.mouse.provisioner.model.Identity;
import lombok.extern.slf4j.Slf4j;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Instant;
import java.util.concurrent.TimeUnit;

/**
 * Posts an embed message to a chat webhook for each created account and each identity
 * that gave up. Delivery failures are logged and never reach the workers.
 *
 * <p>The webhook url embeds its own token, so it is never logged.
 */
@Service
@Slf4j
@ConditionalOnProperty(name = "notifications.webhook.enabled", havingValue = "true")
public class WebhookAlertService implements ProvisioningListener {

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final int COLOR_SUCCESS = 0x2ECC71;
    private static final int COLOR_FAILURE = 0xE74C3C;

    private final String webhookUrl;
    private final ObjectMapper objectMapper;
    private final OkHttpClient client;

    public WebhookAlertService(@Value("${notifications.webhook.url}") String webhookUrl,
                               ObjectMapper objectMapper) {
        this.webhookUrl = webhookUrl;
        this.objectMapper = objectMapper;
        this.client = new OkHttpClient.Builder()
                .connectTimeout(5, TimeUnit.SECONDS)
                .callTimeout(10, TimeUnit.SECONDS)
                .build();
    }

    @Override
    public void onAccountCreated(Account account) {
        ObjectNode embed = embed("Account created", COLOR_SUCCESS);
        ArrayNode fields = embed.putArray("fields");
        field(fields, "Email", account.getEmail());
        field(fields, "Proxy", account.getProxy() != null ? account.getProxy() : "none");
        send(embed);
    }

    @Override
    public void onPermanentFailure(Identity identity, FailureReason reason, int attempts) {
        ObjectNode embed = embed("Identity failed", COLOR_FAILURE);
        ArrayNode fields = embed.putArray("fields");
        field(fields, "Email", identity.email());
        field(fields, "Reason", reason.name());
        field(fields, "Attempts", String.valueOf(attempts));
        send(embed);
    }

    private ObjectNode embed(String title, int color) {
        ObjectNode embed = objectMapper.createObjectNode();
        embed.put("title", title);
        embed.put("color", color);
        embed.put("timestamp", Instant.now().toString());
        return embed;
    }

    private static void field(ArrayNode fields, String name, String value) {
        fields.addObject()
                .put("name", name)
                .put("value", value)
                .put("inline", true);
    }

    private void send(ObjectNode embed) {
        try {
            ObjectNode payload = objectMapper.createObjectNode();
            payload.putArray("embeds").add(embed);
            Request request = new Request.Builder()
                    .url(webhookUrl)
                    .post(RequestBody.create(objectMapper.writeValueAsString(payload), JSON))
                    .build();
            try (Response response = client.newCall(request).execute()) {
                if (!response.isSuccessful()) {
                    log.warn("Webhook rejected alert | Status: {}", response.code());
                }
            }
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize webhook alert", e);
        } catch (IOException | IllegalArgumentException e) {
            log.error("Failed to send webhook alert: {}", e.getMessage());
        }
    }
}
