package com.mouse.provisioner.channel;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mouse.provisioner.config.SmsApiConfig;
import com.mouse.provisioner.exception.ChannelException;
import com.mouse.provisioner.interceptor.BearerAuthInterceptor;
import com.mouse.provisioner.interceptor.SimpleHttpLoggingInterceptor;
import com.mouse.provisioner.interfaces.SmsCodeChannel;
import com.mouse.provisioner.model.Identity;
import com.mouse.provisioner.model.SmsOrder;
import lombok.extern.slf4j.Slf4j;
import okhttp3.*;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * SMS activation API client: buys a number for one verification and polls the order for
 * the received code. Requests are multipart forms with the key both as field and Bearer token.
 */
@Slf4j
@Component
public class HttpSmsCodeChannel implements SmsCodeChannel {

    private final SmsApiConfig config;
    private final ObjectMapper objectMapper;
    private final OkHttpClient client;

    public HttpSmsCodeChannel(SmsApiConfig config, ObjectMapper objectMapper) {
        this.config = config;
        this.objectMapper = objectMapper;
        this.client = new OkHttpClient.Builder()
                .connectTimeout(config.getTimeoutMs(), TimeUnit.MILLISECONDS)
                .readTimeout(config.getTimeoutMs(), TimeUnit.MILLISECONDS)
                .writeTimeout(config.getTimeoutMs(), TimeUnit.MILLISECONDS)
                .retryOnConnectionFailure(true)
                .addInterceptor(new SimpleHttpLoggingInterceptor())
                .addInterceptor(new BearerAuthInterceptor(config.getApiKey()))
                .build();
    }

    @Override
    public SmsOrder order(Identity identity) {
        requireKey();
        RequestBody form = new MultipartBody.Builder()
                .setType(MultipartBody.FORM)
                .addFormDataPart("key", config.getApiKey())
                .addFormDataPart("country", config.getCountry())
                .addFormDataPart("service", config.getService())
                .addFormDataPart("max_price", config.getMaxPrice())
                .addFormDataPart("quantity", "1")
                .build();

        JsonNode body = post("/purchase/sms", form);
        String phone = text(body, "phonenumber");
        String orderId = text(body, "order_id");
        if (phone == null || orderId == null) {
            throw new ChannelException("SMS order response without number or order id: " + describe(body));
        }
        log.info("SMS number reserved | Email: {} | OrderId: {}", identity.email(), orderId);
        return new SmsOrder(orderId, phone);
    }

    @Override
    public Optional<String> poll(String orderId) {
        requireKey();
        RequestBody form = new MultipartBody.Builder()
                .setType(MultipartBody.FORM)
                .addFormDataPart("orderid", orderId)
                .addFormDataPart("key", config.getApiKey())
                .build();

        JsonNode body = post("/sms/check", form);
        String sms = text(body, "sms");
        if (sms == null || sms.isBlank() || "0".equals(sms)) {
            return Optional.empty();
        }
        return Optional.of(sms.trim());
    }

    private JsonNode post(String path, RequestBody form) {
        Request request = new Request.Builder()
                .url(stripTrailingSlash(config.getBaseUrl()) + path)
                .post(form)
                .build();
        try (Response response = client.newCall(request).execute()) {
            ResponseBody responseBody = response.body();
            String payload = responseBody != null ? responseBody.string() : "";
            if (!response.isSuccessful()) {
                throw new ChannelException("SMS API " + path + " returned HTTP " + response.code());
            }
            return objectMapper.readTree(payload.isEmpty() ? "{}" : payload);
        } catch (IOException e) {
            throw new ChannelException("SMS API " + path + " unreachable: " + e.getMessage(), e);
        }
    }

    private void requireKey() {
        if (config.getApiKey() == null || config.getApiKey().isBlank()) {
            throw new ChannelException("SMS API key is not configured");
        }
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    private static String describe(JsonNode body) {
        JsonNode message = body.get("message");
        return message != null ? message.asText() : "<no message>";
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
