package com.mouse.provisioner.interceptor;

import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;
import okhttp3.Interceptor;
import okhttp3.Request;
import okhttp3.Response;

import java.io.IOException;
import java.util.Set;
import java.util.concurrent.TimeUnit;

/**
 * Logs method, path, status and latency of outbound API calls. Query parameters that carry
 * secrets are masked; bodies are never read.
 */
@Slf4j
public class SimpleHttpLoggingInterceptor implements Interceptor {

    private static final Set<String> SECRET_PARAMS = Set.of("key", "api_key", "apikey", "token");

    @Override
    public Response intercept(Chain chain) throws IOException {
        Request request = chain.request();
        String target = redact(request.url());
        log.debug("→ {} {}", request.method(), target);

        long startNs = System.nanoTime();
        Response response;
        try {
            response = chain.proceed(request);
        } catch (IOException e) {
            long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNs);
            log.warn("← FAILED {} {} after {}ms: {}", request.method(), target, elapsedMs, e.getMessage());
            throw e;
        }

        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNs);
        log.debug("← {} {} | {}ms", response.code(), request.url().encodedPath(), elapsedMs);
        return response;
    }

    static String redact(HttpUrl url) {
        HttpUrl.Builder builder = url.newBuilder();
        for (String name : url.queryParameterNames()) {
            if (SECRET_PARAMS.contains(name.toLowerCase())) {
                builder.setQueryParameter(name, "***");
            }
        }
        return builder.build().toString();
    }
}
