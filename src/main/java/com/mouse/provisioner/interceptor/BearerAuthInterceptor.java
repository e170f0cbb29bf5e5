package com.mouse.provisioner.interceptor;

import lombok.RequiredArgsConstructor;
import okhttp3.Interceptor;
import okhttp3.Request;
import okhttp3.Response;

import java.io.IOException;

@RequiredArgsConstructor
public class BearerAuthInterceptor implements Interceptor {

    private final String apiKey;

    @Override
    public Response intercept(Interceptor.Chain chain) throws IOException {
        Request original = chain.request();
        Request.Builder builder = original.newBuilder()
                .header("Accept", "application/json")
                .header("Authorization", "Bearer " + apiKey);
        return chain.proceed(builder.build());
    }
}
