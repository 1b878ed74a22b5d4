package com.example.infracopilot.monitoring;

import lombok.RequiredArgsConstructor;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Duration;

@Component
@RequiredArgsConstructor
public class OkHttpEndpointProbe implements EndpointProbe {

    private final OkHttpClient httpClient;

    @Override
    public int probe(String url, Duration timeout) throws IOException {
        OkHttpClient client = httpClient.newBuilder()
                .callTimeout(timeout)
                .followRedirects(true)
                .followSslRedirects(true)
                .build();
        Request request;
        try {
            request = new Request.Builder()
                    .url(url)
                    .header("User-Agent", "infra-copilot-probe")
                    .get()
                    .build();
        } catch (IllegalArgumentException e) {
            throw new IOException("Invalid URL: " + url, e);
        }
        try (Response response = client.newCall(request).execute()) {
            return response.code();
        }
    }
}
