package com.example.infracopilot.monitoring;

import com.example.infracopilot.config.CopilotProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.FormBody;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Obtains Azure Resource Manager tokens with the OAuth2 client-credentials flow.
 * A statically configured access token takes precedence. Tokens are cached
 * until shortly before they expire.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AzureClientCredentialProvider implements CloudCredentialProvider {

    private static final String MANAGEMENT_SCOPE = "https://management.azure.com/.default";
    private static final Duration EXPIRY_MARGIN = Duration.ofMinutes(5);

    private final CopilotProperties properties;
    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    private String cachedToken;
    private Instant cachedUntil = Instant.EPOCH;

    @Override
    public synchronized String acquireToken() {
        CopilotProperties.AzureConfig azure = properties.getAzure();
        if (!isBlank(azure.getAccessToken())) {
            return azure.getAccessToken();
        }
        if (cachedToken != null && clock.instant().isBefore(cachedUntil)) {
            return cachedToken;
        }
        if (isBlank(azure.getTenantId()) || isBlank(azure.getClientId()) || isBlank(azure.getClientSecret())) {
            throw new CloudAuthenticationException(
                    "no credentials configured (set AZURE_TENANT_ID, AZURE_CLIENT_ID and AZURE_CLIENT_SECRET)");
        }

        String url = trimSlash(azure.getLoginUrl()) + "/" + azure.getTenantId() + "/oauth2/v2.0/token";
        Request request = new Request.Builder()
                .url(url)
                .post(new FormBody.Builder()
                        .add("grant_type", "client_credentials")
                        .add("client_id", azure.getClientId())
                        .add("client_secret", azure.getClientSecret())
                        .add("scope", MANAGEMENT_SCOPE)
                        .build())
                .build();

        OkHttpClient client = httpClient.newBuilder()
                .callTimeout(Duration.ofSeconds(azure.getTimeoutSeconds()))
                .build();

        try (Response response = client.newCall(request).execute()) {
            String body = response.body() != null ? response.body().string() : "";
            if (!response.isSuccessful()) {
                throw new CloudAuthenticationException(
                        "token endpoint returned " + response.code() + describeError(body));
            }
            JsonNode root = objectMapper.readTree(body);
            JsonNode token = root.get("access_token");
            if (token == null || token.asText().isBlank()) {
                throw new CloudAuthenticationException("token endpoint returned no access_token");
            }
            long expiresIn = root.path("expires_in").asLong(3600);
            cachedToken = token.asText();
            cachedUntil = clock.instant().plusSeconds(expiresIn).minus(EXPIRY_MARGIN);
            log.debug("Acquired Azure management token, valid for {}s", expiresIn);
            return cachedToken;
        } catch (IOException e) {
            throw new CloudAuthenticationException("token request failed: " + e.getMessage(), e);
        }
    }

    private String describeError(String body) {
        try {
            JsonNode description = objectMapper.readTree(body).get("error_description");
            return description != null ? " (" + description.asText() + ")" : "";
        } catch (IOException e) {
            return "";
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    static String trimSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
