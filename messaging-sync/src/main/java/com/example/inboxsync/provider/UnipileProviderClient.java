package com.example.inboxsync.provider;

import com.example.inboxsync.config.SyncProperties;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.util.UriBuilder;

@Slf4j
@Component
public class UnipileProviderClient implements ProviderClient {

    private static final ParameterizedTypeReference<ProviderPage<ProviderChat>> CHAT_PAGE =
            new ParameterizedTypeReference<>() {};
    private static final ParameterizedTypeReference<ProviderPage<ProviderMessage>> MESSAGE_PAGE =
            new ParameterizedTypeReference<>() {};
    private static final ParameterizedTypeReference<ProviderPage<ProviderAttendee>> ATTENDEE_PAGE =
            new ParameterizedTypeReference<>() {};

    private final RestClient restClient;

    public UnipileProviderClient(RestClient.Builder restClientBuilder, SyncProperties syncProperties) {
        SyncProperties.Provider provider = syncProperties.getProvider();
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout((int) provider.getTimeout().toMillis());
        requestFactory.setReadTimeout((int) provider.getTimeout().toMillis());
        RestClient.Builder builder = restClientBuilder
                .baseUrl(provider.getBaseUrl())
                .requestFactory(requestFactory)
                .defaultHeader("accept", MediaType.APPLICATION_JSON_VALUE);
        if (StringUtils.hasText(provider.getApiKey())) {
            builder.defaultHeader("X-API-KEY", provider.getApiKey());
        }
        this.restClient = builder.build();
    }

    @Override
    public ProviderPage<ProviderChat> listChats(String accountId, String cursor, int limit) {
        return call("list chats for account " + accountId, () -> restClient.get()
                .uri(uri -> withCursor(uri.path("/chats")
                        .queryParam("account_id", accountId)
                        .queryParam("limit", limit), cursor)
                        .build())
                .retrieve()
                .body(CHAT_PAGE));
    }

    @Override
    public ProviderPage<ProviderMessage> listMessages(String accountId, String chatId, String cursor, int limit) {
        return call("list messages of chat " + chatId, () -> restClient.get()
                .uri(uri -> withCursor(uri.path("/chats/{chatId}/messages")
                        .queryParam("account_id", accountId)
                        .queryParam("limit", limit), cursor)
                        .build(chatId))
                .retrieve()
                .body(MESSAGE_PAGE));
    }

    @Override
    public ProviderPage<ProviderAttendee> listAttendees(String accountId, String chatId, int limit) {
        return call("list attendees of chat " + chatId, () -> restClient.get()
                .uri(uri -> uri.path("/chats/{chatId}/attendees")
                        .queryParam("account_id", accountId)
                        .queryParam("limit", limit)
                        .build(chatId))
                .retrieve()
                .body(ATTENDEE_PAGE));
    }

    @Override
    public AttachmentContent getAttachmentContent(
            String messageExternalId, String attachmentExternalId, String accountId) {
        ResponseEntity<byte[]> response = call("fetch attachment " + attachmentExternalId, () -> restClient.get()
                .uri(uri -> uri.path("/messages/{messageId}/attachments/{attachmentId}")
                        .queryParam("account_id", accountId)
                        .build(messageExternalId, attachmentExternalId))
                .accept(MediaType.ALL)
                .retrieve()
                .toEntity(byte[].class));
        byte[] body = response.getBody();
        if (body == null || body.length == 0) {
            throw new ProviderException("Empty content for attachment " + attachmentExternalId, null);
        }
        MediaType contentType = response.getHeaders().getContentType();
        return new AttachmentContent(body, contentType != null ? contentType.toString() : null);
    }

    @Override
    public ProviderProfile getProfile(String identifier, String accountId) {
        return call("fetch profile " + identifier, () -> restClient.get()
                .uri(uri -> uri.path("/users/{identifier}")
                        .queryParam("account_id", accountId)
                        .build(identifier))
                .retrieve()
                .body(ProviderProfile.class));
    }

    private UriBuilder withCursor(UriBuilder uri, String cursor) {
        return StringUtils.hasText(cursor) ? uri.queryParam("cursor", cursor) : uri;
    }

    private <T> T call(String operation, Supplier<T> request) {
        try {
            T result = request.get();
            if (result == null) {
                throw new ProviderException("Empty response when trying to " + operation, null);
            }
            return result;
        } catch (RestClientResponseException ex) {
            log.debug("Provider rejected request to {} with status {}", operation, ex.getStatusCode().value());
            throw new ProviderException(
                    "Provider failed to " + operation + ": " + ex.getStatusCode().value(),
                    ex.getStatusCode().value(),
                    ex);
        } catch (RestClientException ex) {
            throw new ProviderException("Provider unreachable when trying to " + operation, ex);
        }
    }
}
