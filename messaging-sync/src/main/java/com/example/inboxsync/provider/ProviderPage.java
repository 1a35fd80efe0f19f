package com.example.inboxsync.provider;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;
import org.springframework.util.StringUtils;

/**
 * One page of a cursor-paginated listing. A null or blank cursor means no further pages.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ProviderPage<T>(List<T> items, String cursor) {

    public ProviderPage {
        items = items != null ? List.copyOf(items) : List.of();
    }

    public boolean hasMore() {
        return StringUtils.hasText(cursor);
    }

    public static <T> ProviderPage<T> of(List<T> items, String cursor) {
        return new ProviderPage<>(items, cursor);
    }
}
