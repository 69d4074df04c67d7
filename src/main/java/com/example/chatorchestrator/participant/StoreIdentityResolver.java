package com.example.chatorchestrator.participant;

import com.example.chatorchestrator.store.StoreClient;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;

/**
 * Looks profiles up in the {@code user_profiles} collection.
 */
@Component
public class StoreIdentityResolver implements IdentityResolver {

    static final String USER_PROFILES = "user_profiles";

    private final StoreClient store;

    public StoreIdentityResolver(StoreClient store) {
        this.store = store;
    }

    @Override
    public Optional<UserProfile> resolveProfile(String userId) {
        return store.get(USER_PROFILES, userId).map(doc -> UserProfile.builder()
                .userId(userId)
                .displayName(string(doc, "displayName", string(doc, "name", null)))
                .avatarUrl(string(doc, "avatarUrl", string(doc, "avatar", null)))
                .build());
    }

    private static String string(Map<String, Object> doc, String field, String fallback) {
        Object value = doc.get(field);
        return value != null ? value.toString() : fallback;
    }
}
