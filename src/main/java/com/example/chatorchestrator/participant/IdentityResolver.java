package com.example.chatorchestrator.participant;

import java.util.Optional;

/**
 * Resolves display name and avatar of a user. Implementations may throw; callers treat
 * resolution as best-effort.
 */
public interface IdentityResolver {

    Optional<UserProfile> resolveProfile(String userId);
}
