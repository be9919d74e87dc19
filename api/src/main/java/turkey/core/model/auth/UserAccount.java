package turkey.core.model.auth;

import java.util.Objects;

/**
 * The slice of a user record the token engine needs.
 *
 * @param id           user identifier (token subject)
 * @param role         role claim carried in access tokens
 * @param appId        application scope, may be null for users not bound to an app
 * @param tokenVersion current per-user token version; only ever increases
 */
public record UserAccount(String id, String role, String appId, long tokenVersion) {

    public UserAccount {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(role, "role is required");
        if (tokenVersion < 0) {
            throw new IllegalArgumentException("tokenVersion must not be negative");
        }
    }

    public UserAccount withTokenVersion(long newVersion) {
        return new UserAccount(id, role, appId, newVersion);
    }
}
