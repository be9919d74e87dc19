package turkey.spi;

import java.util.Optional;

import io.smallrye.mutiny.Uni;

import turkey.core.model.auth.UserAccount;

/**
 * Collaborator exposing the user records the token engine depends on.
 *
 * <p>User CRUD lives outside this service; deployments provide their own bean.
 */
public interface UserDirectory {

    Uni<Optional<UserAccount>> getById(String userId);

    Uni<Optional<Long>> getTokenVersion(String userId);

    /**
     * Increment the user's token version.
     *
     * @return Uni with the new version, empty if the user does not exist
     */
    Uni<Optional<Long>> bumpTokenVersion(String userId);
}
