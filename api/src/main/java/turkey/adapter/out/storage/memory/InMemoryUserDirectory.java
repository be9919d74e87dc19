package turkey.adapter.out.storage.memory;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import jakarta.enterprise.context.ApplicationScoped;

import io.quarkus.arc.DefaultBean;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import turkey.core.model.auth.UserAccount;
import turkey.spi.UserDirectory;

/**
 * In-memory user directory.
 *
 * <p>Default bean used until the hosting backend supplies its own
 * {@link UserDirectory}. Users are seeded via {@link #save(UserAccount)}.
 */
@ApplicationScoped
@DefaultBean
public class InMemoryUserDirectory implements UserDirectory {

    private static final Logger LOG = Logger.getLogger(InMemoryUserDirectory.class);

    private final ConcurrentMap<String, UserAccount> users = new ConcurrentHashMap<>();

    public InMemoryUserDirectory() {
        LOG.debug("Initialized in-memory user directory");
    }

    /**
     * Insert or replace a user.
     */
    public void save(UserAccount user) {
        users.put(user.id(), user);
    }

    @Override
    public Uni<Optional<UserAccount>> getById(String userId) {
        return Uni.createFrom().item(() -> Optional.ofNullable(users.get(userId)));
    }

    @Override
    public Uni<Optional<Long>> getTokenVersion(String userId) {
        return getById(userId).map(user -> user.map(UserAccount::tokenVersion));
    }

    @Override
    public Uni<Optional<Long>> bumpTokenVersion(String userId) {
        return Uni.createFrom().item(() -> Optional.ofNullable(
                        users.computeIfPresent(userId, (id, user) -> user.withTokenVersion(user.tokenVersion() + 1)))
                .map(UserAccount::tokenVersion));
    }
}
