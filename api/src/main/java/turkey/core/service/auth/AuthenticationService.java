package turkey.core.service.auth;

import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import turkey.core.model.auth.LoginResult;
import turkey.core.model.auth.UserAccount;
import turkey.core.port.in.TokenLifecycle;
import turkey.core.util.SecureHash;
import turkey.spi.CredentialVerifier;
import turkey.spi.UserDirectory;

/**
 * Password login: lockout check, credential check, then token pair issuance.
 *
 * <p>A locked-out key is refused before the credential verifier runs, so a
 * locked identity gets no further password checks.
 */
@ApplicationScoped
public class AuthenticationService {

    private static final Logger LOG = Logger.getLogger(AuthenticationService.class);

    private final LockoutTracker lockout;
    private final CredentialVerifier credentials;
    private final UserDirectory users;
    private final TokenLifecycle tokens;

    @Inject
    public AuthenticationService(
            LockoutTracker lockout, CredentialVerifier credentials, UserDirectory users, TokenLifecycle tokens) {
        this.lockout = lockout;
        this.credentials = credentials;
        this.users = users;
        this.tokens = tokens;
    }

    /**
     * Authenticate a credential pair and issue tokens.
     *
     * @param origin   network origin of the request
     * @param identity claimed identity (e.g. email)
     * @param secret   presented password
     * @param audience requesting application, or null for the default audience
     * @return Uni with the login result
     */
    public Uni<LoginResult> login(String origin, String identity, String secret, String audience) {
        final var status = lockout.check(origin, identity);
        if (status.locked()) {
            LOG.infov("Login refused for locked identity {0} from {1}", SecureHash.forLog(identity), origin);
            return Uni.createFrom().item(new LoginResult.LockedOut(status.retryAfter()));
        }

        return credentials
                .verify(identity, secret)
                .flatMap(userId -> userId.isEmpty()
                        ? Uni.createFrom().item(Optional.<UserAccount>empty())
                        : users.getById(userId.get()))
                .flatMap(user -> {
                    if (user.isEmpty()) {
                        final var failure = lockout.recordFailure(origin, identity);
                        return Uni.createFrom().<LoginResult>item(new LoginResult.InvalidCredentials(failure));
                    }
                    lockout.recordSuccess(origin, identity);
                    return tokens.issueTokenPair(user.get(), audience)
                            .map(pair -> (LoginResult) new LoginResult.Success(user.get(), pair))
                            .invoke(() -> LOG.debugf("Login succeeded for user %s", user.get().id()));
                });
    }
}
