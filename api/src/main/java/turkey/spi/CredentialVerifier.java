package turkey.spi;

import java.util.Optional;

import io.smallrye.mutiny.Uni;

/**
 * Collaborator that checks a credential pair. Password hashing policy lives behind it.
 */
public interface CredentialVerifier {

    /**
     * Verify a credential pair.
     *
     * @param identity claimed identity (e.g. email)
     * @param secret   presented password
     * @return Uni with the user id on success, empty on any mismatch
     */
    Uni<Optional<String>> verify(String identity, String secret);
}
