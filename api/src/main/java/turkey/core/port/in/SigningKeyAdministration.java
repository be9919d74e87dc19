package turkey.core.port.in;

import java.util.List;

import io.smallrye.mutiny.Uni;

import turkey.core.model.auth.SigningKeyRecord;

/**
 * Administrative key operations consumed by an external administration layer.
 *
 * <p>Returned records never carry private key material.
 */
public interface SigningKeyAdministration {

    /**
     * Generate and activate a new key alongside the existing active keys.
     */
    Uni<SigningKeyRecord> generateKey();

    /**
     * Retire a key. Fails if the key is unknown or is the last active key.
     */
    Uni<Void> retireKey(String kid);

    /**
     * Generate and activate a new key; retire all other active keys unless
     * {@code gracefulKeepOld} is set.
     */
    Uni<SigningKeyRecord> rotateKeys(boolean gracefulKeepOld);

    /**
     * List every stored key, newest first.
     */
    Uni<List<SigningKeyRecord>> listKeys();
}
