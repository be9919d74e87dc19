package turkey.core.service.auth;

import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;
import org.jose4j.jwk.JsonWebKey;
import org.jose4j.jwk.JsonWebKeySet;
import org.jose4j.jwk.PublicJsonWebKey;
import org.jose4j.jwk.Use;
import org.jose4j.lang.JoseException;

import turkey.core.model.auth.SigningKeyRecord;

/**
 * Builds the JSON Web Key Set (RFC 7517) relying parties use to verify tokens.
 *
 * <p>The set holds every ACTIVE key plus RETIRED keys whose tokens may still be
 * unexpired, so a token signed just before a rotation keeps verifying for
 * parties that cached the set.
 */
@ApplicationScoped
public class PublicKeySetService {

    private static final Logger LOG = Logger.getLogger(PublicKeySetService.class);

    private final KeyManager keyManager;

    @Inject
    public PublicKeySetService(KeyManager keyManager) {
        this.keyManager = keyManager;
    }

    public Uni<JsonWebKeySet> getPublicKeySet() {
        return keyManager.listVerificationKeys().map(this::toKeySet);
    }

    /**
     * The set serialized without private members.
     */
    public Uni<String> getPublicKeySetJson() {
        return getPublicKeySet().map(set -> set.toJson(JsonWebKey.OutputControlLevel.PUBLIC_ONLY));
    }

    private JsonWebKeySet toKeySet(List<SigningKeyRecord> keys) {
        final var set = new JsonWebKeySet();
        for (var key : keys) {
            set.addJsonWebKey(toJwk(key));
        }
        LOG.debugf("Built JWKS with %d keys", keys.size());
        return set;
    }

    private static PublicJsonWebKey toJwk(SigningKeyRecord key) {
        try {
            final var jwk = PublicJsonWebKey.Factory.newPublicJwk(key.publicKey());
            jwk.setKeyId(key.kid());
            jwk.setUse(Use.SIGNATURE);
            jwk.setAlgorithm(key.algorithm());
            return jwk;
        } catch (JoseException e) {
            throw new IllegalStateException("Cannot export public key " + key.kid(), e);
        }
    }
}
