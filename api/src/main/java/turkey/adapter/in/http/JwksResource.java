package turkey.adapter.in.http;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import turkey.core.config.KeyConfig;
import turkey.core.service.auth.PublicKeySetService;

/**
 * JWKS endpoint publishing the public half of every key valid for verification.
 *
 * <p>Relying parties cache the response; {@code max-age} and
 * {@code stale-while-revalidate} come from {@link KeyConfig}. Retired keys stay
 * in the set while tokens they signed may still be unexpired, so a cache at most
 * {@code max-age} old never misses a key for a live token.
 *
 * @see <a href="https://tools.ietf.org/html/rfc7517">RFC 7517 - JSON Web Key (JWK)</a>
 */
@Path("/.well-known")
@ApplicationScoped
public class JwksResource {

    private static final Logger LOG = Logger.getLogger(JwksResource.class);

    private final PublicKeySetService publicKeys;
    private final KeyConfig keyConfig;

    @Inject
    public JwksResource(PublicKeySetService publicKeys, KeyConfig keyConfig) {
        this.publicKeys = publicKeys;
        this.keyConfig = keyConfig;
    }

    /**
     * Response format:
     * <pre>{@code
     * {
     *   "keys": [
     *     {"kty": "EC", "kid": "key_...", "use": "sig", "alg": "ES256", "crv": "P-256", "x": "...", "y": "..."}
     *   ]
     * }
     * }</pre>
     */
    @GET
    @Path("/jwks.json")
    @Produces(MediaType.APPLICATION_JSON)
    public Uni<Response> getJwks() {
        return publicKeys.getPublicKeySetJson().map(json -> {
            LOG.debug("Serving JWKS");
            return Response.ok(json, MediaType.APPLICATION_JSON_TYPE)
                    .header("Cache-Control", cacheControl())
                    .build();
        });
    }

    String cacheControl() {
        return "public, max-age=" + keyConfig.jwksCacheMaxAge().toSeconds()
                + ", stale-while-revalidate=" + keyConfig.jwksStaleWhileRevalidate().toSeconds();
    }
}
