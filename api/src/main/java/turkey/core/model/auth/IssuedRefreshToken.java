package turkey.core.model.auth;

/**
 * Freshly minted refresh token. The raw secret exists only here and on the wire.
 *
 * @param rawSecret secret handed to the client
 * @param record    persisted record
 */
public record IssuedRefreshToken(String rawSecret, RefreshTokenRecord record) {

    @Override
    public String toString() {
        return "IssuedRefreshToken[record=" + record.id() + "]";
    }
}
