package turkey.core.service.auth;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.when;

import java.security.KeyPairGenerator;
import java.security.spec.ECGenParameterSpec;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import org.jose4j.jws.AlgorithmIdentifiers;
import org.jose4j.jws.JsonWebSignature;
import org.jose4j.jwt.JwtClaims;
import org.jose4j.jwt.NumericDate;
import org.jose4j.jwt.consumer.ErrorCodeValidator;
import org.jose4j.jwt.consumer.ErrorCodes;
import org.jose4j.jwt.consumer.InvalidJwtException;
import org.jose4j.jwx.JsonWebStructure;
import org.jose4j.keys.HmacKey;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import turkey.core.model.auth.AccessTokenClaims;
import turkey.core.model.auth.AuthErrorCode;
import turkey.core.model.auth.IssuedAccessToken;
import turkey.core.model.auth.TokenVerificationResult;
import turkey.core.model.auth.UserAccount;
import turkey.support.TestConfigs;

@DisplayName("TokenIssuer and TokenVerifier")
class TokenVerifierTest {

    private static final Duration TIMEOUT = TokenEngine.TIMEOUT;

    private TokenEngine engine;
    private UserAccount user;

    @BeforeEach
    void setUp() {
        engine = new TokenEngine();
        user = engine.user("u1", "user", 3);
    }

    private IssuedAccessToken issue(String audience) {
        return engine.issuer.issue(user, audience).await().atMost(TIMEOUT);
    }

    private TokenVerificationResult verify(String token, String audience) {
        return engine.verifier.verify(token, audience).await().atMost(TIMEOUT);
    }

    private static AccessTokenClaims assertValid(TokenVerificationResult result) {
        return assertInstanceOf(TokenVerificationResult.Valid.class, result).claims();
    }

    private static void assertInvalid(AuthErrorCode expected, TokenVerificationResult result) {
        assertEquals(expected, assertInstanceOf(TokenVerificationResult.Invalid.class, result).code());
    }

    @Nested
    @DisplayName("issuance")
    class Issuance {

        @Test
        @DisplayName("should carry subject, role, token version and audience")
        void shouldCarryClaims() {
            final var issued = issue("app1");

            final var claims = assertValid(verify(issued.token(), "app1"));
            assertEquals("u1", claims.subject());
            assertEquals("user", claims.role());
            assertEquals(3, claims.tokenVersion());
            assertEquals("app1", claims.audience());
            assertEquals(TestConfigs.ISSUER, claims.issuer());
            assertEquals(issued.claims().jti(), claims.jti());
        }

        @Test
        @DisplayName("should set iat and nbf to issue time and exp to issue time plus ttl")
        void shouldSetTimes() {
            final var claims = issue("app1").claims();

            assertEquals(engine.clock.instant(), claims.issuedAt());
            assertEquals(claims.issuedAt(), claims.notBefore());
            assertEquals(claims.issuedAt().plus(Duration.ofMinutes(15)), claims.expiresAt());
            assertTrue(claims.jti().startsWith(SecureTokenGenerator.ACCESS_TOKEN_ID_PREFIX));
        }

        @Test
        @DisplayName("should put kid, alg and typ in the header")
        void shouldSetHeader() throws Exception {
            final var issued = issue("app1");
            final var signingKey = engine.keyManager.getSigningKey().await().atMost(TIMEOUT);

            final var structure = JsonWebStructure.fromCompactSerialization(issued.token());
            assertEquals(signingKey.kid(), structure.getKeyIdHeaderValue());
            assertEquals("ES256", structure.getAlgorithmHeaderValue());
            assertEquals("JWT", structure.getHeader("typ"));
            assertEquals(signingKey.kid(), issued.claims().keyId());
        }

        @Test
        @DisplayName("should fall back to the default audience")
        void shouldUseDefaultAudience() {
            final var issued = issue(null);

            assertEquals(TestConfigs.DEFAULT_AUDIENCE, issued.claims().audience());
            assertValid(verify(issued.token(), TestConfigs.DEFAULT_AUDIENCE));
        }

        @Test
        @DisplayName("should mint a distinct jti per token")
        void shouldMintDistinctJti() {
            assertNotEquals(issue("app1").claims().jti(), issue("app1").claims().jti());
        }

        @Test
        @DisplayName("should carry the granted scope through verification")
        void shouldCarryScope() throws Exception {
            final var issued = engine.issuer.issue(user, "app1", " orders:read orders:write ")
                    .await()
                    .atMost(TIMEOUT);

            assertEquals("orders:read orders:write", issued.claims().scope());
            assertEquals("orders:read orders:write", assertValid(verify(issued.token(), "app1")).scope());

            final var jws = (JsonWebSignature) JsonWebStructure.fromCompactSerialization(issued.token());
            final var payload = JwtClaims.parse(jws.getUnverifiedPayload());
            assertEquals("orders:read orders:write", payload.getStringClaimValue("scope"));
        }

        @Test
        @DisplayName("should issue an empty scope when none is granted")
        void shouldDefaultToEmptyScope() {
            final var issued = issue("app1");

            assertEquals("", issued.claims().scope());
            assertEquals("", assertValid(verify(issued.token(), "app1")).scope());
        }
    }

    @Nested
    @DisplayName("token version")
    class TokenVersion {

        @Test
        @DisplayName("should reject tokens carrying a superseded version and accept the new one")
        void shouldRejectStaleVersion() {
            final var before = issue("app1");
            assertValid(verify(before.token(), "app1"));

            engine.users.bumpTokenVersion("u1").await().atMost(TIMEOUT);

            assertInvalid(AuthErrorCode.TOKEN_VERSION_STALE, verify(before.token(), "app1"));

            user = user.withTokenVersion(4);
            final var after = issue("app1");
            assertEquals(4, assertValid(verify(after.token(), "app1")).tokenVersion());
        }

        @Test
        @DisplayName("should reject tokens of a user that no longer exists")
        void shouldRejectUnknownSubject() {
            final var ghost = new UserAccount("ghost", "user", null, 0);
            final var token = engine.issuer.issue(ghost, "app1").await().atMost(TIMEOUT).token();

            assertInvalid(AuthErrorCode.TOKEN_VERSION_STALE, verify(token, "app1"));
        }
    }

    @Nested
    @DisplayName("time checks")
    class TimeChecks {

        @Test
        @DisplayName("should accept a token just past exp within the clock skew")
        void shouldTolerateSkew() {
            final var token = issue("app1").token();
            engine.clock.advance(Duration.ofMinutes(15).plusSeconds(10));

            assertValid(verify(token, "app1"));
        }

        @Test
        @DisplayName("should reject a token past exp plus skew")
        void shouldRejectExpired() {
            final var token = issue("app1").token();
            engine.clock.advance(Duration.ofMinutes(15).plusSeconds(31));

            assertInvalid(AuthErrorCode.TOKEN_EXPIRED, verify(token, "app1"));
        }

        @Test
        @DisplayName("should reject a token whose nbf is beyond the skew")
        void shouldRejectNotYetValid() {
            final var token = issue("app1").token();
            engine.clock.set(engine.clock.instant().minus(Duration.ofMinutes(2)));

            assertInvalid(AuthErrorCode.TOKEN_NOT_YET_VALID, verify(token, "app1"));
        }
    }

    @Nested
    @DisplayName("claim and signature checks")
    class ClaimChecks {

        @Test
        @DisplayName("should reject a different expected audience")
        void shouldRejectAudience() {
            assertInvalid(AuthErrorCode.AUDIENCE_MISMATCH, verify(issue("app1").token(), "app2"));
        }

        @Test
        @DisplayName("should accept any audience when none is expected")
        void shouldAcceptAnyAudience() {
            assertEquals("app1", assertValid(verify(issue("app1").token(), null)).audience());
        }

        @Test
        @DisplayName("should reject a foreign issuer")
        void shouldRejectIssuer() {
            final var otherConfig = TestConfigs.tokenConfig();
            when(otherConfig.issuer()).thenReturn("https://elsewhere.test");
            final var otherVerifier = new TokenVerifier(
                    engine.keyManager, engine.users, engine.denylist, otherConfig, engine.revocationConfig, engine.clock);

            final var result = otherVerifier.verify(issue("app1").token(), "app1").await().atMost(TIMEOUT);

            assertInvalid(AuthErrorCode.ISSUER_MISMATCH, result);
        }

        @Test
        @DisplayName("should reject a signature made over different content")
        void shouldRejectTamperedSignature() {
            final var first = issue("app1").token().split("\\.");
            final var second = issue("app1").token().split("\\.");
            final var spliced = first[0] + "." + first[1] + "." + second[2];

            assertInvalid(AuthErrorCode.SIGNATURE_INVALID, verify(spliced, "app1"));
        }

        @Test
        @DisplayName("should reject a token signed by an unknown key")
        void shouldRejectUnknownKey() throws Exception {
            final var keyGen = KeyPairGenerator.getInstance("EC");
            keyGen.initialize(new ECGenParameterSpec("secp256r1"));
            final var foreign = keyGen.generateKeyPair();

            final var jws = new JsonWebSignature();
            jws.setPayload(claimsFor("u1").toJson());
            jws.setKey(foreign.getPrivate());
            jws.setKeyIdHeaderValue("key_foreign");
            jws.setAlgorithmHeaderValue(AlgorithmIdentifiers.ECDSA_USING_P256_CURVE_AND_SHA256);

            assertInvalid(AuthErrorCode.SIGNATURE_INVALID, verify(jws.getCompactSerialization(), "app1"));
        }

        @Test
        @DisplayName("should reject any algorithm other than ES256")
        void shouldRejectOtherAlgorithms() throws Exception {
            final var signingKey = engine.keyManager.getSigningKey().await().atMost(TIMEOUT);
            final var jws = new JsonWebSignature();
            jws.setPayload(claimsFor("u1").toJson());
            jws.setKey(new HmacKey(new byte[32]));
            jws.setKeyIdHeaderValue(signingKey.kid());
            jws.setAlgorithmHeaderValue(AlgorithmIdentifiers.HMAC_SHA256);

            assertInvalid(AuthErrorCode.SIGNATURE_INVALID, verify(jws.getCompactSerialization(), "app1"));
        }

        @Test
        @DisplayName("should classify garbage as malformed")
        void shouldRejectGarbage() {
            assertInvalid(AuthErrorCode.TOKEN_MALFORMED, verify("not-a-token", "app1"));
            assertInvalid(AuthErrorCode.TOKEN_MALFORMED, verify(null, "app1"));
            assertInvalid(AuthErrorCode.TOKEN_MALFORMED, verify("", "app1"));
        }

        private JwtClaims claimsFor(String subject) {
            final var now = engine.clock.instant().getEpochSecond();
            final var claims = new JwtClaims();
            claims.setIssuer(TestConfigs.ISSUER);
            claims.setAudience("app1");
            claims.setSubject(subject);
            claims.setJwtId("at_forged");
            claims.setIssuedAt(NumericDate.fromSeconds(now));
            claims.setNotBefore(NumericDate.fromSeconds(now));
            claims.setExpirationTime(NumericDate.fromSeconds(now + 900));
            claims.setClaim("role", "admin");
            claims.setClaim("tokenVersion", 3);
            return claims;
        }
    }

    @Nested
    @DisplayName("key rotation")
    class KeyRotation {

        @Test
        @DisplayName("should keep verifying tokens signed by a just-retired key")
        void shouldVerifyAfterRotation() {
            final var token = issue("app1").token();
            engine.clock.advance(Duration.ofMinutes(1));

            engine.keyManager.rotate(false).await().atMost(TIMEOUT);
            engine.clock.advance(Duration.ofMinutes(10));

            assertValid(verify(token, "app1"));
            final var fresh = issue("app1");
            assertValid(verify(fresh.token(), "app1"));
        }
    }

    @Nested
    @DisplayName("denylist")
    class Denylist {

        @Test
        @DisplayName("should reject a revoked jti")
        void shouldRejectRevoked() {
            final var issued = issue("app1");
            engine.denylist
                    .revoke(issued.claims().jti(), "u1", "app1", issued.claims().expiresAt(), null)
                    .await()
                    .atMost(TIMEOUT);

            assertInvalid(AuthErrorCode.TOKEN_REVOKED, verify(issued.token(), "app1"));
        }

        @Test
        @DisplayName("should skip the denylist when revocation checks are disabled")
        void shouldSkipWhenDisabled() {
            final var issued = issue("app1");
            engine.denylist
                    .revoke(issued.claims().jti(), "u1", "app1", issued.claims().expiresAt(), null)
                    .await()
                    .atMost(TIMEOUT);
            when(engine.revocationConfig.enabled()).thenReturn(false);

            assertValid(verify(issued.token(), "app1"));
        }
    }

    @Nested
    @DisplayName("verifySignatureAllowExpired()")
    class AllowExpired {

        @Test
        @DisplayName("should return claims of an expired token")
        void shouldAcceptExpired() {
            final var issued = issue("app1");
            engine.clock.advance(Duration.ofHours(2));

            final var claims = assertValid(
                    engine.verifier.verifySignatureAllowExpired(issued.token()).await().atMost(TIMEOUT));
            assertEquals(issued.claims().jti(), claims.jti());
            assertEquals(issued.claims().expiresAt(), claims.expiresAt());
        }
    }

    @Nested
    @DisplayName("classify()")
    class Classify {

        private InvalidJwtException failure(int... codes) {
            final var details = new ArrayList<ErrorCodeValidator.Error>();
            for (var code : codes) {
                details.add(new ErrorCodeValidator.Error(code, "code " + code));
            }
            return new InvalidJwtException("invalid", List.copyOf(details), null);
        }

        @Test
        @DisplayName("should prefer signature over every other failure")
        void signatureWins() {
            final var result = TokenVerifier.classify(failure(ErrorCodes.EXPIRED, ErrorCodes.SIGNATURE_INVALID));

            assertInvalid(AuthErrorCode.SIGNATURE_INVALID, result);
        }

        @Test
        @DisplayName("should prefer audience over expiry")
        void audienceBeatsExpiry() {
            final var result = TokenVerifier.classify(failure(ErrorCodes.EXPIRED, ErrorCodes.AUDIENCE_INVALID));

            assertInvalid(AuthErrorCode.AUDIENCE_MISMATCH, result);
        }

        @Test
        @DisplayName("should fall back to malformed for unknown codes")
        void unknownIsMalformed() {
            assertInvalid(AuthErrorCode.TOKEN_MALFORMED, TokenVerifier.classify(failure(ErrorCodes.MISCELLANEOUS)));
        }

        @Test
        @DisplayName("should report expiry")
        void expired() {
            assertInvalid(AuthErrorCode.TOKEN_EXPIRED, TokenVerifier.classify(failure(ErrorCodes.EXPIRED)));
            assertTrue(AuthErrorCode.TOKEN_EXPIRED.isRoutine());
        }
    }
}
