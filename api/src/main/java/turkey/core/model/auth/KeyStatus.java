package turkey.core.model.auth;

/**
 * Lifecycle status of a signing key.
 *
 * <p>Lifecycle: ACTIVE → RETIRED → (deleted after retention period)
 *
 * <ul>
 *   <li>ACTIVE: usable for verification; the newest ACTIVE key signs new tokens</li>
 *   <li>RETIRED: never signs again, still verifies tokens until they have all expired</li>
 * </ul>
 */
public enum KeyStatus {
    ACTIVE,
    RETIRED
}
