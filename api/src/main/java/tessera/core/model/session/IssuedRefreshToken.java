package tessera.core.model.session;

/**
 * A freshly minted refresh token together with its stored record.
 *
 * @param rawToken value returned to the caller; never persisted
 * @param record   the stored record keyed by the token digest
 */
public record IssuedRefreshToken(String rawToken, RefreshRecord record) {

    @Override
    public String toString() {
        return "IssuedRefreshToken[tokenId=" + record.tokenId() + ", familyId=" + record.familyId() + "]";
    }
}
