package fr.lapetina.aimux.domain.model;

import java.util.Objects;

/**
 * A reserved credential handed to a bridge for a single dispatch.
 * The secret never appears in {@link #toString()}.
 */
public record CredentialRef(String providerId, String credentialId, String secret) {

    public CredentialRef {
        Objects.requireNonNull(providerId, "Provider ID is required");
        Objects.requireNonNull(credentialId, "Credential ID is required");
    }

    /**
     * Returns a masked form of the secret suitable for diagnostics.
     */
    public String maskedSecret() {
        return mask(secret);
    }

    public static String mask(String secret) {
        if (secret == null || secret.isEmpty()) {
            return "";
        }
        if (secret.length() <= 8) {
            return "****";
        }
        return secret.substring(0, 4) + "****" + secret.substring(secret.length() - 2);
    }

    @Override
    public String toString() {
        return "CredentialRef{" +
                "providerId='" + providerId + '\'' +
                ", credentialId='" + credentialId + '\'' +
                ", secret=" + maskedSecret() +
                '}';
    }
}
