package fr.lapetina.tr064.domain.model;

/**
 * Firmware information. Only reported by the TR-064 root descriptor.
 */
public record SystemVersion(
        String hw,
        String major,
        String minor,
        String patch,
        String buildNumber,
        String display
) {
    public static final SystemVersion UNKNOWN = new SystemVersion(null, null, null, null, null, null);

    /**
     * Returns the version as "minor.patch" (e.g. "07.29"), or null if unknown.
     */
    public String version() {
        if (minor != null && !minor.isEmpty() && patch != null && !patch.isEmpty()) {
            return minor + "." + patch;
        }
        return null;
    }

    /**
     * Compares the firmware version numerically with {@code minor.patch}.
     * Returns false when the version is unknown or not numeric.
     */
    public boolean isAtLeast(int requiredMinor, int requiredPatch) {
        if (version() == null) {
            return false;
        }
        try {
            int actualMinor = Integer.parseInt(minor.trim());
            int actualPatch = Integer.parseInt(patch.trim());
            return actualMinor > requiredMinor || (actualMinor == requiredMinor && actualPatch >= requiredPatch);
        } catch (NumberFormatException e) {
            return false;
        }
    }
}
