package com.capprobe.probe;

/**
 * Opaque installation hint attached to a probe. Only used to enrich negative results and
 * {@link ProbeNotPresentException} messages.
 *
 * @param packageName name of the package that provides the capability (nullable)
 * @param url         documentation URL with installation instructions (nullable)
 */
public record InstallHint(String packageName, String url) {

    public InstallHint {
        if (isBlank(packageName) && isBlank(url)) {
            throw new IllegalArgumentException("packageName or url must be given");
        }
    }

    /**
     * Human-readable resolution text, e.g. for display next to a "not available" reason.
     */
    public String describe() {
        StringBuilder text = new StringBuilder();
        if (!isBlank(packageName)) {
            text.append("To enable this capability, install the package '%s'.".formatted(packageName));
        }
        if (!isBlank(url)) {
            if (!text.isEmpty()) {
                text.append(' ');
            }
            text.append("Further installation instructions might be available at %s.".formatted(url));
        }
        return text.toString();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
