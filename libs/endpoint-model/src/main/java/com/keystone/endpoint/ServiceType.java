package com.keystone.endpoint;

/**
 * GA4GH service type triple.
 *
 * @param group    organization namespace (e.g. "org.ga4gh")
 * @param artifact service artifact (e.g. "service-registry")
 * @param version  artifact version (e.g. "1.0.0")
 */
public record ServiceType(String group, String artifact, String version) {

    public ServiceType {
        if (group == null || group.isBlank()) {
            throw new IllegalArgumentException("group must not be null or blank");
        }
        if (artifact == null || artifact.isBlank()) {
            throw new IllegalArgumentException("artifact must not be null or blank");
        }
    }

    /**
     * Parses the {@code group:artifact:version} notation.
     *
     * @throws IllegalArgumentException if the text does not have three parts
     */
    public static ServiceType parse(String text) {
        String[] parts = text == null ? new String[0] : text.split(":");
        if (parts.length != 3) {
            throw new IllegalArgumentException("Expected group:artifact:version, got: " + text);
        }
        return new ServiceType(parts[0], parts[1], parts[2]);
    }

    /** Compares group and artifact only. */
    public boolean isSameArtifact(ServiceType other) {
        return other != null && group.equals(other.group) && artifact.equals(other.artifact);
    }

    @Override
    public String toString() {
        return group + ":" + artifact + ":" + version;
    }
}
