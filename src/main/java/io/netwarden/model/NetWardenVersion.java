package io.netwarden.model;

public final class NetWardenVersion {
    public static final int API_VERSION = 1;

    private NetWardenVersion() {
    }

    public static String version() {
        String fromManifest = NetWardenVersion.class.getPackage().getImplementationVersion();
        return fromManifest == null || fromManifest.isBlank() ? "0.1.0-dev" : fromManifest;
    }

    public static String display() {
        return "v" + version() + " (api v" + API_VERSION + ")";
    }
}
