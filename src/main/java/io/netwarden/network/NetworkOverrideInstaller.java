package io.netwarden.network;

import java.io.IOException;

@FunctionalInterface
public interface NetworkOverrideInstaller {

    NetworkOverride install() throws IOException;
}
