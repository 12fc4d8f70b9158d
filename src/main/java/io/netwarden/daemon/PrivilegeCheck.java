package io.netwarden.daemon;

import com.sun.security.auth.module.UnixSystem;

final class PrivilegeCheck {
    private PrivilegeCheck() {
    }

    static boolean isRoot() {
        try {
            return new UnixSystem().getUid() == 0L;
        } catch (LinkageError e) {
            return false;
        }
    }
}
