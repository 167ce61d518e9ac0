package kvd.commands;

import kvd.BuildInfo;
import kvd.db.Store;

import java.util.Objects;

/**
 * Collaborators that commands are constructed with.
 */
public final class CommandEnvironment {
    private final Store store;
    private final BuildInfo buildInfo;

    public CommandEnvironment(Store store, BuildInfo buildInfo) {
        this.store = Objects.requireNonNull(store, "store");
        this.buildInfo = Objects.requireNonNull(buildInfo, "buildInfo");
    }

    public Store getStore() {
        return store;
    }

    public BuildInfo getBuildInfo() {
        return buildInfo;
    }
}
