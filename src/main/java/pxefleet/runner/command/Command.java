package pxefleet.runner.command;

import java.util.Objects;

/**
 * One parsed token of a command string: a client instruction or an execution
 * flag, with its validated parameter.
 *
 * @param name         command or flag
 * @param index        OS/partition index for index-taking commands, otherwise null
 * @param downloadType transfer method for {@code initcache}, otherwise null
 */
public record Command(CommandName name, Integer index, CacheDownloadType downloadType) {

    public Command {
        Objects.requireNonNull(name, "name is required");
        switch (name.paramKind()) {
            case NONE -> {
                if (index != null || downloadType != null) {
                    throw new IllegalArgumentException(name.token() + " takes no parameter");
                }
            }
            case OPTIONAL_INDEX, REQUIRED_INDEX -> {
                if (downloadType != null) {
                    throw new IllegalArgumentException(name.token() + " takes a numeric parameter");
                }
                if (index == null && name.paramKind() == ParamKind.REQUIRED_INDEX) {
                    throw new IllegalArgumentException(name.token() + " requires a numeric parameter");
                }
                if (index != null && index < 1) {
                    throw new IllegalArgumentException(name.token() + " parameter must be >= 1");
                }
            }
            case OPTIONAL_DOWNLOAD_TYPE -> {
                if (index != null) {
                    throw new IllegalArgumentException(name.token() + " takes a download type");
                }
            }
        }
    }

    public static Command of(CommandName name) {
        return new Command(name, null, null);
    }

    public static Command of(CommandName name, int index) {
        return new Command(name, index, null);
    }

    public static Command initcache(CacheDownloadType type) {
        return new Command(CommandName.INITCACHE, null, type);
    }

    public static Command sync(int os) {
        return of(CommandName.SYNC, os);
    }

    public static Command start(int os) {
        return of(CommandName.START, os);
    }

    public boolean isFlag() {
        return name.isFlag();
    }

    /** Canonical token, e.g. {@code sync:1} or {@code initcache:rsync}. */
    public String token() {
        if (index != null) {
            return name.token() + ":" + index;
        }
        if (downloadType != null) {
            return name.token() + ":" + downloadType.token();
        }
        return name.token();
    }

    @Override
    public String toString() {
        return token();
    }
}
