package pxefleet.runner.command;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Closed vocabulary of client commands and execution flags.
 * Flags change how the remaining commands run and never reach the client as
 * an instruction of their own.
 */
public enum CommandName {
    PARTITION(ParamKind.NONE, false),
    LABEL(ParamKind.NONE, false),
    FORMAT(ParamKind.OPTIONAL_INDEX, false),
    INITCACHE(ParamKind.OPTIONAL_DOWNLOAD_TYPE, false),
    SYNC(ParamKind.REQUIRED_INDEX, false),
    NEW(ParamKind.REQUIRED_INDEX, false),
    START(ParamKind.REQUIRED_INDEX, false),
    REBOOT(ParamKind.NONE, false),
    HALT(ParamKind.NONE, false),
    CREATE_IMAGE(ParamKind.REQUIRED_INDEX, false),
    UPLOAD_IMAGE(ParamKind.REQUIRED_INDEX, false),
    NOAUTO(ParamKind.NONE, true),
    DISABLEGUI(ParamKind.NONE, true);

    private final ParamKind paramKind;
    private final boolean flag;

    CommandName(ParamKind paramKind, boolean flag) {
        this.paramKind = paramKind;
        this.flag = flag;
    }

    public ParamKind paramKind() {
        return paramKind;
    }

    public boolean isFlag() {
        return flag;
    }

    /** Commands after which the client leaves the boot environment. */
    public boolean leavesBootEnvironment() {
        return this == START || this == REBOOT || this == HALT;
    }

    /** Token form as written in command strings, e.g. {@code create_image}. */
    public String token() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<CommandName> fromToken(String token) {
        for (CommandName name : values()) {
            if (name.token().equals(token)) {
                return Optional.of(name);
            }
        }
        return Optional.empty();
    }

    public static List<String> commandTokens() {
        return Arrays.stream(values()).filter(n -> !n.flag).map(CommandName::token).toList();
    }

    public static List<String> flagTokens() {
        return Arrays.stream(values()).filter(n -> n.flag).map(CommandName::token).toList();
    }
}
