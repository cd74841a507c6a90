package pxefleet.runner.command;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Ordered result of parsing a command string.
 * Tokens keep their submitted order, flags included, so that
 * {@link #format()} reproduces an equivalent string for both the live and the
 * onboot path.
 */
public final class CommandPlan {

    private final List<Command> tokens;

    public CommandPlan(List<Command> tokens) {
        Objects.requireNonNull(tokens, "tokens");
        if (tokens.isEmpty()) {
            throw new IllegalArgumentException("command plan must not be empty");
        }
        this.tokens = List.copyOf(tokens);
    }

    /** All tokens in submitted order. */
    public List<Command> tokens() {
        return tokens;
    }

    /** Client instructions only, in order. */
    public List<Command> commands() {
        return tokens.stream().filter(c -> !c.isFlag()).toList();
    }

    public List<CommandName> flags() {
        return tokens.stream().filter(Command::isFlag).map(Command::name).distinct().toList();
    }

    public boolean hasFlag(CommandName flag) {
        return tokens.stream().anyMatch(c -> c.name() == flag);
    }

    /** True if any instruction makes the client leave the boot environment. */
    public boolean leavesBootEnvironment() {
        return commands().stream().anyMatch(c -> c.name().leavesBootEnvironment());
    }

    /** Plan with the given flag prepended unless it is already present. */
    public CommandPlan withLeadingFlag(CommandName flag) {
        if (!flag.isFlag()) {
            throw new IllegalArgumentException(flag.token() + " is not a flag");
        }
        if (hasFlag(flag)) {
            return this;
        }
        List<Command> withFlag = new ArrayList<>(tokens.size() + 1);
        withFlag.add(Command.of(flag));
        withFlag.addAll(tokens);
        return new CommandPlan(withFlag);
    }

    /** Comma-joined canonical form, e.g. {@code noauto,sync:1,start:1}. */
    public String format() {
        return tokens.stream().map(Command::token).collect(Collectors.joining(","));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof CommandPlan other))
            return false;
        return tokens.equals(other.tokens);
    }

    @Override
    public int hashCode() {
        return tokens.hashCode();
    }

    @Override
    public String toString() {
        return format();
    }
}
