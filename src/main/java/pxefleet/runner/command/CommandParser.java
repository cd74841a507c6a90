package pxefleet.runner.command;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Parser and validator for client command strings.
 *
 * <pre>
 * commands := token (',' token)*
 * token    := name (':' param)?
 * </pre>
 *
 * The parser is pure and shared by immediate execution and onboot scheduling,
 * so both paths accept exactly the same input. Unknown names, missing or
 * surplus parameters, and empty tokens are rejected with an
 * {@link InvalidCommandSyntaxException}.
 */
public final class CommandParser {

    private static final Pattern INDEX = Pattern.compile("^[0-9]{1,9}$");

    private CommandParser() {
    }

    public static CommandPlan parse(String input) {
        if (input == null || input.isBlank()) {
            throw new InvalidCommandSyntaxException("", 0, 0, "command string is empty");
        }

        List<Command> tokens = new ArrayList<>();
        String[] raw = input.split(",", -1);
        int offset = 0;

        for (int i = 0; i < raw.length; i++) {
            String token = raw[i];
            int position = i + 1;
            int tokenOffset = offset + leadingWhitespace(token);
            tokens.add(parseToken(token.trim(), position, tokenOffset));
            offset += token.length() + 1;
        }

        return new CommandPlan(tokens);
    }

    /**
     * Validate without throwing.
     *
     * @return the parse error, or empty if the input is valid
     */
    public static Optional<InvalidCommandSyntaxException> check(String input) {
        try {
            parse(input);
            return Optional.empty();
        } catch (InvalidCommandSyntaxException e) {
            return Optional.of(e);
        }
    }

    private static Command parseToken(String token, int position, int offset) {
        if (token.isEmpty()) {
            throw new InvalidCommandSyntaxException(token, position, offset, "empty token");
        }

        int colon = token.indexOf(':');
        String nameText = (colon < 0 ? token : token.substring(0, colon)).trim().toLowerCase(Locale.ROOT);
        String param = colon < 0 ? null : token.substring(colon + 1).trim();

        CommandName name = CommandName.fromToken(nameText)
                .orElseThrow(() -> new InvalidCommandSyntaxException(token, position, offset,
                        "unknown command '" + nameText + "'"));

        if (param != null && param.isEmpty()) {
            throw new InvalidCommandSyntaxException(token, position, offset, "missing parameter after ':'");
        }

        switch (name.paramKind()) {
            case NONE -> {
                if (param != null) {
                    throw new InvalidCommandSyntaxException(token, position, offset,
                            name.token() + " takes no parameter");
                }
                return Command.of(name);
            }
            case OPTIONAL_INDEX -> {
                if (param == null) {
                    return Command.of(name);
                }
                return Command.of(name, parseIndex(name, param, token, position, offset));
            }
            case REQUIRED_INDEX -> {
                if (param == null) {
                    throw new InvalidCommandSyntaxException(token, position, offset,
                            name.token() + " requires a numeric parameter");
                }
                return Command.of(name, parseIndex(name, param, token, position, offset));
            }
            case OPTIONAL_DOWNLOAD_TYPE -> {
                if (param == null) {
                    return Command.of(name);
                }
                CacheDownloadType type = CacheDownloadType.fromToken(param)
                        .orElseThrow(() -> new InvalidCommandSyntaxException(token, position, offset,
                                "invalid download type '" + param + "' (expected rsync, multicast or torrent)"));
                return Command.initcache(type);
            }
            default -> throw new IllegalStateException("Unhandled parameter kind: " + name.paramKind());
        }
    }

    private static int parseIndex(CommandName name, String param, String token, int position, int offset) {
        if (!INDEX.matcher(param).matches()) {
            throw new InvalidCommandSyntaxException(token, position, offset,
                    "invalid number '" + param + "' for " + name.token());
        }
        int value = Integer.parseInt(param);
        if (value < 1) {
            throw new InvalidCommandSyntaxException(token, position, offset,
                    name.token() + " parameter must be >= 1");
        }
        return value;
    }

    private static int leadingWhitespace(String s) {
        int i = 0;
        while (i < s.length() && Character.isWhitespace(s.charAt(i))) {
            i++;
        }
        return i;
    }
}
