package mnemo.commands;

import java.util.Locale;

/**
 * Error reply texts shared by the dispatcher and the commands.
 */
public final class Errors {
    public static final String WRONG_TYPE = "WRONGTYPE Operation against a key holding the wrong kind of value";
    public static final String PROTOCOL = "ERR Protocol error";

    private Errors() {
    }

    public static String wrongArity(String command) {
        return "ERR wrong number of arguments for '" + command.toLowerCase(Locale.ROOT) + "' command";
    }

    public static String unknownCommand(String command) {
        return "ERR unknown command '" + command.toLowerCase(Locale.ROOT) + "'";
    }
}
