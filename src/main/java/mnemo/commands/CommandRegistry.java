package mnemo.commands;

import mnemo.commands.connection.EchoCommand;
import mnemo.commands.connection.PingCommand;
import mnemo.commands.generic.DelCommand;
import mnemo.commands.string.GetCommand;
import mnemo.commands.string.SetCommand;

import java.util.Collections;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

public class CommandRegistry {
    private final Map<String, CommandContainer> commands = new HashMap<>();

    public static CommandRegistry defaults() {
        CommandRegistry registry = new CommandRegistry();
        // Connection
        registry.register("PING", new PingCommand(), -1);
        registry.register("ECHO", new EchoCommand(), -2);
        // String
        registry.register("GET", new GetCommand(), 2);
        registry.register("SET", new SetCommand(), 3);
        // Generic
        registry.register("DEL", new DelCommand(), -2);
        return registry;
    }

    public void register(String name, Command command, int arity) {
        String key = name.toUpperCase(Locale.ROOT);
        commands.put(key, new CommandContainer(key, command, new CommandMetadata(arity)));
    }

    public CommandContainer get(String name) {
        return commands.get(name.toUpperCase(Locale.ROOT));
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(commands.keySet());
    }
}
