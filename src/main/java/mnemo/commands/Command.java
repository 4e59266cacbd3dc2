package mnemo.commands;

import mnemo.db.MnemoDatabase;
import mnemo.protocol.Reply;

import java.util.List;

public interface Command {
    // Executes the command logic against the store and returns the reply.
    // args.get(0) is the command name; arity is checked by the caller.
    Reply execute(MnemoDatabase db, List<byte[]> args);
}
