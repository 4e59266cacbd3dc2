package mnemo.commands.connection;

import mnemo.commands.Command;
import mnemo.db.MnemoDatabase;
import mnemo.protocol.Reply;

import java.util.List;

public class EchoCommand implements Command {
    @Override
    public Reply execute(MnemoDatabase db, List<byte[]> args) {
        return Reply.bulk(args.get(1));
    }
}
