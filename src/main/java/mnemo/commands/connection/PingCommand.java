package mnemo.commands.connection;

import mnemo.commands.Command;
import mnemo.db.MnemoDatabase;
import mnemo.protocol.Reply;
import mnemo.protocol.Resp;

import java.util.List;

public class PingCommand implements Command {
    private static final Reply PONG = Reply.status("PONG");

    @Override
    public Reply execute(MnemoDatabase db, List<byte[]> args) {
        if (args.size() > 1) {
            return Reply.status(Resp.text(args.get(1)));
        }
        return PONG;
    }
}
