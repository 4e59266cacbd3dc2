package mnemo.commands.string;

import mnemo.commands.Command;
import mnemo.db.MnemoDatabase;
import mnemo.protocol.Reply;
import mnemo.protocol.Resp;

import java.util.List;

public class SetCommand implements Command {
    @Override
    public Reply execute(MnemoDatabase db, List<byte[]> args) {
        String ack = db.set(Resp.text(args.get(1)), args.get(2));
        return Reply.status(ack);
    }
}
