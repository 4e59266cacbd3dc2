package mnemo.commands.generic;

import mnemo.commands.Command;
import mnemo.db.MnemoDatabase;
import mnemo.protocol.Reply;
import mnemo.protocol.Resp;

import java.util.List;

public class DelCommand implements Command {
    @Override
    public Reply execute(MnemoDatabase db, List<byte[]> args) {
        String[] keys = new String[args.size() - 1];
        for (int i = 1; i < args.size(); i++) {
            keys[i - 1] = Resp.text(args.get(i));
        }
        return Reply.integer(db.delete(keys));
    }
}
