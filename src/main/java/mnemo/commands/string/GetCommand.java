package mnemo.commands.string;

import mnemo.commands.Command;
import mnemo.commands.Errors;
import mnemo.db.Lookup;
import mnemo.db.MnemoDatabase;
import mnemo.protocol.Reply;
import mnemo.protocol.Resp;

import java.util.List;

public class GetCommand implements Command {
    @Override
    public Reply execute(MnemoDatabase db, List<byte[]> args) {
        Lookup lookup = db.get(Resp.text(args.get(1)));
        switch (lookup.getStatus()) {
            case FOUND:
                return Reply.bulk(lookup.getValue());
            case WRONG_TYPE:
                return Reply.error(Errors.WRONG_TYPE);
            case ABSENT:
            default:
                return Reply.nullBulk();
        }
    }
}
