package mnemo.commands.generic;

import mnemo.db.MnemoDatabase;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static mnemo.commands.CommandTestSupport.makeArgs;
import static mnemo.commands.CommandTestSupport.wire;
import static org.junit.jupiter.api.Assertions.*;

public class DelCommandTest {

    private MnemoDatabase db;
    private final DelCommand cmd = new DelCommand();

    @BeforeEach
    public void setup() {
        db = new MnemoDatabase();
        db.set("a", new byte[]{1});
        db.set("b", new byte[]{2});
    }

    @Test
    public void testDeletesMultipleKeys() {
        assertEquals(":2\r\n", wire(cmd.execute(db, makeArgs("DEL", "a", "b", "c"))));
        assertFalse(db.get("a").isFound());
        assertFalse(db.get("b").isFound());
    }

    @Test
    public void testSecondCallRemovesNothing() {
        cmd.execute(db, makeArgs("DEL", "a"));
        assertEquals(":0\r\n", wire(cmd.execute(db, makeArgs("DEL", "a"))));
        assertTrue(db.get("b").isFound());
    }
}
