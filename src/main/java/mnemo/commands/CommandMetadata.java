package mnemo.commands;

public class CommandMetadata {
    private final int arity;

    /**
     * @param arity token count including the command name; a negative value
     *              -N means "at least N"
     */
    public CommandMetadata(int arity) {
        if (arity == 0) throw new IllegalArgumentException("arity must not be 0");
        this.arity = arity;
    }

    public boolean acceptsArgCount(int tokens) {
        return arity > 0 ? tokens == arity : tokens >= -arity;
    }
}
