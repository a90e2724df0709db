package tech.databroker.core.result;

/**
 * Result of a create, update or delete command.
 *
 * <p>Commands only report status: the success flag and a human-readable message.
 *
 * @param successful Whether the command affected exactly the expected record
 * @param message    Outcome description, empty if none
 */
public record CommandResult(
    boolean successful,
    String message
) {
    public CommandResult {
        message = message == null ? "" : message;
    }

    public static CommandResult success() {
        return new CommandResult(true, "");
    }

    public static CommandResult success(String message) {
        return new CommandResult(true, message);
    }

    public static CommandResult failure(String message) {
        return new CommandResult(false, message);
    }
}
