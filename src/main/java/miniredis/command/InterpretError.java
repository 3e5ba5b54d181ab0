package miniredis.command;

public enum InterpretError {
    NOT_A_COMMAND,
    UNKNOWN_COMMAND,
    ARITY_ERROR,
    TYPE_ERROR
}
