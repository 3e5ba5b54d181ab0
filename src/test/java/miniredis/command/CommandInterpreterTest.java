package miniredis.command;

import miniredis.resp.RespArray;
import miniredis.resp.RespBulkString;
import miniredis.resp.RespError;
import miniredis.resp.RespInteger;
import miniredis.resp.RespSimpleString;
import miniredis.resp.RespValue;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CommandInterpreterTest {

    private static final CommandInterpreter interpreter = new CommandInterpreter();

    private static RespArray command(RespValue... tokens) {
        return new RespArray(Arrays.asList(tokens));
    }

    private static RespBulkString bulk(String value) {
        return new RespBulkString(value);
    }

    private static void assertInterpretError(RespValue input, InterpretError expected) {
        assertThatThrownBy(() -> interpreter.interpret(input))
                .isInstanceOf(InterpretException.class)
                .hasFieldOrPropertyWithValue("error", expected);
    }

    @ParameterizedTest
    @ValueSource(strings = {"PING", "Ping", "ping", "pInG"})
    void testCreatesPingCommandCaseInsensitively(String name) {
        assertThat(interpreter.interpret(command(bulk(name)))).isEqualTo(new Ping());
    }

    @Test
    void testCreatesPingCommandWithArguments() {
        assertThat(interpreter.interpret(command(bulk("PING"), bulk("Hello"), new RespInteger(3))))
                .isEqualTo(new Ping());
    }

    @ParameterizedTest
    @ValueSource(strings = {"ECHO", "Echo", "echo"})
    void testCreatesEchoCommand(String name) {
        assertThat(interpreter.interpret(command(bulk(name), bulk("hey")))).isEqualTo(new Echo("hey"));
    }

    @Test
    void testEchoKeepsBinaryArgumentLossily() {
        RedisCommand echo = interpreter.interpret(command(bulk("ECHO"),
                new RespBulkString(new byte[]{'a', (byte) 0xc3, '\r', '\n'})));
        assertThat(echo).isEqualTo(new Echo("a\uFFFD\r\n"));
    }

    @Test
    void testEchoWithNoArguments() {
        assertThatThrownBy(() -> interpreter.interpret(command(bulk("ECHO"))))
                .isInstanceOf(InterpretException.class)
                .hasFieldOrPropertyWithValue("error", InterpretError.ARITY_ERROR)
                .hasMessage("ECHO requires a message argument");
    }

    @Test
    void testEchoWithTooManyArguments() {
        assertInterpretError(command(bulk("ECHO"), bulk("a"), bulk("b")), InterpretError.ARITY_ERROR);
    }

    static Stream<RespValue> invalidTypedValues() {
        return Stream.of(
                new RespSimpleString("hey"),
                new RespError("hey"),
                new RespInteger(0),
                new RespArray(List.of(bulk("hey")))
        );
    }

    @ParameterizedTest
    @MethodSource("invalidTypedValues")
    void testEchoWithInvalidArgument(RespValue invalidArgument) {
        assertInterpretError(command(bulk("ECHO"), invalidArgument), InterpretError.TYPE_ERROR);
    }

    @ParameterizedTest
    @MethodSource("invalidTypedValues")
    void testInvalidCommandNameType(RespValue invalidName) {
        assertThatThrownBy(() -> interpreter.interpret(command(invalidName)))
                .isInstanceOf(InterpretException.class)
                .hasFieldOrPropertyWithValue("error", InterpretError.NOT_A_COMMAND)
                .hasMessage("invalid command type: " + invalidName.getClass().getSimpleName());
    }

    @Test
    void testEmptyArray() {
        assertInterpretError(command(), InterpretError.NOT_A_COMMAND);
    }

    @Test
    void testUnknownCommand() {
        assertThatThrownBy(() -> interpreter.interpret(command(bulk("UNKNOWN"), bulk("x"))))
                .isInstanceOf(InterpretException.class)
                .hasFieldOrPropertyWithValue("error", InterpretError.UNKNOWN_COMMAND)
                .hasMessage("unsupported command: UNKNOWN");
    }

    @Test
    void testNonUtf8CommandName() {
        assertInterpretError(command(new RespBulkString(new byte[]{'p', (byte) 0xff, 'n', 'g'})),
                InterpretError.UNKNOWN_COMMAND);
    }

    @Test
    void testErrorFrameIsDowngradedToUnknown() {
        assertThat(interpreter.interpret(new RespError("some error"))).isEqualTo(new Unknown());
    }

    @ParameterizedTest
    @MethodSource("nonCommandValues")
    void testTopLevelNonArray(RespValue value) {
        assertInterpretError(value, InterpretError.NOT_A_COMMAND);
    }

    static Stream<RespValue> nonCommandValues() {
        return Stream.of(
                new RespSimpleString("PING"),
                new RespInteger(1),
                new RespBulkString("PING")
        );
    }
}
