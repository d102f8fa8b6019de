package hdlgen.event;

import hdlgen.expr.Var;
import hdlgen.generator.Generator;
import hdlgen.stmt.EventActionType;
import java.util.Map;

/**
 * What {@link EventPasses#extractEventFireCondition(Generator)} learns about one tracing statement.
 * @param name event name
 * @param transaction transaction name, null if the event is not part of one
 * @param combinational false if the event fires inside an {@code always_ff} block
 * @param type role within the transaction
 * @param condition 1-bit value that is high exactly when the statement is reached
 * @param fields the field snapshot
 * @param generator the generator containing the statement
 */
public record EventInfo(String name, String transaction, boolean combinational, EventActionType type, Var condition,
                        Map<String, Var> fields, Generator generator) {}
