package io.github.sparkrew.callflow.flow_extractor.model;

/**
 * A call-like expression found inside a method body.
 * The receiver is the dotted chain written before the member name with whitespace removed,
 * empty when the expression has no explicit receiver. For constructor calls the receiver is the
 * instantiated type as written and the name is {@code new}.
 */
public record Invocation(Kind kind, String receiver, String name, int line) {

    /**
     * Receiver text used when the receiver is an arbitrary expression (a call result, a cast...)
     * rather than a plain dotted name.
     */
    public static final String EXPRESSION_RECEIVER = "<expr>";

    public enum Kind {
        METHOD_CALL,
        CONSTRUCTOR_CALL,
        TYPE_REFERENCE,
        METHOD_REFERENCE
    }

    public boolean hasReceiver() {
        return receiver != null && !receiver.isEmpty() && !EXPRESSION_RECEIVER.equals(receiver);
    }
}
