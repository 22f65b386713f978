package dev.mesh2dm.parse;

/**
 * Raised when a line's card is missing or unknown, or when the card carries fewer fields than it requires.
 * <p>
 * Field counts exclude the card keyword itself. Both counts are {@code -1} when the card was rejected by name.
 */
public class CardException extends MeshFormatException {

    private final String card;
    private final int requiredFields;
    private final int actualFields;

    public CardException(String card, String message) {
        this(card, message, -1, -1);
    }

    public CardException(String card, String message, int requiredFields, int actualFields) {
        super(message);
        this.card = card;
        this.requiredFields = requiredFields;
        this.actualFields = actualFields;
    }

    static CardException unrecognized(String kind, String card) {
        return new CardException(card, "Invalid " + kind + " card \"" + card + "\"");
    }

    static CardException insufficientFields(String card, String message, int requiredFields, int actualFields) {
        return new CardException(card, message + ", got " + actualFields, requiredFields, actualFields);
    }

    public String card() {
        return card;
    }

    public int requiredFields() {
        return requiredFields;
    }

    public int actualFields() {
        return actualFields;
    }

    public boolean isFieldCountError() {
        return requiredFields >= 0;
    }
}
