package polygon.math;

/**
 * Lançada por {@link Normalization#orElseThrow()} quando se exige a direção de um vetor nulo.
 */
public final class ZeroVectorException extends ArithmeticException {

    private final transient Vector2 payload;

    public ZeroVectorException(Vector2 payload) {
        super("Vetor nulo não pode ser normalizado: " + payload);
        this.payload = payload;
    }

    public Vector2 payload() {
        return payload;
    }
}
