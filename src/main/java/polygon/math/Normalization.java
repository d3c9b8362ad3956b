package polygon.math;

/**
 * Resultado de {@link Vector2#unit()}: ou o vetor unitário, ou a falha de vetor nulo.
 * Quem chama deve tratar os dois casos (por exemplo com {@code instanceof}).
 */
public sealed interface Normalization permits Normalization.Success, Normalization.ZeroVectorError {

    /**
     * @return true se a normalização produziu um vetor unitário
     */
    boolean isSuccess();

    /**
     * Vetor unitário da normalização.
     *
     * @return o vetor unitário
     * @throws ZeroVectorException se a normalização falhou
     */
    Vector2 orElseThrow();

    /**
     * @param fallback vetor usado quando a normalização falhou
     * @return o vetor unitário, ou {@code fallback} em caso de vetor nulo
     */
    Vector2 orElse(Vector2 fallback);

    /**
     * Normalização bem-sucedida.
     *
     * @param value vetor de comprimento 1 (a menos de arredondamento)
     */
    record Success(Vector2 value) implements Normalization {
        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public Vector2 orElseThrow() {
            return value;
        }

        @Override
        public Vector2 orElse(Vector2 fallback) {
            return value;
        }
    }

    /**
     * Falha: o vetor de entrada tem norma zero.
     *
     * @param payload sempre a origem
     */
    record ZeroVectorError(Vector2 payload) implements Normalization {
        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public Vector2 orElseThrow() {
            throw new ZeroVectorException(payload);
        }

        @Override
        public Vector2 orElse(Vector2 fallback) {
            return fallback;
        }
    }
}
