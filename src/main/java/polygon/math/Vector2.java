package polygon.math;

/**
 * Representa um vetor 2D imutável (ponto ou deslocamento no plano).
 * Os componentes não são validados: NaN e infinitos se propagam pelas operações
 * seguindo a aritmética IEEE 754.
 *
 * @param x componente X
 * @param y componente Y
 */
public record Vector2(double x, double y) {

    /**
     * Vetor nulo (0,0).
     */
    public static final Vector2 ORIGIN = new Vector2(0.0, 0.0);

    /**
     * Retorna a origem (0,0).
     *
     * @return vetor nulo
     */
    public static Vector2 origin() {
        return ORIGIN;
    }

    /**
     * Soma este vetor com outro.
     *
     * @param o vetor a ser somado
     * @return novo vetor resultado da soma
     */
    public Vector2 add(Vector2 o) {
        return new Vector2(x + o.x, y + o.y);
    }

    /**
     * Subtrai outro vetor deste.
     *
     * @param o vetor a ser subtraído
     * @return novo vetor resultado da subtração
     */
    public Vector2 subtract(Vector2 o) {
        return new Vector2(x - o.x, y - o.y);
    }

    /**
     * Multiplica este vetor por um escalar. Escalar negativo reflete o vetor.
     *
     * @param c escalar
     * @return novo vetor escalado
     */
    public Vector2 scale(double c) {
        return new Vector2(x * c, y * c);
    }

    /**
     * Divide os dois componentes por um escalar.
     * Não verifica divisão por zero: c == 0 produz componentes infinitos ou NaN,
     * e cabe a quem chama evitar isso.
     *
     * @param c divisor
     * @return novo vetor dividido
     */
    public Vector2 divide(double c) {
        return new Vector2(x / c, y / c);
    }

    /**
     * Retorna o comprimento (norma Euclidiana) deste vetor.
     * Calculado como sqrt(x² + y²), sem proteção contra underflow.
     *
     * @return comprimento do vetor
     */
    public double norm() {
        return Math.sqrt(x * x + y * y);
    }

    /**
     * Indica se o vetor é nulo, isto é, se a norma é exatamente 0.0.
     * Vetores minúsculos cuja norma sofre underflow também contam como nulos.
     *
     * @return true se norm() == 0.0
     */
    public boolean isZero() {
        return norm() == 0.0;
    }

    /**
     * Ângulo do vetor em relação ao eixo X positivo, em (-π, π].
     * Para o vetor nulo retorna 0, que não representa uma direção.
     *
     * @return atan2(y, x)
     */
    public double radian() {
        return Math.atan2(y, x);
    }

    /**
     * Retorna o vetor unitário com a mesma direção deste.
     * Vetor nulo não tem direção: nesse caso o resultado é um
     * {@link Normalization.ZeroVectorError} com a origem como payload.
     *
     * @return resultado da normalização
     */
    public Normalization unit() {
        double n = norm();
        if (n == 0.0) {
            return new Normalization.ZeroVectorError(origin());
        }
        return new Normalization.Success(divide(n));
    }

    // Igualdade exata por componente: -0.0 == 0.0 e NaN igual a NaN.
    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Vector2 o)) {
            return false;
        }
        return same(x, o.x) && same(y, o.y);
    }

    @Override
    public int hashCode() {
        // + 0.0 converte -0.0 em 0.0
        return 31 * Double.hashCode(x + 0.0) + Double.hashCode(y + 0.0);
    }

    @Override
    public String toString() {
        return "(" + x + ", " + y + ")";
    }

    private static boolean same(double a, double b) {
        return a == b || (Double.isNaN(a) && Double.isNaN(b));
    }
}
