package waterinsoils.config;

/**
 * Constantes físicas y numéricas compartidas por todo el cálculo del perfil.
 */
public final class PhysicalConstants {

    private PhysicalConstants() {
    }

    /**
     * Peso específico del agua [kN/m³]. Con esta unidad, 1 m de columna de agua equivale a 10 kPa.
     */
    public static final double GAMMA_WATER = 10.0;

    /**
     * Tolerancia [m] para considerar iguales dos cargas piezométricas.
     */
    public static final double HEAD_TOLERANCE = 1e-9;

    /**
     * Paso de discretización por defecto del eje de profundidad [m].
     */
    public static final double DEFAULT_DEPTH_STEP = 0.05;
}
