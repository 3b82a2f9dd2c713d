package waterinsoils.domain.soil;

import lombok.Builder;
import waterinsoils.domain.profile.PiezometerColumn;

/**
 * Salida del resolvedor de régimen: geometría saneada, régimen de la arcilla y valores de contorno
 * que el integrador usa como anclajes de continuidad.
 *
 * @param regime                   Régimen de flujo en la arcilla.
 * @param z1                       Espesor efectivo de Sand-1 [m].
 * @param z2                       Espesor efectivo de Clay [m].
 * @param z3                       Espesor efectivo de Sand-2 [m].
 * @param h1                       Carga efectiva de Sand-1 [m] (0 si el estrato no existe).
 * @param h3                       Carga efectiva de Sand-2 [m] (0 si el estrato no existe).
 * @param equivalentHead           S = h1 + z2 + z3 [m].
 * @param excessGradient           Gradiente de exceso con signo, (S - max(h3, z3)) / z2. Cero en régimen equilibrado.
 * @param waterTableDepth          Profundidad del nivel freático en Sand-1, z1 - h1 [m]. Negativa si hay lámina de agua.
 * @param lowerPiezometricDepth    Profundidad del nivel piezométrico de Sand-2, z1 + z2 + z3 - h3 [m].
 * @param porePressureAtClayTop    Presión intersticial en el contacto Sand-1 / Clay [kPa].
 * @param porePressureAtClayBottom Presión intersticial en el contacto Clay / Sand-2 [kPa].
 * @param upperPiezometer          Piezómetro de Sand-1.
 * @param lowerPiezometer          Piezómetro de Sand-2.
 */
@Builder
public record ResolvedGeometry(
        Regime regime,
        double z1,
        double z2,
        double z3,
        double h1,
        double h3,
        double equivalentHead,
        double excessGradient,
        double waterTableDepth,
        double lowerPiezometricDepth,
        double porePressureAtClayTop,
        double porePressureAtClayBottom,
        PiezometerColumn upperPiezometer,
        PiezometerColumn lowerPiezometer
) {

    public double clayTopDepth() {
        return z1;
    }

    public double clayBottomDepth() {
        return z1 + z2;
    }

    public double totalDepth() {
        return z1 + z2 + z3;
    }

    /**
     * Exceso de carga arriba con Sand-1 seca (h1 = 0): la arcilla no recibe agua desde el techo y
     * sólo se satura por debajo del nivel piezométrico de Sand-2.
     */
    public boolean hasDryUpperSand() {
        return regime == Regime.UPWARD && h1 == 0.0;
    }

    /**
     * Gradiente que transmite fuerza de filtración a la arcilla. Nulo si no hay flujo a través de ella.
     */
    public double seepageGradient() {
        return hasDryUpperSand() ? 0.0 : excessGradient;
    }

    /**
     * Diferencia de carga S - h3 que gobierna la clasificación del régimen [m].
     */
    public double headDifference() {
        return equivalentHead - h3;
    }
}
