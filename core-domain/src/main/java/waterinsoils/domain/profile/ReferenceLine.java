package waterinsoils.domain.profile;

/**
 * Recta hidrostática de referencia (discontinua en el gráfico de presiones).
 *
 * @param name          Identificador ("h1_hydrostatic", "h3_hydrostatic").
 * @param startPressure Presión en el origen de la recta [kPa].
 * @param startDepth    Profundidad del origen [m].
 * @param endPressure   Presión en el extremo [kPa].
 * @param endDepth      Profundidad del extremo [m].
 */
public record ReferenceLine(
        String name,
        double startPressure,
        double startDepth,
        double endPressure,
        double endDepth
) {

    /**
     * Presión de la recta a una profundidad dada, por interpolación lineal.
     */
    public double pressureAt(double depth) {
        if (endDepth == startDepth) {
            return endPressure;
        }
        double fraction = (depth - startDepth) / (endDepth - startDepth);
        return startPressure + fraction * (endPressure - startPressure);
    }
}
