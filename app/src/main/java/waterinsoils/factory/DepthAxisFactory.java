package waterinsoils.factory;

import waterinsoils.domain.profile.DepthAxis;

/**
 * Fábrica de ejes de profundidad equiespaciados.
 */
public final class DepthAxisFactory {

    /**
     * Prohibido construir esta clase utilidad
     */
    private DepthAxisFactory() {
    }

    /**
     * Crea el eje {@code 0 ... totalDepth} con el número de intervalos más próximo a {@code totalDepth / step}.
     * <p>
     * Las profundidades se calculan como {@code i * totalDepth / n} en lugar de sumar el paso, para no
     * acumular error de redondeo, y la última muestra es exactamente {@code totalDepth}.
     *
     * @param totalDepth Profundidad de la base de la columna [m]. Si no es positiva, el eje es {@code [0.0]}.
     * @param step       Paso nominal [m] (> 0).
     * @return Eje con {@code round(totalDepth / step) + 1} muestras (al menos dos si la columna no está vacía).
     */
    public static DepthAxis createUniform(double totalDepth, double step) {
        if (!(step > 0.0)) {
            throw new IllegalArgumentException("El paso de profundidad debe ser positivo: " + step);
        }
        if (!(totalDepth > 0.0)) {
            return DepthAxis.surfaceOnly();
        }

        final int intervals = (int) Math.max(1L, Math.round(totalDepth / step));
        final double[] depths = new double[intervals + 1];
        for (int i = 0; i < intervals; i++) {
            depths[i] = totalDepth * i / intervals;
        }
        depths[intervals] = totalDepth;
        return new DepthAxis(depths);
    }
}
