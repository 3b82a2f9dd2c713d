package waterinsoils.domain.profile;

import java.util.Arrays;
import java.util.Objects;

/**
 * Eje discreto de profundidades, ordenado de la superficie (0) a la base de la columna.
 *
 * @param depths Profundidades [m], no decrecientes y con al menos una muestra.
 */
public record DepthAxis(double[] depths) {

    public DepthAxis {
        Objects.requireNonNull(depths, "El array de profundidades no puede ser nulo.");
        if (depths.length == 0) {
            throw new IllegalArgumentException("El eje de profundidad debe contener al menos una muestra.");
        }
        for (int i = 1; i < depths.length; i++) {
            if (depths[i] < depths[i - 1]) {
                throw new IllegalArgumentException(String.format(
                        "El eje de profundidad debe ser no decreciente: %.4f m en %d tras %.4f m.",
                        depths[i], i, depths[i - 1]));
            }
        }
        depths = depths.clone();
    }

    /**
     * Eje degenerado de una sola muestra en la superficie (columna vacía).
     */
    public static DepthAxis surfaceOnly() {
        return new DepthAxis(new double[]{0.0});
    }

    @Override
    public double[] depths() {
        return depths.clone();
    }

    public int size() {
        return depths.length;
    }

    public double depthAt(int index) {
        return depths[index];
    }

    public double maxDepth() {
        return depths[depths.length - 1];
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return Arrays.equals(depths, ((DepthAxis) o).depths);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(depths);
    }

    @Override
    public String toString() {
        return "DepthAxis[size=" + depths.length + ", maxDepth=" + maxDepth() + "]";
    }
}
