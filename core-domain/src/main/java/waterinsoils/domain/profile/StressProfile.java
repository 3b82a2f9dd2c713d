package waterinsoils.domain.profile;

import java.util.Arrays;
import java.util.Objects;

/**
 * Resultado del integrador: tres series alineadas con el eje de profundidad [kPa].
 * <p>
 * La tensión efectiva se deriva siempre como {@code total - presión intersticial}, muestra a muestra.
 * Puede ser negativa (filtración ascendente intensa); recortarla es tarea de la capa de presentación.
 *
 * @param depths          Profundidades [m].
 * @param totalStress     Tensión vertical total σ [kPa].
 * @param porePressure    Presión intersticial u [kPa].
 * @param effectiveStress Tensión vertical efectiva σ' [kPa].
 */
public record StressProfile(
        double[] depths,
        double[] totalStress,
        double[] porePressure,
        double[] effectiveStress
) {

    public StressProfile {
        Objects.requireNonNull(depths, "El array de profundidades no puede ser nulo.");
        Objects.requireNonNull(totalStress, "El array de tensión total no puede ser nulo.");
        Objects.requireNonNull(porePressure, "El array de presión intersticial no puede ser nulo.");
        Objects.requireNonNull(effectiveStress, "El array de tensión efectiva no puede ser nulo.");

        int length = depths.length;
        if (totalStress.length != length || porePressure.length != length || effectiveStress.length != length) {
            throw new IllegalArgumentException("Todas las series del perfil deben tener la longitud del eje de profundidad.");
        }

        depths = depths.clone();
        totalStress = totalStress.clone();
        porePressure = porePressure.clone();
        effectiveStress = effectiveStress.clone();
    }

    /**
     * Construye el perfil calculando la tensión efectiva a partir de la total y la intersticial.
     */
    public static StressProfile of(double[] depths, double[] totalStress, double[] porePressure) {
        Objects.requireNonNull(totalStress, "El array de tensión total no puede ser nulo.");
        Objects.requireNonNull(porePressure, "El array de presión intersticial no puede ser nulo.");
        if (totalStress.length != porePressure.length) {
            throw new IllegalArgumentException("Las series de tensión total y presión intersticial deben tener la misma longitud.");
        }
        double[] effective = new double[totalStress.length];
        for (int i = 0; i < effective.length; i++) {
            effective[i] = totalStress[i] - porePressure[i];
        }
        return new StressProfile(depths, totalStress, porePressure, effective);
    }

    @Override
    public double[] depths() {
        return depths.clone();
    }

    @Override
    public double[] totalStress() {
        return totalStress.clone();
    }

    @Override
    public double[] porePressure() {
        return porePressure.clone();
    }

    @Override
    public double[] effectiveStress() {
        return effectiveStress.clone();
    }

    public int size() {
        return depths.length;
    }

    public double depthAt(int index) {
        return depths[index];
    }

    public double totalStressAt(int index) {
        return totalStress[index];
    }

    public double porePressureAt(int index) {
        return porePressure[index];
    }

    public double effectiveStressAt(int index) {
        return effectiveStress[index];
    }

    /**
     * Mínimo de las tres series; límite inferior del eje de tensiones al dibujar.
     */
    public double minValue() {
        return Math.min(min(totalStress), Math.min(min(porePressure), min(effectiveStress)));
    }

    /**
     * Máximo de las tres series; límite superior del eje de tensiones al dibujar.
     */
    public double maxValue() {
        return Math.max(max(totalStress), Math.max(max(porePressure), max(effectiveStress)));
    }

    private static double min(double[] values) {
        return Arrays.stream(values).min().orElse(0.0);
    }

    private static double max(double[] values) {
        return Arrays.stream(values).max().orElse(0.0);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        StressProfile that = (StressProfile) o;
        return Arrays.equals(depths, that.depths) &&
                Arrays.equals(totalStress, that.totalStress) &&
                Arrays.equals(porePressure, that.porePressure) &&
                Arrays.equals(effectiveStress, that.effectiveStress);
    }

    @Override
    public int hashCode() {
        int result = Arrays.hashCode(depths);
        result = 31 * result + Arrays.hashCode(totalStress);
        result = 31 * result + Arrays.hashCode(porePressure);
        result = 31 * result + Arrays.hashCode(effectiveStress);
        return result;
    }

    @Override
    public String toString() {
        return "StressProfile[samples=" + depths.length + "]";
    }
}
