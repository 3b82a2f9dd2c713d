package waterinsoils.physics.model;

import waterinsoils.config.SoilProfileConfig;
import waterinsoils.domain.soil.BoundaryHeads;

/**
 * Política de rangos de los controles de carga.
 * <p>
 * El calculador no revalida las cargas; esta clase la usa quien construye la configuración
 * (los controles de la interfaz) para mantener h1 y h3 dentro de rangos con sentido:
 * <ul>
 * <li>{@code h1 ∈ [0, z1]}: el nivel freático no sube por encima de la superficie.</li>
 * <li>{@code h3 ∈ [0, 1.5 (z1 + z2 + z3)]}.</li>
 * <li>Sin arcilla ({@code z2 = 0}) las dos arenas forman un único acuífero: {@code h3 = h1 + z3}.</li>
 * </ul>
 */
public class BoundaryHeadLimiter {

    /**
     * Margen sobre la profundidad total que se permite a la carga artesiana de Sand-2.
     */
    private static final double H3_RANGE_FACTOR = 1.5;

    public double maxH1(double z1) {
        return Math.max(0.0, z1);
    }

    public double maxH3(double z1, double z2, double z3) {
        return H3_RANGE_FACTOR * (Math.max(0.0, z1) + Math.max(0.0, z2) + Math.max(0.0, z3));
    }

    public BoundaryHeads limit(double z1, double z2, double z3, BoundaryHeads requested) {
        double h1 = clamp(requested.h1(), maxH1(z1));

        double h3 = requested.h3();
        if (z2 <= 0.0 && z3 > 0.0) {
            h3 = h1 + z3;
        }
        h3 = clamp(h3, maxH3(z1, z2, z3));

        return new BoundaryHeads(h1, h3);
    }

    public SoilProfileConfig limit(SoilProfileConfig config) {
        BoundaryHeads limited = limit(config.z1(), config.z2(), config.z3(), config.heads());
        return config.withH1(limited.h1()).withH3(limited.h3());
    }

    private static double clamp(double value, double max) {
        return Math.max(0.0, Math.min(max, value));
    }
}
