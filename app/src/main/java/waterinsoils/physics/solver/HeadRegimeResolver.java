package waterinsoils.physics.solver;

import waterinsoils.domain.profile.PiezometerColumn;
import waterinsoils.domain.soil.Regime;
import waterinsoils.domain.soil.ResolvedGeometry;
import waterinsoils.physics.i.IRegimeResolver;

import static waterinsoils.config.PhysicalConstants.GAMMA_WATER;
import static waterinsoils.config.PhysicalConstants.HEAD_TOLERANCE;

/**
 * Resolvedor de régimen por comparación de cargas.
 * <p>
 * Toma como carga equivalente en la base de la arcilla {@code S = h1 + z2 + z3} y la compara con
 * la carga {@code h3} de la arena inferior. El gradiente de exceso se normaliza por el espesor de la
 * arcilla y usa {@code max(h3, z3)}: si el nivel de Sand-2 queda por debajo de su techo, la base de
 * la arcilla drena libremente (u = 0) en lugar de quedar en succión.
 * <p>
 * Clase sin estado, thread safe.
 */
public class HeadRegimeResolver implements IRegimeResolver {

    @Override
    public String getName() {
        return "Head-Comparison";
    }

    @Override
    public String getDescription() {
        return "Clasificación S = h1 + z2 + z3 frente a h3, gradiente (S - max(h3, z3)) / z2";
    }

    @Override
    public ResolvedGeometry resolve(double z1, double z2, double z3, double h1, double h3) {
        // 1. Saneado de geometría: espesor negativo = estrato ausente
        final double t1 = Math.max(0.0, z1);
        final double t2 = Math.max(0.0, z2);
        final double t3 = Math.max(0.0, z3);
        final double totalDepth = t1 + t2 + t3;

        // Sin estrato no hay piezómetro
        final double head1 = (t1 <= 0.0) ? 0.0 : Math.max(0.0, h1);
        final double head3 = (t3 <= 0.0) ? 0.0 : Math.max(0.0, h3);

        // 2. Clasificación
        final double equivalentHead = head1 + t2 + t3;
        final Regime regime = classify(equivalentHead, head3, t2, t3);

        final double excessGradient = switch (regime) {
            case BALANCED -> 0.0;
            case UPWARD, DOWNWARD -> (equivalentHead - Math.max(head3, t3)) / t2;
        };

        // 3. Anclajes de contorno
        final double waterTableDepth = t1 - head1;
        final double lowerPiezometricDepth = totalDepth - head3;
        final double poreAtClayTop = GAMMA_WATER * head1;
        final double poreAtClayBottom = switch (regime) {
            case BALANCED -> GAMMA_WATER * (t1 + t2 - waterTableDepth);
            case UPWARD, DOWNWARD -> GAMMA_WATER * Math.max(head3 - t3, 0.0);
        };

        return ResolvedGeometry.builder()
                .regime(regime)
                .z1(t1)
                .z2(t2)
                .z3(t3)
                .h1(head1)
                .h3(head3)
                .equivalentHead(equivalentHead)
                .excessGradient(excessGradient)
                .waterTableDepth(waterTableDepth)
                .lowerPiezometricDepth(lowerPiezometricDepth)
                .porePressureAtClayTop(poreAtClayTop)
                .porePressureAtClayBottom(poreAtClayBottom)
                .upperPiezometer(new PiezometerColumn("h₁", t1, t1 - head1))
                .lowerPiezometer(new PiezometerColumn("h₃", totalDepth, totalDepth - head3))
                .build();
    }

    /**
     * Sin arcilla (o sin arena inferior) no hay gradiente que transmitir: la columna es hidrostática.
     */
    static Regime classify(double equivalentHead, double head3, double clayThickness, double sand2Thickness) {
        if (clayThickness <= 0.0 || sand2Thickness <= 0.0) {
            return Regime.BALANCED;
        }
        double difference = equivalentHead - head3;
        if (Math.abs(difference) <= HEAD_TOLERANCE) {
            return Regime.BALANCED;
        }
        return difference > 0.0 ? Regime.UPWARD : Regime.DOWNWARD;
    }
}
