package waterinsoils.physics.solver;

import waterinsoils.domain.profile.DepthAxis;
import waterinsoils.domain.profile.StressProfile;
import waterinsoils.domain.soil.LayerSpec;
import waterinsoils.domain.soil.ResolvedGeometry;
import waterinsoils.domain.soil.SoilStratigraphy;
import waterinsoils.physics.i.IProfileIntegrator;

import static waterinsoils.config.PhysicalConstants.GAMMA_WATER;

/**
 * Integrador por tramos de la tensión total y la presión intersticial.
 * <p>
 * Recorre el eje de profundidad como una máquina de estados monótona
 * (Sand-1 → Clay → Sand-2). Los estados en los contactos {@code z1} y {@code z1 + z2} se fijan en la
 * cota exacta del contacto y se pasan al estrato siguiente, de modo que el resultado no depende de
 * que el eje contenga muestras justo en los contactos. La presión intersticial de ambos contactos es
 * la que entrega el resolvedor; aquí sólo se acumula la tensión total.
 * <p>
 * Clase sin estado, thread safe.
 */
public class LayeredStressIntegrator implements IProfileIntegrator {

    /**
     * Estado acumulado en una cota: lo que un estrato entrega al siguiente.
     */
    private record BoundaryState(double depth, double totalStress, double porePressure) {
    }

    @Override
    public String getName() {
        return "Piecewise-Layered";
    }

    @Override
    public String getDescription() {
        return "Integración por estratos con anclajes de contorno explícitos en z1 y z1 + z2";
    }

    @Override
    public StressProfile integrate(DepthAxis depthAxis, SoilStratigraphy layers, ResolvedGeometry geometry) {
        final int sampleCount = depthAxis.size();
        final double[] depths = depthAxis.depths();
        final double[] totalStress = new double[sampleCount];
        final double[] porePressure = new double[sampleCount];

        // 1. Anclajes en los contactos: tensión total acumulada, presión intersticial del resolvedor
        final BoundaryState clayTop = new BoundaryState(
                geometry.clayTopDepth(),
                sand1State(geometry.clayTopDepth(), layers.sand1(), geometry).totalStress(),
                geometry.porePressureAtClayTop());
        final BoundaryState clayBottom = new BoundaryState(
                geometry.clayBottomDepth(),
                clayTop.totalStress() + geometry.z2() * layers.clay().saturatedUnitWeight(),
                geometry.porePressureAtClayBottom());

        // 2. Recorrido en profundidad
        for (int i = 0; i < sampleCount; i++) {
            double depth = depths[i];
            BoundaryState state;
            if (depth <= geometry.clayTopDepth()) {
                state = sand1State(depth, layers.sand1(), geometry);
            } else if (depth <= geometry.clayBottomDepth()) {
                state = clayState(depth, clayTop, clayBottom, layers.clay(), geometry);
            } else {
                state = sand2State(depth, clayBottom, layers.sand2(), geometry);
            }
            totalStress[i] = state.totalStress();
            porePressure[i] = state.porePressure();
        }

        return StressProfile.of(depths, totalStress, porePressure);
    }

    /**
     * Sand-1: zona seca sobre el nivel freático {@code z1 - h1} y zona saturada bajo él.
     * Si la carga supera el espesor del estrato, la lámina de agua sobre la superficie actúa
     * como sobrecarga tanto en la tensión total como en la intersticial.
     */
    private BoundaryState sand1State(double depth, LayerSpec sand1, ResolvedGeometry geometry) {
        final double waterTable = geometry.waterTableDepth();

        if (depth <= waterTable) {
            return new BoundaryState(depth, depth * sand1.dryUnitWeight(), 0.0);
        }

        final double pondedWater = GAMMA_WATER * Math.max(0.0, -waterTable);
        final double dryThickness = Math.max(0.0, waterTable);
        double total = pondedWater
                + dryThickness * sand1.dryUnitWeight()
                + (depth - dryThickness) * sand1.saturatedUnitWeight();
        double pore = (depth - waterTable) * GAMMA_WATER;
        return new BoundaryState(depth, total, pore);
    }

    /**
     * Clay: la tensión total continúa con el peso saturado. La presión intersticial es hidrostática
     * en régimen equilibrado y, en los demás, la recta que une los dos anclajes (pendiente
     * {@code γw (1 - i)}). Con Sand-1 seca la arcilla no recibe flujo desde el techo: la presión se
     * mantiene en la del techo hasta el nivel piezométrico de Sand-2 y crece hidrostática bajo él.
     */
    private BoundaryState clayState(double depth, BoundaryState top, BoundaryState bottom,
                                    LayerSpec clay, ResolvedGeometry geometry) {
        final double distance = depth - top.depth();
        double total = top.totalStress() + distance * clay.saturatedUnitWeight();

        double pore = switch (geometry.regime()) {
            case BALANCED -> (depth - geometry.waterTableDepth()) * GAMMA_WATER;
            case UPWARD, DOWNWARD -> geometry.hasDryUpperSand()
                    ? drainedClayPorePressure(depth, top, geometry)
                    : top.porePressure() + (bottom.porePressure() - top.porePressure()) * distance / geometry.z2();
        };
        return new BoundaryState(depth, total, pore);
    }

    private double drainedClayPorePressure(double depth, BoundaryState top, ResolvedGeometry geometry) {
        final double piezometricDepth = geometry.lowerPiezometricDepth();
        if (depth <= piezometricDepth) {
            return top.porePressure();
        }
        return (depth - piezometricDepth) * GAMMA_WATER;
    }

    /**
     * Sand-2: la tensión total continúa con el peso saturado. La presión intersticial depende de
     * dónde queda el nivel piezométrico {@code z1 + z2 + z3 - h3} respecto al techo del estrato.
     */
    private BoundaryState sand2State(double depth, BoundaryState top, LayerSpec sand2, ResolvedGeometry geometry) {
        final double distance = depth - top.depth();
        double total = top.totalStress() + distance * sand2.saturatedUnitWeight();

        double pore = switch (geometry.regime()) {
            case BALANCED -> (depth - geometry.waterTableDepth()) * GAMMA_WATER;
            case UPWARD, DOWNWARD -> confinedSandPorePressure(depth, top, geometry);
        };
        return new BoundaryState(depth, total, pore);
    }

    private double confinedSandPorePressure(double depth, BoundaryState top, ResolvedGeometry geometry) {
        // h3 >= z3: el nivel piezométrico está en el techo o por encima, una única recta hidrostática.
        // Rama separada para no operar con un tramo seco de longitud nula.
        if (geometry.h3() >= geometry.z3()) {
            return top.porePressure() + (depth - top.depth()) * GAMMA_WATER;
        }

        final double piezometricDepth = geometry.lowerPiezometricDepth();
        if (depth <= piezometricDepth) {
            return top.porePressure();
        }
        return top.porePressure() + (depth - piezometricDepth) * GAMMA_WATER;
    }
}
