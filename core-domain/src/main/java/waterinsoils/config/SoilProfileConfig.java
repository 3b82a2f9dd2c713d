package waterinsoils.config;

import lombok.Builder;
import lombok.With;
import waterinsoils.domain.soil.BoundaryHeads;
import waterinsoils.domain.soil.LayerSpec;
import waterinsoils.domain.soil.SoilStratigraphy;

/**
 * Objeto de valor inmutable con todos los parámetros de un recálculo del perfil.
 * <p>
 * Corresponde a los valores actuales de los controles de la interfaz: cada cambio produce una
 * configuración nueva y un perfil calculado desde cero.
 *
 * @param z1        Espesor de Sand-1 [m].
 * @param z2        Espesor de Clay [m].
 * @param z3        Espesor de Sand-2 [m].
 * @param h1        Carga piezométrica sobre la base de Sand-1 [m].
 * @param h3        Carga piezométrica sobre la base de Sand-2 [m].
 * @param gamma1    Peso específico seco de Sand-1 [kN/m³].
 * @param gammaR1   Peso específico saturado de Sand-1 [kN/m³].
 * @param gamma2    Peso específico seco de Clay [kN/m³].
 * @param gammaR2   Peso específico saturado de Clay [kN/m³].
 * @param gamma3    Peso específico seco de Sand-2 [kN/m³].
 * @param gammaR3   Peso específico saturado de Sand-2 [kN/m³].
 * @param depthStep Paso del eje de profundidad [m] (> 0).
 */
@Builder
@With
public record SoilProfileConfig(
        // --- Geometría ---
        double z1,
        double z2,
        double z3,

        // --- Cargas piezométricas ---
        double h1,
        double h3,

        // --- Pesos específicos ---
        double gamma1,
        double gammaR1,
        double gamma2,
        double gammaR2,
        double gamma3,
        double gammaR3,

        // --- Discretización ---
        double depthStep
) {

    public SoilProfileConfig {
        if (!(depthStep > 0.0)) {
            throw new IllegalArgumentException("El paso de profundidad debe ser positivo: " + depthStep);
        }
    }

    public SoilStratigraphy stratigraphy() {
        return new SoilStratigraphy(
                new LayerSpec(z1, gamma1, gammaR1),
                new LayerSpec(z2, gamma2, gammaR2),
                new LayerSpec(z3, gamma3, gammaR3));
    }

    public BoundaryHeads heads() {
        return new BoundaryHeads(h1, h3);
    }

    /**
     * Valores iniciales de los controles: columna 2/2/2 m con h1 = 1 m y h3 = 6.5 m.
     */
    public static SoilProfileConfig getTestingProfile() {
        return SoilProfileConfig.builder()
                .z1(2.0)
                .z2(2.0)
                .z3(2.0)
                .h1(1.0)
                .h3(6.5)
                .gamma1(18.0)
                .gammaR1(19.0)
                .gamma2(19.0)
                .gammaR2(21.0)
                .gamma3(18.0)
                .gammaR3(19.0)
                .depthStep(PhysicalConstants.DEFAULT_DEPTH_STEP)
                .build();
    }
}
