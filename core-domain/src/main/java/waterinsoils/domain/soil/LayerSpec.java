package waterinsoils.domain.soil;

import lombok.Builder;
import lombok.With;

/**
 * Propiedades de un estrato homogéneo.
 * <p>
 * Físicamente se espera {@code saturatedUnitWeight > dryUnitWeight}, pero no se impone:
 * el cálculo produce siempre un perfil, aunque los datos no sean geotécnicamente razonables.
 *
 * @param thickness           Espesor del estrato [m]. Un valor negativo se trata como estrato ausente.
 * @param dryUnitWeight       Peso específico aparente sobre el nivel freático [kN/m³].
 * @param saturatedUnitWeight Peso específico saturado bajo el nivel freático [kN/m³].
 */
@Builder
@With
public record LayerSpec(
        double thickness,
        double dryUnitWeight,
        double saturatedUnitWeight
) {

    /**
     * Espesor utilizable en el cálculo: los espesores negativos cuentan como cero.
     */
    public double effectiveThickness() {
        return Math.max(0.0, thickness);
    }

    public boolean hasThickness() {
        return thickness > 0.0;
    }
}
