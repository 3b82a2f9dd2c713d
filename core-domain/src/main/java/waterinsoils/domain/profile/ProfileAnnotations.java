package waterinsoils.domain.profile;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Puntos de anclaje que la capa de presentación necesita para dibujar la columna y el gráfico de presiones.
 *
 * @param layerBands       Estratos presentes, de arriba abajo.
 * @param upperPiezometer  Piezómetro de la arena superior (h₁).
 * @param lowerPiezometer  Piezómetro de la arena inferior (h₃).
 * @param plotTopDepth     Cota superior del eje de profundidad [m] (negativa, por encima de la superficie).
 * @param seepageArrow     Anotación de la arcilla, o {@code null} si no procede.
 * @param referenceLines   Rectas hidrostáticas de referencia.
 */
public record ProfileAnnotations(
        List<LayerBand> layerBands,
        PiezometerColumn upperPiezometer,
        PiezometerColumn lowerPiezometer,
        double plotTopDepth,
        SeepageArrow seepageArrow,
        List<ReferenceLine> referenceLines
) {

    public ProfileAnnotations {
        Objects.requireNonNull(layerBands, "La lista de estratos no puede ser nula.");
        Objects.requireNonNull(upperPiezometer, "El piezómetro superior no puede ser nulo.");
        Objects.requireNonNull(lowerPiezometer, "El piezómetro inferior no puede ser nulo.");
        Objects.requireNonNull(referenceLines, "La lista de rectas de referencia no puede ser nula.");
        layerBands = List.copyOf(layerBands);
        referenceLines = List.copyOf(referenceLines);
    }

    public Optional<SeepageArrow> findSeepageArrow() {
        return Optional.ofNullable(seepageArrow);
    }

    public Optional<ReferenceLine> findReferenceLine(String name) {
        return referenceLines.stream().filter(line -> line.name().equals(name)).findFirst();
    }
}
