package waterinsoils.factory;

import waterinsoils.domain.profile.LayerBand;
import waterinsoils.domain.profile.ProfileAnnotations;
import waterinsoils.domain.profile.ReferenceLine;
import waterinsoils.domain.profile.SeepageArrow;
import waterinsoils.domain.soil.ResolvedGeometry;
import waterinsoils.domain.soil.SoilLayerType;

import java.util.ArrayList;
import java.util.List;

import static waterinsoils.config.PhysicalConstants.GAMMA_WATER;
import static waterinsoils.config.PhysicalConstants.HEAD_TOLERANCE;

/**
 * Fábrica de los anclajes de dibujo de la columna y del gráfico de presiones.
 * <p>
 * No interviene en el cálculo del perfil: sólo traduce la geometría resuelta a posiciones
 * que la capa de presentación consume tal cual.
 */
public class ProfileAnnotationFactory {

    /**
     * Cota superior por defecto del eje de profundidad [m], un metro por encima de la superficie.
     */
    private static final double DEFAULT_PLOT_TOP = -1.0;

    /**
     * Longitud de la flecha de filtración como fracción del espesor de la arcilla.
     */
    private static final double ARROW_LENGTH_FRACTION = 0.3;

    public static final String H1_REFERENCE = "h1_hydrostatic";
    public static final String H3_REFERENCE = "h3_hydrostatic";

    public ProfileAnnotations create(ResolvedGeometry geometry) {
        return new ProfileAnnotations(
                layerBands(geometry),
                geometry.upperPiezometer(),
                geometry.lowerPiezometer(),
                plotTopDepth(geometry),
                seepageArrow(geometry),
                referenceLines(geometry));
    }

    private List<LayerBand> layerBands(ResolvedGeometry geometry) {
        List<LayerBand> bands = new ArrayList<>(3);
        addBand(bands, SoilLayerType.SAND_1, 0.0, geometry.clayTopDepth());
        addBand(bands, SoilLayerType.CLAY, geometry.clayTopDepth(), geometry.clayBottomDepth());
        addBand(bands, SoilLayerType.SAND_2, geometry.clayBottomDepth(), geometry.totalDepth());
        return bands;
    }

    private static void addBand(List<LayerBand> bands, SoilLayerType type, double top, double bottom) {
        if (bottom > top) {
            bands.add(new LayerBand(type, type.getDisplayName(), top, bottom));
        }
    }

    /**
     * Si el piezómetro de Sand-2 sobresale de la superficie, el eje se amplía para que quepa entero.
     */
    private double plotTopDepth(ResolvedGeometry geometry) {
        double lowerLevel = geometry.lowerPiezometricDepth();
        if (geometry.h3() != 0.0 && lowerLevel < 0.0) {
            return Math.min(DEFAULT_PLOT_TOP, lowerLevel - 1.0);
        }
        return DEFAULT_PLOT_TOP;
    }

    private SeepageArrow seepageArrow(ResolvedGeometry geometry) {
        if (geometry.z2() <= 0.0) {
            return null;
        }
        final double midDepth = geometry.clayTopDepth() + geometry.z2() / 2.0;
        final double arrowLength = geometry.z2() * ARROW_LENGTH_FRACTION;

        return switch (geometry.regime()) {
            // Carga artesiana bajo la arcilla: la filtración empuja hacia arriba
            case DOWNWARD -> new SeepageArrow(midDepth, midDepth + arrowLength, "- f_s");
            case UPWARD -> geometry.h1() != 0.0
                    ? new SeepageArrow(midDepth, midDepth - arrowLength, "+ f_s")
                    : null;
            case BALANCED -> geometry.h1() != 0.0 && Math.abs(geometry.headDifference()) <= HEAD_TOLERANCE
                    ? new SeepageArrow(midDepth, midDepth, "Hydrostatic")
                    : null;
        };
    }

    private List<ReferenceLine> referenceLines(ResolvedGeometry geometry) {
        List<ReferenceLine> lines = new ArrayList<>(2);
        final double totalDepth = geometry.totalDepth();
        if (geometry.h1() != 0.0) {
            lines.add(new ReferenceLine(H1_REFERENCE,
                    0.0, geometry.waterTableDepth(),
                    geometry.equivalentHead() * GAMMA_WATER, totalDepth));
        }
        lines.add(new ReferenceLine(H3_REFERENCE,
                0.0, geometry.lowerPiezometricDepth(),
                geometry.h3() * GAMMA_WATER, totalDepth));
        return lines;
    }
}
