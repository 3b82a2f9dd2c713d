package waterinsoils.domain.soil;

import java.util.Objects;

/**
 * Columna estratigráfica fija de tres estratos: arena, arcilla y arena.
 * <p>
 * Las profundidades de contacto se derivan de los espesores efectivos, de modo que un
 * estrato con espesor nulo o negativo desaparece sin desplazar a los demás.
 */
public record SoilStratigraphy(LayerSpec sand1, LayerSpec clay, LayerSpec sand2) {

    public SoilStratigraphy {
        Objects.requireNonNull(sand1, "El estrato Sand-1 no puede ser nulo.");
        Objects.requireNonNull(clay, "El estrato Clay no puede ser nulo.");
        Objects.requireNonNull(sand2, "El estrato Sand-2 no puede ser nulo.");
    }

    public LayerSpec layer(SoilLayerType type) {
        return switch (type) {
            case SAND_1 -> sand1;
            case CLAY -> clay;
            case SAND_2 -> sand2;
        };
    }

    /**
     * Profundidad del contacto Sand-1 / Clay [m].
     */
    public double clayTopDepth() {
        return sand1.effectiveThickness();
    }

    /**
     * Profundidad del contacto Clay / Sand-2 [m].
     */
    public double clayBottomDepth() {
        return clayTopDepth() + clay.effectiveThickness();
    }

    /**
     * Profundidad de la base de la columna [m].
     */
    public double totalDepth() {
        return clayBottomDepth() + sand2.effectiveThickness();
    }
}
