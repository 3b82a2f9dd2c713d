package waterinsoils.domain.soil;

/**
 * Régimen de flujo en la arcilla confinante.
 * <p>
 * Se clasifica comparando la carga equivalente {@code S = h1 + z2 + z3} (la que tendría la
 * base de la arcilla si estuviera en continuidad hidráulica con la arena superior) con la
 * carga {@code h3} de la arena inferior.
 */
public enum Regime {

    /**
     * {@code S == h3}, o bien falta la arcilla o la arena inferior: reparto puramente hidrostático
     * desde el nivel freático de la arena superior.
     */
    BALANCED,

    /**
     * {@code S > h3}: exceso de carga sobre la arcilla respecto a la arena inferior.
     * La presión intersticial crece en la arcilla más despacio que la hidrostática.
     */
    UPWARD,

    /**
     * {@code S < h3}: déficit de carga sobre la arcilla (condición artesiana en la arena inferior).
     * La presión intersticial crece en la arcilla más deprisa que la hidrostática.
     */
    DOWNWARD
}
