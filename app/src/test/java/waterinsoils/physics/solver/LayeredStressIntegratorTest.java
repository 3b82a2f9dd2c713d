package waterinsoils.physics.solver;

import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import waterinsoils.config.SoilProfileConfig;
import waterinsoils.domain.profile.DepthAxis;
import waterinsoils.domain.profile.StressProfile;
import waterinsoils.domain.soil.ResolvedGeometry;
import waterinsoils.domain.soil.SoilStratigraphy;
import waterinsoils.factory.DepthAxisFactory;

import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Pruebas unitarias para {@link LayeredStressIntegrator}.
 * Los valores esperados se obtienen a mano con γw = 10 kN/m³ y los pesos del perfil de pruebas
 * (γ1 = 18/19, γ2 = 19/21, γ3 = 18/19 kN/m³).
 */
@Slf4j
class LayeredStressIntegratorTest {

    private static final double TOLERANCE = 1e-9;

    private HeadRegimeResolver resolver;
    private LayeredStressIntegrator integrator;

    @BeforeEach
    void setUp() {
        resolver = new HeadRegimeResolver();
        integrator = new LayeredStressIntegrator();
    }

    private StressProfile integrate(SoilProfileConfig config, double... depths) {
        SoilStratigraphy layers = config.stratigraphy();
        ResolvedGeometry geometry = resolver.resolve(layers, config.heads());
        return integrator.integrate(new DepthAxis(depths), layers, geometry);
    }

    @Test
    @DisplayName("Sand-1: zona seca con γ seco y zona saturada con γ saturado bajo z1 - h1")
    void integrate_upperSand_shouldSplitAtWaterTable() {
        // ARRANGE: nivel freático a 1 m
        SoilProfileConfig config = SoilProfileConfig.getTestingProfile();

        // ACT
        StressProfile profile = integrate(config, 0.0, 0.5, 1.0, 1.5, 2.0);

        // ASSERT
        assertArrayEquals(new double[]{0.0, 9.0, 18.0, 27.5, 37.0}, profile.totalStress(), TOLERANCE);
        assertArrayEquals(new double[]{0.0, 0.0, 0.0, 5.0, 10.0}, profile.porePressure(), TOLERANCE);
    }

    @Test
    @DisplayName("DOWNWARD: la presión en la arcilla crece más deprisa que la hidrostática y enlaza con Sand-2")
    void integrate_downward_shouldLinkClayAnchors() {
        SoilProfileConfig config = SoilProfileConfig.getTestingProfile();

        StressProfile profile = integrate(config, 2.0, 3.0, 4.0, 5.0, 6.0);

        assertArrayEquals(new double[]{10.0, 27.5, 45.0, 55.0, 65.0}, profile.porePressure(), TOLERANCE);
        assertArrayEquals(new double[]{37.0, 58.0, 79.0, 98.0, 117.0}, profile.totalStress(), TOLERANCE);
        assertArrayEquals(new double[]{27.0, 30.5, 34.0, 43.0, 52.0}, profile.effectiveStress(), TOLERANCE);
    }

    @Test
    @DisplayName("UPWARD con h3 < z3: la arcilla drena hacia una arena inferior con nivel interior")
    void integrate_upwardWithLowerHeadInsideSand_shouldHoldThenRiseHydrostatically() {
        // ARRANGE: h1 = z1 (freático en superficie), h3 = 1 m < z3
        SoilProfileConfig config = SoilProfileConfig.getTestingProfile().withH1(2.0).withH3(1.0);

        // ACT
        StressProfile profile = integrate(config, 0.0, 2.0, 3.0, 4.0, 4.5, 5.0, 5.5, 6.0);

        // ASSERT
        assertArrayEquals(new double[]{0.0, 20.0, 10.0, 0.0, 0.0, 0.0, 5.0, 10.0}, profile.porePressure(), TOLERANCE);
        assertArrayEquals(new double[]{0.0, 38.0, 59.0, 80.0, 89.5, 99.0, 108.5, 118.0}, profile.totalStress(), TOLERANCE);
        assertEquals(10.0 * config.h3(), profile.porePressureAt(profile.size() - 1), TOLERANCE);
    }

    @Test
    @DisplayName("UPWARD con h3 > z3: una sola recta hidrostática en Sand-2 desde el contacto")
    void integrate_upwardWithLowerHeadAboveSand_shouldUseSingleHydrostaticLine() {
        SoilProfileConfig config = SoilProfileConfig.getTestingProfile().withH1(2.0).withH3(3.0);

        StressProfile profile = integrate(config, 4.0, 5.0, 6.0);

        assertArrayEquals(new double[]{10.0, 20.0, 30.0}, profile.porePressure(), TOLERANCE);
    }

    @Test
    @DisplayName("UPWARD con Sand-1 seca (h1 = 0): la arcilla sólo se satura bajo el nivel piezométrico de Sand-2")
    void integrate_upwardWithDryUpperSand_shouldHoldClayPressureUntilLowerPiezometricLevel() {
        // ARRANGE: S = 4 > h3 = 3, nivel piezométrico de Sand-2 a 6 - 3 = 3 m
        SoilProfileConfig config = SoilProfileConfig.getTestingProfile().withH1(0.0).withH3(3.0);

        // ACT
        StressProfile profile = integrate(config, 0.0, 2.0, 3.0, 3.5, 4.0, 5.0, 6.0);

        // ASSERT
        assertArrayEquals(new double[]{0.0, 0.0, 0.0, 5.0, 10.0, 20.0, 30.0}, profile.porePressure(), TOLERANCE);
        assertArrayEquals(new double[]{0.0, 36.0, 57.0, 67.5, 78.0, 97.0, 116.0}, profile.totalStress(), TOLERANCE);
    }

    @Test
    @DisplayName("UPWARD con Sand-1 seca y h3 < z3: arcilla sin presión y Sand-2 saturada sólo bajo su nivel")
    void integrate_upwardWithDryUpperSandAndLowerHeadInsideSand_shouldKeepClayDry() {
        SoilProfileConfig config = SoilProfileConfig.getTestingProfile().withH1(0.0).withH3(1.0);

        StressProfile profile = integrate(config, 2.0, 3.0, 4.0, 4.5, 5.5, 6.0);

        assertArrayEquals(new double[]{0.0, 0.0, 0.0, 0.0, 5.0, 10.0}, profile.porePressure(), TOLERANCE);
    }

    @Test
    @DisplayName("h3 == z3: el tramo seco de Sand-2 tiene longitud nula y no produce errores")
    void integrate_lowerHeadEqualToThickness_shouldNotFail() {
        SoilProfileConfig config = SoilProfileConfig.getTestingProfile().withH3(2.0);

        StressProfile profile = assertDoesNotThrow(() -> integrate(config, 0.0, 2.0, 4.0, 5.0, 6.0));

        for (int i = 0; i < profile.size(); i++) {
            assertTrue(Double.isFinite(profile.porePressureAt(i)), "Presión no finita en la muestra " + i);
        }
        assertEquals(0.0, profile.porePressureAt(2), TOLERANCE, "Base de la arcilla drenada");
        assertEquals(20.0, profile.porePressureAt(4), TOLERANCE, "u(base) = γw h3");
    }

    @Test
    @DisplayName("BALANCED: la presión es hidrostática desde z1 - h1 en toda la columna saturada")
    void integrate_balanced_shouldBePurelyHydrostatic() {
        SoilProfileConfig config = SoilProfileConfig.getTestingProfile().withH3(5.0);
        DepthAxis axis = DepthAxisFactory.createUniform(6.0, 0.05);
        SoilStratigraphy layers = config.stratigraphy();
        ResolvedGeometry geometry = resolver.resolve(layers, config.heads());

        StressProfile profile = integrator.integrate(axis, layers, geometry);

        double waterTable = config.z1() - config.h1();
        for (int i = 0; i < profile.size(); i++) {
            double depth = profile.depthAt(i);
            double expected = depth <= waterTable ? 0.0 : (depth - waterTable) * 10.0;
            assertEquals(expected, profile.porePressureAt(i), 1e-9, "Profundidad " + depth);
        }
    }

    @Test
    @DisplayName("Continuidad: la tensión total no salta en los contactos aunque el eje no los contenga")
    void integrate_shouldBeContinuousAcrossContacts() {
        SoilProfileConfig config = SoilProfileConfig.getTestingProfile();
        double eps = 1e-7;

        StressProfile profile = integrate(config, 2.0 - eps, 2.0, 2.0 + eps, 4.0 - eps, 4.0, 4.0 + eps);

        assertEquals(profile.totalStressAt(1), profile.totalStressAt(0), 1e-5);
        assertEquals(profile.totalStressAt(1), profile.totalStressAt(2), 1e-5);
        assertEquals(profile.totalStressAt(4), profile.totalStressAt(3), 1e-5);
        assertEquals(profile.totalStressAt(4), profile.totalStressAt(5), 1e-5);
        assertEquals(profile.porePressureAt(4), profile.porePressureAt(5), 1e-5, "u continua en el contacto Clay / Sand-2");
    }

    static Stream<Arguments> contactAnchorProfiles() {
        SoilProfileConfig base = SoilProfileConfig.getTestingProfile();
        return Stream.of(
                Arguments.of("DOWNWARD", base),
                Arguments.of("UPWARD h3 < z3", base.withH1(2.0).withH3(1.0)),
                Arguments.of("UPWARD h3 > z3", base.withH1(1.5).withH3(3.0)),
                Arguments.of("UPWARD Sand-1 seca", base.withH1(0.0).withH3(3.0)),
                Arguments.of("BALANCED", base.withH3(5.0)),
                Arguments.of("lámina de agua", base.withH1(3.0).withH3(7.5)),
                Arguments.of("espesores irregulares", base.withZ1(1.13).withZ2(2.071).withZ3(0.9).withH1(0.4).withH3(5.2))
        );
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("contactAnchorProfiles")
    @DisplayName("La presión en los contactos coincide con los anclajes del resolvedor")
    void integrate_contactPressures_shouldMatchResolverAnchors(String name, SoilProfileConfig config) {
        SoilStratigraphy layers = config.stratigraphy();
        ResolvedGeometry geometry = resolver.resolve(layers, config.heads());

        StressProfile profile = integrator.integrate(
                new DepthAxis(new double[]{0.0, geometry.clayTopDepth(), geometry.clayBottomDepth()}), layers, geometry);

        assertEquals(geometry.porePressureAtClayTop(), profile.porePressureAt(1), TOLERANCE, "Contacto Sand-1 / Clay (" + name + ")");
        assertEquals(geometry.porePressureAtClayBottom(), profile.porePressureAt(2), TOLERANCE, "Contacto Clay / Sand-2 (" + name + ")");
    }

    @Test
    @DisplayName("h1 > z1: la lámina de agua actúa como sobrecarga y la tensión efectiva arranca en cero")
    void integrate_pondedWater_shouldActAsSurcharge() {
        SoilProfileConfig config = SoilProfileConfig.getTestingProfile().withH1(3.0).withH3(7.0);

        StressProfile profile = integrate(config, 0.0, 1.0, 2.0);

        log.info("σ con lámina de 1 m: {}", profile.totalStress());
        assertArrayEquals(new double[]{10.0, 29.0, 48.0}, profile.totalStress(), TOLERANCE);
        assertArrayEquals(new double[]{10.0, 20.0, 30.0}, profile.porePressure(), TOLERANCE);
        assertEquals(0.0, profile.effectiveStressAt(0), TOLERANCE);
    }

    @Test
    @DisplayName("Arcilla ausente: Sand-2 continúa directamente desde el contacto con Sand-1")
    void integrate_missingClay_shouldContinueFromUpperSand() {
        SoilProfileConfig config = SoilProfileConfig.getTestingProfile().withZ2(0.0).withH3(10.0);

        StressProfile profile = integrate(config, 0.0, 2.0, 3.0, 4.0);

        assertArrayEquals(new double[]{0.0, 37.0, 56.0, 75.0}, profile.totalStress(), TOLERANCE);
        assertArrayEquals(new double[]{0.0, 10.0, 20.0, 30.0}, profile.porePressure(), TOLERANCE);
    }

    @Test
    @DisplayName("Columna vacía: una única muestra nula")
    void integrate_emptyStack_shouldReturnSingleZeroSample() {
        SoilProfileConfig config = SoilProfileConfig.getTestingProfile().withZ1(0).withZ2(0).withZ3(0);

        StressProfile profile = integrate(config, 0.0);

        assertArrayEquals(new double[]{0.0}, profile.totalStress());
        assertArrayEquals(new double[]{0.0}, profile.porePressure());
        assertArrayEquals(new double[]{0.0}, profile.effectiveStress());
    }
}
