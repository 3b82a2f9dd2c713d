package waterinsoils.physics.simulator;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import waterinsoils.config.SoilProfileConfig;
import waterinsoils.domain.profile.DepthAxis;
import waterinsoils.domain.profile.EffectiveUnitWeights;
import waterinsoils.domain.profile.ProfileAnnotations;
import waterinsoils.domain.profile.StressProfile;
import waterinsoils.domain.profile.StressProfileResult;
import waterinsoils.domain.soil.ResolvedGeometry;
import waterinsoils.domain.soil.SoilStratigraphy;
import waterinsoils.factory.DepthAxisFactory;
import waterinsoils.factory.ProfileAnnotationFactory;
import waterinsoils.physics.i.IProfileIntegrator;
import waterinsoils.physics.i.IRegimeResolver;
import waterinsoils.physics.model.EffectiveUnitWeightModel;
import waterinsoils.physics.solver.HeadRegimeResolver;
import waterinsoils.physics.solver.LayeredStressIntegrator;

import java.util.Objects;

/**
 * Orquesta un recálculo completo del perfil de tensiones.
 * Facade de alto nivel sobre {@link IRegimeResolver} e {@link IProfileIntegrator}.
 * <p>
 * Cada llamada a {@link #calculate(SoilProfileConfig)} es una función pura de la configuración:
 * no hay estado entre llamadas, así que una misma instancia puede compartirse entre hilos.
 * El debounce de cambios rápidos en los controles es responsabilidad del llamador.
 */
@Slf4j
public class StressProfileCalculator {

    @Getter
    private final IRegimeResolver resolver;
    @Getter
    private final IProfileIntegrator integrator;

    private final EffectiveUnitWeightModel unitWeightModel;
    private final ProfileAnnotationFactory annotationFactory;

    public StressProfileCalculator() {
        this(new HeadRegimeResolver(), new LayeredStressIntegrator());
    }

    public StressProfileCalculator(IRegimeResolver resolver, IProfileIntegrator integrator) {
        this.resolver = Objects.requireNonNull(resolver, "El resolvedor de régimen no puede ser nulo.");
        this.integrator = Objects.requireNonNull(integrator, "El integrador no puede ser nulo.");
        this.unitWeightModel = new EffectiveUnitWeightModel();
        this.annotationFactory = new ProfileAnnotationFactory();

        log.info("StressProfileCalculator inicializado. Resolver={}, Integrator={}",
                resolver.getName(), integrator.getName());
    }

    public StressProfileResult calculate(SoilProfileConfig config) {
        Objects.requireNonNull(config, "La configuración del perfil no puede ser nula.");

        // 1. Régimen y anclajes de contorno
        SoilStratigraphy layers = config.stratigraphy();
        ResolvedGeometry geometry = resolver.resolve(layers, config.heads());

        // 2. Eje de profundidad sobre la geometría saneada
        DepthAxis depthAxis = DepthAxisFactory.createUniform(geometry.totalDepth(), config.depthStep());

        // 3. Integración en profundidad
        StressProfile profile = integrator.integrate(depthAxis, layers, geometry);

        // 4. Cálculos auxiliares para la presentación
        EffectiveUnitWeights unitWeights = unitWeightModel.calculate(layers, geometry);
        ProfileAnnotations annotations = annotationFactory.create(geometry);

        if (log.isDebugEnabled()) {
            int last = profile.size() - 1;
            log.debug("Perfil calculado: régimen={}, S={} m, h3={} m, muestras={}, u(base)={} kPa, σ'(base)={} kPa",
                    geometry.regime(), geometry.equivalentHead(), geometry.h3(), profile.size(),
                    profile.porePressureAt(last), profile.effectiveStressAt(last));
        }

        return StressProfileResult.builder()
                .config(config)
                .geometry(geometry)
                .profile(profile)
                .effectiveUnitWeights(unitWeights)
                .annotations(annotations)
                .build();
    }
}
