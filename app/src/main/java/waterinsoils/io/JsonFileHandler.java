package waterinsoils.io;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;
import waterinsoils.config.SoilProfileConfig;
import waterinsoils.domain.profile.StressProfileResult;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Objects;

/**
 * Intercambio de perfiles con la capa de dibujo mediante archivos JSON.
 * <p>
 * Entrada: {@link SoilProfileConfig} con los valores de los controles. Salida: {@link StressProfileResult}
 * con las series alineadas con el eje de profundidad, el régimen y las anotaciones. Los archivos de salida
 * no se vuelven a leer como objetos de dominio; {@link #readTree(String)} permite inspeccionarlos.
 */
@Slf4j
public class JsonFileHandler {

    // Costoso de crear y thread-safe: una única instancia compartida.
    private static final ObjectMapper objectMapper = createConfiguredObjectMapper();

    private static ObjectMapper createConfiguredObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
        mapper.findAndRegisterModules();
        return mapper;
    }

    /**
     * Lee la configuración de un perfil. Los campos ausentes valen 0, salvo que el paso de profundidad
     * resultante no sea positivo, en cuyo caso la validación del record aborta la lectura.
     *
     * @param filePath Ruta del archivo (ej: "profiles/artesian.json").
     * @throws IOException Si el archivo no existe, no es JSON válido o describe una configuración inválida.
     */
    public SoilProfileConfig readConfig(String filePath) throws IOException {
        SoilProfileConfig config = read(filePath, SoilProfileConfig.class, "configuración de perfil");
        log.debug("Configuración leída: z = {}/{}/{} m, h1 = {} m, h3 = {} m, paso = {} m",
                config.z1(), config.z2(), config.z3(), config.h1(), config.h3(), config.depthStep());
        return config;
    }

    public void writeConfig(SoilProfileConfig config, String filePath) throws IOException {
        write(config, filePath, "configuración de perfil");
    }

    /**
     * Escribe un resultado completo. Si el archivo ya existe, se sobrescribe.
     */
    public void writeResult(StressProfileResult result, String filePath) throws IOException {
        log.info("Resultado a exportar: régimen {}, {} muestras hasta {} m",
                result.regime(), result.profile().size(), result.geometry().totalDepth());
        write(result, filePath, "perfil de tensiones");
    }

    /**
     * Árbol JSON de un archivo ya escrito, sin ligarlo a un tipo de dominio.
     */
    public JsonNode readTree(String filePath) throws IOException {
        return read(filePath, JsonNode.class, "resultado exportado");
    }

    private <T> void write(T data, String filePath, String description) throws IOException {
        Objects.requireNonNull(data, "Los datos a escribir (" + description + ") no pueden ser nulos.");
        Path path = Paths.get(filePath);
        log.info("Escribiendo {} en {}", description, path.toAbsolutePath());

        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writeValue(path.toFile(), data);
            log.debug("Escritura de {} completada.", description);
        } catch (IOException e) {
            log.error("No se pudo escribir {} en {}", description, path.toAbsolutePath(), e);
            throw e;
        }
    }

    private <T> T read(String filePath, Class<T> type, String description) throws IOException {
        Path path = Paths.get(filePath);
        log.info("Leyendo {} desde {}", description, path.toAbsolutePath());

        if (!Files.exists(path)) {
            throw new IOException("No existe el archivo de " + description + ": " + path.toAbsolutePath());
        }

        try {
            return objectMapper.readValue(path.toFile(), type);
        } catch (IOException e) {
            log.error("No se pudo interpretar {} desde {}", description, path.toAbsolutePath(), e);
            throw e;
        }
    }
}
