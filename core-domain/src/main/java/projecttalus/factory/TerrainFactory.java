package projecttalus.factory;

import lombok.extern.slf4j.Slf4j;
import projecttalus.domain.terrain.TerrainPoint;
import projecttalus.domain.terrain.TerrainProfile;
import projecttalus.domain.terrain.WaterTable;
import projecttalus.exception.ParameterException;

import java.util.List;

/**
 * Construcción de perfiles de terreno tipo a partir de unos pocos parámetros.
 */
@Slf4j
public final class TerrainFactory {

    private TerrainFactory() {
        // Clase de utilidad
    }

    /**
     * Talud simple: meseta de coronación a la izquierda, paramento recto que
     * desciende hacia +x y meseta de pie.
     *
     * @param height         Altura del talud H [m].
     * @param angleDegrees   Inclinación del paramento β [°].
     * @param crestExtension Longitud de la meseta de coronación [m].
     * @param toeExtension   Longitud de la meseta de pie [m].
     * @return Perfil (0, H), (a, H), (a + H/tan β, 0), (a + H/tan β + b, 0).
     */
    public static TerrainProfile simpleSlope(double height, double angleDegrees,
                                            double crestExtension, double toeExtension) {
        if (!(height > 0) || Double.isInfinite(height)) {
            throw new ParameterException("height", height, "La altura del talud debe ser > 0");
        }
        if (!(angleDegrees > 0 && angleDegrees < 90)) {
            throw new ParameterException("angleDegrees", angleDegrees, "La inclinación debe estar en (0°, 90°)");
        }
        if (!(crestExtension > 0) || !(toeExtension > 0)) {
            throw new ParameterException(String.format(
                    "Las mesetas deben tener longitud > 0 (coronación = %s, pie = %s)", crestExtension, toeExtension));
        }
        double run = height / Math.tan(Math.toRadians(angleDegrees));
        double toeX = crestExtension + run;
        log.debug("Talud simple H = {} m, β = {}°, pie en x = {}", height, angleDegrees, toeX);
        return new TerrainProfile(List.of(
                TerrainPoint.of(0.0, height),
                TerrainPoint.of(crestExtension, height),
                TerrainPoint.of(toeX, 0.0),
                TerrainPoint.of(toeX + toeExtension, 0.0)));
    }

    /**
     * Nivel freático horizontal que cubre todo el perfil.
     */
    public static WaterTable horizontalWaterTable(TerrainProfile terrain, double elevation) {
        if (!Double.isFinite(elevation)) {
            throw new ParameterException("elevation", elevation, "Cota del nivel freático no finita");
        }
        return new WaterTable(new TerrainProfile(List.of(
                TerrainPoint.of(terrain.getMinX(), elevation),
                TerrainPoint.of(terrain.getMaxX(), elevation))));
    }
}
