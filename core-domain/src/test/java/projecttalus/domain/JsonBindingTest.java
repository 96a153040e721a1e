package projecttalus.domain;

import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import projecttalus.domain.circle.FailureCircle;
import projecttalus.domain.circle.SearchBounds;
import projecttalus.domain.terrain.SoilLayer;
import projecttalus.domain.terrain.SoilProfile;
import projecttalus.domain.terrain.TerrainProfile;
import projecttalus.domain.terrain.WaterTable;
import projecttalus.exception.ParameterException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Las formas de datos externas deben poder leerse y escribirse con Jackson
 * sin adaptadores, pasando por las mismas validaciones que los constructores.
 */
class JsonBindingTest {

    private ObjectMapper mapper;

    @BeforeEach
    void setUp() {
        mapper = new ObjectMapper();
    }

    @Test
    @DisplayName("Debería leer un perfil de terreno y conservar el orden de los puntos")
    void readTerrain() throws Exception {
        String json = """
                {
                  "points": [ {"x": 0, "y": 12}, {"x": 25, "y": 8}, {"x": 40, "y": 0} ]
                }
                """;

        TerrainProfile terrain = mapper.readValue(json, TerrainProfile.class);

        assertThat(terrain).isEqualTo(TerrainProfile.of(0, 12, 25, 8, 40, 0));
    }

    @Test
    @DisplayName("Un perfil inválido se rechaza al deserializar")
    void readInvalidTerrain() {
        String json = """
                { "points": [ {"x": 5, "y": 1}, {"x": 2, "y": 0} ] }
                """;

        assertThatThrownBy(() -> mapper.readValue(json, TerrainProfile.class))
                .isInstanceOf(JsonMappingException.class)
                .hasRootCauseInstanceOf(ParameterException.class);
    }

    @Test
    @DisplayName("Un estrato sin cota de muro se interpreta como ilimitado")
    void readUnboundedLayer() throws Exception {
        String json = """
                { "name": "Arcilla", "cohesion": 15, "frictionAngleDegrees": 20, "unitWeight": 19 }
                """;

        SoilLayer layer = mapper.readValue(json, SoilLayer.class);

        assertThat(layer.isUnbounded()).isTrue();
        assertThat(layer.cohesion()).isEqualTo(15.0);
    }

    @Test
    @DisplayName("Ida y vuelta de perfil estratigráfico, nivel freático, círculo y límites")
    void roundTrip() throws Exception {
        SoilProfile soil = new SoilProfile(java.util.List.of(
                SoilLayer.bounded("Relleno", 5, 30, 18, 6.0),
                SoilLayer.bounded("Arcilla", 20, 22, 19, 2.0)));
        WaterTable water = new WaterTable(TerrainProfile.of(0, 6, 40, 0), 9.81);
        FailureCircle circle = FailureCircle.of(22, 2.67, 13);
        SearchBounds bounds = new SearchBounds(11.2, 32.2, 10.4, 20.0, 6.4, 24.0);

        assertThat(mapper.readValue(mapper.writeValueAsString(soil), SoilProfile.class)).isEqualTo(soil);
        assertThat(mapper.readValue(mapper.writeValueAsString(water), WaterTable.class)).isEqualTo(water);
        assertThat(mapper.readValue(mapper.writeValueAsString(circle), FailureCircle.class)).isEqualTo(circle);
        assertThat(mapper.readValue(mapper.writeValueAsString(bounds), SearchBounds.class)).isEqualTo(bounds);
    }
}
