package com.geoviewer.aoi.application.mapper;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.geoviewer.aoi.application.dto.AoiDraft;
import com.geoviewer.aoi.domain.model.GeometryType;
import com.geoviewer.aoi.domain.model.MultiPolygonGeometry;
import com.geoviewer.aoi.domain.model.Position;
import jakarta.validation.Validation;
import jakarta.validation.ValidatorFactory;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AoiRequestParserTest {

    private static ValidatorFactory validatorFactory;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private AoiRequestParser parser;

    @BeforeAll
    static void createValidator() {
        validatorFactory = Validation.buildDefaultValidatorFactory();
    }

    @AfterAll
    static void closeValidator() {
        validatorFactory.close();
    }

    @BeforeEach
    void setUp() {
        parser = new AoiRequestParser(objectMapper, validatorFactory.getValidator());
    }

    private AoiDraft parse(String json) throws Exception {
        JsonNode body = objectMapper.readTree(json);
        return parser.parse(body);
    }

    @Test
    void testParse_Feature_UsesPropertiesForNameAndDescription() throws Exception {
        AoiDraft draft = parse("{\"type\":\"Feature\",\"name\":\"ignored\","
            + "\"properties\":{\"name\":\"Downtown\",\"description\":\"Core area\"},"
            + "\"geometry\":{\"type\":\"Point\",\"coordinates\":[91.29,23.84]}}");

        assertThat(draft.getGeometry().getType()).isEqualTo(GeometryType.POINT);
        assertThat(draft.getName()).isEqualTo("Downtown");
        assertThat(draft.getDescription()).isEqualTo("Core area");
    }

    @Test
    void testParse_Wrapper_UsesTopLevelFields() throws Exception {
        AoiDraft draft = parse("{\"name\":\"Field\",\"geometry\":{\"type\":\"MultiPolygon\","
            + "\"coordinates\":[[[[0,0],[1,0],[1,1],[0,0]]],[[[5,5],[6,5],[6,6],[5,5]]]]}}");

        assertThat(draft.getGeometry()).isInstanceOf(MultiPolygonGeometry.class);
        assertThat(((MultiPolygonGeometry) draft.getGeometry()).getCoordinates()).hasSize(2);
        assertThat(draft.getName()).isEqualTo("Field");
        assertThat(draft.getDescription()).isEmpty();
    }

    @Test
    void testParse_BareGeometry_HasEmptyNames() throws Exception {
        AoiDraft draft = parse("{\"type\":\"Polygon\",\"coordinates\":[[[0,0],[1,0],[1,1],[0,1]]]}");

        assertThat(draft.getGeometry().getType()).isEqualTo(GeometryType.POLYGON);
        assertThat(draft.getName()).isEmpty();
        assertThat(draft.getDescription()).isEmpty();
    }

    @Test
    void testParse_EmptyPolygon_ReportsViolation() {
        assertThatThrownBy(() -> parse("{\"type\":\"Polygon\",\"coordinates\":[]}"))
            .isInstanceOfSatisfying(AoiRequestParser.InvalidGeoJsonException.class,
                e -> assertThat(e.getDetails()).anyMatch(d -> d.startsWith("coordinates")));
    }

    @Test
    void testParse_MissingGeometry_Throws() {
        assertThatThrownBy(() -> parse("{\"type\":\"Feature\",\"properties\":{}}"))
            .isInstanceOf(AoiRequestParser.InvalidGeoJsonException.class);
    }

    @Test
    void testParse_NonNumericCoordinate_Throws() {
        assertThatThrownBy(() -> parse("{\"type\":\"Point\",\"coordinates\":[\"east\",1]}"))
            .isInstanceOf(AoiRequestParser.InvalidGeoJsonException.class);
    }

    @Test
    void testParse_NullCoordinate_IsRejectedNotZeroed() {
        assertThatThrownBy(() -> parse(
            "{\"type\":\"Polygon\",\"coordinates\":[[[null,10],[1,0],[1,1],[0,1],[null,10]]]}"))
            .isInstanceOfSatisfying(AoiRequestParser.InvalidGeoJsonException.class,
                e -> assertThat(e.getDetails()).anyMatch(d -> d.contains("two numbers")));
    }

    @Test
    void testParse_NumericStringCoordinate_IsRejectedNotCoerced() {
        assertThatThrownBy(() -> parse("{\"type\":\"Point\",\"coordinates\":[\"12.5\",\"40\"]}"))
            .isInstanceOf(AoiRequestParser.InvalidGeoJsonException.class);
    }

    @Test
    void testParse_ThreeElementPosition_Throws() {
        assertThatThrownBy(() -> parse("{\"type\":\"Point\",\"coordinates\":[1,2,3]}"))
            .isInstanceOf(AoiRequestParser.InvalidGeoJsonException.class);
    }

    @Test
    void testParse_IntegerCoordinates_AreAccepted() throws Exception {
        AoiDraft draft = parse("{\"type\":\"Point\",\"coordinates\":[12,40]}");

        assertThat(draft.getGeometry().getPositions()).containsExactly(new Position(12, 40));
    }

    @Test
    void testParse_ArrayBody_Throws() {
        assertThatThrownBy(() -> parse("[1,2]"))
            .isInstanceOf(AoiRequestParser.InvalidGeoJsonException.class)
            .hasMessage("Invalid GeoJSON");
    }
}
