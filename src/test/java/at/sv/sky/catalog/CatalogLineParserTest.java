package at.sv.sky.catalog;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class CatalogLineParserTest {

    @Test
    void parse_tabSeparated_allColumns() {
        CatalogTarget target = CatalogLineParser.parse(
                "M42\tM 42\tEmission Nebula\t5.5881\t-5.3908\t4.0\t85\tOrion\tOrion Nebula");

        assertThat(target.getId()).isEqualTo("M42");
        assertThat(target.getName()).isEqualTo("M 42");
        assertThat(target.getType()).isEqualTo("Emission Nebula");
        assertThat(target.getRa()).isEqualTo(5.5881);
        assertThat(target.getDec()).isEqualTo(-5.3908);
        assertThat(target.getMagnitude()).isEqualTo(4.0);
        assertThat(target.getSize()).isEqualTo(85.0);
        assertThat(target.getConstellation()).isEqualTo("Orion");
        assertThat(target.getCommonName()).isEqualTo("Orion Nebula");
        assertThat(target.getDisplayName()).isEqualTo("M 42 (Orion Nebula)");
        assertThat(target.getDistance()).isNull();
    }

    @Test
    void parse_distanceColumn() {
        CatalogTarget target = CatalogLineParser.parse(
                "M31\tM 31\tSpiral Galaxy\t0.7123\t41.2689\t3.4\t178\tAndromeda\tAndromeda Galaxy\t2537000");

        assertThat(target.getDistance()).isEqualTo(2537000.0);
        assertThat(CatalogLineParser.parse(
                "M31\tM 31\tSpiral Galaxy\t0.7123\t41.2689\t3.4\t178\tAndromeda\tAndromeda Galaxy\tfar")).isNull();
    }

    @Test
    void parse_spaceSeparated_sexagesimalCoordinates() {
        CatalogTarget target = CatalogLineParser.parse(
                "NGC7000  North America  Emission Nebula  20h 59m 17.1s  +44° 31' 44\"");

        assertThat(target.getId()).isEqualTo("NGC7000");
        assertThat(target.getName()).isEqualTo("North America");
        assertThat(target.getRa()).isCloseTo(20.988083, within(1e-6));
        assertThat(target.getDec()).isCloseTo(44.528889, within(1e-6));
        assertThat(target.getMagnitude()).isNull();
        assertThat(target.hasMagnitude()).isFalse();
        assertThat(target.getDisplayName()).isEqualTo("North America");
    }

    @Test
    void parse_dashMarksEmptyOptionalColumn() {
        CatalogTarget target = CatalogLineParser.parse("M2\tM 2\tGlobular Cluster\t21.5575\t-0.8232\t6.5\t-\tAquarius\t-");

        assertThat(target.getSize()).isNull();
        assertThat(target.getConstellation()).isEqualTo("Aquarius");
        assertThat(target.getCommonName()).isNull();
    }

    @Test
    void parse_malformed_null() {
        assertThat(CatalogLineParser.parse("M1\tM 1\tSupernova Remnant\t5.5755")).isNull();
        assertThat(CatalogLineParser.parse("M1\tM 1\tSupernova Remnant\tabc\t22.0")).isNull();
        assertThat(CatalogLineParser.parse("M1\tM 1\tSupernova Remnant\t25.0\t22.0")).isNull();
        assertThat(CatalogLineParser.parse("M1\tM 1\tSupernova Remnant\t5.5\t-91")).isNull();
        assertThat(CatalogLineParser.parse("M1\tM 1\tSupernova Remnant\t5.5\t22.0\tbright")).isNull();
    }

    @Test
    void parse_commentsAndBlankLines_null() {
        assertThat(CatalogLineParser.parse("# id name type")).isNull();
        assertThat(CatalogLineParser.parse("   ")).isNull();
        assertThat(CatalogLineParser.parse(null)).isNull();
        assertThat(CatalogLineParser.isSkippable("  # comment")).isTrue();
        assertThat(CatalogLineParser.isSkippable("M1")).isFalse();
    }
}
