package com.abcft.pdfstruct.core.table;

import com.google.common.collect.ImmutableMap;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TableDetectionParametersTest {

    @Test
    void shouldUseDefaults() {
        TableDetectionParameters params = TableDetectionParameters.defaults();

        assertThat(params.columnCoverageThreshold).isEqualTo(0.5);
        assertThat(params.rowCoverageThreshold).isEqualTo(0.5);
        assertThat(params.subsumptionThreshold).isEqualTo(0.5);
        assertThat(params.boundaryTolerance).isEqualTo(1.0);
        assertThat(params.maxConcurrentPages).isEqualTo(4);
        assertThat(params.coordinateSystem).isEqualTo(CoordinateSystem.BOTTOM_UP);
        assertThat(params.acceptsPage(1)).isTrue();
        assertThat(params.acceptsPage(10_000)).isTrue();
    }

    @Test
    void shouldReadParametersFromMap() {
        Map<String, String> map = ImmutableMap.<String, String>builder()
                .put("table.columnCoverage", "0.6")
                .put("table.rowCoverage", "0.7")
                .put("table.subsumption", "0.8")
                .put("table.boundaryTolerance", "2")
                .put("table.maxConcurrentPages", "8")
                .put("table.coordinateSystem", "top_down")
                .put("startPage", "2")
                .put("endPage", "3")
                .put("debug", "1")
                .build();

        TableDetectionParameters params = new TableDetectionParameters.Builder(map).build();

        assertThat(params.columnCoverageThreshold).isEqualTo(0.6);
        assertThat(params.rowCoverageThreshold).isEqualTo(0.7);
        assertThat(params.subsumptionThreshold).isEqualTo(0.8);
        assertThat(params.boundaryTolerance).isEqualTo(2.0);
        assertThat(params.maxConcurrentPages).isEqualTo(8);
        assertThat(params.coordinateSystem).isEqualTo(CoordinateSystem.TOP_DOWN);
        assertThat(params.debug).isTrue();
        assertThat(params.acceptsPage(1)).isFalse();
        assertThat(params.acceptsPage(2)).isTrue();
        assertThat(params.acceptsPage(3)).isTrue();
        assertThat(params.acceptsPage(4)).isFalse();
    }

    @Test
    void shouldIgnoreUnparsableValues() {
        TableDetectionParameters params = new TableDetectionParameters.Builder(
                ImmutableMap.of("table.columnCoverage", "lots", "table.coordinateSystem", "sideways")).build();

        assertThat(params.columnCoverageThreshold).isEqualTo(0.5);
        assertThat(params.coordinateSystem).isEqualTo(CoordinateSystem.BOTTOM_UP);
    }

    @Test
    void shouldCopyWithBuildUpon() {
        TableDetectionParameters params = new TableDetectionParameters.Builder()
                .setSubsumptionThreshold(0.9)
                .setMaxConcurrentPages(1)
                .build();

        TableDetectionParameters copy = params.buildUpon().setBoundaryTolerance(0.5).build();

        assertThat(copy.subsumptionThreshold).isEqualTo(0.9);
        assertThat(copy.maxConcurrentPages).isEqualTo(1);
        assertThat(copy.boundaryTolerance).isEqualTo(0.5);
        assertThat(params.boundaryTolerance).isEqualTo(1.0);
    }

    @Test
    void shouldRejectInvalidValues() {
        assertThatThrownBy(() -> new TableDetectionParameters.Builder().setColumnCoverageThreshold(0).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("columnCoverageThreshold");
        assertThatThrownBy(() -> new TableDetectionParameters.Builder().setSubsumptionThreshold(1.5).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new TableDetectionParameters.Builder().setBoundaryTolerance(-1).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new TableDetectionParameters.Builder().setMaxConcurrentPages(0).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new TableDetectionParameters.Builder().setStartPageIndex(3).setEndPageIndex(1).build())
                .isInstanceOf(IllegalArgumentException.class);
    }

}
