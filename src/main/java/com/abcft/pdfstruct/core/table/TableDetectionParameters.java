package com.abcft.pdfstruct.core.table;

import com.abcft.pdfstruct.core.ExtractParameters;
import com.abcft.pdfstruct.util.MapUtils;

import java.util.Map;

/**
 * Parameters for table detection and reconstruction.
 */
public final class TableDetectionParameters extends ExtractParameters {

    public static final double DEFAULT_COVERAGE_THRESHOLD = 0.5;
    public static final double DEFAULT_BOUNDARY_TOLERANCE = 1.0;
    public static final int DEFAULT_MAX_CONCURRENT_PAGES = 4;

    public static final class Builder extends ExtractParameters.Builder<TableDetectionParameters> {

        // 单元格覆盖某一列宽度超过该比例时，认为覆盖该列
        double columnCoverageThreshold = DEFAULT_COVERAGE_THRESHOLD;
        double rowCoverageThreshold = DEFAULT_COVERAGE_THRESHOLD;
        // 页面元素与表格区域重叠超过该比例时，被表格吞并
        double subsumptionThreshold = DEFAULT_COVERAGE_THRESHOLD;
        double boundaryTolerance = DEFAULT_BOUNDARY_TOLERANCE;
        int maxConcurrentPages = DEFAULT_MAX_CONCURRENT_PAGES;
        CoordinateSystem coordinateSystem = CoordinateSystem.BOTTOM_UP;

        public Builder() {
        }

        public Builder(Map<String, String> params) {
            super(params);
            this.columnCoverageThreshold = MapUtils.getDouble(params, "table.columnCoverage", columnCoverageThreshold);
            this.rowCoverageThreshold = MapUtils.getDouble(params, "table.rowCoverage", rowCoverageThreshold);
            this.subsumptionThreshold = MapUtils.getDouble(params, "table.subsumption", subsumptionThreshold);
            this.boundaryTolerance = MapUtils.getDouble(params, "table.boundaryTolerance", boundaryTolerance);
            this.maxConcurrentPages = MapUtils.getInt(params, "table.maxConcurrentPages", maxConcurrentPages);
            this.coordinateSystem = MapUtils.getEnum(params, "table.coordinateSystem",
                    CoordinateSystem.class, coordinateSystem);
        }

        public Builder setColumnCoverageThreshold(double columnCoverageThreshold) {
            this.columnCoverageThreshold = columnCoverageThreshold;
            return this;
        }

        public Builder setRowCoverageThreshold(double rowCoverageThreshold) {
            this.rowCoverageThreshold = rowCoverageThreshold;
            return this;
        }

        public Builder setSubsumptionThreshold(double subsumptionThreshold) {
            this.subsumptionThreshold = subsumptionThreshold;
            return this;
        }

        public Builder setBoundaryTolerance(double boundaryTolerance) {
            this.boundaryTolerance = boundaryTolerance;
            return this;
        }

        public Builder setMaxConcurrentPages(int maxConcurrentPages) {
            this.maxConcurrentPages = maxConcurrentPages;
            return this;
        }

        public Builder setCoordinateSystem(CoordinateSystem coordinateSystem) {
            this.coordinateSystem = coordinateSystem;
            return this;
        }

        @Override
        public TableDetectionParameters build() {
            return new TableDetectionParameters(this);
        }
    }

    private TableDetectionParameters(Builder builder) {
        super(builder);
        checkRatio("columnCoverageThreshold", builder.columnCoverageThreshold);
        checkRatio("rowCoverageThreshold", builder.rowCoverageThreshold);
        checkRatio("subsumptionThreshold", builder.subsumptionThreshold);
        if (builder.boundaryTolerance < 0) {
            throw new IllegalArgumentException("boundaryTolerance must be >= 0: " + builder.boundaryTolerance);
        }
        if (builder.maxConcurrentPages < 1) {
            throw new IllegalArgumentException("maxConcurrentPages must be >= 1: " + builder.maxConcurrentPages);
        }
        this.columnCoverageThreshold = builder.columnCoverageThreshold;
        this.rowCoverageThreshold = builder.rowCoverageThreshold;
        this.subsumptionThreshold = builder.subsumptionThreshold;
        this.boundaryTolerance = builder.boundaryTolerance;
        this.maxConcurrentPages = builder.maxConcurrentPages;
        this.coordinateSystem = builder.coordinateSystem;
    }

    private static void checkRatio(String name, double value) {
        if (!(value > 0 && value <= 1)) {
            throw new IllegalArgumentException(name + " must be in (0, 1]: " + value);
        }
    }

    public static TableDetectionParameters defaults() {
        return new Builder().build();
    }

    @Override
    public Builder buildUpon() {
        return buildUpon(new Builder())
                .setColumnCoverageThreshold(columnCoverageThreshold)
                .setRowCoverageThreshold(rowCoverageThreshold)
                .setSubsumptionThreshold(subsumptionThreshold)
                .setBoundaryTolerance(boundaryTolerance)
                .setMaxConcurrentPages(maxConcurrentPages)
                .setCoordinateSystem(coordinateSystem);
    }

    public final double columnCoverageThreshold;
    public final double rowCoverageThreshold;
    public final double subsumptionThreshold;
    public final double boundaryTolerance;
    public final int maxConcurrentPages;
    public final CoordinateSystem coordinateSystem;

}
