package com.abcft.pdfstruct.core;

import com.abcft.pdfstruct.util.MapUtils;

import java.util.Map;

/**
 * Parameters shared by every processing stage.
 */
public abstract class ExtractParameters {

    public abstract static class Builder<T extends ExtractParameters> {

        int startPageIndex = 0;
        int endPageIndex = Integer.MAX_VALUE;
        boolean debug;

        public Builder() {
        }

        public Builder(Map<String, String> params) {
            this.startPageIndex = MapUtils.getInt(params, "startPage", 1) - 1;
            this.endPageIndex = MapUtils.getInt(params, "endPage", Integer.MAX_VALUE);
            if (this.endPageIndex != Integer.MAX_VALUE) {
                this.endPageIndex -= 1;
            }
            this.debug = MapUtils.getBoolean(params, "debug", false);
        }

        /**
         * Sets the page index to process.
         *
         * @param pageIndex the index of the page (0-based) to process.
         * @return this builder.
         */
        public Builder<T> setPageIndex(int pageIndex) {
            this.startPageIndex = pageIndex;
            this.endPageIndex = pageIndex;
            return this;
        }

        /**
         * Sets the start page index to process.
         *
         * Default value is 0.
         *
         * @param startPageIndex the index of the first page (0-based) to process.
         * @return this builder.
         */
        public Builder<T> setStartPageIndex(int startPageIndex) {
            this.startPageIndex = startPageIndex;
            return this;
        }

        /**
         * Sets the last page index to process.
         *
         * Default value is {@value Integer#MAX_VALUE}.
         *
         * @param endPageIndex the index of the last page (0-based) to process.
         * @return this builder.
         */
        public Builder<T> setEndPageIndex(int endPageIndex) {
            this.endPageIndex = endPageIndex;
            return this;
        }

        /**
         * sets whether we should run in debug mode.
         *
         * @param debug true if we wants to run in debug mode.
         * @return this builder.
         */
        public Builder<T> setDebug(boolean debug) {
            this.debug = debug;
            return this;
        }

        public abstract T build();
    }

    public final int startPageIndex;
    public final int endPageIndex;
    public final boolean debug;

    protected ExtractParameters(Builder<?> builder) {
        if (builder.startPageIndex < 0 || builder.endPageIndex < builder.startPageIndex) {
            throw new IllegalArgumentException(String.format("Bad page range: [%d, %d]",
                    builder.startPageIndex, builder.endPageIndex));
        }
        this.startPageIndex = builder.startPageIndex;
        this.endPageIndex = builder.endPageIndex;
        this.debug = builder.debug;
    }

    protected <TBuilder extends Builder<?>> TBuilder buildUpon(TBuilder builder) {
        builder.setStartPageIndex(startPageIndex)
                .setEndPageIndex(endPageIndex)
                .setDebug(debug);
        return builder;
    }

    /**
     * Creates a builder initialized with the values of this object.
     */
    public abstract Builder<? extends ExtractParameters> buildUpon();

    /**
     * @param pageNumber 1-based page number.
     * @return whether the page lies inside the configured page range.
     */
    public boolean acceptsPage(int pageNumber) {
        int pageIndex = pageNumber - 1;
        return pageIndex >= startPageIndex && pageIndex <= endPageIndex;
    }

}
