package com.spreadsheet.calc.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Settings under the "spreadsheet" prefix, e.g.
 * <pre>
 * spreadsheet.grid.max-columns=26
 * spreadsheet.grid.max-rows=99
 * spreadsheet.api.base-path=/api
 * </pre>
 */
@ConfigurationProperties(prefix = "spreadsheet")
public class SpreadsheetProperties {

    private final GridSettings grid = new GridSettings();
    private final ApiSettings api = new ApiSettings();

    public GridSettings getGrid() {
        return grid;
    }

    public ApiSettings getApi() {
        return api;
    }

    public static class GridSettings {
        private int maxColumns = 26;
        private int maxRows = 99;

        public int getMaxColumns() {
            return maxColumns;
        }

        public void setMaxColumns(int maxColumns) {
            this.maxColumns = maxColumns;
        }

        public int getMaxRows() {
            return maxRows;
        }

        public void setMaxRows(int maxRows) {
            this.maxRows = maxRows;
        }
    }

    public static class ApiSettings {
        private String basePath = "/api";

        public String getBasePath() {
            return basePath;
        }

        public void setBasePath(String basePath) {
            this.basePath = basePath;
        }
    }
}
