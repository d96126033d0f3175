package com.spreadsheet.calc.config;

import com.spreadsheet.calc.models.Grid;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(SpreadsheetProperties.class)
public class GridConfig {

    @Bean
    public Grid grid(SpreadsheetProperties properties) {
        return new Grid(properties.getGrid().getMaxColumns(), properties.getGrid().getMaxRows());
    }
}
