package com.sheetdoc.app.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sheetdoc.app.evaluation.SheetEvaluator;
import com.sheetdoc.app.evaluation.functions.FunctionLibrary;
import com.sheetdoc.app.sheetdoc.SheetContentParser;
import com.sheetdoc.app.sheetdoc.SheetDocCodec;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the formula engine and the SheetDoc codec. None of them hold
 * per-sheet state, so singletons are shared by all requests.
 */
@Configuration
@EnableConfigurationProperties(SheetProperties.class)
public class EngineConfiguration {

    @Bean
    public FunctionLibrary functionLibrary() {
        return FunctionLibrary.standard();
    }

    @Bean
    public SheetEvaluator sheetEvaluator(FunctionLibrary functionLibrary, SheetProperties sheetProperties) {
        return new SheetEvaluator(functionLibrary, sheetProperties.getMaxRangeCells());
    }

    @Bean
    public SheetDocCodec sheetDocCodec(SheetEvaluator sheetEvaluator) {
        return new SheetDocCodec(sheetEvaluator);
    }

    @Bean
    public SheetContentParser sheetContentParser(SheetDocCodec sheetDocCodec, ObjectMapper objectMapper) {
        return new SheetContentParser(sheetDocCodec, objectMapper);
    }
}
