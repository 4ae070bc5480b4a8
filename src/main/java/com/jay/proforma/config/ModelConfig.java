package com.jay.proforma.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.jay.proforma.model.WaterfallTier;
import jakarta.annotation.PostConstruct;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;

/**
 * Loads and exposes the calculation settings from proforma.yaml.
 * Values are read once at startup. Every section carries defaults, so a ModelConfig
 * created with {@code new} is usable without the file (engine unit tests rely on this).
 */
@Slf4j
@Component
public class ModelConfig {

    @Value("${proforma.config-file:proforma.yaml}")
    private String configFile = "proforma.yaml";

    // ── Sections ──────────────────────────────────────────────────────────────
    private Solver solver = new Solver();
    private Defaults defaults = new Defaults();
    private Waterfall waterfall = new Waterfall();
    private Validation validation = new Validation();

    @PostConstruct
    public void load() {
        try {
            ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
            mapper.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
            mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
            InputStream is = getClass().getClassLoader().getResourceAsStream(configFile);
            if (is == null) {
                log.warn("Config file '{}' not found on classpath — using defaults", configFile);
                return;
            }
            ConfigRoot root;
            try (is) {
                root = mapper.readValue(is, ConfigRoot.class);
            }
            if (root.getSolver() != null)     this.solver     = root.getSolver();
            if (root.getDefaults() != null)   this.defaults   = root.getDefaults();
            if (root.getWaterfall() != null)  this.waterfall  = root.getWaterfall();
            if (root.getValidation() != null) this.validation = root.getValidation();
            log.info("ModelConfig loaded from '{}'. Waterfall tiers: {}, circular references: {}",
                configFile, waterfall.getTiers().size(), defaults.isCircularReferences());
        } catch (Exception e) {
            log.error("Failed to load {} — calculations will use defaults: {}", configFile, e.getMessage());
        }
    }

    // ── Accessors ─────────────────────────────────────────────────────────────
    public Solver solver()         { return solver; }
    public Defaults defaults()     { return defaults; }
    public Waterfall waterfall()   { return waterfall; }
    public Validation validation() { return validation; }

    // ── Config POJOs ──────────────────────────────────────────────────────────

    @Data public static class ConfigRoot {
        private Solver solver;
        private Defaults defaults;
        private Waterfall waterfall;
        private Validation validation;
    }

    @Data public static class Solver {
        private double initialGuess = 0.10;
        private double tolerance = 1e-7;
        private int maxIterations = 100;
        private double bisectionLow = -0.99;
        private double bisectionHigh = 10.0;
        private int bisectionIterations = 200;
    }

    @Data public static class Defaults {
        private boolean circularReferences = true;
        private boolean actual365 = true;
        private boolean simpleMonthlyPref = false;
        private double discountRate = 0.10;
    }

    @Data public static class Waterfall {
        private List<WaterfallTier> tiers = new ArrayList<>(List.of(
            new WaterfallTier("Hurdle I",    0.05, 0.90, 0.10,   0.0),
            new WaterfallTier("Hurdle II",   0.05, 0.75, 0.0833, 0.1667),
            new WaterfallTier("Hurdle III",  0.05, 0.75, 0.0833, 0.1667),
            new WaterfallTier("Final Split", 0.0,  0.75, 0.0833, 0.1667)
        ));
    }

    @Data public static class Validation {
        private double areaTolerance = 0.5;
        private double splitTolerance = 1e-6;
        private double amountTolerance = 0.01;
    }
}
