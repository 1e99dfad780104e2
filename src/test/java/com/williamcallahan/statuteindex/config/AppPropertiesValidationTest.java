package com.williamcallahan.statuteindex.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import java.util.Set;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

/**
 * Verifies bean validation constraints on the application properties.
 */
class AppPropertiesValidationTest {

    private static ValidatorFactory validatorFactory;
    private static Validator validator;

    @BeforeAll
    static void createValidator() {
        validatorFactory = Validation.buildDefaultValidatorFactory();
        validator = validatorFactory.getValidator();
    }

    @AfterAll
    static void closeValidator() {
        validatorFactory.close();
    }

    @Test
    void defaultsAreValid() {
        assertTrue(validator.validate(new AppProperties()).isEmpty());
    }

    @Test
    void rejectsBlankCollection() {
        AppProperties appProperties = new AppProperties();
        appProperties.getLegislation().setCollection(" ");

        Set<ConstraintViolation<AppProperties>> violations = validator.validate(appProperties);

        assertEquals(1, violations.size());
        assertEquals("legislation.collection", violations.iterator().next().getPropertyPath().toString());
    }

    @Test
    void rejectsNonPositiveDiscoveryPageLimit() {
        AppProperties appProperties = new AppProperties();
        appProperties.getIngestion().setDiscoveryPageLimit(0);

        Set<ConstraintViolation<AppProperties>> violations = validator.validate(appProperties);

        assertEquals(1, violations.size());
        assertEquals("discoveryPageLimit must be at least 1", violations.iterator().next().getMessage());
    }

    @Test
    void rejectsNonPositiveSearchLimit() {
        AppProperties appProperties = new AppProperties();
        appProperties.getSearch().setMaxLimit(0);

        assertEquals(1, validator.validate(appProperties).size());
    }
}
