package com.example.cablebox.application.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.example.cablebox.common.exception.BusinessException;
import com.example.cablebox.common.exception.StationErrorCodes;
import com.example.cablebox.domain.model.StationRules;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Arrays;
import javax.validation.Validation;
import javax.validation.ValidatorFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class StationRulesParserTest {

    private ValidatorFactory validatorFactory;
    private StationRulesParser parser;

    @BeforeEach
    void setUp() {
        validatorFactory = Validation.buildDefaultValidatorFactory();
        parser = new StationRulesParser(new ObjectMapper(), validatorFactory.getValidator());
    }

    @AfterEach
    void tearDown() {
        validatorFactory.close();
    }

    @Test
    void shouldReturnDefaultsForMissingRules() {
        StationRules rules = parser.parse(null);

        assertEquals(24, rules.getAvoidRepeatHours());
        assertEquals(3, rules.getArtistSeparation());
        assertTrue(rules.isTuneInEnabled());
        assertEquals(0.6D, rules.getTuneInMaxFraction());
        assertTrue(rules.getIncludeGenres().isEmpty());
        assertNull(rules.getYearRange());
    }

    @Test
    void shouldNormalizeNameLists() {
        StationRules rules = parser.parse("{\"includeGenres\":[\" Rock \",\"rock\",\"Indie   Pop\",\"\"]}");

        assertEquals(Arrays.asList("Rock", "Indie Pop"), rules.getIncludeGenres());
    }

    @Test
    void shouldAcceptLegacyKeys() {
        StationRules rules = parser.parse("{\"genresInclude\":[\"Jazz\"],\"artistsExclude\":[\"Noise\"],"
                + "\"yearMin\":1990,\"yearMax\":1999,\"durationMaxSec\":420,"
                + "\"avoidSameArtistWithinTracks\":5,\"unknownFlag\":true}");

        assertEquals(Arrays.asList("Jazz"), rules.getIncludeGenres());
        assertEquals(Arrays.asList("Noise"), rules.getExcludeArtists());
        assertEquals(Integer.valueOf(1990), rules.getYearRange().getMin());
        assertEquals(Integer.valueOf(1999), rules.getYearRange().getMax());
        assertNull(rules.getDurationRange().getMinSec());
        assertEquals(Integer.valueOf(420), rules.getDurationRange().getMaxSec());
        assertEquals(5, rules.getArtistSeparation());
    }

    @Test
    void shouldFallBackToLegacyKeyWhenCurrentKeyIsNull() {
        StationRules rules = parser.parse("{\"artistSeparation\":null,\"avoidSameArtistWithinTracks\":5,"
                + "\"includeGenres\":null,\"genresInclude\":[\"Jazz\"]}");

        assertEquals(5, rules.getArtistSeparation());
        assertEquals(Arrays.asList("Jazz"), rules.getIncludeGenres());
    }

    @Test
    void shouldPreferCurrentKeyOverLegacyKey() {
        StationRules rules = parser.parse("{\"artistSeparation\":7,\"avoidSameArtistWithinTracks\":5}");

        assertEquals(7, rules.getArtistSeparation());
    }

    @Test
    void shouldUseDefaultsForExplicitNulls() {
        StationRules rules = parser.parse("{\"artistSeparation\":null,\"avoidRepeatHours\":null,"
                + "\"tuneInEnabled\":null,\"tuneInMaxFraction\":null,\"tuneInMinHeadSec\":null,"
                + "\"tuneInMinTailSec\":null,\"tuneInProbability\":null,\"includeArtists\":null}");

        assertEquals(3, rules.getArtistSeparation());
        assertEquals(24, rules.getAvoidRepeatHours());
        assertTrue(rules.isTuneInEnabled());
        assertEquals(0.6D, rules.getTuneInMaxFraction());
        assertEquals(8, rules.getTuneInMinHeadSec());
        assertEquals(20, rules.getTuneInMinTailSec());
        assertEquals(0.9D, rules.getTuneInProbability());
        assertTrue(rules.getIncludeArtists().isEmpty());
    }

    @Test
    void shouldRejectInvertedYearRange() {
        BusinessException error = assertThrows(BusinessException.class,
                () -> parser.parse("{\"yearRange\":{\"min\":2001,\"max\":1999}}"));

        assertEquals(StationErrorCodes.STATION_RULES_INVALID, error.getCode());
    }

    @Test
    void shouldRejectOutOfRangeValues() {
        assertThrows(BusinessException.class, () -> parser.parse("{\"avoidRepeatHours\":500}"));
        assertThrows(BusinessException.class, () -> parser.parse("{\"tuneInProbability\":1.5}"));
    }

    @Test
    void shouldRejectMalformedJson() {
        BusinessException notJson = assertThrows(BusinessException.class, () -> parser.parse("{oops"));
        BusinessException notObject = assertThrows(BusinessException.class, () -> parser.parse("[1,2]"));

        assertEquals(StationErrorCodes.STATION_RULES_INVALID, notJson.getCode());
        assertEquals(StationErrorCodes.STATION_RULES_INVALID, notObject.getCode());
    }
}
