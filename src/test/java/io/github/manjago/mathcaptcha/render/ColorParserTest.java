package io.github.manjago.mathcaptcha.render;

import io.github.manjago.mathcaptcha.core.InvalidConfigException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class ColorParserTest {

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource(delimiter = '|', value = {
        "#ffffff       | rgb 1.000 1.000 1.000",
        "#000000       | rgb 0.000 0.000 0.000",
        "FF8000        | rgb 1.000 0.502 0.000",
        "rgb(255,0,0)  | rgb 1.000 0.000 0.000",
        "rgb 0 128 255 | rgb 0.000 0.502 1.000",
        "rgb(0.5,0,1)  | rgb 0.500 0.000 1.000",
        "rgb(1,1,1)    | rgb 1.000 1.000 1.000"
    })
    @DisplayName("Colors become dvipng rgb triplets")
    void parsesColors(String input, String expected) {
        assertEquals(expected, ColorParser.toDvipng(input));
    }

    @ParameterizedTest
    @ValueSource(strings = {"Transparent", "transparent", "TRANSPARENT", "Transparent white"})
    @DisplayName("Transparent passes through unchanged")
    void transparentPassthrough(String input) {
        assertEquals(input, ColorParser.toDvipng(input));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "white", "#fff", "#gggggg", "rgb(1,2)"})
    @DisplayName("Unrecognized colors are rejected")
    void rejectsInvalid(String input) {
        assertThrows(InvalidConfigException.class, () -> ColorParser.toDvipng(input));
    }

    @Test
    @DisplayName("Any channel above 1 scales the whole triplet")
    void mixedScale() {
        // 2 > 1, so 1 is read as 1/255 as well
        assertEquals("rgb 0.004 0.008 0.000", ColorParser.toDvipng("rgb(1,2,0)"));
    }
}
