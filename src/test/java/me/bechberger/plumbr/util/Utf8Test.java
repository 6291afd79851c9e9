package me.bechberger.plumbr.util;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.assertEquals;

class Utf8Test {

    @ParameterizedTest
    @ValueSource(strings = {
        "",
        "plain ascii",
        "grüße",
        "日本語のログ",
        "emoji 😀 in text",
        "\uD800 unpaired high",
        "unpaired low \uDC00",
        "reversed \uDC00\uD800 pair",
        "mixed é 日 😀 end"
    })
    void matchesJdkEncoder(String text) {
        assertEquals(text.getBytes(StandardCharsets.UTF_8).length, Utf8.encodedLength(text));
    }
}
