package com.edugen.common.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TokenCounterTest {

    @Test
    void should_EstimateFourCharsPerToken() {
        assertThat(TokenCounter.countTokens("abcdefgh")).isEqualTo(2);
        assertThat(TokenCounter.countTokens("abcdefghi")).isEqualTo(3);
    }

    @Test
    void should_CountZero_When_TextIsEmptyOrNull() {
        assertThat(TokenCounter.countTokens("")).isZero();
        assertThat(TokenCounter.countTokens(null)).isZero();
    }
}
