package com.finplan.plananalysis.sheet;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@DisplayName("NumericValues Tests")
class NumericValuesTest {

    @Test
    @DisplayName("Should parse plain and comma decimal numbers")
    void shouldParseDecimals() {
        assertThat(NumericValues.parse("45.00")).hasValue(45.0);
        assertThat(NumericValues.parse("-3,5")).hasValue(-3.5);
    }

    @Test
    @DisplayName("Should collapse European thousands groups")
    void shouldCollapseThousandsGroups() {
        assertThat(NumericValues.parse("1.234,56").getAsDouble()).isCloseTo(1234.56, within(1e-9));
        assertThat(NumericValues.parse("1.234.567,00").getAsDouble()).isCloseTo(1234567.0, within(1e-9));
    }

    @Test
    @DisplayName("Should strip currency symbols and spaces")
    void shouldStripCurrencyAndSpaces() {
        assertThat(NumericValues.parse("€ 1 200")).hasValue(1200.0);
        assertThat(NumericValues.parse("$99")).hasValue(99.0);
        assertThat(NumericValues.parse("1 500")).hasValue(1500.0);
    }

    @Test
    @DisplayName("Should read only the leading number")
    void shouldReadLeadingNumber() {
        assertThat(NumericValues.parse("12 EUR")).hasValue(12.0);
        assertThat(NumericValues.parse("25%")).hasValue(25.0);
    }

    @Test
    @DisplayName("Should treat text, blanks and null as not numeric")
    void shouldRejectNonNumeric() {
        assertThat(NumericValues.parse("Groceries")).isEmpty();
        assertThat(NumericValues.parse("")).isEmpty();
        assertThat(NumericValues.parse(null)).isEmpty();
        assertThat(NumericValues.isNumeric("n/a")).isFalse();
        assertThat(NumericValues.valueOrZero("n/a")).isZero();
    }
}
