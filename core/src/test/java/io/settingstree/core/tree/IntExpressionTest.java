package io.settingstree.core.tree;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

@DisplayName("IntExpression")
class IntExpressionTest {

    @ParameterizedTest(name = "{0} = {1}")
    @CsvSource({
        "42, 42",
        "0x10, 16",
        "0xff, 255",
        "4*1024, 4096",
        "1+2*3, 7",
        "(1+2)*3, 9",
        "7/2, 3",
        "-7/2, -3",
        "1|2|4, 7",
        "6&3, 2",
        "1|2&3, 3",
        "!0, 1",
        "!5, 0",
        "-(2+3), -5",
        "(1|4)*0x10, 80"
    })
    void evaluates(String expression, long expected) {
        assertThat(IntExpression.evaluate(expression)).isEqualTo(expected);
    }

    @Test
    @DisplayName("only expression characters make a candidate")
    void candidates() {
        assertThat(IntExpression.isCandidate("4*1024")).isTrue();
        assertThat(IntExpression.isCandidate("4 * 1024")).isFalse();
        assertThat(IntExpression.isCandidate("fast")).isFalse();
    }

    @Test
    @DisplayName("malformed expressions are rejected")
    void malformed() {
        assertThatThrownBy(() -> IntExpression.evaluate("(1+2"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("missing ')'");
        assertThatThrownBy(() -> IntExpression.evaluate("1+"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("unexpected end");
        assertThatThrownBy(() -> IntExpression.evaluate("4/0"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("division by zero");
        assertThatThrownBy(() -> IntExpression.evaluate("12ab"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("unexpected 'a'");
    }

    @Test
    @DisplayName("overflow is an arithmetic error")
    void overflow() {
        assertThatThrownBy(() -> IntExpression.evaluate("0x7fffffffffffffff+1"))
                .isInstanceOf(ArithmeticException.class);
    }
}
