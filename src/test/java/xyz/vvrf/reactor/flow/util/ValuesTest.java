package xyz.vvrf.reactor.flow.util;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ValuesTest {

    @Test
    void truthiness() {
        assertThat(Values.isTruthy(null)).isFalse();
        assertThat(Values.isTruthy(false)).isFalse();
        assertThat(Values.isTruthy(0)).isFalse();
        assertThat(Values.isTruthy(Double.NaN)).isFalse();
        assertThat(Values.isTruthy("")).isFalse();
        assertThat(Values.isTruthy("false")).isTrue();
        assertThat(Values.isTruthy(Collections.emptyList())).isTrue();
        assertThat(Values.isTruthy(Collections.emptyMap())).isTrue();
    }

    @ParameterizedTest
    @CsvSource({"42, 42.0", "' 3.5 ', 3.5", "-1e2, -100.0"})
    void numericStringsConvert(String text, double expected) {
        assertThat(Values.toNumber(text)).isEqualTo(expected);
    }

    @Test
    void nonNumericValuesBecomeNaN() {
        assertThat(Values.toNumber("abc")).isNaN();
        assertThat(Values.toNumber("")).isNaN();
        assertThat(Values.toNumber(true)).isNaN();
        assertThat(Values.toNumber(null)).isNaN();
    }

    @Test
    void asStringDropsIntegralFractionAndSerializesStructures() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("a", 1);
        map.put("b", Arrays.asList("x", "y"));

        assertThat(Values.asString(3.0)).isEqualTo("3");
        assertThat(Values.asString(3.25)).isEqualTo("3.25");
        assertThat(Values.asString(null)).isEqualTo("null");
        assertThat(Values.asString(map)).isEqualTo("{\"a\":1,\"b\":[\"x\",\"y\"]}");
    }

    @Test
    void deepEqualsComparesStructurally() {
        Map<String, Object> left = new LinkedHashMap<>();
        left.put("n", 1);
        left.put("items", Arrays.asList(1, "two"));
        Map<String, Object> right = new LinkedHashMap<>();
        right.put("items", Arrays.asList(1.0, "two"));
        right.put("n", 1.0);

        assertThat(Values.deepEquals(left, right)).isTrue();
        assertThat(Values.deepEquals(Arrays.asList(1, 2), Arrays.asList(2, 1))).isFalse();
        assertThat(Values.deepEquals("1", 1)).isTrue();
        assertThat(Values.deepEquals(Collections.emptyList(), "[]")).isFalse();
    }

    @Test
    void parseJsonOnlyAcceptsObjectsAndArrays() {
        assertThat(Values.parseJson("{\"a\":1}")).hasValue(Collections.singletonMap("a", 1));
        assertThat(Values.parseJson(" [1,2] ")).hasValue(Arrays.asList(1, 2));
        assertThat(Values.parseJson("42")).isEmpty();
        assertThat(Values.parseJson("{broken")).isEmpty();
    }

    @Test
    void toItemsWrapsScalars() {
        assertThat(Values.toItems(Arrays.asList(1, 2))).containsExactly(1, 2);
        assertThat(Values.toItems("x")).containsExactly("x");
        assertThat(Values.toItems(new Object[]{"a", "b"})).containsExactly("a", "b");
    }
}
